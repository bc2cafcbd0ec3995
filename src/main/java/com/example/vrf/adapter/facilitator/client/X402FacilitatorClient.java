package com.example.vrf.adapter.facilitator.client;

import com.example.vrf.adapter.facilitator.PaymentFacilitator;
import com.example.vrf.adapter.facilitator.dto.FacilitatorRequest;
import com.example.vrf.adapter.facilitator.dto.SettleResponse;
import com.example.vrf.adapter.facilitator.dto.SupportedResponse;
import com.example.vrf.adapter.facilitator.dto.VerifyResponse;
import com.example.vrf.domain.entity.PaymentProof;
import com.example.vrf.domain.entity.PaymentRequirement;
import com.example.vrf.exception.FacilitatorException;
import com.example.vrf.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * OkHttp client for an x402 facilitator (/verify, /settle, /supported).
 * Transport failures surface as {@link FacilitatorException}; non-2xx answers are
 * turned into negative verify/settle results carrying the status code.
 */
@Slf4j
@Component
public class X402FacilitatorClient implements PaymentFacilitator {

  private static final String FACILITATOR_BREAKER = "facilitator";
  private static final MediaType JSON = MediaType.get("application/json");

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String facilitatorUrl;

  public X402FacilitatorClient(
      @Qualifier("facilitatorOkHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      ApplicationProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    String url = properties.payment().facilitatorUrl();
    this.facilitatorUrl = url == null ? "" : url.replaceAll("/+$", "");
    if (isConfigured()) {
      log.info("Initialized x402 facilitator client for: {}", facilitatorUrl);
    }
  }

  @Override
  public boolean isConfigured() {
    return !facilitatorUrl.isEmpty();
  }

  @Override
  @CircuitBreaker(name = FACILITATOR_BREAKER, fallbackMethod = "verifyFallback")
  public VerifyResponse verify(PaymentProof proof, PaymentRequirement requirement) {
    try (Response response = post("/verify", proof, requirement)) {
      if (!response.isSuccessful()) {
        log.error("Facilitator verify failed with status {}: {}", response.code(), bodyText(response));
        return VerifyResponse.invalid("Facilitator error: " + response.code());
      }
      VerifyResponse verifyResponse = objectMapper.readValue(bodyText(response), VerifyResponse.class);
      log.info("Payment verified: valid={}, payer={}", verifyResponse.valid(), verifyResponse.payer());
      return verifyResponse;
    } catch (IOException e) {
      throw new FacilitatorException("Facilitator verify request failed", e);
    }
  }

  public VerifyResponse verifyFallback(PaymentProof proof, PaymentRequirement requirement,
                                       Throwable ex) {
    log.error("Facilitator circuit breaker rejected verify for network {}", proof.network(), ex);
    throw new FacilitatorException("Facilitator unreachable", ex);
  }

  @Override
  @CircuitBreaker(name = FACILITATOR_BREAKER, fallbackMethod = "settleFallback")
  public SettleResponse settle(PaymentProof proof, PaymentRequirement requirement) {
    try (Response response = post("/settle", proof, requirement)) {
      if (!response.isSuccessful()) {
        log.error("Facilitator settle failed with status {}: {}", response.code(), bodyText(response));
        return SettleResponse.failed("Facilitator error: " + response.code());
      }
      SettleResponse settleResponse = objectMapper.readValue(bodyText(response), SettleResponse.class);
      log.info("Payment settled: success={}, transaction={}",
               settleResponse.success(), settleResponse.transaction());
      return settleResponse;
    } catch (IOException e) {
      throw new FacilitatorException("Facilitator settle request failed", e);
    }
  }

  public SettleResponse settleFallback(PaymentProof proof, PaymentRequirement requirement,
                                       Throwable ex) {
    log.error("Facilitator circuit breaker rejected settle for network {}", proof.network(), ex);
    throw new FacilitatorException("Facilitator unreachable", ex);
  }

  @Override
  public SupportedResponse supported() {
    if (!isConfigured()) {
      return SupportedResponse.empty();
    }
    Request request = new Request.Builder()
        .url(facilitatorUrl + "/supported")
        .get()
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        log.warn("Failed to fetch supported networks, status: {}", response.code());
        return SupportedResponse.empty();
      }
      return objectMapper.readValue(bodyText(response), SupportedResponse.class);
    } catch (IOException e) {
      log.warn("Supported networks request failed: {}", e.getMessage());
      return SupportedResponse.empty();
    }
  }

  private Response post(String path, PaymentProof proof, PaymentRequirement requirement)
      throws IOException {
    if (!isConfigured()) {
      throw new FacilitatorException("Facilitator URL is not configured");
    }
    FacilitatorRequest body = new FacilitatorRequest(proof.x402Version(), proof.payload(), requirement);
    Request request = new Request.Builder()
        .url(facilitatorUrl + path)
        .post(RequestBody.create(objectMapper.writeValueAsBytes(body), JSON))
        .build();
    return httpClient.newCall(request).execute();
  }

  private String bodyText(Response response) throws IOException {
    ResponseBody body = response.body();
    return body != null ? body.string() : "";
  }
}
