package com.example.vrf.adapter.verification.client;

import com.example.vrf.adapter.verification.dto.QuoteVerificationResponse;
import com.example.vrf.exception.AttestationException;
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
import java.util.Map;

/**
 * Client for the public attestation verification API.
 */
@Slf4j
@Component
public class QuoteVerificationClient {

  private static final String VERIFIER_BREAKER = "attestationVerifier";
  private static final MediaType JSON = MediaType.get("application/json");

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String verificationUrl;

  public QuoteVerificationClient(
      @Qualifier("storageOkHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      ApplicationProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.verificationUrl = properties.tee().verificationUrl();
  }

  public String verificationUrl() {
    return verificationUrl;
  }

  public boolean isConfigured() {
    return verificationUrl != null && !verificationUrl.isBlank();
  }

  /**
   * Posts {@code {"hex": quote}} to the verifier.
   *
   * @throws AttestationException when the verifier cannot be reached
   */
  @CircuitBreaker(name = VERIFIER_BREAKER, fallbackMethod = "verifyFallback")
  public QuoteVerificationResponse verify(String quoteHex) {
    if (!isConfigured()) {
      throw new AttestationException("Quote verification URL is not configured");
    }
    try {
      Request request = new Request.Builder()
          .url(verificationUrl)
          .post(RequestBody.create(objectMapper.writeValueAsBytes(Map.of("hex", quoteHex)), JSON))
          .build();

      try (Response response = httpClient.newCall(request).execute()) {
        ResponseBody body = response.body();
        String text = body != null ? body.string() : "";
        if (!response.isSuccessful()) {
          log.warn("Quote verification returned status {}", response.code());
          return new QuoteVerificationResponse(response.code(), null, text);
        }
        return new QuoteVerificationResponse(response.code(), objectMapper.readTree(text), null);
      }
    } catch (IOException e) {
      throw new AttestationException("Quote verification request failed", e);
    }
  }

  public QuoteVerificationResponse verifyFallback(String quoteHex, Throwable ex) {
    log.error("Quote verification unavailable", ex);
    throw ex instanceof AttestationException attestationException
          ? attestationException
          : new AttestationException("Quote verification unavailable", ex);
  }
}
