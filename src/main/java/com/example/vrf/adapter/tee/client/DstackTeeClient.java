package com.example.vrf.adapter.tee.client;

import com.example.vrf.adapter.tee.TeeClient;
import com.example.vrf.adapter.tee.dto.InfoResponse;
import com.example.vrf.adapter.tee.dto.KeyResponse;
import com.example.vrf.adapter.tee.dto.QuoteResponse;
import com.example.vrf.exception.TeeException;
import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.util.HashUtils;
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
 * HTTP client for the dstack guest agent (GetQuote, GetKey, Info).
 * Protected by the "tee" circuit breaker.
 */
@Slf4j
@Component
public class DstackTeeClient implements TeeClient {

  private static final String TEE_BREAKER = "tee";
  private static final MediaType JSON = MediaType.get("application/json");

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String endpoint;

  public DstackTeeClient(
      @Qualifier("teeOkHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      ApplicationProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    String url = properties.tee().endpoint();
    this.endpoint = url == null ? "" : url.replaceAll("/+$", "");
    if (isConfigured()) {
      log.info("Initialized dstack TEE client for: {}", endpoint);
    } else {
      log.info("No TEE endpoint configured, TEE client disabled");
    }
  }

  @Override
  public boolean isConfigured() {
    return !endpoint.isEmpty();
  }

  @Override
  @CircuitBreaker(name = TEE_BREAKER, fallbackMethod = "getQuoteFallback")
  public QuoteResponse getQuote(byte[] reportData) {
    QuoteResponse quote = call("/GetQuote", Map.of("report_data", HashUtils.toHex(reportData)),
                               QuoteResponse.class);
    if (quote.quote() == null || quote.quote().isEmpty()) {
      throw new TeeException("TEE agent returned an empty quote");
    }
    return quote;
  }

  public QuoteResponse getQuoteFallback(byte[] reportData, Throwable ex) {
    log.error("TEE quote unavailable: {}", ex.getMessage());
    throw asTeeException("TEE quote unavailable", ex);
  }

  @Override
  @CircuitBreaker(name = TEE_BREAKER, fallbackMethod = "getKeyFallback")
  public KeyResponse getKey(String path, String purpose) {
    KeyResponse key = call("/GetKey", Map.of("path", path, "purpose", purpose), KeyResponse.class);
    if (key.key() == null || key.key().isEmpty()) {
      throw new TeeException("TEE agent returned an empty key for path: " + path);
    }
    return key;
  }

  public KeyResponse getKeyFallback(String path, String purpose, Throwable ex) {
    log.error("TEE key derivation unavailable for path {}: {}", path, ex.getMessage());
    throw asTeeException("TEE key derivation unavailable", ex);
  }

  @Override
  @CircuitBreaker(name = TEE_BREAKER)
  public InfoResponse info() {
    return call("/Info", Map.of(), InfoResponse.class);
  }

  private <T> T call(String method, Map<String, String> body, Class<T> responseType) {
    if (!isConfigured()) {
      throw new TeeException("TEE endpoint is not configured");
    }
    try {
      Request request = new Request.Builder()
          .url(endpoint + method)
          .post(RequestBody.create(objectMapper.writeValueAsBytes(body), JSON))
          .build();

      try (Response response = httpClient.newCall(request).execute()) {
        if (!response.isSuccessful()) {
          throw new TeeException("TEE agent " + method + " returned status: " + response.code());
        }
        ResponseBody responseBody = response.body();
        if (responseBody == null) {
          throw new TeeException("Received an empty response body from TEE agent " + method);
        }
        return objectMapper.readValue(responseBody.string(), responseType);
      }
    } catch (IOException e) {
      throw new TeeException("TEE agent " + method + " request failed", e);
    }
  }

  private TeeException asTeeException(String message, Throwable ex) {
    return ex instanceof TeeException teeException ? teeException : new TeeException(message, ex);
  }
}
