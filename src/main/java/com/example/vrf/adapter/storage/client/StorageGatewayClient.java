package com.example.vrf.adapter.storage.client;

import com.example.vrf.adapter.storage.ProofStorage;
import com.example.vrf.adapter.storage.dto.UploadResponse;
import com.example.vrf.exception.StorageException;
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
 * Uploads proof documents through a bundling gateway in front of the permanent
 * ledger. Tags travel as {@code X-Tag-<name>} headers.
 */
@Slf4j
@Component
public class StorageGatewayClient implements ProofStorage {

  private static final String STORAGE_BREAKER = "storage";
  private static final String TAG_HEADER_PREFIX = "X-Tag-";
  private static final MediaType JSON = MediaType.get("application/json");

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String storageUrl;
  private final String readUrlPrefix;

  public StorageGatewayClient(
      @Qualifier("storageOkHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      ApplicationProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    String url = properties.commitment().storageUrl();
    this.storageUrl = url == null ? "" : url.replaceAll("/+$", "");
    this.readUrlPrefix = properties.commitment().readUrlPrefix();
  }

  @Override
  public boolean isConfigured() {
    return !storageUrl.isEmpty();
  }

  @Override
  public String readUrl(String transactionId) {
    return readUrlPrefix.endsWith("/") ? readUrlPrefix + transactionId
                                       : readUrlPrefix + "/" + transactionId;
  }

  @Override
  @CircuitBreaker(name = STORAGE_BREAKER, fallbackMethod = "uploadFallback")
  public String upload(byte[] document, Map<String, String> tags) {
    if (!isConfigured()) {
      throw new StorageException("Storage gateway URL is not configured");
    }

    Request.Builder builder = new Request.Builder()
        .url(storageUrl + "/tx")
        .post(RequestBody.create(document, JSON));
    tags.forEach((name, value) -> builder.header(TAG_HEADER_PREFIX + name, value));

    try (Response response = httpClient.newCall(builder.build()).execute()) {
      if (!response.isSuccessful()) {
        throw new StorageException("Storage gateway returned a non-successful status: "
                                   + response.code());
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new StorageException("Received an empty response body from storage gateway");
      }
      UploadResponse upload = objectMapper.readValue(body.string(), UploadResponse.class);
      if (upload.id() == null || upload.id().isBlank()) {
        throw new StorageException("Storage gateway did not return a transaction id");
      }
      log.info("Proof uploaded: {}", upload.id());
      return upload.id();
    } catch (IOException e) {
      throw new StorageException("Proof upload failed", e);
    }
  }

  public String uploadFallback(byte[] document, Map<String, String> tags, Throwable ex) {
    log.warn("Storage circuit breaker rejected upload: {}", ex.getMessage());
    throw ex instanceof StorageException storageException
          ? storageException
          : new StorageException("Storage gateway unavailable", ex);
  }
}
