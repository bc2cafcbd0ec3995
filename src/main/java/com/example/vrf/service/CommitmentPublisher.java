package com.example.vrf.service;

import com.example.vrf.adapter.storage.ProofStorage;
import com.example.vrf.domain.entity.CommitmentRecord;
import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.util.HashUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes a commitment to each seed. The uploaded proof document carries
 * {@code SHA256(seed || requestHash)} but never the seed itself, so only the
 * caller holding the seed can check it against the published hash.
 *
 * <p>Never throws: a failed upload yields a record with no transaction fields.
 */
@Slf4j
@Service
public class CommitmentPublisher {

  private final ProofStorage proofStorage;
  private final CommitmentKeyProvider keyProvider;
  private final EncryptionService encryptionService;
  private final TeeIdentityService teeIdentityService;
  private final ObjectMapper objectMapper;
  private final Executor executor;
  private final Clock clock;
  private final ApplicationProperties.CommitmentProperties commitment;

  public CommitmentPublisher(ProofStorage proofStorage,
                             CommitmentKeyProvider keyProvider,
                             EncryptionService encryptionService,
                             TeeIdentityService teeIdentityService,
                             ObjectMapper objectMapper,
                             @Qualifier("backgroundTaskExecutor") Executor executor,
                             Clock clock,
                             ApplicationProperties properties) {
    this.proofStorage = proofStorage;
    this.keyProvider = keyProvider;
    this.encryptionService = encryptionService;
    this.teeIdentityService = teeIdentityService;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.clock = clock;
    this.commitment = properties.commitment();
  }

  public boolean isEnabled() {
    return commitment.enabled() && proofStorage.isConfigured();
  }

  /**
   * @return the commitment record, or {@code null} when publishing is disabled
   */
  public CommitmentRecord publish(String seedHex, String requestHash, String attestation,
                                  String endpoint, Map<String, Object> metadata) {
    if (!isEnabled()) {
      return null;
    }
    String commitmentHash = HashUtils.toHex(HashUtils.bindSeed(seedHex, requestHash));
    Duration timeout = commitment.uploadTimeout();

    CompletableFuture<CommitmentRecord> upload = CompletableFuture.supplyAsync(
        () -> upload(commitmentHash, requestHash, attestation, endpoint, metadata), executor);
    try {
      return upload.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      upload.cancel(true);
      log.warn("Commitment upload for {} timed out after {}", HashUtils.abbreviate(commitmentHash), timeout);
    } catch (ExecutionException e) {
      log.warn("Commitment upload for {} failed: {}", HashUtils.abbreviate(commitmentHash),
               e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while publishing commitment {}", HashUtils.abbreviate(commitmentHash));
    } catch (RuntimeException e) {
      log.warn("Commitment upload for {} could not be scheduled: {}",
               HashUtils.abbreviate(commitmentHash), e.getMessage());
    }
    return CommitmentRecord.unpublished(commitmentHash);
  }

  /**
   * Proof document as uploaded, before signing or encryption. Contains no seed.
   */
  Map<String, Object> proofDocument(String commitmentHash, String requestHash, String attestation,
                                    String endpoint, Map<String, Object> metadata) {
    Map<String, Object> proof = new LinkedHashMap<>();
    proof.put("attestation", attestation);
    proof.put("request_hash", requestHash);
    proof.put("commitment_hash", commitmentHash);
    proof.put("endpoint", endpoint);
    proof.put("timestamp", clock.millis());
    proof.put("tee_type", teeIdentityService.teeType());
    proof.put("app_id", teeIdentityService.identity().appId());
    proof.put("metadata", metadata != null ? metadata : Map.of());
    return proof;
  }

  private CommitmentRecord upload(String commitmentHash, String requestHash, String attestation,
                                  String endpoint, Map<String, Object> metadata) {
    Map<String, Object> proof = proofDocument(commitmentHash, requestHash, attestation, endpoint, metadata);
    byte[] proofBytes = toJson(proof);
    boolean encrypt = commitment.encryptPayload();

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("commitment_hash", commitmentHash);
    document.put("encrypted", encrypt);
    if (encrypt) {
      document.put("ciphertext", encryptionService.encrypt(proofBytes));
    } else {
      document.put("proof", proof);
    }
    document.put("signature", keyProvider.sign(proofBytes));
    document.put("signature_algorithm", CommitmentKeyProvider.SIGNATURE_ALGORITHM);

    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("Content-Type", "application/json");
    tags.put("App-Name", commitment.appName());
    tags.put("Commitment-Hash", commitmentHash);
    tags.put("TEE-Type", teeIdentityService.teeType());
    tags.put("Endpoint", endpoint);

    String transactionId = proofStorage.upload(toJson(document), tags);
    log.info("Commitment {} published: {}", HashUtils.abbreviate(commitmentHash), transactionId);
    return new CommitmentRecord(commitmentHash, transactionId, proofStorage.readUrl(transactionId), encrypt);
  }

  private byte[] toJson(Object value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize proof document", e);
    }
  }
}
