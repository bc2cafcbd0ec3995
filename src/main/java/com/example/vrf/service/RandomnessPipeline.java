package com.example.vrf.service;

import com.example.vrf.domain.entity.AccessGrant;
import com.example.vrf.domain.entity.AttestationEnvelope;
import com.example.vrf.domain.entity.CommitmentRecord;
import com.example.vrf.domain.entity.RandomnessRequest;
import com.example.vrf.domain.entity.RandomnessResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one randomness call: validate, authorize, generate, attest, commit,
 * then schedule settlement of a paid request.
 *
 * <p>A failure after the payment was verified releases its replay reservation,
 * since nothing was delivered and nothing will be settled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RandomnessPipeline {

  private final RandomnessEngine randomnessEngine;
  private final AccessGateService accessGateService;
  private final AttestationBinder attestationBinder;
  private final AttestationCodec attestationCodec;
  private final CommitmentPublisher commitmentPublisher;
  private final TeeIdentityService teeIdentityService;
  private final UsageStatsService usageStatsService;
  private final SettlementService settlementService;

  public Map<String, Object> execute(RandomnessRequest request, HttpServletRequest httpRequest) {
    randomnessEngine.validate(request);
    AccessGrant grant = accessGateService.authorize(httpRequest, httpRequest.getRequestURI());

    Map<String, Object> response;
    try {
      response = produce(request, grant);
    } catch (RuntimeException e) {
      accessGateService.release(grant);
      throw e;
    }

    if (grant.requiresSettlement()) {
      settlementService.settleAsync(grant.payment());
    }
    return response;
  }

  private Map<String, Object> produce(RandomnessRequest request, AccessGrant grant) {
    RandomnessResult result = randomnessEngine.generate(request);
    String requestHash = request.effectiveRequestHash();

    AttestationEnvelope envelope = attestationBinder.bind(result.seedHex(), requestHash);
    String attestation = attestationCodec.encode(envelope);

    CommitmentRecord commitment = commitmentPublisher.publish(
        result.seedHex(), requestHash, attestation, request.operation().endpointName(),
        request.metadataOrEmpty());

    usageStatsService.record(grant);
    log.info("Randomness served: operation={}, tier={}, attested={}",
             request.operation().endpointName(), grant.tier().wireName(), envelope.hardwareBacked());

    Map<String, Object> response = new LinkedHashMap<>(result.derivedValue().responseFields());
    response.put("random_seed", result.seedHex());
    response.put("attestation", attestation);
    response.put("timestamp", result.timestampMs());
    response.put("tee_type", teeIdentityService.teeType());
    response.put("app_id", teeIdentityService.identity().appId());
    if (commitment != null) {
      response.put("commitment", commitment);
    }
    return response;
  }
}
