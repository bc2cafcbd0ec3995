package com.example.vrf.service;

import com.example.vrf.adapter.facilitator.PaymentFacilitator;
import com.example.vrf.adapter.facilitator.dto.VerifyResponse;
import com.example.vrf.domain.entity.AccessGrant;
import com.example.vrf.domain.entity.PaymentProof;
import com.example.vrf.domain.entity.PaymentRequirement;
import com.example.vrf.domain.entity.PaymentRequirements;
import com.example.vrf.domain.entity.VerifiedPayment;
import com.example.vrf.exception.FacilitatorException;
import com.example.vrf.exception.PaymentRequiredException;
import com.example.vrf.exception.PaymentRequiredException.Reason;
import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.util.ClientRequestUtils;
import com.example.vrf.util.HashUtils;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Decides whether a randomness request may proceed.
 *
 * <p>Tiers are tried in order: API key, allow-list, payment. A payment proof is
 * reserved in the replay store before the facilitator is asked to verify it and
 * released again if verification does not succeed, so two concurrent requests
 * carrying the same proof cannot both pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessGateService {

  private final ApplicationProperties properties;
  private final ReplayStore replayStore;
  private final PaymentHeaderDecoder paymentHeaderDecoder;
  private final PaymentFacilitator facilitator;
  private final PaymentRequirementsService requirementsService;

  /**
   * @param resourcePath the path advertised in the payment requirements
   * @throws PaymentRequiredException when the request is not allowed through
   */
  public AccessGrant authorize(HttpServletRequest request, String resourcePath) {
    String apiKey = ClientRequestUtils.getApiKey(request);
    if (apiKey != null && matchesApiKey(apiKey)) {
      return AccessGrant.apiKey("key:" + HashUtils.sha256Hex(apiKey).substring(0, 8));
    }

    String allowlisted = matchAllowlist(request);
    if (allowlisted != null) {
      return AccessGrant.allowlisted(allowlisted);
    }

    PaymentRequirements requirements = requirementsService.requirementsFor(resourcePath);
    String paymentHeader = ClientRequestUtils.getPaymentHeader(request);
    if (paymentHeader == null) {
      throw new PaymentRequiredException(Reason.PAYMENT_REQUIRED,
                                         "This endpoint requires payment via x402 protocol",
                                         requirements);
    }

    PaymentProof proof;
    try {
      proof = paymentHeaderDecoder.decode(paymentHeader);
    } catch (IllegalArgumentException e) {
      log.warn("Rejected malformed payment header from {}: {}",
               ClientRequestUtils.maskIpAddress(ClientRequestUtils.getClientIpAddress(request)),
               e.getMessage());
      throw denial(Reason.INVALID_PAYMENT_FORMAT, "Invalid payment format", requirements);
    }

    PaymentRequirement requirement = requirements.forNetwork(proof.network())
        .orElseThrow(() -> denial(Reason.PAYMENT_INVALID,
                                  "Unsupported payment network: " + proof.network(), requirements));

    String proofHash = HashUtils.sha256Hex(proof.rawHeaderBytes());
    if (replayStore.exists(proofHash)) {
      log.warn("Replay attempt detected for proof {}", HashUtils.abbreviate(proofHash));
      throw denial(Reason.REPLAY_DETECTED, "Replay detected: payment proof already used", requirements);
    }
    if (!replayStore.reserve(proofHash)) {
      log.warn("Concurrent replay of proof {} rejected", HashUtils.abbreviate(proofHash));
      throw denial(Reason.REPLAY_DETECTED, "Replay detected: payment proof already used", requirements);
    }

    if (!facilitator.isConfigured()) {
      return acceptUnverified(proof, requirement, proofHash, requirements);
    }

    VerifyResponse verification;
    try {
      verification = facilitator.verify(proof, requirement);
    } catch (FacilitatorException e) {
      replayStore.release(proofHash);
      log.error("Payment verification failed for proof {}: {}",
                HashUtils.abbreviate(proofHash), e.getMessage());
      throw denial(Reason.PAYMENT_INVALID, "Facilitator unreachable", requirements);
    } catch (RuntimeException e) {
      replayStore.release(proofHash);
      throw e;
    }

    if (!verification.valid()) {
      replayStore.release(proofHash);
      String reason = verification.invalidReason() != null ? verification.invalidReason()
                                                           : "Payment verification failed";
      log.warn("Payment rejected by facilitator for proof {}: {}", HashUtils.abbreviate(proofHash), reason);
      throw denial(Reason.PAYMENT_INVALID, reason, requirements);
    }

    String payer = verification.payer() != null ? verification.payer() : proof.payer();
    log.info("Payment accepted on {} from {}", proof.network(), payer);
    return AccessGrant.paid(new VerifiedPayment(proof, requirement, proofHash, payer));
  }

  /**
   * True when the request carries one of the configured API keys.
   */
  public boolean hasValidApiKey(HttpServletRequest request) {
    String apiKey = ClientRequestUtils.getApiKey(request);
    return apiKey != null && matchesApiKey(apiKey);
  }

  /**
   * Returns the reservation held by a paid grant whose request did not complete.
   */
  public void release(AccessGrant grant) {
    if (grant != null && grant.requiresSettlement()) {
      replayStore.release(grant.payment().proofHash());
      log.info("Released reservation for proof {}", HashUtils.abbreviate(grant.payment().proofHash()));
    }
  }

  private AccessGrant acceptUnverified(PaymentProof proof, PaymentRequirement requirement,
                                       String proofHash, PaymentRequirements requirements) {
    ApplicationProperties.PaymentProperties payment = properties.payment();
    if (properties.runtime().production() || !payment.allowUnverifiedInDev()) {
      replayStore.release(proofHash);
      log.error("No facilitator configured, refusing payment {}", HashUtils.abbreviate(proofHash));
      throw denial(Reason.PAYMENT_INVALID, "Payment verification unavailable", requirements);
    }
    log.warn("No facilitator configured: accepting UNVERIFIED payment {} (development only)",
             HashUtils.abbreviate(proofHash));
    return AccessGrant.paid(new VerifiedPayment(proof, requirement, proofHash, proof.payer()));
  }

  private boolean matchesApiKey(String candidate) {
    byte[] candidateBytes = candidate.getBytes(StandardCharsets.UTF_8);
    boolean matched = false;
    for (String key : properties.access().apiKeys()) {
      if (key != null && !key.isBlank()
          && MessageDigest.isEqual(candidateBytes, key.getBytes(StandardCharsets.UTF_8))) {
        matched = true;
      }
    }
    return matched;
  }

  private String matchAllowlist(HttpServletRequest request) {
    List<String> allowlist = properties.access().allowlist();
    if (allowlist.isEmpty()) {
      return null;
    }
    String origin = ClientRequestUtils.getOrigin(request);
    String clientIp = ClientRequestUtils.getClientIpAddress(request);
    for (String entry : allowlist) {
      if (entry == null || entry.isBlank()) {
        continue;
      }
      if (origin.contains(entry) || (clientIp != null && clientIp.contains(entry))) {
        return entry;
      }
    }
    return null;
  }

  private PaymentRequiredException denial(Reason reason, String message,
                                          PaymentRequirements requirements) {
    return new PaymentRequiredException(reason, message, requirements.withError(message));
  }
}
