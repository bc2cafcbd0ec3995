package com.example.vrf.service;

import com.example.vrf.adapter.verification.client.QuoteVerificationClient;
import com.example.vrf.adapter.verification.dto.QuoteVerificationResponse;
import com.example.vrf.domain.entity.AttestationEnvelope;
import com.example.vrf.exception.RandomnessValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks a previously issued attestation (or a raw quote) with the public
 * verification API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttestationVerificationService {

  public static final String VERIFIED_BY = "Phala Cloud Attestation API";

  /**
   * HTTP status and body to return to the caller.
   */
  public record VerificationOutcome(int status, Map<String, Object> body) {}

  private final AttestationCodec attestationCodec;
  private final QuoteVerificationClient verificationClient;
  private final Clock clock;

  /**
   * @throws RandomnessValidationException when neither input is usable
   */
  public VerificationOutcome verify(String attestation, String quoteHex) {
    String quote;
    if (attestation != null && !attestation.isBlank()) {
      AttestationEnvelope envelope;
      try {
        envelope = attestationCodec.decode(attestation);
      } catch (IllegalArgumentException e) {
        throw new RandomnessValidationException("Invalid attestation format");
      }
      if (envelope instanceof AttestationEnvelope.TdxAttestation tdx) {
        quote = tdx.quote();
      } else {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", false);
        body.put("error", "Mock attestation cannot be verified");
        body.put("tee_type", TeeIdentityService.TEE_TYPE_SIMULATION);
        return new VerificationOutcome(200, body);
      }
    } else {
      quote = quoteHex;
    }

    if (quote == null || quote.isBlank()) {
      throw new RandomnessValidationException("Missing attestation or quote_hex parameter");
    }

    QuoteVerificationResponse response = verificationClient.verify(quote);
    Map<String, Object> body = new LinkedHashMap<>();
    if (!response.successful()) {
      body.put("valid", false);
      body.put("error", "Quote verification failed: " + response.error());
      return new VerificationOutcome(response.status(), body);
    }

    body.put("valid", response.quoteVerified());
    body.put("verification_result", response.body());
    body.put("verified_by", VERIFIED_BY);
    body.put("verified_at", Instant.now(clock).toString());
    log.info("Quote verification completed: valid={}", response.quoteVerified());
    return new VerificationOutcome(200, body);
  }
}
