package com.example.vrf.service;

import com.example.vrf.adapter.tee.TeeClient;
import com.example.vrf.adapter.tee.dto.QuoteResponse;
import com.example.vrf.domain.entity.AttestationEnvelope;
import com.example.vrf.exception.AttestationException;
import com.example.vrf.exception.TeeException;
import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.util.HashUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Binds a seed to a TEE quote over {@code SHA256(seed || requestHash)}.
 *
 * <p>In production a missing quote aborts the request. Elsewhere a mock envelope
 * carrying the report data is returned instead.
 */
@Slf4j
@Service
public class AttestationBinder {

  public static final String ALGORITHM = "sha256";
  public static final String PROVIDER = "phala-dstack";
  public static final String SIMULATION_WARNING = "No TEE hardware detected - simulation mode";

  private final TeeClient teeClient;
  private final Clock clock;
  private final boolean production;

  public AttestationBinder(TeeClient teeClient, Clock clock, ApplicationProperties properties) {
    this.teeClient = teeClient;
    this.clock = clock;
    this.production = properties.runtime().production();
  }

  /**
   * @throws AttestationException in production when no quote could be obtained
   */
  public AttestationEnvelope bind(String seedHex, String requestHash) {
    byte[] reportData = HashUtils.bindSeed(seedHex, requestHash);
    try {
      QuoteResponse quote = teeClient.getQuote(reportData);
      return new AttestationEnvelope.TdxAttestation(quote.quote(), quote.eventLog(), ALGORITHM, PROVIDER);
    } catch (TeeException e) {
      if (production) {
        log.error("TEE attestation unavailable, refusing to release randomness", e);
        throw new AttestationException("TEE attestation unavailable", e);
      }
      log.warn("TEE attestation unavailable, returning mock attestation: {}", e.getMessage());
      return new AttestationEnvelope.MockTeeAttestation(HashUtils.toHex(reportData), clock.millis(),
                                                        SIMULATION_WARNING);
    }
  }
}
