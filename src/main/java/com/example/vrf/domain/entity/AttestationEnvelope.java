package com.example.vrf.domain.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Attestation bound to one randomness output. Serialized as JSON with a
 * {@code type} discriminator, then base64-encoded on the wire.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AttestationEnvelope.TdxAttestation.class, name = AttestationEnvelope.TDX_TYPE),
    @JsonSubTypes.Type(value = AttestationEnvelope.MockTeeAttestation.class, name = AttestationEnvelope.MOCK_TYPE)
})
public sealed interface AttestationEnvelope {

  String TDX_TYPE = "tdx-attestation";
  String MOCK_TYPE = "mock-tee-attestation";

  boolean hardwareBacked();

  /**
   * Hardware quote over {@code SHA256(seed || requestHash)}.
   */
  record TdxAttestation(
      String quote,
      @JsonProperty("event_log") String eventLog,
      String algorithm,
      String provider
  ) implements AttestationEnvelope {
    @Override
    public boolean hardwareBacked() {
      return true;
    }
  }

  /**
   * Development stand-in carrying the report data that would have been quoted.
   * Never produced in production.
   */
  record MockTeeAttestation(
      @JsonProperty("report_data") String reportDataHex,
      long timestamp,
      String warning
  ) implements AttestationEnvelope {
    @Override
    public boolean hardwareBacked() {
      return false;
    }
  }
}
