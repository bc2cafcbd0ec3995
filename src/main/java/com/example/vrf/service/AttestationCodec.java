package com.example.vrf.service;

import com.example.vrf.domain.entity.AttestationEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;

/**
 * Wire form of {@link AttestationEnvelope}: base64 of its JSON.
 */
@Component
@RequiredArgsConstructor
public class AttestationCodec {

  private final ObjectMapper objectMapper;

  public String encode(AttestationEnvelope envelope) {
    try {
      return Base64.getEncoder().encodeToString(
          objectMapper.writerFor(AttestationEnvelope.class).writeValueAsBytes(envelope));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize attestation", e);
    }
  }

  /**
   * @throws IllegalArgumentException when the value is not an encoded envelope
   */
  public AttestationEnvelope decode(String encoded) {
    try {
      return objectMapper.readValue(Base64.getDecoder().decode(encoded.trim()), AttestationEnvelope.class);
    } catch (IllegalArgumentException | IOException e) {
      throw new IllegalArgumentException("Invalid attestation format", e);
    }
  }
}
