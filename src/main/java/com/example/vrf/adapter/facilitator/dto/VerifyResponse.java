package com.example.vrf.adapter.facilitator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Facilitator /verify response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VerifyResponse(
    @JsonProperty("isValid") boolean valid,
    @JsonProperty("invalidReason") String invalidReason,
    @JsonProperty("payer") String payer
) {
  public static VerifyResponse invalid(String reason) {
    return new VerifyResponse(false, reason, null);
  }
}
