package com.example.vrf.adapter.facilitator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Facilitator /settle response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SettleResponse(
    boolean success,
    String transaction,
    String network,
    String payer,
    String errorReason
) {
  public static SettleResponse failed(String reason) {
    return new SettleResponse(false, null, null, null, reason);
  }
}
