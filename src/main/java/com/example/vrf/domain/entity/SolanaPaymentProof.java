package com.example.vrf.domain.entity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Partially signed SPL transfer; the facilitator co-signs as fee payer.
 */
public record SolanaPaymentProof(
    int x402Version,
    String network,
    String scheme,
    String asset,
    String amount,
    String transaction,
    byte[] rawHeaderBytes,
    JsonNode payload
) implements PaymentProof {

  @Override
  public String payer() {
    return null;
  }

  @Override
  public String authorizationOrTransaction() {
    return transaction;
  }
}
