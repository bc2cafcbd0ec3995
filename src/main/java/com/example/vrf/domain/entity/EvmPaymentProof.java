package com.example.vrf.domain.entity;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * EIP-3009 transferWithAuthorization signed by the payer.
 */
public record EvmPaymentProof(
    int x402Version,
    String network,
    String scheme,
    String payer,
    String asset,
    String amount,
    String signature,
    Map<String, String> authorization,
    byte[] rawHeaderBytes,
    JsonNode payload
) implements PaymentProof {

  @Override
  public String authorizationOrTransaction() {
    return signature;
  }
}
