package com.example.vrf.domain.entity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded x402 payment header. One variant per network family, resolved once
 * at decode time. Immutable once decoded.
 */
public sealed interface PaymentProof permits SolanaPaymentProof, EvmPaymentProof {

  int x402Version();

  String network();

  String scheme();

  /**
   * Payer address when the payload names it (EVM authorizations do, Solana
   * transactions only reveal it after facilitator verification).
   */
  String payer();

  String asset();

  String amount();

  /**
   * Signed Solana transaction (base64) or the EVM authorization signature.
   */
  String authorizationOrTransaction();

  /**
   * Exact bytes of the header value as received; the replay identity is their SHA-256.
   */
  byte[] rawHeaderBytes();

  /**
   * The decoded payload tree, forwarded to the facilitator untouched.
   */
  JsonNode payload();
}
