package com.example.vrf.support;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Canned x402 payment headers.
 */
public final class PaymentHeaders {

  private PaymentHeaders() {}

  public static String solanaV2(String transaction) {
    return encode("""
        {"x402Version":2,
         "accepted":{"scheme":"exact","network":"solana","asset":"USDC-solana","amount":"10000"},
         "payload":{"transaction":"%s"}}
        """.formatted(transaction));
  }

  public static String baseV2(String from, String nonce) {
    return encode("""
        {"x402Version":2,
         "accepted":{"scheme":"exact","network":"base","asset":"USDC-base","amount":"10000"},
         "payload":{"signature":"0xsig-%s",
                    "authorization":{"from":"%s","to":"payto-base","value":"10000",
                                     "validAfter":"0","validBefore":"9999999999","nonce":"%s"}}}
        """.formatted(nonce, from, nonce));
  }

  public static String solanaV1(String transaction) {
    return encode("""
        {"x402Version":1,"scheme":"exact","network":"solana",
         "payload":{"transaction":"%s"}}
        """.formatted(transaction));
  }

  public static String encode(String json) {
    return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }
}
