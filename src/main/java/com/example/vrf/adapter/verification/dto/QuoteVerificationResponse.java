package com.example.vrf.adapter.verification.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a remote quote verification. {@code body} is the verifier's JSON
 * when it answered 2xx; otherwise {@code error} carries its response text.
 */
public record QuoteVerificationResponse(
    int status,
    JsonNode body,
    String error
) {

  public boolean successful() {
    return status >= 200 && status < 300;
  }

  /**
   * The verifier reports {@code quote.verified == true}.
   */
  public boolean quoteVerified() {
    return body != null && body.path("quote").path("verified").asBoolean(false);
  }
}
