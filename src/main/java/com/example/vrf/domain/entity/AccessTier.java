package com.example.vrf.domain.entity;

/**
 * How a request was let through the access gate.
 */
public enum AccessTier {
  // Origin or client IP matched the configured allow-list.
  ALLOWLISTED("allowlisted"),
  // A configured X-API-Key was presented.
  API_KEY("api_key"),
  // An x402 payment proof was verified by the facilitator.
  PAID("paid");

  private final String wireName;

  AccessTier(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
