package com.example.vrf.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String V1_BASE = "/v1";
    public static final String RANDOM_BASE = "/random";

    // Randomness paths
    public static final String RANDOMNESS = "/randomness";
    public static final String NUMBER = "/number";
    public static final String DICE = "/dice";
    public static final String PICK = "/pick";
    public static final String SHUFFLE = "/shuffle";
    public static final String WINNERS = "/winners";
    public static final String UUID = "/uuid";

    // Attestation paths
    public static final String ATTESTATION = "/attestation";
    public static final String VERIFY = "/verify";

    // Health paths
    public static final String HEALTH = "/health";
    public static final String READY = "/health/ready";
    public static final String STATS = "/stats";

    private ApiPath() {}
  }

  public static final class Header {
    public static final String PAYMENT_REQUIRED = "payment-required";
    public static final String RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    private Header() {}
  }

  private ApiConstants() {}
}
