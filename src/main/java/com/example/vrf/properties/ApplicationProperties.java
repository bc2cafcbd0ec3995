package com.example.vrf.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the randomness gateway.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @DefaultValue("0.0.0") String version,
    @NotNull @Valid @DefaultValue RuntimeProperties runtime,
    @NotNull @Valid @DefaultValue AccessProperties access,
    @NotNull @Valid @DefaultValue PaymentProperties payment,
    @NotNull @Valid @DefaultValue RateLimitProperties rateLimit,
    @NotNull @Valid @DefaultValue ReplayProperties replay,
    @NotNull @Valid @DefaultValue RedisProperties redis,
    @NotNull @Valid @DefaultValue OkHttpProperties http,
    @NotNull @Valid @DefaultValue AsyncProperties async,
    @NotNull @Valid @DefaultValue TeeProperties tee,
    @NotNull @Valid @DefaultValue CommitmentProperties commitment,
    @NotNull @Valid @DefaultValue CorsProperties cors
) {

  /**
   * Production switch. Outside production the mock attestation and the
   * unverified-payment escape hatch become available.
   */
  public record RuntimeProperties(
      @DefaultValue("false") boolean production
  ) {}

  /**
   * Free-tier access: API keys and allow-list entries (origin or IP substrings)
   */
  public record AccessProperties(
      @DefaultValue List<String> apiKeys,
      @DefaultValue List<String> allowlist
  ) {}

  /**
   * x402 payment configuration
   */
  public record PaymentProperties(
      String facilitatorUrl,
      @DefaultValue("2") @Min(1) @Max(2) int x402Version,
      @DefaultValue("Verifiable randomness request") String description,
      @DefaultValue("http://localhost:8080") @NotBlank String publicBaseUrl,
      @DefaultValue("$0.01") String priceDisplay,
      @DefaultValue List<@Valid PaymentOptionProperties> options,
      @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration verifyTimeout,
      @DefaultValue("3") @Positive int settleMaxAttempts,
      @DefaultValue("500ms") @DurationUnit(ChronoUnit.MILLIS) Duration settleBackoff,
      @DefaultValue("10m") @DurationUnit(ChronoUnit.MINUTES) Duration supportedCacheTtl,
      @DefaultValue("false") boolean allowUnverifiedInDev
  ) {

    public boolean facilitatorConfigured() {
      return facilitatorUrl != null && !facilitatorUrl.isBlank();
    }
  }

  /**
   * One accepted network/asset/price/recipient combination
   */
  public record PaymentOptionProperties(
      @NotBlank String network,
      @DefaultValue("exact") @NotBlank String scheme,
      @NotBlank String asset,
      @NotBlank String amount,
      @NotBlank String payTo,
      @DefaultValue("60") @Positive int maxTimeoutSeconds,
      String feePayer
  ) {}

  /**
   * Fixed-window limits for the global and the paid-route limiter
   */
  public record RateLimitProperties(
      @NotNull @Valid WindowProperties global,
      @NotNull @Valid WindowProperties paid
  ) {
    public record WindowProperties(
        @Positive int limit,
        @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration window
    ) {}
  }

  /**
   * Replay-protection store configuration
   */
  public record ReplayProperties(
      @DefaultValue("1h") @DurationUnit(ChronoUnit.SECONDS) Duration ttl,
      @DefaultValue("10000") @Positive int maxEntries,
      @DefaultValue("false") boolean durableEnabled,
      @DefaultValue("x402:proof:") @NotBlank String keyPrefix
  ) {}

  /**
   * Redis configuration with cluster support
   */
  public record RedisProperties(
      @DefaultValue("standalone") @Pattern(regexp = "standalone|cluster") String mode,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @NotNull @Valid @DefaultValue SslProperties ssl,
      @Valid ClusterProperties cluster,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid @DefaultValue PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("false") boolean enabled
    ) {}

    public record ClusterProperties(
        String nodes,
        @DefaultValue("3") @Min(0) @Max(5) int maxRedirects
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @Positive int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid @DefaultValue ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost
    ) {}
  }

  /**
   * Background executor for settlement and commitment uploads
   */
  public record AsyncProperties(
      @DefaultValue("4") @Positive int corePoolSize,
      @DefaultValue("16") @Positive int maxPoolSize,
      @DefaultValue("500") @PositiveOrZero int queueCapacity,
      @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration shutdownTimeout
  ) {}

  /**
   * TEE agent (quote/key derivation) configuration
   */
  public record TeeProperties(
      String endpoint,
      @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @DefaultValue("unknown") String appId,
      @DefaultValue("https://cloud-api.phala.network/api/v1/attestations/verify") String verificationUrl,
      @DefaultValue("https://cloud.phala.network/dashboard/cvms/") String dashboardUrl
  ) {

    public boolean configured() {
      return endpoint != null && !endpoint.isBlank();
    }
  }

  /**
   * Commitment publishing to immutable storage
   */
  public record CommitmentProperties(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("false") boolean encryptPayload,
      String storageUrl,
      @DefaultValue("https://arweave.net/") String readUrlPrefix,
      @DefaultValue("vrf-gateway") String appName,
      @DefaultValue("commitment/signing") String keyPath,
      @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration uploadTimeout
  ) {}

  /**
   * Allowed browser origins in production
   */
  public record CorsProperties(
      @DefaultValue List<String> allowedOrigins
  ) {}
}
