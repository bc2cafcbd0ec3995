package com.example.vrf.config;

import com.example.vrf.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration validator that enforces business rules and constraints
 * beyond basic JSR-303 validation. Fails fast with every violation listed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(ApplicationProperties.class)
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_MUST_BE_POSITIVE = "%s must be positive.";
  private static final String PROTOCOL_HTTP = "http://";
  private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1", "[::1]");

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully (production={}).", properties.runtime().production());
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validatePaymentConfig(errors);
    validateRateLimitConfig(errors);
    validateCommitmentConfig(errors);
    validateTeeConfig(errors);
    validateHttpConfig(errors);
    return errors;
  }

  private void validatePaymentConfig(List<String> errors) {
    ApplicationProperties.PaymentProperties payment = properties.payment();
    boolean production = properties.runtime().production();

    if (production && payment.allowUnverifiedInDev()) {
      errors.add("'app.payment.allow-unverified-in-dev' must not be enabled in production.");
    }
    if (production && !payment.facilitatorConfigured()) {
      errors.add("A facilitator URL ('app.payment.facilitator-url') is required in production.");
    }
    if (production && payment.options().isEmpty()) {
      errors.add("At least one payment option must be configured in production.");
    }
    if (payment.facilitatorConfigured()) {
      validateRemoteUrl(payment.facilitatorUrl(), "Facilitator URL", errors);
    }
    validateRemoteUrl(payment.publicBaseUrl(), "Public base URL", errors);

    Set<String> networks = new HashSet<>();
    for (ApplicationProperties.PaymentOptionProperties option : payment.options()) {
      if (!networks.add(option.network().toLowerCase(Locale.ROOT))) {
        errors.add("Payment option network must be unique: " + option.network());
      }
      if (!isPositiveInteger(option.amount())) {
        errors.add("Payment amount for %s must be a positive integer in base units: %s"
                       .formatted(option.network(), option.amount()));
      }
    }
  }

  private void validateRateLimitConfig(List<String> errors) {
    ApplicationProperties.RateLimitProperties rateLimit = properties.rateLimit();
    if (rateLimit.global().window().isZero() || rateLimit.global().window().isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Global rate-limit window"));
    }
    if (rateLimit.paid().window().isZero() || rateLimit.paid().window().isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Paid rate-limit window"));
    }
  }

  private void validateCommitmentConfig(List<String> errors) {
    ApplicationProperties.CommitmentProperties commitment = properties.commitment();
    if (!commitment.enabled()) {
      return;
    }
    if (commitment.storageUrl() == null || commitment.storageUrl().isBlank()) {
      errors.add("A storage URL ('app.commitment.storage-url') is required when commitments are enabled.");
    } else {
      validateRemoteUrl(commitment.storageUrl(), "Storage URL", errors);
    }
    if (commitment.uploadTimeout().isZero() || commitment.uploadTimeout().isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Commitment upload timeout"));
    }
  }

  private void validateTeeConfig(List<String> errors) {
    ApplicationProperties.TeeProperties tee = properties.tee();
    if (tee.configured() && !isValidUrl(tee.endpoint())) {
      errors.add(ERROR_INVALID_URL.formatted("TEE endpoint", tee.endpoint()));
    }
    validateRemoteUrl(tee.verificationUrl(), "Quote verification URL", errors);
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void validateRemoteUrl(String url, String fieldName, List<String> errors) {
    if (!isValidUrl(url)) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, url));
      return;
    }
    if (url.startsWith(PROTOCOL_HTTP) && !LOCAL_HOSTS.contains(URI.create(url).getHost())) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, url));
    }
  }

  private boolean isValidUrl(String url) {
    if (url == null || url.isBlank()) {
      return false;
    }
    try {
      URI uri = new URI(url);
      return uri.getScheme() != null && uri.getHost() != null;
    } catch (URISyntaxException e) {
      return false;
    }
  }

  private boolean isPositiveInteger(String value) {
    try {
      return Long.parseLong(value) > 0;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
