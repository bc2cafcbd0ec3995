package com.example.vrf.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.vrf.support.TestProperties;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigurationValidatorTest {

  private static List<String> validate(TestProperties properties) {
    return new ConfigurationValidator(properties.build()).validate();
  }

  @Test
  void defaultsAreValid() {
    assertThat(validate(TestProperties.defaults())).isEmpty();
  }

  @Test
  void productionRequiresFacilitatorAndRejectsDevShortcuts() {
    TestProperties properties = TestProperties.defaults();
    properties.production = true;
    properties.facilitatorUrl = null;
    properties.allowUnverifiedInDev = true;

    assertThat(validate(properties)).anySatisfy(e -> assertThat(e).contains("facilitator-url"))
                                    .anySatisfy(e -> assertThat(e).contains("allow-unverified-in-dev"));
  }

  @Test
  void remoteUrlsMustUseHttps() {
    TestProperties properties = TestProperties.defaults();
    properties.facilitatorUrl = "http://facilitator.example.com";

    assertThat(validate(properties)).containsExactly(
        "Facilitator URL must use HTTPS in non-local environments: http://facilitator.example.com");
  }

  @Test
  void paymentOptionsMustBeDistinctWithIntegerAmounts() {
    TestProperties properties = TestProperties.defaults();
    properties.options.add(TestProperties.option("Solana", "10000"));
    properties.options.add(TestProperties.option("polygon", "0.01"));

    assertThat(validate(properties)).containsExactlyInAnyOrder(
        "Payment option network must be unique: Solana",
        "Payment amount for polygon must be a positive integer in base units: 0.01");
  }

  @Test
  void commitmentsNeedStorage() {
    TestProperties properties = TestProperties.defaults();
    properties.commitmentEnabled = true;
    properties.uploadTimeout = Duration.ZERO;

    assertThat(validate(properties)).hasSize(2);
  }

  @Test
  void hostLimitCannotExceedTotal() {
    TestProperties properties = TestProperties.defaults();
    properties.maxRequests = 5;
    properties.maxRequestsPerHost = 10;

    assertThat(validate(properties)).hasSize(1);
  }

  @Test
  void startupFailsWithEveryViolationListed() {
    TestProperties properties = TestProperties.defaults();
    properties.teeEndpoint = "not a url";
    properties.maxRequests = 1;
    properties.maxRequestsPerHost = 2;

    assertThatThrownBy(() -> new ConfigurationValidator(properties.build()).afterPropertiesSet())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageStartingWith("Configuration validation failed with 2 error(s)")
        .hasMessageContaining("TEE endpoint is invalid");
  }
}
