package com.example.vrf.config;

import com.example.vrf.exception.FacilitatorException;
import com.example.vrf.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for deferred settlement: only an unreachable facilitator is retried
 */
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class RetryConfig {

  private final ApplicationProperties properties;

  @Bean
  public RetryTemplate settlementRetryTemplate() {
    ApplicationProperties.PaymentProperties payment = properties.payment();
    return RetryTemplate.builder()
        .maxAttempts(payment.settleMaxAttempts())
        .fixedBackoff(payment.settleBackoff().toMillis())
        .retryOn(FacilitatorException.class)
        .build();
  }
}
