package com.example.vrf.service;

import com.example.vrf.adapter.facilitator.PaymentFacilitator;
import com.example.vrf.adapter.facilitator.dto.SupportedResponse;
import com.example.vrf.domain.entity.PaymentRequirement;
import com.example.vrf.domain.entity.PaymentRequirements;
import com.example.vrf.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the x402 payment requirements advertised with every 402.
 */
@Slf4j
@Service
public class PaymentRequirementsService {

  public static final String DEFAULT_ERROR = "Payment required";
  private static final String SUPPORTED_KEY = "supported";
  private static final String SOLANA_FAMILY = "solana";

  private final ApplicationProperties.PaymentProperties payment;
  private final PaymentFacilitator facilitator;
  private final ObjectMapper objectMapper;
  private final Cache<String, SupportedResponse> supportedCache;

  public PaymentRequirementsService(ApplicationProperties properties,
                                    PaymentFacilitator facilitator,
                                    ObjectMapper objectMapper) {
    this.payment = properties.payment();
    this.facilitator = facilitator;
    this.objectMapper = objectMapper;
    this.supportedCache = Caffeine.newBuilder()
        .maximumSize(1)
        .expireAfterWrite(payment.supportedCacheTtl())
        .build();
  }

  /**
   * Requirements for the given resource path, one entry per configured option.
   */
  public PaymentRequirements requirementsFor(String resourcePath) {
    List<PaymentRequirement> accepts = new ArrayList<>();
    for (ApplicationProperties.PaymentOptionProperties option : payment.options()) {
      accepts.add(new PaymentRequirement(
          option.scheme(),
          option.network(),
          option.amount(),
          option.asset(),
          option.payTo(),
          option.maxTimeoutSeconds(),
          extraFor(option)));
    }
    return new PaymentRequirements(
        payment.x402Version(),
        DEFAULT_ERROR,
        new PaymentRequirements.Resource(resourceUrl(resourcePath), payment.description(),
                                         "application/json"),
        List.copyOf(accepts));
  }

  /**
   * Base64 JSON form sent in the {@code payment-required} response header.
   */
  public String encodeHeader(PaymentRequirements requirements) {
    try {
      return Base64.getEncoder().encodeToString(objectMapper.writeValueAsBytes(requirements));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize payment requirements", e);
    }
  }

  private Map<String, String> extraFor(ApplicationProperties.PaymentOptionProperties option) {
    if (option.feePayer() != null && !option.feePayer().isBlank()) {
      return Map.of("feePayer", option.feePayer());
    }
    if (!option.network().toLowerCase().startsWith(SOLANA_FAMILY) || !facilitator.isConfigured()) {
      return Map.of();
    }
    return discoverFeePayer(option.network())
        .map(feePayer -> Map.of("feePayer", feePayer))
        .orElse(Map.of());
  }

  private Optional<String> discoverFeePayer(String network) {
    SupportedResponse supported = supportedCache.getIfPresent(SUPPORTED_KEY);
    if (supported == null) {
      supported = facilitator.supported();
      if (supported.kinds() != null && !supported.kinds().isEmpty()) {
        supportedCache.put(SUPPORTED_KEY, supported);
        log.info("Cached facilitator supported kinds: {}", supported.kinds().size());
      }
    }
    return supported.feePayerFor(network);
  }

  private String resourceUrl(String resourcePath) {
    String base = payment.publicBaseUrl();
    return base.endsWith("/") ? base.substring(0, base.length() - 1) + resourcePath
                              : base + resourcePath;
  }
}
