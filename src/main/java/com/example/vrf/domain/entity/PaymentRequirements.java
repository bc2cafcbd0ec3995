package com.example.vrf.domain.entity;

import java.util.List;
import java.util.Optional;

/**
 * Machine-readable payment requirements sent with a 402, base64-encoded in the
 * {@code payment-required} header.
 */
public record PaymentRequirements(
    int x402Version,
    String error,
    Resource resource,
    List<PaymentRequirement> accepts
) {

  public record Resource(String url, String description, String mimeType) {}

  public Optional<PaymentRequirement> forNetwork(String network) {
    return accepts.stream()
        .filter(requirement -> requirement.network().equalsIgnoreCase(network))
        .findFirst();
  }

  public PaymentRequirements withError(String newError) {
    return new PaymentRequirements(x402Version, newError, resource, accepts);
  }
}
