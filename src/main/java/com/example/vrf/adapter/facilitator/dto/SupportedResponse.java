package com.example.vrf.adapter.facilitator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Facilitator /supported response: the payment kinds it can verify and settle
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SupportedResponse(List<Kind> kinds) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Kind(int x402Version, String scheme, String network, Map<String, Object> extra) {}

  public static SupportedResponse empty() {
    return new SupportedResponse(List.of());
  }

  /**
   * Fee payer advertised for a network, if any
   */
  public Optional<String> feePayerFor(String network) {
    if (kinds == null) {
      return Optional.empty();
    }
    return kinds.stream()
        .filter(kind -> network.equalsIgnoreCase(kind.network()))
        .map(Kind::extra)
        .filter(extra -> extra != null && extra.get("feePayer") != null)
        .map(extra -> String.valueOf(extra.get("feePayer")))
        .findFirst();
  }
}
