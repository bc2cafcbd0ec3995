package com.example.vrf.service;

import com.example.vrf.domain.entity.EvmPaymentProof;
import com.example.vrf.domain.entity.PaymentProof;
import com.example.vrf.domain.entity.SolanaPaymentProof;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes the base64 JSON payment header into a {@link PaymentProof}.
 *
 * <p>Accepts x402 v2 payloads (network and scheme under {@code accepted}) and v1
 * payloads (network and scheme at the top level). The variant is picked from the
 * inner payload: a {@code transaction} means Solana, a {@code signature} plus
 * {@code authorization} means an EVM transfer authorization.
 */
@Component
@RequiredArgsConstructor
public class PaymentHeaderDecoder {

  private static final String SCHEME_PREFIX = "x402 ";

  private final ObjectMapper objectMapper;

  /**
   * @throws IllegalArgumentException when the header is not a well-formed payment payload
   */
  public PaymentProof decode(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      throw new IllegalArgumentException("Payment header is empty");
    }
    String token = stripScheme(headerValue.trim());
    byte[] rawHeaderBytes = token.getBytes(StandardCharsets.UTF_8);

    JsonNode root;
    try {
      root = objectMapper.readTree(Base64.getDecoder().decode(token));
    } catch (IllegalArgumentException | IOException e) {
      throw new IllegalArgumentException("Payment header is not base64 encoded JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Payment header must be a JSON object");
    }

    int version = root.path("x402Version").asInt(1);
    JsonNode accepted = root.path("accepted");
    String network = firstText(accepted.path("network"), root.path("network"));
    String scheme = firstText(accepted.path("scheme"), root.path("scheme"));
    String asset = firstText(accepted.path("asset"), root.path("asset"));
    String amount = firstText(accepted.path("amount"), root.path("amount"));
    if (network == null) {
      throw new IllegalArgumentException("Payment header does not name a network");
    }

    JsonNode payload = root.path("payload");
    if (!payload.isObject()) {
      throw new IllegalArgumentException("Payment header carries no payload");
    }

    String transaction = text(payload.path("transaction"));
    if (transaction != null) {
      return new SolanaPaymentProof(version, network, scheme, asset, amount, transaction,
                                    rawHeaderBytes, root);
    }

    String signature = text(payload.path("signature"));
    JsonNode authorization = payload.path("authorization");
    if (signature != null && authorization.isObject()) {
      Map<String, String> fields = new LinkedHashMap<>();
      authorization.fields().forEachRemaining(entry -> fields.put(entry.getKey(), entry.getValue().asText()));
      String value = fields.get("value");
      return new EvmPaymentProof(version, network, scheme, fields.get("from"), asset,
                                 amount != null ? amount : value, signature, Map.copyOf(fields),
                                 rawHeaderBytes, root);
    }

    throw new IllegalArgumentException("Payment payload has neither a transaction nor an authorization");
  }

  private String stripScheme(String value) {
    if (value.regionMatches(true, 0, SCHEME_PREFIX, 0, SCHEME_PREFIX.length())) {
      return value.substring(SCHEME_PREFIX.length()).trim();
    }
    return value;
  }

  private String firstText(JsonNode preferred, JsonNode fallback) {
    String value = text(preferred);
    return value != null ? value : text(fallback);
  }

  private String text(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return null;
    }
    String value = node.asText();
    return value.isBlank() ? null : value;
  }
}
