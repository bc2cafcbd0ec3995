package com.example.vrf.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * One entry of the x402 {@code accepts} array: what to pay, where, and on which network.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PaymentRequirement(
    String scheme,
    String network,
    String amount,
    String asset,
    String payTo,
    int maxTimeoutSeconds,
    Map<String, String> extra
) {}
