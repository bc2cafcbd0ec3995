package com.example.vrf.web.rest.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Either a base64 attestation envelope or a raw quote in hex
 */
public record VerifyRequest(
    String attestation,
    @JsonProperty("quote_hex") String quoteHex
) {}
