package com.example.vrf.adapter.tee.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * TEE agent GetKey response. {@code key} is hex encoded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyResponse(
    @JsonProperty("key") String key,
    @JsonProperty("signature_chain") List<String> signatureChain
) {}
