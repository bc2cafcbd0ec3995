package com.example.vrf.web.rest.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code /v1/randomness} and {@code /v1/random/uuid}; both fields optional
 */
public record RandomnessBody(
    @JsonProperty("request_hash") String requestHash,
    Map<String, Object> metadata
) {}
