package com.example.vrf.web.rest.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * @param dice notation such as {@code 2d6} or {@code 1d20}
 */
public record DiceRequest(
    String dice,
    @JsonProperty("request_hash") String requestHash,
    Map<String, Object> metadata
) {}
