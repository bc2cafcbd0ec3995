package com.example.vrf.web.rest.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record NumberRequest(
    Long min,
    Long max,
    @JsonProperty("request_hash") String requestHash,
    Map<String, Object> metadata
) {}
