package com.example.vrf.web.rest.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Body of pick and shuffle. Items may be any JSON values and are returned as given.
 */
public record ItemsRequest(
    List<Object> items,
    @JsonProperty("request_hash") String requestHash,
    Map<String, Object> metadata
) {}
