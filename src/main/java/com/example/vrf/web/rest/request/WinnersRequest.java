package com.example.vrf.web.rest.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record WinnersRequest(
    List<Object> items,
    Integer count,
    @JsonProperty("request_hash") String requestHash,
    Map<String, Object> metadata
) {}
