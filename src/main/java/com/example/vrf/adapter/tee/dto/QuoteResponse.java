package com.example.vrf.adapter.tee.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * TEE agent GetQuote response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuoteResponse(
    @JsonProperty("quote") String quote,
    @JsonProperty("event_log") String eventLog
) {}
