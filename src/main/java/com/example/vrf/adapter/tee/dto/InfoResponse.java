package com.example.vrf.adapter.tee.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * TEE agent Info response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InfoResponse(
    @JsonProperty("app_id") String appId,
    @JsonProperty("instance_id") String instanceId,
    @JsonProperty("app_name") String appName
) {}
