package com.example.vrf.adapter.storage.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Storage gateway upload receipt
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadResponse(String id) {}
