package com.example.vrf.service;

import com.example.vrf.adapter.tee.TeeClient;
import com.example.vrf.adapter.tee.dto.InfoResponse;
import com.example.vrf.adapter.tee.dto.QuoteResponse;
import com.example.vrf.domain.entity.TeeIdentity;
import com.example.vrf.exception.AttestationException;
import com.example.vrf.exception.TeeException;
import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.util.HashUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks whether TEE hardware is present and which deployment this instance is.
 */
@Slf4j
@Service
public class TeeIdentityService {

  public static final String TEE_TYPE_TDX = "tdx";
  public static final String TEE_TYPE_SIMULATION = "simulation";
  private static final String ATTESTATION_REQUEST = "attestation-request";

  private final TeeClient teeClient;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties.TeeProperties tee;

  private volatile boolean hardwareDetected;
  private volatile TeeIdentity identity;

  public TeeIdentityService(TeeClient teeClient, ObjectMapper objectMapper,
                            ApplicationProperties properties) {
    this.teeClient = teeClient;
    this.objectMapper = objectMapper;
    this.tee = properties.tee();
    this.identity = new TeeIdentity(tee.appId(), null, null);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void detect() {
    if (!teeClient.isConfigured()) {
      log.info("TEE agent not configured, running in simulation mode");
      return;
    }
    try {
      InfoResponse info = teeClient.info();
      hardwareDetected = true;
      TeeIdentity current = identity;
      if (info.appId() != null && !info.appId().isBlank()) {
        current = current.withAppId(info.appId());
      }
      if (info.instanceId() != null && !info.instanceId().isBlank()) {
        current = current.withInstanceId(info.instanceId());
      }
      identity = current;
      log.info("TEE agent detected, running in TDX mode (app_id={})", current.appId());
    } catch (TeeException e) {
      log.warn("TEE agent not reachable, running in simulation mode: {}", e.getMessage());
    }
  }

  public String teeType() {
    return hardwareDetected ? TEE_TYPE_TDX : TEE_TYPE_SIMULATION;
  }

  public boolean hardwareDetected() {
    return hardwareDetected;
  }

  public TeeIdentity identity() {
    return identity;
  }

  /**
   * Fresh quote and identity for out-of-band verification.
   *
   * @throws AttestationException when the TEE cannot produce a quote
   */
  public Map<String, Object> attestationInfo() {
    Map<String, Object> response = new LinkedHashMap<>();
    if (!hardwareDetected) {
      response.put("tee_type", teeType());
      response.put("verified", false);
      response.put("error", "TEE hardware not available (simulation mode)");
      response.put("verification_url", null);
      return response;
    }

    QuoteResponse quote;
    try {
      quote = teeClient.getQuote(HashUtils.sha256(ATTESTATION_REQUEST.getBytes(StandardCharsets.UTF_8)));
    } catch (TeeException e) {
      log.error("Failed to get attestation info", e);
      throw new AttestationException("Failed to generate attestation", e);
    }

    TeeIdentity current = parseEventLog(quote.eventLog(), identity);
    identity = current;

    Map<String, Object> verification = new LinkedHashMap<>();
    verification.put("phala_cloud_api", tee.verificationUrl());
    verification.put("phala_dashboard", tee.dashboardUrl() + current.appId());
    verification.put("instructions",
                     "POST the quote_hex to the verification API to verify this attestation");

    response.put("tee_type", teeType());
    response.put("verified", true);
    response.put("app_id", current.appId());
    response.put("compose_hash", current.composeHash());
    response.put("instance_id", current.instanceId());
    response.put("quote_hex", quote.quote());
    response.put("event_log", quote.eventLog());
    response.put("verification", verification);
    return response;
  }

  /**
   * Picks app-id, compose-hash and instance-id out of the TEE event log.
   * An unreadable log leaves the identity unchanged.
   */
  TeeIdentity parseEventLog(String eventLog, TeeIdentity current) {
    if (eventLog == null || eventLog.isBlank()) {
      return current;
    }
    TeeIdentity parsed = current;
    try {
      JsonNode events = objectMapper.readTree(eventLog);
      if (!events.isArray()) {
        return current;
      }
      for (JsonNode event : events) {
        String payload = event.path("event_payload").asText(null);
        switch (event.path("event").asText("")) {
          case "app-id" -> parsed = parsed.withAppId(payload);
          case "compose-hash" -> parsed = parsed.withComposeHash(payload);
          case "instance-id" -> parsed = parsed.withInstanceId(payload);
          default -> {
            // other measurements are not part of the identity
          }
        }
      }
      return parsed;
    } catch (IOException e) {
      log.warn("Could not parse TEE event log: {}", e.getMessage());
      return current;
    }
  }
}
