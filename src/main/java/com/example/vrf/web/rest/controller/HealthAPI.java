package com.example.vrf.web.rest.controller;

import static com.example.vrf.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "Health",
    description = "Health, readiness and usage endpoints for monitoring"
)
@RequestMapping(
    value = V1_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Basic health check",
      description = "Liveness plus feature flags: TEE mode, pricing, replay store mode, commitments"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is healthy"),
      @ApiResponse(responseCode = "500", description = "Internal server error")
  })
  @GetMapping(value = HEALTH)
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Readiness probe",
      description = "Checks the durable replay store when one is enabled"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is ready"),
      @ApiResponse(responseCode = "503", description = "Service is not ready"),
      @ApiResponse(responseCode = "500", description = "Internal server error")
  })
  @GetMapping(value = READY)
  ResponseEntity<Map<String, Object>> readiness();

  @Operation(
      summary = "Usage statistics",
      description = "Request counters and revenue since start. Requires X-API-Key or api_key."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Counters returned"),
      @ApiResponse(responseCode = "401", description = "Missing or unknown API key")
  })
  @GetMapping(value = STATS)
  ResponseEntity<Map<String, Object>> stats(HttpServletRequest request);
}
