package com.example.vrf.web.rest.controller;

import static com.example.vrf.web.rest.ApiConstants.ApiPath.*;

import com.example.vrf.web.rest.request.VerifyRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "Attestation",
    description = "TEE identity and out-of-band quote verification"
)
@RequestMapping(
    value = V1_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AttestationAPI {

  @Operation(
      summary = "Current TEE attestation",
      description = "Fresh quote plus app id, compose hash and instance id parsed from the event log"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Attestation generated, or simulation notice"),
      @ApiResponse(responseCode = "500", description = "TEE failed to produce a quote")
  })
  @GetMapping(value = ATTESTATION)
  ResponseEntity<Map<String, Object>> attestation();

  @Operation(
      summary = "Verify an attestation",
      description = "Accepts a base64 attestation envelope or a raw quote_hex and checks it "
                    + "against the quote verification API"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Verification performed"),
      @ApiResponse(responseCode = "400", description = "Missing or undecodable input"),
      @ApiResponse(responseCode = "500", description = "Verification API unreachable")
  })
  @PostMapping(value = VERIFY)
  ResponseEntity<Map<String, Object>> verify(@RequestBody VerifyRequest body);
}
