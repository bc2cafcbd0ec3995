package com.example.vrf.web.rest.controller;

import com.example.vrf.service.AttestationVerificationService;
import com.example.vrf.service.AttestationVerificationService.VerificationOutcome;
import com.example.vrf.service.TeeIdentityService;
import com.example.vrf.web.rest.request.VerifyRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AttestationController implements AttestationAPI {

  private final TeeIdentityService teeIdentityService;
  private final AttestationVerificationService verificationService;

  @Override
  public ResponseEntity<Map<String, Object>> attestation() {
    return ResponseEntity.ok(teeIdentityService.attestationInfo());
  }

  @Override
  public ResponseEntity<Map<String, Object>> verify(VerifyRequest body) {
    VerificationOutcome outcome = verificationService.verify(body.attestation(), body.quoteHex());
    return ResponseEntity.status(outcome.status()).body(outcome.body());
  }
}
