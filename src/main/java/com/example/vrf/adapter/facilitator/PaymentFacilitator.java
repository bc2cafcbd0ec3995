package com.example.vrf.adapter.facilitator;

import com.example.vrf.adapter.facilitator.dto.SettleResponse;
import com.example.vrf.adapter.facilitator.dto.SupportedResponse;
import com.example.vrf.adapter.facilitator.dto.VerifyResponse;
import com.example.vrf.domain.entity.PaymentProof;
import com.example.vrf.domain.entity.PaymentRequirement;

/**
 * Third-party service that verifies and settles x402 payments on our behalf.
 */
public interface PaymentFacilitator {

  /**
   * Checks the payment against the requirement without moving funds.
   *
   * @throws com.example.vrf.exception.FacilitatorException when the facilitator cannot be reached
   */
  VerifyResponse verify(PaymentProof proof, PaymentRequirement requirement);

  /**
   * Executes a previously verified payment on-chain.
   *
   * @throws com.example.vrf.exception.FacilitatorException when the facilitator cannot be reached
   */
  SettleResponse settle(PaymentProof proof, PaymentRequirement requirement);

  /**
   * Supported networks; empty when the facilitator cannot be reached.
   */
  SupportedResponse supported();

  boolean isConfigured();
}
