package com.example.vrf.adapter.facilitator.dto;

import com.example.vrf.domain.entity.PaymentRequirement;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of the facilitator /verify and /settle calls
 */
public record FacilitatorRequest(
    int x402Version,
    JsonNode paymentPayload,
    PaymentRequirement paymentRequirements
) {}
