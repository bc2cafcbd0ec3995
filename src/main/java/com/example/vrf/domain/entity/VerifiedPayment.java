package com.example.vrf.domain.entity;

/**
 * A payment proof that passed facilitator verification, paired with the
 * requirement it was verified against. Settled after the handler succeeds.
 */
public record VerifiedPayment(
    PaymentProof proof,
    PaymentRequirement requirement,
    String proofHash,
    String payer
) {}
