package com.example.vrf.domain.entity;

import java.time.Instant;

/**
 * A consumed (or in-flight) payment proof.
 */
public record ReplayRecord(String proofHash, Instant insertedAt) {}
