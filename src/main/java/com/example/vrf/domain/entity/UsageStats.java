package com.example.vrf.domain.entity;

/**
 * Point-in-time snapshot of usage counters.
 */
public record UsageStats(
    long totalRequests,
    long paidRequests,
    long allowlistedRequests,
    long apiKeyRequests,
    long totalRevenueBaseUnits
) {}
