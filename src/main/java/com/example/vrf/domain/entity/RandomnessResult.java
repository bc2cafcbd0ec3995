package com.example.vrf.domain.entity;

/**
 * The output of one randomness call. {@code seedHex} is the only entropy used;
 * {@code derivedValue} is a pure function of the underlying bytes.
 */
public record RandomnessResult(
    RandomnessOperation operation,
    String seedHex,
    DerivedValue derivedValue,
    long timestampMs
) {}
