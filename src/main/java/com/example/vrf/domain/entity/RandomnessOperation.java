package com.example.vrf.domain.entity;

/**
 * Randomness-producing operations, named as they appear in routes and proofs.
 */
public enum RandomnessOperation {
  RANDOMNESS("randomness"),
  NUMBER("number"),
  DICE("dice"),
  PICK("pick"),
  SHUFFLE("shuffle"),
  WINNERS("winners"),
  UUID("uuid");

  private final String endpointName;

  RandomnessOperation(String endpointName) {
    this.endpointName = endpointName;
  }

  public String endpointName() {
    return endpointName;
  }
}
