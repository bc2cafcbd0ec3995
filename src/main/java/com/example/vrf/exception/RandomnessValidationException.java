package com.example.vrf.exception;

/**
 * Malformed or out-of-range randomness parameters. Mapped to 400.
 */
public class RandomnessValidationException extends RuntimeException {
  public RandomnessValidationException(String message) {
    super(message);
  }
}
