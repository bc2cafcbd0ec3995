package com.example.vrf.exception;

/**
 * Missing or unknown API key on an operator endpoint.
 */
public class UnauthorizedException extends RuntimeException {
  public UnauthorizedException(String message) {
    super(message);
  }
}
