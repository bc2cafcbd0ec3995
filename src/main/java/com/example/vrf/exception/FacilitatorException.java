package com.example.vrf.exception;


/**
 * Payment facilitator call failure
 */
public class FacilitatorException extends RuntimeException {
  public FacilitatorException(String message) {
    super(message);
  }

  public FacilitatorException(String message, Throwable cause) {
    super(message, cause);
  }
}
