package com.example.vrf.exception;


/**
 * Attestation could not be produced where a hardware quote is mandatory
 */
public class AttestationException extends RuntimeException {
  public AttestationException(String message) {
    super(message);
  }

  public AttestationException(String message, Throwable cause) {
    super(message, cause);
  }
}
