package com.example.vrf.exception;


/**
 * TEE agent call failure
 */
public class TeeException extends RuntimeException {
  public TeeException(String message) {
    super(message);
  }

  public TeeException(String message, Throwable cause) {
    super(message, cause);
  }
}
