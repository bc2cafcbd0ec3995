package com.example.vrf.exception;


/**
 * Durable replay store unreachable
 */
public class ReplayStoreUnavailableException extends RuntimeException {
  public ReplayStoreUnavailableException(String message) {
    super(message);
  }

  public ReplayStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
