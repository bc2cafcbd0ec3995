package com.example.vrf.exception;

import com.example.vrf.domain.entity.PaymentRequirements;

/**
 * Request denied by the access gate. Always rendered as 402 with the
 * payment requirements attached, so the caller can pay (again).
 */
public class PaymentRequiredException extends RuntimeException {

  public enum Reason {
    PAYMENT_REQUIRED("payment_required"),
    INVALID_PAYMENT_FORMAT("invalid_payment_format"),
    REPLAY_DETECTED("replay_detected"),
    PAYMENT_INVALID("payment_invalid");

    private final String code;

    Reason(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }

  private final Reason reason;
  private final transient PaymentRequirements requirements;

  public PaymentRequiredException(Reason reason, String message, PaymentRequirements requirements) {
    super(message);
    this.reason = reason;
    this.requirements = requirements;
  }

  public Reason reason() {
    return reason;
  }

  public PaymentRequirements requirements() {
    return requirements;
  }
}
