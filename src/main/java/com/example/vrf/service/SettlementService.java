package com.example.vrf.service;

import com.example.vrf.adapter.facilitator.PaymentFacilitator;
import com.example.vrf.adapter.facilitator.dto.SettleResponse;
import com.example.vrf.domain.entity.VerifiedPayment;
import com.example.vrf.exception.FacilitatorException;
import com.example.vrf.util.HashUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Settles verified payments after the randomness has been delivered.
 * Failures are logged only; the caller already has its result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {

  private final PaymentFacilitator facilitator;
  private final RetryTemplate settlementRetryTemplate;

  @Async("backgroundTaskExecutor")
  public void settleAsync(VerifiedPayment payment) {
    settle(payment);
  }

  /**
   * @return {@code true} if the facilitator reported the payment settled
   */
  public boolean settle(VerifiedPayment payment) {
    String proof = HashUtils.abbreviate(payment.proofHash());
    if (!facilitator.isConfigured()) {
      log.warn("Skipping settlement of unverified payment {}", proof);
      return false;
    }
    try {
      SettleResponse response = settlementRetryTemplate.execute(context -> {
        if (context.getRetryCount() > 0) {
          log.info("Retrying settlement of {} (attempt {})", proof, context.getRetryCount() + 1);
        }
        return facilitator.settle(payment.proof(), payment.requirement());
      });
      if (response.success()) {
        log.info("Settlement succeeded for {}: transaction={}, network={}",
                 proof, response.transaction(), response.network());
        return true;
      }
      log.warn("Settlement rejected for {}: {}", proof, response.errorReason());
      return false;
    } catch (FacilitatorException e) {
      log.error("Settlement failed for {} after retries", proof, e);
      return false;
    }
  }
}
