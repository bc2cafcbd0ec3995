package com.example.vrf.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.vrf.domain.entity.AccessGrant;
import com.example.vrf.domain.entity.AttestationEnvelope;
import com.example.vrf.domain.entity.CommitmentRecord;
import com.example.vrf.domain.entity.PaymentRequirement;
import com.example.vrf.domain.entity.RandomnessRequest;
import com.example.vrf.domain.entity.TeeIdentity;
import com.example.vrf.domain.entity.VerifiedPayment;
import com.example.vrf.exception.AttestationException;
import com.example.vrf.exception.RandomnessValidationException;
import com.example.vrf.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class RandomnessPipelineTest {

  private AccessGateService accessGate;
  private AttestationBinder binder;
  private CommitmentPublisher publisher;
  private UsageStatsService usageStats;
  private SettlementService settlement;
  private RandomnessPipeline pipeline;
  private MockHttpServletRequest httpRequest;

  @BeforeEach
  void setUp() {
    MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    accessGate = mock(AccessGateService.class);
    binder = mock(AttestationBinder.class);
    publisher = mock(CommitmentPublisher.class);
    settlement = mock(SettlementService.class);
    TeeIdentityService teeIdentity = mock(TeeIdentityService.class);
    when(teeIdentity.teeType()).thenReturn("simulation");
    when(teeIdentity.identity()).thenReturn(new TeeIdentity("test-app", null, null));
    when(binder.bind(anyString(), anyString()))
        .thenReturn(new AttestationEnvelope.MockTeeAttestation("00", 0L, "sim"));
    usageStats = new UsageStatsService(clock);

    pipeline = new RandomnessPipeline(
        new RandomnessEngine(new SecureRandomEntropySource(), clock), accessGate, binder,
        new AttestationCodec(new ObjectMapper()), publisher, teeIdentity, usageStats, settlement);
    httpRequest = new MockHttpServletRequest("POST", "/v1/random/number");
  }

  private static AccessGrant paidGrant() {
    var requirement = new PaymentRequirement("exact", "base", "10000", "USDC-base", "payto-base", 60, null);
    return AccessGrant.paid(new VerifiedPayment(null, requirement, "hash", "0xpayer"));
  }

  @Test
  void assemblesResponse() {
    when(accessGate.authorize(any(), eq("/v1/random/number"))).thenReturn(AccessGrant.apiKey("k"));
    CommitmentRecord record = new CommitmentRecord("c0", "tx", "https://arweave.net/tx", false);
    when(publisher.publish(anyString(), eq("number:1-6"), anyString(), eq("number"), anyMap()))
        .thenReturn(record);

    Map<String, Object> response = pipeline.execute(RandomnessRequest.number(1L, 6L, null, null), httpRequest);

    assertThat(response).containsKeys("number", "min", "max", "random_seed", "attestation", "timestamp");
    assertThat((Long) response.get("number")).isBetween(1L, 6L);
    assertThat((String) response.get("random_seed")).matches("[0-9a-f]{64}");
    assertThat(response)
        .containsEntry("tee_type", "simulation")
        .containsEntry("app_id", "test-app")
        .containsEntry("commitment", record);
    assertThat(usageStats.snapshot().apiKeyRequests()).isEqualTo(1);
    verifyNoInteractions(settlement);
  }

  @Test
  void omitsCommitmentWhenDisabled() {
    when(accessGate.authorize(any(), any())).thenReturn(AccessGrant.apiKey("k"));

    Map<String, Object> response = pipeline.execute(RandomnessRequest.uuid(null, null), httpRequest);

    assertThat(response).containsKey("uuid").doesNotContainKey("commitment");
  }

  @Test
  void schedulesSettlementForPaidRequest() {
    AccessGrant grant = paidGrant();
    when(accessGate.authorize(any(), any())).thenReturn(grant);

    pipeline.execute(RandomnessRequest.dice("2d6", null, null), httpRequest);

    verify(settlement).settleAsync(grant.payment());
    assertThat(usageStats.snapshot().totalRevenueBaseUnits()).isEqualTo(10_000);
  }

  @Test
  void validatesBeforeCharging() {
    assertThatThrownBy(() -> pipeline.execute(RandomnessRequest.dice("0d6", null, null), httpRequest))
        .isInstanceOf(RandomnessValidationException.class);

    verifyNoInteractions(accessGate);
  }

  @Test
  void releasesReservationWhenAttestationFails() {
    AccessGrant grant = paidGrant();
    when(accessGate.authorize(any(), any())).thenReturn(grant);
    when(binder.bind(anyString(), anyString())).thenThrow(new AttestationException("TEE attestation unavailable"));

    assertThatThrownBy(() -> pipeline.execute(RandomnessRequest.randomness(null, null), httpRequest))
        .isInstanceOf(AttestationException.class);

    verify(accessGate).release(grant);
    verify(settlement, never()).settleAsync(any());
    assertThat(usageStats.snapshot().totalRequests()).isZero();
  }
}
