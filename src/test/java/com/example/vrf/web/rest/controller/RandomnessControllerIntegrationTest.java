package com.example.vrf.web.rest.controller;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.vrf.adapter.facilitator.PaymentFacilitator;
import com.example.vrf.adapter.facilitator.dto.SettleResponse;
import com.example.vrf.adapter.facilitator.dto.SupportedResponse;
import com.example.vrf.adapter.facilitator.dto.VerifyResponse;
import com.example.vrf.support.PaymentHeaders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RandomnessControllerIntegrationTest {

  private static final String API_KEY = "test-key";

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private PaymentFacilitator facilitator;

  @BeforeEach
  void setUp() {
    when(facilitator.isConfigured()).thenReturn(true);
    when(facilitator.supported()).thenReturn(SupportedResponse.empty());
  }

  @Test
  void numberWithApiKey() throws Exception {
    mockMvc.perform(post("/v1/random/number")
                        .header("X-API-Key", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"min\":1,\"max\":100}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.number", allOf(greaterThanOrEqualTo(1), lessThanOrEqualTo(100))))
        .andExpect(jsonPath("$.min").value(1))
        .andExpect(jsonPath("$.max").value(100))
        .andExpect(jsonPath("$.random_seed", matchesPattern("[0-9a-f]{64}")))
        .andExpect(jsonPath("$.attestation", notNullValue()))
        .andExpect(jsonPath("$.tee_type").value("simulation"))
        .andExpect(jsonPath("$.app_id").value("test-app"))
        .andExpect(header().exists("X-RateLimit-Limit"))
        .andExpect(header().exists("X-RateLimit-Reset"));
  }

  @Test
  void diceWithApiKey() throws Exception {
    mockMvc.perform(post("/v1/random/dice")
                        .header("X-API-Key", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dice\":\"2d6\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.dice").value("2d6"))
        .andExpect(jsonPath("$.rolls", hasSize(2)))
        .andExpect(jsonPath("$.min_possible").value(2))
        .andExpect(jsonPath("$.max_possible").value(12));
  }

  @Test
  void rawRandomnessAcceptsEmptyBody() throws Exception {
    mockMvc.perform(post("/v1/randomness").param("api_key", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.random_seed", matchesPattern("[0-9a-f]{64}")));
  }

  @Test
  void unpaidRequestGets402WithRequirements() throws Exception {
    mockMvc.perform(post("/v1/random/uuid"))
        .andExpect(status().isPaymentRequired())
        .andExpect(header().exists("payment-required"))
        .andExpect(jsonPath("$.status").value(402))
        .andExpect(jsonPath("$.error").value("payment_required"))
        .andExpect(jsonPath("$.path").value("/v1/random/uuid"))
        .andExpect(jsonPath("$.payment.accepts", hasSize(2)))
        .andExpect(jsonPath("$.payment.accepts[0].network").value("solana"))
        .andExpect(jsonPath("$.payment.accepts[0].payTo").value("payto-solana"));
  }

  @Test
  void invalidParametersAreRejectedBeforePayment() throws Exception {
    mockMvc.perform(post("/v1/random/number")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"min\":10,\"max\":1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_error"));

    verify(facilitator, never()).verify(any(), any());
  }

  @Test
  void malformedJsonIsBadRequest() throws Exception {
    mockMvc.perform(post("/v1/random/pick")
                        .header("X-API-Key", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_error"));
  }

  @Test
  void paidRequestIsServedOnceAndSettled() throws Exception {
    when(facilitator.verify(any(), any())).thenReturn(new VerifyResponse(true, null, "0xpayer"));
    when(facilitator.settle(any(), any()))
        .thenReturn(new SettleResponse(true, "0xtx", "base", "0xpayer", null));
    String payment = PaymentHeaders.baseV2("0xpayer", "nonce-it-1");

    mockMvc.perform(post("/v1/random/uuid").header("PAYMENT-SIGNATURE", payment))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.uuid", notNullValue()));

    mockMvc.perform(post("/v1/random/uuid").header("PAYMENT-SIGNATURE", payment))
        .andExpect(status().isPaymentRequired())
        .andExpect(jsonPath("$.error").value("replay_detected"));

    verify(facilitator, timeout(2_000)).settle(any(), any());
  }

  @Test
  void rejectedPaymentIs402() throws Exception {
    when(facilitator.verify(any(), any())).thenReturn(VerifyResponse.invalid("insufficient_funds"));

    mockMvc.perform(post("/v1/random/uuid")
                        .header("PAYMENT-SIGNATURE", PaymentHeaders.solanaV2("dHgtaXQtMg==")))
        .andExpect(status().isPaymentRequired())
        .andExpect(jsonPath("$.error").value("payment_invalid"))
        .andExpect(jsonPath("$.message").value("insufficient_funds"));
  }

  @Test
  void unknownRandomRouteIsNotFound() throws Exception {
    mockMvc.perform(post("/v1/random/coin").header("X-API-Key", API_KEY))
        .andExpect(status().isNotFound());
  }

  @Test
  void getIsNotAllowed() throws Exception {
    mockMvc.perform(get("/v1/random/number").header("X-API-Key", API_KEY))
        .andExpect(status().isMethodNotAllowed());
  }
}
