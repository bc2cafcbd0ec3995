package com.example.vrf.web.rest.controller;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HealthAndAttestationIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper objectMapper;

  @Test
  void healthDescribesDeployment() throws Exception {
    mockMvc.perform(get("/v1/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.tee_type").value("simulation"))
        .andExpect(jsonPath("$.version").value("test"))
        .andExpect(jsonPath("$.x402_enabled").value(true))
        .andExpect(jsonPath("$.verification_available").value(false))
        .andExpect(jsonPath("$.replay_store").value("memory"))
        .andExpect(jsonPath("$.endpoints", hasItem("POST /v1/random/number - Random number in range")))
        .andExpect(header().string("X-Content-Type-Options", "nosniff"));
  }

  @Test
  void readinessWithoutRedis() throws Exception {
    mockMvc.perform(get("/v1/health/ready"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.redis.status").value("DISABLED"))
        .andExpect(jsonPath("$.ready").value(true));
  }

  @Test
  void statsRequireApiKey() throws Exception {
    mockMvc.perform(get("/v1/stats"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("unauthorized"));

    mockMvc.perform(get("/v1/stats").header("X-API-Key", "test-key"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.stats.total_requests", notNullValue()))
        .andExpect(jsonPath("$.uptime_seconds", notNullValue()));
  }

  @Test
  void attestationInSimulation() throws Exception {
    mockMvc.perform(get("/v1/attestation"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tee_type").value("simulation"))
        .andExpect(jsonPath("$.verified").value(false));
  }

  @Test
  void verifyRequiresInput() throws Exception {
    mockMvc.perform(post("/v1/verify").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Missing attestation or quote_hex parameter"));
  }

  @Test
  void mockAttestationFromServedRequestIsNotVerifiable() throws Exception {
    String body = mockMvc.perform(post("/v1/random/uuid").header("X-API-Key", "test-key"))
        .andExpect(status().isOk())
        .andReturn().getResponse().getContentAsString();
    JsonNode served = objectMapper.readTree(body);

    mockMvc.perform(post("/v1/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                            java.util.Map.of("attestation", served.path("attestation").asText()))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(false))
        .andExpect(jsonPath("$.tee_type").value("simulation"));
  }

  @Test
  void unmappedPathsAreDenied() throws Exception {
    mockMvc.perform(get("/admin"))
        .andExpect(status().isForbidden());
  }
}
