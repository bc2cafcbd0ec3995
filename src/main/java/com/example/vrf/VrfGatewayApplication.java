package com.example.vrf;

import com.example.vrf.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Verifiable randomness gateway
 *
 * Attested random values behind an x402 paywall with:
 * - TEE quotes binding every seed to the request
 * - Replay protection backed by Redis with an in-memory fallback
 * - Optional commitments published to immutable storage
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class VrfGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(VrfGatewayApplication.class);
    app.setRegisterShutdownHook(true); // drains the background executor
    app.run(args);
  }
}
