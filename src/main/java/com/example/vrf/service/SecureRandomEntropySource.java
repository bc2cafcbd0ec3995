package com.example.vrf.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class SecureRandomEntropySource implements EntropySource {

  private final SecureRandom secureRandom = new SecureRandom();

  @Override
  public byte[] nextBytes(int length) {
    byte[] bytes = new byte[length];
    secureRandom.nextBytes(bytes);
    return bytes;
  }
}
