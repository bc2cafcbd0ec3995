package com.example.vrf.service;

/**
 * Source of cryptographically secure random bytes.
 */
public interface EntropySource {

  byte[] nextBytes(int length);
}
