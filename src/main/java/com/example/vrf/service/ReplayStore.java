package com.example.vrf.service;

/**
 * Set of consumed payment-proof hashes with TTL.
 *
 * <p>{@link #reserve(String)} is atomic: of any number of concurrent callers
 * reserving the same hash, exactly one gets {@code true}.
 */
public interface ReplayStore {

  boolean exists(String proofHash);

  /**
   * Marks the hash as in use.
   *
   * @return {@code true} if this call inserted the hash, {@code false} if it was already present
   */
  boolean reserve(String proofHash);

  /**
   * Undoes a reservation whose payment was not accepted.
   */
  void release(String proofHash);
}
