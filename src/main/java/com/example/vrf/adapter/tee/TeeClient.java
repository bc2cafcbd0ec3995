package com.example.vrf.adapter.tee;

import com.example.vrf.adapter.tee.dto.InfoResponse;
import com.example.vrf.adapter.tee.dto.KeyResponse;
import com.example.vrf.adapter.tee.dto.QuoteResponse;

/**
 * TEE agent running next to the service inside the confidential VM.
 * Every call throws {@link com.example.vrf.exception.TeeException} on failure.
 */
public interface TeeClient {

  /**
   * Hardware quote with the given 32-byte report data embedded.
   */
  QuoteResponse getQuote(byte[] reportData);

  /**
   * Key deterministically derived from the application identity and {@code path}.
   */
  KeyResponse getKey(String path, String purpose);

  InfoResponse info();

  boolean isConfigured();
}
