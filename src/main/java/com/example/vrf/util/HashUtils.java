package com.example.vrf.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers shared by the replay store, the rate limiter and the attestation layer
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class HashUtils {

  private static final HexFormat HEX = HexFormat.of();

  public static byte[] sha256(byte[]... parts) {
    MessageDigest digest = newDigest();
    for (byte[] part : parts) {
      digest.update(part);
    }
    return digest.digest();
  }

  public static String sha256Hex(byte[]... parts) {
    return HEX.formatHex(sha256(parts));
  }

  public static String sha256Hex(String value) {
    return sha256Hex(value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * {@code SHA256(seed || requestHash)} over the UTF-8 text of both values.
   * Used both as attestation report data and as the published commitment.
   */
  public static byte[] bindSeed(String seedHex, String requestHash) {
    return sha256(
        seedHex.getBytes(StandardCharsets.UTF_8),
        (requestHash != null ? requestHash : "").getBytes(StandardCharsets.UTF_8));
  }

  public static String toHex(byte[] bytes) {
    return HEX.formatHex(bytes);
  }

  public static byte[] fromHex(String hex) {
    String normalized = hex.startsWith("0x") ? hex.substring(2) : hex;
    return HEX.parseHex(normalized);
  }

  /**
   * Shortened form for log lines.
   */
  public static String abbreviate(String hash) {
    if (hash == null || hash.length() <= 12) {
      return hash;
    }
    return hash.substring(0, 12) + "...";
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
