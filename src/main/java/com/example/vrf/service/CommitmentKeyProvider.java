package com.example.vrf.service;

import com.example.vrf.adapter.tee.TeeClient;
import com.example.vrf.adapter.tee.dto.KeyResponse;
import com.example.vrf.exception.TeeException;
import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.util.HashUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * Commitment signing key, derived from the TEE on first use and kept for the
 * lifetime of the process. The key never leaves memory.
 */
@Slf4j
@Component
public class CommitmentKeyProvider {

  public static final String SIGNATURE_ALGORITHM = "HMAC-SHA256";
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final String KEY_PURPOSE = "signing";
  private static final String ENCRYPTION_KEY_LABEL = "commitment-encryption";

  private final TeeClient teeClient;
  private final String keyPath;

  private volatile byte[] signingKey;
  private volatile SecretKey encryptionKey;

  public CommitmentKeyProvider(TeeClient teeClient, ApplicationProperties properties) {
    this.teeClient = teeClient;
    this.keyPath = properties.commitment().keyPath();
  }

  /**
   * HMAC-SHA256 of {@code document}, hex encoded.
   *
   * @throws TeeException when the key cannot be derived
   */
  public String sign(byte[] document) {
    return HashUtils.toHex(hmac(signingKey(), document));
  }

  /**
   * AES-256 key for proof payload encryption, derived from the signing key.
   */
  public SecretKey encryptionKey() {
    SecretKey key = encryptionKey;
    if (key == null) {
      synchronized (this) {
        if (encryptionKey == null) {
          byte[] material = hmac(signingKey(), ENCRYPTION_KEY_LABEL.getBytes(StandardCharsets.UTF_8));
          encryptionKey = new SecretKeySpec(material, "AES");
        }
        key = encryptionKey;
      }
    }
    return key;
  }

  private byte[] signingKey() {
    byte[] key = signingKey;
    if (key == null) {
      synchronized (this) {
        if (signingKey == null) {
          signingKey = derive();
        }
        key = signingKey;
      }
    }
    return key;
  }

  private byte[] derive() {
    KeyResponse response = teeClient.getKey(keyPath, KEY_PURPOSE);
    byte[] material;
    try {
      material = HashUtils.fromHex(response.key());
    } catch (IllegalArgumentException e) {
      throw new TeeException("TEE returned a malformed key for path: " + keyPath, e);
    }
    if (material.length < 32) {
      throw new TeeException("TEE key for path " + keyPath + " is shorter than 256 bits");
    }
    log.info("Commitment signing key derived from TEE path: {}", keyPath);
    return Arrays.copyOf(material, 32);
  }

  private static byte[] hmac(byte[] key, byte[] data) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 not available", e);
    }
  }
}
