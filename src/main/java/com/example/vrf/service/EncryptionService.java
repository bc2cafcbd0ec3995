package com.example.vrf.service;

import com.example.vrf.exception.EncryptionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption of proof payloads with the TEE-derived commitment key
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EncryptionService {

  private final CommitmentKeyProvider keyProvider;

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  /**
   * Encrypts and returns base64 of {@code iv || ciphertext}.
   */
  public String encrypt(byte[] plaintext) {
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, keyProvider.encryptionKey(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));

      byte[] encrypted = cipher.doFinal(plaintext);

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);

      return Base64.getEncoder().encodeToString(combined);

    } catch (Exception e) {
      log.error("Proof encryption failed", e);
      throw new EncryptionException("Failed to encrypt proof payload", e);
    }
  }

  /**
   * Reverses {@link #encrypt}. This is how holders of the key read an encrypted proof document.
   */
  public byte[] decrypt(String encryptedData) {
    try {
      byte[] combined = Base64.getDecoder().decode(encryptedData);
      if (combined.length <= GCM_IV_LENGTH) {
        throw new EncryptionException("Encrypted payload is too short");
      }

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, keyProvider.encryptionKey(),
                  new GCMParameterSpec(GCM_TAG_LENGTH, combined, 0, GCM_IV_LENGTH));

      return cipher.doFinal(combined, GCM_IV_LENGTH, combined.length - GCM_IV_LENGTH);

    } catch (EncryptionException e) {
      throw e;
    } catch (Exception e) {
      log.error("Proof decryption failed", e);
      throw new EncryptionException("Failed to decrypt proof payload", e);
    }
  }
}
