package com.example.vrf.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.vrf.adapter.tee.TeeClient;
import com.example.vrf.adapter.tee.dto.KeyResponse;
import com.example.vrf.exception.EncryptionException;
import com.example.vrf.exception.TeeException;
import com.example.vrf.support.TestProperties;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EncryptionServiceTest {

  private TeeClient teeClient;
  private CommitmentKeyProvider keyProvider;
  private EncryptionService encryptionService;

  @BeforeEach
  void setUp() {
    teeClient = mock(TeeClient.class);
    when(teeClient.getKey(anyString(), anyString())).thenReturn(new KeyResponse("0x" + "7a".repeat(32), List.of()));
    keyProvider = new CommitmentKeyProvider(teeClient, TestProperties.defaults().build());
    encryptionService = new EncryptionService(keyProvider);
  }

  @Test
  void decryptsWhatItEncrypted() {
    byte[] plaintext = "{\"request_hash\":\"dice:2d6\"}".getBytes(StandardCharsets.UTF_8);

    String first = encryptionService.encrypt(plaintext);
    String second = encryptionService.encrypt(plaintext);

    assertThat(first).isNotEqualTo(second);
    assertThat(encryptionService.decrypt(first)).isEqualTo(plaintext);
    assertThat(encryptionService.decrypt(second)).isEqualTo(plaintext);
  }

  @Test
  void keyIsDerivedOnce() {
    encryptionService.encrypt(new byte[] {1});
    keyProvider.sign(new byte[] {2});
    encryptionService.encrypt(new byte[] {3});

    verify(teeClient, times(1)).getKey("commitment/signing", "signing");
  }

  @Test
  void tamperedCiphertextFails() {
    byte[] combined = Base64.getDecoder().decode(encryptionService.encrypt(new byte[] {1, 2, 3}));
    combined[combined.length - 1] ^= 0x01;

    assertThatThrownBy(() -> encryptionService.decrypt(Base64.getEncoder().encodeToString(combined)))
        .isInstanceOf(EncryptionException.class);
  }

  @Test
  void truncatedPayloadFails() {
    assertThatThrownBy(() -> encryptionService.decrypt(Base64.getEncoder().encodeToString(new byte[4])))
        .isInstanceOf(EncryptionException.class)
        .hasMessage("Encrypted payload is too short");
  }

  @Test
  void shortTeeKeyIsRejected() {
    when(teeClient.getKey(anyString(), anyString())).thenReturn(new KeyResponse("abcdef", List.of()));
    CommitmentKeyProvider weak = new CommitmentKeyProvider(teeClient, TestProperties.defaults().build());

    assertThatThrownBy(() -> weak.sign(new byte[] {1}))
        .isInstanceOf(TeeException.class)
        .hasMessageContaining("shorter than 256 bits");
  }
}
