package com.example.vrf.domain.entity;

/**
 * Deployment identity as reported by the TEE event log.
 */
public record TeeIdentity(String appId, String composeHash, String instanceId) {

  public TeeIdentity withAppId(String value) {
    return new TeeIdentity(value, composeHash, instanceId);
  }

  public TeeIdentity withComposeHash(String value) {
    return new TeeIdentity(appId, value, instanceId);
  }

  public TeeIdentity withInstanceId(String value) {
    return new TeeIdentity(appId, composeHash, value);
  }
}
