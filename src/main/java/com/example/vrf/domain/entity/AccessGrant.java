package com.example.vrf.domain.entity;

/**
 * Outcome of a successful access check. Lives for one request only.
 *
 * @param tier     the tier that matched first
 * @param identity API key fingerprint, matched allow-list entry, or payer address
 * @param payment  the verified payment awaiting settlement; {@code null} unless {@code tier == PAID}
 */
public record AccessGrant(
    AccessTier tier,
    String identity,
    VerifiedPayment payment
) {

  public static AccessGrant apiKey(String identity) {
    return new AccessGrant(AccessTier.API_KEY, identity, null);
  }

  public static AccessGrant allowlisted(String identity) {
    return new AccessGrant(AccessTier.ALLOWLISTED, identity, null);
  }

  public static AccessGrant paid(VerifiedPayment payment) {
    return new AccessGrant(AccessTier.PAID, payment.payer(), payment);
  }

  public boolean requiresSettlement() {
    return tier == AccessTier.PAID && payment != null;
  }
}
