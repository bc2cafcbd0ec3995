package com.example.vrf.domain.entity;

import java.util.List;
import java.util.Map;

/**
 * A typed randomness request. Only the parameters relevant to the operation are set.
 *
 * <p>When the caller supplies no request hash, a deterministic one is derived from
 * the parameters (e.g. {@code number:1-100}) so that the attestation report data is
 * reproducible for a given request shape.
 */
public record RandomnessRequest(
    RandomnessOperation operation,
    Long min,
    Long max,
    String dice,
    List<Object> items,
    Integer count,
    String requestHash,
    Map<String, Object> metadata
) {

  public static RandomnessRequest randomness(String requestHash, Map<String, Object> metadata) {
    return new RandomnessRequest(RandomnessOperation.RANDOMNESS, null, null, null, null, null,
                                 requestHash, metadata);
  }

  public static RandomnessRequest number(Long min, Long max, String requestHash,
                                         Map<String, Object> metadata) {
    return new RandomnessRequest(RandomnessOperation.NUMBER, min, max, null, null, null,
                                 requestHash, metadata);
  }

  public static RandomnessRequest dice(String dice, String requestHash, Map<String, Object> metadata) {
    return new RandomnessRequest(RandomnessOperation.DICE, null, null, dice, null, null,
                                 requestHash, metadata);
  }

  public static RandomnessRequest pick(List<Object> items, String requestHash,
                                       Map<String, Object> metadata) {
    return new RandomnessRequest(RandomnessOperation.PICK, null, null, null, items, null,
                                 requestHash, metadata);
  }

  public static RandomnessRequest shuffle(List<Object> items, String requestHash,
                                          Map<String, Object> metadata) {
    return new RandomnessRequest(RandomnessOperation.SHUFFLE, null, null, null, items, null,
                                 requestHash, metadata);
  }

  public static RandomnessRequest winners(List<Object> items, Integer count, String requestHash,
                                          Map<String, Object> metadata) {
    return new RandomnessRequest(RandomnessOperation.WINNERS, null, null, null, items, count,
                                 requestHash, metadata);
  }

  public static RandomnessRequest uuid(String requestHash, Map<String, Object> metadata) {
    return new RandomnessRequest(RandomnessOperation.UUID, null, null, null, null, null,
                                 requestHash, metadata);
  }

  /**
   * The caller's request hash, or the one derived from the parameters.
   * Only meaningful once the request has been validated.
   */
  public String effectiveRequestHash() {
    if (requestHash != null && !requestHash.isEmpty()) {
      return requestHash;
    }
    return switch (operation) {
      case RANDOMNESS -> "";
      case NUMBER -> "number:" + (min != null ? min : 1) + "-" + max;
      case DICE -> "dice:" + dice;
      case PICK -> "pick:" + items.size();
      case SHUFFLE -> "shuffle:" + items.size();
      case WINNERS -> "winners:" + (count != null ? count : 1) + "of" + items.size();
      case UUID -> "uuid";
    };
  }

  public Map<String, Object> metadataOrEmpty() {
    return metadata != null ? metadata : Map.of();
  }
}
