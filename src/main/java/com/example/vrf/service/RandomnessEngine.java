package com.example.vrf.service;

import com.example.vrf.domain.entity.DerivedValue;
import com.example.vrf.domain.entity.RandomnessRequest;
import com.example.vrf.domain.entity.RandomnessResult;
import com.example.vrf.exception.RandomnessValidationException;
import com.example.vrf.util.HashUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives typed values from one draw of secure random bytes.
 *
 * <p>Every operation draws at least {@value #SEED_LENGTH} bytes; the first
 * {@value #SEED_LENGTH} are returned as the seed and every derived value is a
 * pure function of the drawn buffer. Range reduction is a plain modulo and
 * carries the usual small bias when the range does not divide 2^32 or 2^64.
 */
@Service
@RequiredArgsConstructor
public class RandomnessEngine {

  public static final int SEED_LENGTH = 32;
  public static final long DEFAULT_MIN = 1;
  public static final long MAX_NUMBER_RANGE = 1_000_000_000L;
  public static final int MAX_PICK_ITEMS = 100_000;
  public static final int MAX_SHUFFLE_ITEMS = 1_000;
  public static final int MAX_WINNERS_ITEMS = 100_000;
  public static final int MIN_DICE = 1;
  public static final int MAX_DICE = 100;
  public static final int MIN_SIDES = 2;
  public static final int MAX_SIDES = 1_000;

  private static final Pattern DICE_PATTERN = Pattern.compile("^(\\d+)d(\\d+)$");

  private final EntropySource entropySource;
  private final Clock clock;

  /**
   * Checks the request parameters without drawing entropy.
   *
   * @throws RandomnessValidationException when a parameter is missing or out of range
   */
  public void validate(RandomnessRequest request) {
    switch (request.operation()) {
      case NUMBER -> validateNumber(request.min(), request.max());
      case DICE -> parseDice(request.dice());
      case PICK -> validateItems(request.items(), MAX_PICK_ITEMS,
                                 "items array cannot exceed 100,000 elements");
      case SHUFFLE -> validateItems(request.items(), MAX_SHUFFLE_ITEMS,
                                    "items array cannot exceed 1,000 elements for shuffle");
      case WINNERS -> validateWinners(request.items(), request.count());
      case RANDOMNESS, UUID -> {
        // no parameters
      }
    }
  }

  /**
   * Validates the request, draws entropy and derives the value.
   */
  public RandomnessResult generate(RandomnessRequest request) {
    validate(request);
    DerivedValue value;
    byte[] buffer;
    switch (request.operation()) {
      case NUMBER -> {
        buffer = entropySource.nextBytes(SEED_LENGTH);
        value = number(buffer, request.min(), request.max());
      }
      case DICE -> {
        int[] dice = parseDice(request.dice());
        buffer = entropySource.nextBytes(Math.max(SEED_LENGTH, dice[0] * 4));
        value = dice(buffer, request.dice(), dice[0], dice[1]);
      }
      case PICK -> {
        buffer = entropySource.nextBytes(SEED_LENGTH);
        value = pick(buffer, request.items());
      }
      case SHUFFLE -> {
        buffer = entropySource.nextBytes(Math.max(SEED_LENGTH, request.items().size() * 4));
        value = shuffle(buffer, request.items());
      }
      case WINNERS -> {
        int count = winnersCount(request.count());
        buffer = entropySource.nextBytes(Math.max(SEED_LENGTH, count * 4));
        value = winners(buffer, request.items(), count);
      }
      case UUID -> {
        buffer = entropySource.nextBytes(SEED_LENGTH);
        value = uuid(buffer);
      }
      default -> {
        buffer = entropySource.nextBytes(SEED_LENGTH);
        value = new DerivedValue.RawSeed();
      }
    }
    String seedHex = HashUtils.toHex(Arrays.copyOf(buffer, SEED_LENGTH));
    return new RandomnessResult(request.operation(), seedHex, value, clock.millis());
  }

  static DerivedValue.NumberValue number(byte[] buffer, Long requestedMin, long max) {
    long min = requestedMin != null ? requestedMin : DEFAULT_MIN;
    long range = max - min + 1;
    long offset = Long.remainderUnsigned(ByteBuffer.wrap(buffer, 0, 8).getLong(), range);
    return new DerivedValue.NumberValue(min + offset, min, max);
  }

  static DerivedValue.DiceValue dice(byte[] buffer, String notation, int count, int sides) {
    List<Integer> rolls = new ArrayList<>(count);
    int total = 0;
    for (int i = 0; i < count; i++) {
      int roll = (int) (uint32(buffer, (i * 4) % buffer.length) % sides) + 1;
      rolls.add(roll);
      total += roll;
    }
    return new DerivedValue.DiceValue(notation, List.copyOf(rolls), total, count, count * sides);
  }

  static DerivedValue.PickValue pick(byte[] buffer, List<Object> items) {
    int index = (int) Long.remainderUnsigned(ByteBuffer.wrap(buffer, 0, 8).getLong(), items.size());
    return new DerivedValue.PickValue(items.get(index), index, items.size());
  }

  static DerivedValue.ShuffleValue shuffle(byte[] buffer, List<Object> items) {
    List<Object> shuffled = new ArrayList<>(items);
    int n = shuffled.size();
    for (int i = n - 1; i > 0; i--) {
      int offset = ((n - 1 - i) * 4) % buffer.length;
      int j = (int) (uint32(buffer, offset) % (i + 1));
      Object swap = shuffled.get(i);
      shuffled.set(i, shuffled.get(j));
      shuffled.set(j, swap);
    }
    return new DerivedValue.ShuffleValue(shuffled, n);
  }

  /**
   * Partial Fisher-Yates over the item indices: position {@code i} is filled from
   * the not-yet-chosen tail, so winners never repeat.
   */
  static DerivedValue.WinnersValue winners(byte[] buffer, List<Object> items, int count) {
    int n = items.size();
    int[] indices = new int[n];
    for (int i = 0; i < n; i++) {
      indices[i] = i;
    }
    List<DerivedValue.Winner> winners = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      int j = i + (int) (uint32(buffer, (i * 4) % buffer.length) % (n - i));
      int chosen = indices[j];
      indices[j] = indices[i];
      indices[i] = chosen;
      winners.add(new DerivedValue.Winner(items.get(chosen), chosen, i + 1));
    }
    return new DerivedValue.WinnersValue(List.copyOf(winners), n);
  }

  static DerivedValue.UuidValue uuid(byte[] buffer) {
    byte[] bytes = Arrays.copyOf(buffer, 16);
    bytes[6] = (byte) ((bytes[6] & 0x0f) | 0x40);
    bytes[8] = (byte) ((bytes[8] & 0x3f) | 0x80);
    String hex = HashUtils.toHex(bytes);
    return new DerivedValue.UuidValue(hex.substring(0, 8) + "-" + hex.substring(8, 12) + "-"
                                      + hex.substring(12, 16) + "-" + hex.substring(16, 20) + "-"
                                      + hex.substring(20, 32));
  }

  private static long uint32(byte[] buffer, int offset) {
    return Integer.toUnsignedLong(ByteBuffer.wrap(buffer, offset, 4).getInt());
  }

  private void validateNumber(Long min, Long max) {
    if (max == null || max < 1) {
      throw new RandomnessValidationException("max is required and must be a positive number");
    }
    long effectiveMin = min != null ? min : DEFAULT_MIN;
    if (effectiveMin < 0) {
      throw new RandomnessValidationException("min must not be negative");
    }
    if (effectiveMin >= max) {
      throw new RandomnessValidationException("min must be less than max");
    }
    if (max - effectiveMin > MAX_NUMBER_RANGE) {
      throw new RandomnessValidationException("range (max - min) cannot exceed 1,000,000,000");
    }
  }

  /**
   * @return {@code [count, sides]}
   */
  private int[] parseDice(String notation) {
    if (notation == null) {
      throw new RandomnessValidationException("dice must be a string (e.g., \"2d6\", \"1d20\")");
    }
    Matcher matcher = DICE_PATTERN.matcher(notation.toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new RandomnessValidationException("Invalid dice format. Use \"NdM\" (e.g., \"2d6\", \"1d20\")");
    }
    int count = parseBounded(matcher.group(1));
    int sides = parseBounded(matcher.group(2));
    if (count < MIN_DICE || count > MAX_DICE) {
      throw new RandomnessValidationException("Number of dice must be between 1 and 100");
    }
    if (sides < MIN_SIDES || sides > MAX_SIDES) {
      throw new RandomnessValidationException("Dice sides must be between 2 and 1000");
    }
    return new int[] {count, sides};
  }

  private int parseBounded(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      return Integer.MAX_VALUE;
    }
  }

  private void validateItems(List<Object> items, int maxItems, String tooManyMessage) {
    if (items == null || items.isEmpty()) {
      throw new RandomnessValidationException("items must be a non-empty array");
    }
    if (items.size() > maxItems) {
      throw new RandomnessValidationException(tooManyMessage);
    }
  }

  private void validateWinners(List<Object> items, Integer count) {
    if (items == null || items.isEmpty()) {
      throw new RandomnessValidationException("items must be a non-empty array");
    }
    int winners = winnersCount(count);
    if (winners < 1) {
      throw new RandomnessValidationException("count must be a positive number");
    }
    if (winners > items.size()) {
      throw new RandomnessValidationException("count cannot exceed the number of items");
    }
    if (items.size() > MAX_WINNERS_ITEMS) {
      throw new RandomnessValidationException("items array cannot exceed 100,000 elements");
    }
  }

  private int winnersCount(Integer count) {
    return count != null ? count : 1;
  }
}
