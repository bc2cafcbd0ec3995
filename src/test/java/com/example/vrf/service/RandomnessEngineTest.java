package com.example.vrf.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.vrf.domain.entity.DerivedValue;
import com.example.vrf.domain.entity.RandomnessRequest;
import com.example.vrf.domain.entity.RandomnessResult;
import com.example.vrf.exception.RandomnessValidationException;
import com.example.vrf.support.MutableClock;
import com.example.vrf.util.HashUtils;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RandomnessEngineTest {

  private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
  private final RandomnessEngine engine = new RandomnessEngine(new SecureRandomEntropySource(), clock);

  private static List<Object> items(int n) {
    return IntStream.range(0, n).mapToObj(i -> (Object) ("item-" + i)).collect(Collectors.toList());
  }

  @Nested
  class Number {

    @Test
    void staysWithinInclusiveRange() {
      for (int i = 0; i < 500; i++) {
        RandomnessResult result = engine.generate(RandomnessRequest.number(1L, 100L, null, null));
        DerivedValue.NumberValue value = (DerivedValue.NumberValue) result.derivedValue();
        assertThat(value.number()).isBetween(1L, 100L);
        assertThat(result.seedHex()).hasSize(64).matches("[0-9a-f]+");
      }
    }

    @Test
    void minDefaultsToOne() {
      RandomnessResult result = engine.generate(RandomnessRequest.number(null, 2L, null, null));
      DerivedValue.NumberValue value = (DerivedValue.NumberValue) result.derivedValue();
      assertThat(value.min()).isEqualTo(1);
      assertThat(value.number()).isBetween(1L, 2L);
    }

    @Test
    void reducesFirstEightBytesModuloRange() {
      byte[] buffer = ByteBuffer.allocate(32).putLong(250L).array();
      DerivedValue.NumberValue value = RandomnessEngine.number(buffer, 1L, 100L);
      assertThat(value.number()).isEqualTo(51);
    }

    @Test
    void treatsHighBitAsUnsigned() {
      byte[] buffer = ByteBuffer.allocate(32).putLong(-1L).array();
      // 2^64 - 1 mod 10 = 5
      assertThat(RandomnessEngine.number(buffer, 0L, 9L).number()).isEqualTo(5);
    }

    @Test
    void rejectsMissingMax() {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.number(1L, null, null, null)))
          .isInstanceOf(RandomnessValidationException.class)
          .hasMessage("max is required and must be a positive number");
    }

    @Test
    void rejectsMinNotBelowMax() {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.number(5L, 5L, null, null)))
          .isInstanceOf(RandomnessValidationException.class)
          .hasMessage("min must be less than max");
    }

    @Test
    void rejectsNegativeMin() {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.number(-1L, 5L, null, null)))
          .isInstanceOf(RandomnessValidationException.class)
          .hasMessage("min must not be negative");
    }

    @Test
    void rejectsRangeAboveOneBillion() {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.number(0L, 1_000_000_001L, null, null)))
          .isInstanceOf(RandomnessValidationException.class)
          .hasMessageContaining("cannot exceed 1,000,000,000");
      engine.validate(RandomnessRequest.number(0L, 1_000_000_000L, null, null));
    }
  }

  @Nested
  class Dice {

    @Test
    void twoD6RollsAreInRangeAndSumToTotal() {
      for (int i = 0; i < 200; i++) {
        DerivedValue.DiceValue value = (DerivedValue.DiceValue)
            engine.generate(RandomnessRequest.dice("2d6", null, null)).derivedValue();
        assertThat(value.rolls()).hasSize(2).allSatisfy(roll -> assertThat(roll).isBetween(1, 6));
        assertThat(value.total()).isEqualTo(value.rolls().stream().mapToInt(Integer::intValue).sum());
        assertThat(value.minPossible()).isEqualTo(2);
        assertThat(value.maxPossible()).isEqualTo(12);
      }
    }

    @Test
    void hundredDiceDrawEnoughBytes() {
      DerivedValue.DiceValue value = (DerivedValue.DiceValue)
          engine.generate(RandomnessRequest.dice("100d1000", null, null)).derivedValue();
      assertThat(value.rolls()).hasSize(100).allSatisfy(roll -> assertThat(roll).isBetween(1, 1000));
    }

    @Test
    void eachRollUsesItsOwnFourBytes() {
      byte[] buffer = ByteBuffer.allocate(32).putInt(7).putInt(5).array();
      DerivedValue.DiceValue value = RandomnessEngine.dice(buffer, "2d6", 2, 6);
      assertThat(value.rolls()).containsExactly(2, 6);
      assertThat(value.total()).isEqualTo(8);
    }

    @Test
    void notationIsCaseInsensitive() {
      engine.validate(RandomnessRequest.dice("3D20", null, null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"d6", "2x6", "2d", "two dice", "2d6+1", ""})
    void rejectsMalformedNotation(String notation) {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.dice(notation, null, null)))
          .isInstanceOf(RandomnessValidationException.class)
          .hasMessageStartingWith("Invalid dice format");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0d6", "101d6", "99999999999d6"})
    void rejectsDiceCountOutOfRange(String notation) {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.dice(notation, null, null)))
          .isInstanceOf(RandomnessValidationException.class)
          .hasMessage("Number of dice must be between 1 and 100");
    }

    @ParameterizedTest
    @ValueSource(strings = {"1d1", "1d1001"})
    void rejectsSidesOutOfRange(String notation) {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.dice(notation, null, null)))
          .isInstanceOf(RandomnessValidationException.class)
          .hasMessage("Dice sides must be between 2 and 1000");
    }

    @Test
    void rejectsMissingNotation() {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.dice(null, null, null)))
          .isInstanceOf(RandomnessValidationException.class);
    }
  }

  @Nested
  class Pick {

    @Test
    void returnsItemAtReportedIndex() {
      List<Object> items = items(10);
      for (int i = 0; i < 100; i++) {
        DerivedValue.PickValue value = (DerivedValue.PickValue)
            engine.generate(RandomnessRequest.pick(items, null, null)).derivedValue();
        assertThat(value.index()).isBetween(0, 9);
        assertThat(value.picked()).isEqualTo(items.get(value.index()));
        assertThat(value.totalItems()).isEqualTo(10);
      }
    }

    @Test
    void rejectsEmptyAndOversizedLists() {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.pick(List.of(), null, null)))
          .hasMessage("items must be a non-empty array");
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.pick(null, null, null)))
          .hasMessage("items must be a non-empty array");
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.pick(items(100_001), null, null)))
          .hasMessage("items array cannot exceed 100,000 elements");
    }
  }

  @Nested
  class Shuffle {

    @Test
    void returnsPermutationOfInput() {
      List<Object> items = new ArrayList<>(items(50));
      items.add("item-0");
      DerivedValue.ShuffleValue value = (DerivedValue.ShuffleValue)
          engine.generate(RandomnessRequest.shuffle(items, null, null)).derivedValue();
      assertThat(value.shuffled()).hasSize(51).containsExactlyInAnyOrderElementsOf(items);
      assertThat(value.originalCount()).isEqualTo(51);
    }

    @Test
    void leavesInputUntouched() {
      List<Object> items = items(20);
      List<Object> copy = List.copyOf(items);
      engine.generate(RandomnessRequest.shuffle(items, null, null));
      assertThat(items).isEqualTo(copy);
    }

    @Test
    void rejectsMoreThanOneThousandItems() {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.shuffle(items(1_001), null, null)))
          .hasMessage("items array cannot exceed 1,000 elements for shuffle");
    }
  }

  @Nested
  class Winners {

    @Test
    void returnsDistinctWinnersWithPositions() {
      List<Object> items = items(30);
      for (int run = 0; run < 100; run++) {
        DerivedValue.WinnersValue value = (DerivedValue.WinnersValue)
            engine.generate(RandomnessRequest.winners(items, 10, null, null)).derivedValue();
        assertThat(value.winners()).hasSize(10);
        Set<Integer> indices = new HashSet<>();
        for (int i = 0; i < value.winners().size(); i++) {
          DerivedValue.Winner winner = value.winners().get(i);
          assertThat(winner.position()).isEqualTo(i + 1);
          assertThat(winner.item()).isEqualTo(items.get(winner.index()));
          indices.add(winner.index());
        }
        assertThat(indices).hasSize(10);
      }
    }

    @Test
    void countEqualToSizeSelectsEveryItem() {
      List<Object> items = items(8);
      DerivedValue.WinnersValue value = (DerivedValue.WinnersValue)
          engine.generate(RandomnessRequest.winners(items, 8, null, null)).derivedValue();
      assertThat(value.winners()).extracting(DerivedValue.Winner::index)
          .containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7);
    }

    @Test
    void countDefaultsToOne() {
      DerivedValue.WinnersValue value = (DerivedValue.WinnersValue)
          engine.generate(RandomnessRequest.winners(items(5), null, null, null)).derivedValue();
      assertThat(value.winners()).hasSize(1);
    }

    @Test
    void rejectsBadCounts() {
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.winners(items(3), 4, null, null)))
          .hasMessage("count cannot exceed the number of items");
      assertThatThrownBy(() -> engine.validate(RandomnessRequest.winners(items(3), 0, null, null)))
          .hasMessage("count must be a positive number");
    }
  }

  @Test
  void uuidIsVersionFourWithRfcVariant() {
    for (int i = 0; i < 50; i++) {
      DerivedValue.UuidValue value = (DerivedValue.UuidValue)
          engine.generate(RandomnessRequest.uuid(null, null)).derivedValue();
      assertThat(value.uuid()).matches("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}");
    }
  }

  @Test
  void rawRandomnessCarriesSeedAndTimestamp() {
    RandomnessResult result = engine.generate(RandomnessRequest.randomness(null, null));
    assertThat(result.seedHex()).hasSize(64);
    assertThat(result.timestampMs()).isEqualTo(clock.millis());
    assertThat(result.derivedValue().responseFields()).isEmpty();
  }

  @Test
  void derivesRequestHashFromParameters() {
    assertThat(RandomnessRequest.randomness(null, null).effectiveRequestHash()).isEmpty();
    String seed = "ab".repeat(32);
    assertThat(HashUtils.bindSeed(seed, RandomnessRequest.randomness(null, null).effectiveRequestHash()))
        .isEqualTo(HashUtils.sha256(seed.getBytes(StandardCharsets.UTF_8)));
    assertThat(RandomnessRequest.number(null, 100L, null, null).effectiveRequestHash())
        .isEqualTo("number:1-100");
    assertThat(RandomnessRequest.dice("2d6", null, null).effectiveRequestHash()).isEqualTo("dice:2d6");
    assertThat(RandomnessRequest.winners(items(4), 2, null, null).effectiveRequestHash())
        .isEqualTo("winners:2of4");
    assertThat(RandomnessRequest.uuid("caller-hash", null).effectiveRequestHash())
        .isEqualTo("caller-hash");
  }
}
