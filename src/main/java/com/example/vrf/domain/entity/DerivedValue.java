package com.example.vrf.domain.entity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The typed value derived from a seed, one variant per operation.
 */
public sealed interface DerivedValue {

  /**
   * Operation-specific response fields, in wire order.
   */
  Map<String, Object> responseFields();

  record RawSeed() implements DerivedValue {
    @Override
    public Map<String, Object> responseFields() {
      return Map.of();
    }
  }

  record NumberValue(long number, long min, long max) implements DerivedValue {
    @Override
    public Map<String, Object> responseFields() {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("number", number);
      fields.put("min", min);
      fields.put("max", max);
      return fields;
    }
  }

  record DiceValue(String dice, List<Integer> rolls, int total, int minPossible, int maxPossible)
      implements DerivedValue {
    @Override
    public Map<String, Object> responseFields() {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("dice", dice);
      fields.put("rolls", rolls);
      fields.put("total", total);
      fields.put("min_possible", minPossible);
      fields.put("max_possible", maxPossible);
      return fields;
    }
  }

  record PickValue(Object picked, int index, int totalItems) implements DerivedValue {
    @Override
    public Map<String, Object> responseFields() {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("picked", picked);
      fields.put("index", index);
      fields.put("total_items", totalItems);
      return fields;
    }
  }

  record ShuffleValue(List<Object> shuffled, int originalCount) implements DerivedValue {
    @Override
    public Map<String, Object> responseFields() {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("shuffled", shuffled);
      fields.put("original_count", originalCount);
      return fields;
    }
  }

  record Winner(Object item, int index, int position) {}

  record WinnersValue(List<Winner> winners, int totalItems) implements DerivedValue {
    @Override
    public Map<String, Object> responseFields() {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("winners", winners);
      fields.put("count", winners.size());
      fields.put("total_items", totalItems);
      return fields;
    }
  }

  record UuidValue(String uuid) implements DerivedValue {
    @Override
    public Map<String, Object> responseFields() {
      return Map.of("uuid", uuid);
    }
  }
}
