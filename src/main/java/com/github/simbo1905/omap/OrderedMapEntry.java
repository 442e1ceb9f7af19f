package com.github.simbo1905.omap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/// One `{Key, Value}` record of the canonical serialized form. A list of these in insertion order
/// is what [OrderedMap#entries()] returns and what [OrderedMapCodec] reads and writes.
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({OrderedMapEntry.KEY, OrderedMapEntry.VALUE})
public final class OrderedMapEntry<K, V> {

  static final String KEY = "Key";
  static final String VALUE = "Value";

  private final K key;
  private final V value;

  @JsonCreator
  public OrderedMapEntry(
      @JsonProperty(value = KEY, required = true) K key, @JsonProperty(VALUE) V value) {
    this.key = key;
    this.value = value;
  }

  public static <K, V> OrderedMapEntry<K, V> of(K key, V value) {
    return new OrderedMapEntry<>(key, value);
  }

  @JsonProperty(KEY)
  public K getKey() {
    return key;
  }

  @JsonProperty(VALUE)
  public V getValue() {
    return value;
  }
}
