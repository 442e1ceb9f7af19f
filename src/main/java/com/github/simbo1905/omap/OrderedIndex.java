package com.github.simbo1905.omap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The three co-indexed structures behind an [OrderedMap]: the values in insertion order, the
/// position of each key and the key at each position. This class is mutable and is never shared
/// between two published maps; copy-on-write happens by calling [#copy()] before mutating.
final class OrderedIndex<K, V> {

  private static final Logger logger = Logger.getLogger(OrderedIndex.class.getName());

  /// Values in insertion order. Append-only apart from the compaction done by [#remove].
  private final ArrayList<V> sequence;

  /// Key to slot in [#sequence].
  private final HashMap<K, Integer> positionOf;

  /// Slot in [#sequence] to key. The exact inverse of [#positionOf].
  private final HashMap<Integer, K> keyAt;

  OrderedIndex() {
    this(new ArrayList<>(), new HashMap<>(), new HashMap<>());
  }

  private OrderedIndex(
      ArrayList<V> sequence, HashMap<K, Integer> positionOf, HashMap<Integer, K> keyAt) {
    this.sequence = sequence;
    this.positionOf = positionOf;
    this.keyAt = keyAt;
  }

  /// Shallow copy of the three structures. Keys and values are shared.
  OrderedIndex<K, V> copy() {
    return new OrderedIndex<>(
        new ArrayList<>(sequence), new HashMap<>(positionOf), new HashMap<>(keyAt));
  }

  int size() {
    return sequence.size();
  }

  boolean containsKey(K key) {
    return positionOf.containsKey(key);
  }

  /// @return the slot of the key or -1 if it is absent
  int positionOf(K key) {
    final Integer position = positionOf.get(key);
    return position == null ? -1 : position;
  }

  K keyAt(int position) {
    return keyAt.get(position);
  }

  V valueAt(int position) {
    return sequence.get(position);
  }

  /// Appends at the tail. Throws [KeyAlreadyExistsException] and leaves the index untouched if
  /// the key is present.
  void append(K key, V value) {
    Objects.requireNonNull(key, "key");
    if (positionOf.containsKey(key)) {
      throw new KeyAlreadyExistsException(key);
    }
    final int ix = sequence.size();
    sequence.add(value);
    positionOf.put(key, ix);
    keyAt.put(ix, key);

    logger.log(Level.FINEST, () -> String.format(">a idx:%d key:%s size:%d", ix, key, size()));
    assert checkSizes();
  }

  /// Removes the key and shifts every later slot down by one so that both maps stay inverses
  /// over `[0, size())`.
  ///
  /// @return false if the key was absent and nothing changed
  boolean remove(K key) {
    final Integer removed = positionOf.remove(key);
    if (removed == null) {
      return false;
    }
    final int ix = removed;
    keyAt.remove(ix);
    sequence.remove(ix);

    // single pass renumbering of the tail
    for (int i = ix; i < sequence.size(); i++) {
      final K shifted = keyAt.remove(i + 1);
      positionOf.put(shifted, i);
      keyAt.put(i, shifted);
    }

    logger.log(
        Level.FINEST,
        () -> String.format("<r idx:%d key:%s shifted:%d", ix, key, sequence.size() - ix));
    assert checkSizes();
    return true;
  }

  private boolean checkSizes() {
    if (sequence.size() != positionOf.size() || positionOf.size() != keyAt.size()) {
      throw new AssertionError(
          String.format(
              "sequence:%d positionOf:%d keyAt:%d",
              sequence.size(), positionOf.size(), keyAt.size()));
    }
    return true;
  }

  /// Full structural check of the index. Linear in the size of the map.
  boolean checkInvariants() {
    checkSizes();
    for (int i = 0; i < sequence.size(); i++) {
      final K key = keyAt.get(i);
      if (key == null) {
        throw new AssertionError("no key at position " + i);
      }
      final Integer back = positionOf.get(key);
      if (back == null || back != i) {
        throw new AssertionError(
            String.format("key %s at position %d maps back to %s", key, i, back));
      }
    }
    for (Map.Entry<K, Integer> entry : positionOf.entrySet()) {
      final int position = entry.getValue();
      if (position < 0 || position >= sequence.size()) {
        throw new AssertionError(
            String.format("key %s maps to invalid position %d", entry.getKey(), position));
      }
    }
    return true;
  }
}
