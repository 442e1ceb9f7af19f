package com.github.simbo1905.omap;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Mutable single-owner construction of an [OrderedMap]. Inserts and deletes happen in place
/// without the per-call copy that [OrderedMap] makes, then [#build()] publishes the result.
///
/// A builder may only be built once. After [#build()] the builder is retired and every method
/// throws [IllegalStateException], which is what guarantees the published map is never mutated.
///
/// Not thread safe and has no internal locking.
public final class OrderedMapBuilder<K, V> {

  private static final Logger logger = Logger.getLogger(OrderedMapBuilder.class.getName());

  private OrderedIndex<K, V> index;

  public OrderedMapBuilder() {
    this(new OrderedIndex<>());
  }

  OrderedMapBuilder(OrderedIndex<K, V> index) {
    this.index = index;
  }

  /// Appends the entry.
  ///
  /// @throws KeyAlreadyExistsException if the key is present; the builder is unchanged
  public OrderedMapBuilder<K, V> set(K key, V value) {
    live().append(key, value);
    return this;
  }

  /// Like [#set] but treats a duplicate key as a programming error.
  ///
  /// @throws AssertionError if the key is present
  public OrderedMapBuilder<K, V> mustSet(K key, V value) {
    try {
      return set(key, value);
    } catch (KeyAlreadyExistsException e) {
      throw new AssertionError(e.getMessage(), e);
    }
  }

  /// Removes the key if present. The remaining entries keep their relative order.
  public OrderedMapBuilder<K, V> delete(K key) {
    live().remove(key);
    return this;
  }

  public boolean contains(K key) {
    return key != null && live().containsKey(key);
  }

  public int size() {
    return live().size();
  }

  /// Publishes the entries as an immutable map and retires this builder.
  public OrderedMap<K, V> build() {
    final OrderedIndex<K, V> built = live();
    index = null;
    logger.log(Level.FINE, () -> String.format("built map of %d entries", built.size()));
    return new OrderedMap<>(built);
  }

  private OrderedIndex<K, V> live() {
    if (index == null) {
      throw new IllegalStateException("builder has already been built");
    }
    return index;
  }
}
