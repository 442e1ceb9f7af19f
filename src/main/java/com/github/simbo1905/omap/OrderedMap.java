package com.github.simbo1905.omap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jetbrains.annotations.TestOnly;

/// An immutable map that remembers the order in which keys were first inserted and refuses to
/// overwrite an existing key.
///
/// Every mutating method returns a new map and leaves the receiver untouched, so a reference to
/// an older version keeps seeing exactly the entries it had. Each mutation copies the index which
/// is linear in the size of the map; use [OrderedMapBuilder] to build large maps.
///
/// Example:
/// <pre>
/// OrderedMap&lt;String, Integer&gt; m = OrderedMap.&lt;String, Integer&gt;empty()
///     .mustSet("a", 1)
///     .mustSet("b", 2);
/// m.forEach((k, v) -&gt; System.out.println(k + ": " + v));
/// </pre>
///
/// A map made with the no-arg constructor has no index until the first [#set] and reads on it
/// behave like reads on an empty map.
///
/// Instances are safe to read from several threads once published. Keys must not be `null`;
/// values may be.
public final class OrderedMap<K, V> implements Iterable<OrderedMapEntry<K, V>> {

  private static final Logger logger = Logger.getLogger(OrderedMap.class.getName());

  /// Null only for the zero form created by the no-arg constructor.
  private final OrderedIndex<K, V> index;

  /// The zero form. Usable for inserts without further construction.
  public OrderedMap() {
    this.index = null;
  }

  /// Wraps an index that no other code will mutate afterwards.
  OrderedMap(OrderedIndex<K, V> index) {
    this.index = index;
  }

  /// @return a new empty map
  public static <K, V> OrderedMap<K, V> empty() {
    return new OrderedMap<>(new OrderedIndex<>());
  }

  /// Builds a map by inserting each record in iteration order.
  ///
  /// @throws KeyAlreadyExistsException if two records share a key; no map is produced
  public static <K, V> OrderedMap<K, V> ofEntries(
      Iterable<? extends OrderedMapEntry<? extends K, ? extends V>> entries) {
    final OrderedMapBuilder<K, V> builder = new OrderedMapBuilder<>();
    for (OrderedMapEntry<? extends K, ? extends V> entry : entries) {
      builder.set(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  /// Returns a new map with the entry appended after all existing entries.
  ///
  /// @throws KeyAlreadyExistsException if the key is present; this map is unchanged
  /// @throws NullPointerException if the key is null
  public OrderedMap<K, V> set(K key, V value) {
    Objects.requireNonNull(key, "key");
    if (contains(key)) {
      throw new KeyAlreadyExistsException(key);
    }
    final OrderedIndex<K, V> next = index == null ? new OrderedIndex<>() : index.copy();
    next.append(key, value);
    return new OrderedMap<>(next);
  }

  /// Like [#set] but treats a duplicate key as a programming error. Intended for chaining literal
  /// construction where the keys are known to be distinct. Prefer [#set] everywhere else.
  ///
  /// @throws AssertionError if the key is present
  public OrderedMap<K, V> mustSet(K key, V value) {
    try {
      return set(key, value);
    } catch (KeyAlreadyExistsException e) {
      throw new AssertionError(e.getMessage(), e);
    }
  }

  /// Returns a map without the key. The remaining entries keep their relative order. If the key is
  /// absent this map is returned as is.
  public OrderedMap<K, V> delete(K key) {
    if (!contains(key)) {
      return this;
    }
    final OrderedIndex<K, V> next = index.copy();
    next.remove(key);
    return new OrderedMap<>(next);
  }

  public int size() {
    return index == null ? 0 : index.size();
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public boolean contains(K key) {
    return index != null && key != null && index.containsKey(key);
  }

  /// @return the value for the key or null if the key is absent. Use [#contains] to tell an
  /// absent key from a null value.
  public V get(K key) {
    return getOrDefault(key, null);
  }

  public V getOrDefault(K key, V defaultValue) {
    if (!contains(key)) {
      return defaultValue;
    }
    return index.valueAt(index.positionOf(key));
  }

  /// @return the value for the key, empty if the key is absent or mapped to null
  public Optional<V> find(K key) {
    return Optional.ofNullable(get(key));
  }

  /// Visits the entries in insertion order. If the visitor throws, no further entries are visited
  /// and the exception is rethrown as is.
  public <E extends Exception> void forEach(EntryVisitor<? super K, ? super V, E> visitor)
      throws E {
    final int size = size();
    for (int ix = 0; ix < size; ix++) {
      visitor.visit(index.keyAt(ix), index.valueAt(ix));
    }
  }

  /// @return a new mutable map with the same entries and no ordering guarantee
  public Map<K, V> unordered() {
    final Map<K, V> result = new HashMap<>(Math.max(16, size() * 2));
    this.<RuntimeException>forEach((key, value) -> result.put(key, value));
    assert result.size() == size() : String.format("unordered:%d size:%d", result.size(), size());
    return result;
  }

  /// @return the canonical serialized form: the records in insertion order
  public List<OrderedMapEntry<K, V>> entries() {
    final List<OrderedMapEntry<K, V>> records = new ArrayList<>(size());
    this.<RuntimeException>forEach((key, value) -> records.add(OrderedMapEntry.of(key, value)));
    return Collections.unmodifiableList(records);
  }

  /// @return the keys in insertion order
  public List<K> keys() {
    final List<K> keys = new ArrayList<>(size());
    this.<RuntimeException>forEach((key, value) -> keys.add(key));
    return Collections.unmodifiableList(keys);
  }

  /// @return the values in insertion order
  public List<V> values() {
    final List<V> values = new ArrayList<>(size());
    this.<RuntimeException>forEach((key, value) -> values.add(value));
    return Collections.unmodifiableList(values);
  }

  @Override
  public Iterator<OrderedMapEntry<K, V>> iterator() {
    return new Iterator<>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < size();
      }

      @Override
      public OrderedMapEntry<K, V> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        final int ix = next++;
        return OrderedMapEntry.of(index.keyAt(ix), index.valueAt(ix));
      }
    };
  }

  public Stream<OrderedMapEntry<K, V>> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  /// @return a builder seeded with a copy of this map's entries
  public OrderedMapBuilder<K, V> toBuilder() {
    return new OrderedMapBuilder<>(index == null ? new OrderedIndex<>() : index.copy());
  }

  /// Logs each slot of the index at the given level.
  public void logAll(Level level) {
    logger.log(level, () -> String.format("Entries=%d", size()));
    for (int ix = 0; ix < size(); ix++) {
      final int position = ix;
      logger.log(
          level,
          () ->
              String.format(
                  "%d key=%s, position=%d, value=%s",
                  position,
                  index.keyAt(position),
                  index.positionOf(index.keyAt(position)),
                  index.valueAt(position)));
    }
  }

  @TestOnly
  boolean checkInvariants() {
    return index == null || index.checkInvariants();
  }

  /// Two maps are equal when they hold equal entries in the same order.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof OrderedMap)) return false;
    final OrderedMap<?, ?> that = (OrderedMap<?, ?>) o;
    if (size() != that.size()) return false;
    for (int ix = 0; ix < size(); ix++) {
      if (!Objects.equals(index.keyAt(ix), that.index.keyAt(ix))
          || !Objects.equals(index.valueAt(ix), that.index.valueAt(ix))) {
        return false;
      }
    }
    return true;
  }

  /// Computed on each call from the current keys and values, which may be mutable.
  @Override
  public int hashCode() {
    int result = 1;
    for (int ix = 0; ix < size(); ix++) {
      result = 31 * result + Objects.hashCode(index.keyAt(ix));
      result = 31 * result + Objects.hashCode(index.valueAt(ix));
    }
    return result;
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("{");
    for (int ix = 0; ix < size(); ix++) {
      if (ix > 0) sb.append(", ");
      sb.append(index.keyAt(ix)).append('=').append(index.valueAt(ix));
    }
    return sb.append('}').toString();
  }
}
