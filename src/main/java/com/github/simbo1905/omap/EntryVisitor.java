package com.github.simbo1905.omap;

/// Callback for [OrderedMap#forEach]. Throwing from [#visit] stops the traversal and the exception
/// reaches the caller of `forEach` unchanged.
///
/// @param <K> key type
/// @param <V> value type
/// @param <E> the exception the visitor may throw, [RuntimeException] for visitors that cannot fail
@FunctionalInterface
public interface EntryVisitor<K, V, E extends Exception> {

  void visit(K key, V value) throws E;
}
