package com.github.simbo1905.omap;

import lombok.Getter;

/// Thrown when a key is inserted into an [OrderedMap] that already holds it, either directly or
/// because a serialized form contains two records with the same `Key`. The map the insert was
/// attempted on is left unchanged.
public class KeyAlreadyExistsException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /// The key that was already present.
  @Getter private final transient Object key;

  public KeyAlreadyExistsException(Object key) {
    super(String.format("key \"%s\" already exists", key));
    this.key = key;
  }
}
