package com.github.simbo1905.omap;

import java.io.IOException;

/// Thrown when serialized input cannot be parsed into an ordered sequence of `{Key, Value}`
/// records. Nothing is decoded when this is thrown.
public class OrderedMapDecodeException extends IOException {

  private static final long serialVersionUID = 1L;

  public OrderedMapDecodeException(String message) {
    super(message);
  }

  public OrderedMapDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
