package com.github.simbo1905.omap;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

/// Writes an [OrderedMap] as a JSON array of `{"Key":…,"Value":…}` objects in insertion order.
final class OrderedMapSerializer extends StdSerializer<OrderedMap<?, ?>> {

  private static final long serialVersionUID = 1L;

  OrderedMapSerializer() {
    super(OrderedMap.class, false);
  }

  @Override
  public boolean isEmpty(SerializerProvider provider, OrderedMap<?, ?> value) {
    return value.isEmpty();
  }

  @Override
  public void serialize(OrderedMap<?, ?> value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    gen.writeStartArray(value, value.size());
    value.<IOException>forEach(
        (key, entryValue) -> {
          gen.writeStartObject();
          provider.defaultSerializeField(OrderedMapEntry.KEY, key, gen);
          provider.defaultSerializeField(OrderedMapEntry.VALUE, entryValue, gen);
          gen.writeEndObject();
        });
    gen.writeEndArray();
  }
}
