package com.github.simbo1905.omap;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.List;

/// Reads the canonical JSON array into an [OrderedMap] of the contained key and value types by
/// replaying an insert per record. Duplicate keys and invalid records are reported as a
/// [JsonMappingException] whose cause is the [KeyAlreadyExistsException] or
/// [OrderedMapDecodeException].
final class OrderedMapDeserializer extends StdDeserializer<OrderedMap<?, ?>> {

  private static final long serialVersionUID = 1L;

  /// `List<OrderedMapEntry<K, V>>` for the contained key and value types.
  private final JavaType recordsType;

  OrderedMapDeserializer(JavaType mapType, JavaType recordsType) {
    super(mapType);
    this.recordsType = recordsType;
  }

  @Override
  public OrderedMap<?, ?> deserialize(JsonParser p, DeserializationContext ctxt)
      throws IOException {
    final List<OrderedMapEntry<Object, Object>> records = ctxt.readValue(p, recordsType);
    try {
      return OrderedMapCodec.replay(records);
    } catch (KeyAlreadyExistsException | OrderedMapDecodeException e) {
      throw JsonMappingException.from(p, e.getMessage(), e);
    }
  }

  @Override
  public Object getEmptyValue(DeserializationContext ctxt) {
    return OrderedMap.empty();
  }
}
