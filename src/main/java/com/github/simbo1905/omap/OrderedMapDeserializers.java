package com.github.simbo1905.omap;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.type.TypeFactory;

/// Resolves a deserializer for every parameterization of [OrderedMap] so that the key and value
/// types of a field such as `OrderedMap<String, Integer>` reach the record reader.
final class OrderedMapDeserializers extends Deserializers.Base {

  @Override
  public JsonDeserializer<?> findBeanDeserializer(
      JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
    if (!type.hasRawClass(OrderedMap.class)) {
      return null;
    }
    final TypeFactory typeFactory = config.getTypeFactory();
    return new OrderedMapDeserializer(
        type,
        OrderedMapCodec.recordsType(
            typeFactory, type.containedTypeOrUnknown(0), type.containedTypeOrUnknown(1)));
  }
}
