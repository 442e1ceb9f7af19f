package com.github.simbo1905.omap;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleSerializers;

/// Jackson module that reads and writes [OrderedMap] in its canonical form, a JSON array of
/// `{"Key":…,"Value":…}` records in insertion order. Register it on any `ObjectMapper` that
/// handles beans with ordered map fields:
/// <pre>
/// ObjectMapper mapper = new ObjectMapper().registerModule(new OrderedMapModule());
/// </pre>
public class OrderedMapModule extends Module {

  @Override
  public String getModuleName() {
    return OrderedMapModule.class.getSimpleName();
  }

  @Override
  public Version version() {
    return Version.unknownVersion();
  }

  @Override
  public void setupModule(SetupContext context) {
    final SimpleSerializers serializers = new SimpleSerializers();
    serializers.addSerializer(new OrderedMapSerializer());
    context.addSerializers(serializers);
    context.addDeserializers(new OrderedMapDeserializers());
  }
}
