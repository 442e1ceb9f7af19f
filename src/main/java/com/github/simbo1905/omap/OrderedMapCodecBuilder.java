package com.github.simbo1905.omap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for [OrderedMapCodec] instances with a fluent API.
///
/// Settings not given explicitly fall back to a system property, then an environment variable,
/// then a built-in default. The property and variable names are the codec class name, a dot and
/// the setting, e.g. `com.github.simbo1905.omap.OrderedMapCodec.PRETTY_PRINT`.
///
/// Example usage:
/// <pre>
/// OrderedMapCodec&lt;String, Integer&gt; codec = new OrderedMapCodecBuilder()
///     .prettyPrint(true)
///     .failOnUnknownFields(false)
///     .build(String.class, Integer.class);
/// </pre>
public class OrderedMapCodecBuilder {

  private static final Logger logger = Logger.getLogger(OrderedMapCodecBuilder.class.getName());

  private JsonMapper jsonMapper;
  private Boolean prettyPrint;
  private Boolean failOnUnknownFields;
  private Boolean caseInsensitiveFields;

  /// Sets the mapper whose configuration and modules the codec starts from. The given mapper is
  /// not modified.
  ///
  /// @param jsonMapper the base mapper
  /// @return this builder for chaining
  public OrderedMapCodecBuilder jsonMapper(JsonMapper jsonMapper) {
    this.jsonMapper = jsonMapper;
    return this;
  }

  /// Indents encoded output. Default false.
  ///
  /// @param prettyPrint true for indented output
  /// @return this builder for chaining
  public OrderedMapCodecBuilder prettyPrint(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
    return this;
  }

  /// Rejects records carrying fields other than `Key` and `Value`. Default true.
  ///
  /// @param failOnUnknownFields false to ignore extra fields
  /// @return this builder for chaining
  public OrderedMapCodecBuilder failOnUnknownFields(boolean failOnUnknownFields) {
    this.failOnUnknownFields = failOnUnknownFields;
    return this;
  }

  /// Accepts any capitalisation of the `Key` and `Value` field names when decoding. Default false.
  ///
  /// @param caseInsensitiveFields true to match field names ignoring case
  /// @return this builder for chaining
  public OrderedMapCodecBuilder caseInsensitiveFields(boolean caseInsensitiveFields) {
    this.caseInsensitiveFields = caseInsensitiveFields;
    return this;
  }

  public <K, V> OrderedMapCodec<K, V> build(Class<K> keyType, Class<V> valueType) {
    final JsonMapper mapper = mapper();
    return new OrderedMapCodec<>(
        mapper, mapper.constructType(keyType), mapper.constructType(valueType));
  }

  public <K, V> OrderedMapCodec<K, V> build(TypeReference<K> keyType, TypeReference<V> valueType) {
    final JsonMapper mapper = mapper();
    return new OrderedMapCodec<>(
        mapper, mapper.constructType(keyType), mapper.constructType(valueType));
  }

  /// Builds a codec for types already resolved by a Jackson `TypeFactory`. The caller is
  /// responsible for `K` and `V` matching the given types.
  public <K, V> OrderedMapCodec<K, V> build(JavaType keyType, JavaType valueType) {
    return new OrderedMapCodec<>(mapper(), keyType, valueType);
  }

  JsonMapper mapper() {
    final boolean pretty =
        resolve(prettyPrint, OrderedMapCodec.PRETTY_PRINT_PROPERTY, false);
    final boolean failOnUnknown =
        resolve(failOnUnknownFields, OrderedMapCodec.FAIL_ON_UNKNOWN_FIELDS_PROPERTY, true);
    final boolean caseInsensitive =
        resolve(caseInsensitiveFields, OrderedMapCodec.CASE_INSENSITIVE_FIELDS_PROPERTY, false);

    logger.log(
        Level.FINE,
        () ->
            String.format(
                "codec prettyPrint:%s failOnUnknownFields:%s caseInsensitiveFields:%s",
                pretty, failOnUnknown, caseInsensitive));

    final JsonMapper.Builder builder =
        jsonMapper == null ? JsonMapper.builder() : jsonMapper.rebuild();
    return builder
        .configure(SerializationFeature.INDENT_OUTPUT, pretty)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, failOnUnknown)
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
        .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, caseInsensitive)
        .addModule(new OrderedMapModule())
        .build();
  }

  /// An explicit setting wins, then the system property, then the environment variable.
  static boolean resolve(Boolean explicit, String setting, boolean defaultValue) {
    if (explicit != null) {
      return explicit;
    }
    final String key = String.format("%s.%s", OrderedMapCodec.class.getName(), setting);
    String value =
        System.getenv(key) == null ? Boolean.toString(defaultValue) : System.getenv(key);
    value = System.getProperty(key, value);
    return Boolean.parseBoolean(value.trim());
  }
}
