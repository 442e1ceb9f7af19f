package com.github.simbo1905.omap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Encodes an [OrderedMap] to its canonical JSON form and decodes it back.
///
/// The canonical form is a JSON array of objects with the two fields `Key` and `Value`. The order
/// of the array is the insertion order of the map:
/// <pre>
/// [{"Key":"a","Value":1},{"Key":"b","Value":2}]
/// </pre>
///
/// Decoding replays an insert per record in array order. Input that is not such an array fails
/// with [OrderedMapDecodeException]; two records with the same key fail with
/// [KeyAlreadyExistsException]. Either way no map is returned, so a caller that assigns the result
/// keeps its previous map on failure.
///
/// Create instances with [OrderedMapCodecBuilder]. A codec is immutable and may be shared between
/// threads.
public final class OrderedMapCodec<K, V> {

  private static final Logger logger = Logger.getLogger(OrderedMapCodec.class.getName());

  public static final String PRETTY_PRINT_PROPERTY = "PRETTY_PRINT";
  public static final String FAIL_ON_UNKNOWN_FIELDS_PROPERTY = "FAIL_ON_UNKNOWN_FIELDS";
  public static final String CASE_INSENSITIVE_FIELDS_PROPERTY = "CASE_INSENSITIVE_FIELDS";

  private final ObjectWriter writer;
  private final ObjectReader reader;

  OrderedMapCodec(ObjectMapper mapper, JavaType keyType, JavaType valueType) {
    final TypeFactory typeFactory = mapper.getTypeFactory();
    this.writer =
        mapper.writerFor(typeFactory.constructParametricType(OrderedMap.class, keyType, valueType));
    this.reader = mapper.readerFor(recordsType(typeFactory, keyType, valueType));
  }

  /// `List<OrderedMapEntry<K, V>>` for the given key and value types.
  static JavaType recordsType(TypeFactory typeFactory, JavaType keyType, JavaType valueType) {
    return typeFactory.constructCollectionType(
        List.class,
        typeFactory.constructParametricType(OrderedMapEntry.class, keyType, valueType));
  }

  public String encode(OrderedMap<K, V> map) throws IOException {
    final String json = writer.writeValueAsString(map);
    logger.log(
        Level.FINE, () -> String.format("encoded %d entries to %d chars", map.size(), json.length()));
    return json;
  }

  public byte[] encodeToBytes(OrderedMap<K, V> map) throws IOException {
    final byte[] json = writer.writeValueAsBytes(map);
    logger.log(
        Level.FINE, () -> String.format("encoded %d entries to %d bytes", map.size(), json.length));
    return json;
  }

  public OrderedMap<K, V> decode(String json) throws IOException {
    final List<OrderedMapEntry<K, V>> records;
    try {
      records = reader.readValue(json);
    } catch (IOException e) {
      throw decodeFailure(e);
    }
    return decoded(records);
  }

  public OrderedMap<K, V> decode(byte[] json) throws IOException {
    final List<OrderedMapEntry<K, V>> records;
    try {
      records = reader.readValue(json);
    } catch (IOException e) {
      throw decodeFailure(e);
    }
    return decoded(records);
  }

  /// Reads the stream to its end and decodes it. The stream is not closed.
  public OrderedMap<K, V> decode(InputStream json) throws IOException {
    return decode(json.readAllBytes());
  }

  private OrderedMap<K, V> decoded(List<OrderedMapEntry<K, V>> records)
      throws OrderedMapDecodeException {
    final OrderedMap<K, V> map = replay(records);
    logger.log(Level.FINE, () -> String.format("decoded %d entries", map.size()));
    return map;
  }

  /// Byte input that is not valid in its detected encoding fails with a plain `IOException` such
  /// as `CharConversionException` rather than a `JsonProcessingException`.
  private static OrderedMapDecodeException decodeFailure(IOException e) {
    final String reason =
        e instanceof JsonProcessingException
            ? ((JsonProcessingException) e).getOriginalMessage()
            : e.getMessage();
    logger.log(Level.FINE, () -> "decode failed: " + reason);
    return new OrderedMapDecodeException("invalid ordered map JSON: " + reason, e);
  }

  /// Builds a map from decoded records in their order. A JSON `null` document arrives as a null
  /// list and yields an empty map.
  ///
  /// @throws OrderedMapDecodeException if a record or its key is null
  /// @throws KeyAlreadyExistsException if two records share a key
  static <K, V> OrderedMap<K, V> replay(List<OrderedMapEntry<K, V>> records)
      throws OrderedMapDecodeException {
    if (records == null) {
      return OrderedMap.empty();
    }
    final OrderedMapBuilder<K, V> builder = new OrderedMapBuilder<>();
    for (int i = 0; i < records.size(); i++) {
      final OrderedMapEntry<K, V> entry = records.get(i);
      if (entry == null) {
        throw new OrderedMapDecodeException("record " + i + " is null");
      }
      if (entry.getKey() == null) {
        throw new OrderedMapDecodeException("record " + i + " has a null Key");
      }
      builder.set(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }
}
