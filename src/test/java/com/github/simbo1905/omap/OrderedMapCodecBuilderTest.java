package com.github.simbo1905.omap;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import org.junit.After;
import org.junit.Test;

public class OrderedMapCodecBuilderTest extends JulLoggingConfig {

  private static final String PRETTY_PRINT_KEY =
      OrderedMapCodec.class.getName() + "." + OrderedMapCodec.PRETTY_PRINT_PROPERTY;
  private static final String FAIL_ON_UNKNOWN_KEY =
      OrderedMapCodec.class.getName() + "." + OrderedMapCodec.FAIL_ON_UNKNOWN_FIELDS_PROPERTY;

  @After
  public void clearProperties() {
    System.clearProperty(PRETTY_PRINT_KEY);
    System.clearProperty(FAIL_ON_UNKNOWN_KEY);
  }

  @Test
  public void testDefaults() {
    assertFalse(OrderedMapCodecBuilder.resolve(null, OrderedMapCodec.PRETTY_PRINT_PROPERTY, false));
    assertTrue(
        OrderedMapCodecBuilder.resolve(
            null, OrderedMapCodec.FAIL_ON_UNKNOWN_FIELDS_PROPERTY, true));
  }

  @Test
  public void testSystemPropertyOverridesDefault() {
    System.setProperty(PRETTY_PRINT_KEY, "true");
    assertTrue(OrderedMapCodecBuilder.resolve(null, OrderedMapCodec.PRETTY_PRINT_PROPERTY, false));
    System.setProperty(PRETTY_PRINT_KEY, " TRUE ");
    assertTrue(OrderedMapCodecBuilder.resolve(null, OrderedMapCodec.PRETTY_PRINT_PROPERTY, false));
  }

  @Test
  public void testExplicitSettingOverridesSystemProperty() {
    System.setProperty(PRETTY_PRINT_KEY, "true");
    assertFalse(
        OrderedMapCodecBuilder.resolve(false, OrderedMapCodec.PRETTY_PRINT_PROPERTY, false));
  }

  @Test
  public void testSystemPropertyReachesCodec() throws IOException {
    final OrderedMap<String, Integer> map = OrderedMap.<String, Integer>empty().mustSet("a", 1);

    System.setProperty(PRETTY_PRINT_KEY, "true");
    final String pretty = new OrderedMapCodecBuilder().build(String.class, Integer.class).encode(map);
    assertThat(pretty, containsString("\n"));

    System.setProperty(FAIL_ON_UNKNOWN_KEY, "false");
    final OrderedMap<String, Integer> decoded =
        new OrderedMapCodecBuilder()
            .build(String.class, Integer.class)
            .decode("[{\"Key\":\"a\",\"Value\":1,\"Comment\":\"ignored\"}]");
    assertEquals(map, decoded);
  }

  @Test
  public void testBaseMapperIsNotModified() throws IOException {
    final JsonMapper base = JsonMapper.builder().build();
    final OrderedMapCodec<String, Integer> codec =
        new OrderedMapCodecBuilder()
            .jsonMapper(base)
            .prettyPrint(true)
            .build(String.class, Integer.class);

    assertThat(
        codec.encode(OrderedMap.<String, Integer>empty().mustSet("a", 1)), containsString("\n"));
    assertFalse(base.isEnabled(SerializationFeature.INDENT_OUTPUT));
    assertThat(base.getRegisteredModuleIds().toString(), not(containsString("OrderedMapModule")));
  }
}
