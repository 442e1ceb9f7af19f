package com.github.simbo1905.omap;

import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.junit.Test;

/// Ordered maps nested inside other documents through a plain `ObjectMapper`.
public class OrderedMapModuleTest extends JulLoggingConfig {

  @JsonPropertyOrder({"name", "scores"})
  public static class Scoreboard {
    public String name;
    public OrderedMap<String, Integer> scores;
  }

  private final ObjectMapper mapper = new ObjectMapper().registerModule(new OrderedMapModule());

  @Test
  public void testNestedRoundTrip() throws IOException {
    final Scoreboard board = new Scoreboard();
    board.name = "finals";
    board.scores = OrderedMap.<String, Integer>empty().mustSet("b", 2).mustSet("a", 1);

    final String json = mapper.writeValueAsString(board);
    assertEquals(
        "{\"name\":\"finals\",\"scores\":[{\"Key\":\"b\",\"Value\":2},{\"Key\":\"a\",\"Value\":1}]}",
        json);

    final Scoreboard decoded = mapper.readValue(json, Scoreboard.class);
    assertEquals("finals", decoded.name);
    assertThat(decoded.scores.keys(), contains("b", "a"));
    assertEquals(Integer.valueOf(1), decoded.scores.get("a"));
  }

  @Test
  public void testNestedNullAndEmpty() throws IOException {
    final Scoreboard nulls = mapper.readValue("{\"name\":\"x\",\"scores\":null}", Scoreboard.class);
    assertNull(nulls.scores);

    final Scoreboard empty = mapper.readValue("{\"name\":\"x\",\"scores\":[]}", Scoreboard.class);
    assertTrue(empty.scores.isEmpty());
  }

  @Test
  public void testNestedDuplicateKey() throws IOException {
    final String json =
        "{\"name\":\"x\",\"scores\":[{\"Key\":\"a\",\"Value\":1},{\"Key\":\"a\",\"Value\":2}]}";
    try {
      mapper.readValue(json, Scoreboard.class);
      fail("expected JsonMappingException");
    } catch (JsonMappingException e) {
      assertTrue(e.getCause() instanceof KeyAlreadyExistsException);
      assertEquals("a", ((KeyAlreadyExistsException) e.getCause()).getKey());
    }
  }

  @Test
  public void testRootValue() throws IOException {
    final OrderedMap<String, Integer> decoded =
        mapper.readValue(
            "[{\"Key\":\"y\",\"Value\":25},{\"Key\":\"x\",\"Value\":24}]",
            new TypeReference<OrderedMap<String, Integer>>() {});
    assertThat(decoded.keys(), contains("y", "x"));
    assertEquals(
        "[{\"Key\":\"y\",\"Value\":25},{\"Key\":\"x\",\"Value\":24}]",
        mapper.writeValueAsString(decoded));
  }

  @Test
  public void testModuleName() {
    assertEquals("OrderedMapModule", new OrderedMapModule().getModuleName());
  }
}
