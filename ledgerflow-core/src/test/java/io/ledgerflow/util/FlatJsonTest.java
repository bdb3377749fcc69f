package io.ledgerflow.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlatJsonTest {

  @Test
  void writesInInsertionOrderSkippingNulls() {
    Map<String, String> object = new LinkedHashMap<>();
    object.put("b", "2");
    object.put("a", "say \"hi\"\n");
    object.put("skip", null);

    assertEquals("{\"b\":\"2\",\"a\":\"say \\\"hi\\\"\\n\"}", FlatJson.write(object));
    assertEquals("{}", FlatJson.write(null));
  }

  @Test
  void readsLiteralsAsText() {
    Map<String, String> parsed = FlatJson.read(" { \"amount\" : 12.50, \"ok\": true, \"gone\": null, \"s\": \"x\\u0041\" } ");

    assertEquals(Map.of("amount", "12.50", "ok", "true", "s", "xA"), parsed);
  }

  @Test
  void emptyInputsGiveEmptyResults() {
    assertTrue(FlatJson.read(null).isEmpty());
    assertTrue(FlatJson.read("  ").isEmpty());
    assertTrue(FlatJson.read("null").isEmpty());
    assertTrue(FlatJson.readList("").isEmpty());
    assertTrue(FlatJson.readList("[]").isEmpty());
  }

  @Test
  void readsArraysOfObjects() {
    List<Map<String, String>> list = FlatJson.readList("[{\"id\":\"0\"},{\"id\":\"1\",\"budget\":\"5\"}]");

    assertEquals(2, list.size());
    assertEquals("5", list.get(1).get("budget"));
    assertEquals(list, FlatJson.readList(FlatJson.writeList(list)));
  }

  @Test
  void rejectsNestingAndTrailingGarbage() {
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":{\"b\":\"c\"}}"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":[1]}"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":\"b\"} extra"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{broken"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.readList("{\"a\":\"b\"}"));
  }
}
