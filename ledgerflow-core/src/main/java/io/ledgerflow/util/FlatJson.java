package io.ledgerflow.util;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON reader/writer for flat objects ({@code Map<String, String>}) and
 * arrays of flat objects. Used for ledger state values, event payloads and stored
 * history, none of which nest.
 *
 * <p>On read, numbers and booleans are kept as their literal text and {@code null}
 * members are dropped. Nested objects or arrays inside an object are rejected.
 */
public final class FlatJson {

  private FlatJson() {
  }

  public static String write(Map<String, String> object) {
    StringBuilder sb = new StringBuilder();
    appendObject(sb, object == null ? Collections.emptyMap() : object);
    return sb.toString();
  }

  public static String writeList(List<Map<String, String>> objects) {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < objects.size(); i++) {
      if (i > 0) sb.append(',');
      appendObject(sb, objects.get(i));
    }
    return sb.append(']').toString();
  }

  /**
   * Parses a flat JSON object. {@code null}, blank and {@code "null"} give an empty map.
   *
   * @throws IllegalArgumentException if the input is not a flat JSON object
   */
  public static Map<String, String> read(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    Reader reader = new Reader(json);
    Map<String, String> result = reader.object();
    reader.end();
    return result;
  }

  /**
   * Parses an array of flat JSON objects. {@code null} or blank gives an empty list.
   */
  public static List<Map<String, String>> readList(String json) {
    if (json == null || json.isBlank()) {
      return Collections.emptyList();
    }
    Reader reader = new Reader(json);
    List<Map<String, String>> result = new ArrayList<>();
    reader.expect('[');
    if (!reader.tryConsume(']')) {
      do {
        result.add(reader.object());
      } while (reader.tryConsume(','));
      reader.expect(']');
    }
    reader.end();
    return result;
  }

  /** Quotes and escapes a string as a JSON string literal. */
  public static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  private static void appendObject(StringBuilder sb, Map<String, String> object) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, String> entry : object.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object keys must not be null");
      }
      if (entry.getValue() == null) {
        continue;
      }
      if (!first) sb.append(',');
      first = false;
      sb.append(quote(entry.getKey())).append(':').append(quote(entry.getValue()));
    }
    sb.append('}');
  }

  private static final class Reader {
    private final String in;
    private int pos;

    Reader(String in) {
      this.in = in;
    }

    Map<String, String> object() {
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      if (tryConsume('}')) {
        return result;
      }
      do {
        skipWhitespace();
        String key = string();
        expect(':');
        skipWhitespace();
        String value = scalar();
        if (value != null) {
          result.put(key, value);
        }
      } while (tryConsume(','));
      expect('}');
      return result;
    }

    private String scalar() {
      if (pos >= in.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      char c = in.charAt(pos);
      if (c == '"') {
        return string();
      }
      if (c == '{' || c == '[') {
        throw new IllegalArgumentException("Nested JSON values are not supported at " + pos);
      }
      int start = pos;
      while (pos < in.length() && ",}] \t\r\n".indexOf(in.charAt(pos)) < 0) {
        pos++;
      }
      String literal = in.substring(start, pos);
      if (literal.isEmpty()) {
        throw new IllegalArgumentException("Expected JSON value at " + start);
      }
      if ("null".equals(literal)) {
        return null;
      }
      if (!"true".equals(literal) && !"false".equals(literal) && !isNumber(literal)) {
        throw new IllegalArgumentException("Invalid JSON literal: " + literal);
      }
      return literal;
    }

    private String string() {
      if (pos >= in.length() || in.charAt(pos) != '"') {
        throw new IllegalArgumentException("Expected string at " + pos);
      }
      pos++;
      StringBuilder sb = new StringBuilder();
      while (pos < in.length()) {
        char c = in.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= in.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = in.charAt(pos++);
        switch (next) {
          case '"', '\\', '/' -> sb.append(next);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > in.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(in.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    void expect(char c) {
      skipWhitespace();
      if (pos >= in.length() || in.charAt(pos) != c) {
        throw new IllegalArgumentException("Expected '" + c + "' at " + pos);
      }
      pos++;
    }

    boolean tryConsume(char c) {
      skipWhitespace();
      if (pos < in.length() && in.charAt(pos) == c) {
        pos++;
        return true;
      }
      return false;
    }

    void end() {
      skipWhitespace();
      if (pos != in.length()) {
        throw new IllegalArgumentException("Trailing characters after JSON at " + pos);
      }
    }

    private void skipWhitespace() {
      while (pos < in.length() && Character.isWhitespace(in.charAt(pos))) {
        pos++;
      }
    }

    private static boolean isNumber(String literal) {
      try {
        new BigDecimal(literal);
        return true;
      } catch (NumberFormatException e) {
        return false;
      }
    }
  }
}
