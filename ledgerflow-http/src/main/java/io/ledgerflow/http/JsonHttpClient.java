package io.ledgerflow.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.ledgerflow.ErrorClassifier;
import io.ledgerflow.ErrorCode;
import io.ledgerflow.LedgerException;
import io.ledgerflow.RateLimitedException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Sends JSON requests and turns non-2xx replies into classified {@link LedgerException}s.
 */
final class JsonHttpClient {
  private static final Logger logger = Logger.getLogger(JsonHttpClient.class.getName());

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Duration requestTimeout;

  JsonHttpClient(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  ObjectMapper mapper() {
    return objectMapper;
  }

  JsonNode get(String url, Map<String, String> query, String bearerToken) {
    HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url + queryString(query)))
        .timeout(requestTimeout)
        .header("Accept", "application/json")
        .GET();
    return send(authorize(request, bearerToken).build());
  }

  JsonNode post(String url, Object body, String bearerToken) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new LedgerException(ErrorCode.INVALID_PARAMS, "Request body is not serializable: " + e.getMessage(), e);
    }
    HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
        .timeout(requestTimeout)
        .header("Accept", "application/json")
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
    return send(authorize(request, bearerToken).build());
  }

  private static HttpRequest.Builder authorize(HttpRequest.Builder request, String bearerToken) {
    if (bearerToken != null) {
      request.header("Authorization", "Bearer " + bearerToken);
    }
    return request;
  }

  private JsonNode send(HttpRequest request) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new LedgerException(ErrorCode.NETWORK_ERROR,
          request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LedgerException(ErrorCode.NETWORK_ERROR, request.method() + " " + request.uri() + " interrupted", e);
    }
    int status = response.statusCode();
    String body = response.body();
    if (status >= 200 && status < 300) {
      return parse(body);
    }
    String message = errorMessage(request, status, body);
    logger.fine(() -> message);
    ErrorCode code = ErrorClassifier.forHttpStatus(status, body);
    if (code == ErrorCode.RATE_LIMITED) {
      throw new RateLimitedException(message, retryAfter(response));
    }
    throw new LedgerException(code, message);
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      return MissingNode.getInstance();
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new LedgerException(ErrorCode.SERVICE_UNAVAILABLE, "Malformed JSON response: " + e.getOriginalMessage(), e);
    }
  }

  private String errorMessage(HttpRequest request, int status, String body) {
    String detail = null;
    if (body != null && !body.isBlank()) {
      try {
        JsonNode node = objectMapper.readTree(body);
        detail = firstText(node, "message", "error", "detail");
      } catch (JsonProcessingException e) {
        detail = body.length() > 200 ? body.substring(0, 200) : body;
      }
    }
    return request.method() + " " + request.uri().getPath() + " returned HTTP " + status
        + (detail == null ? "" : ": " + detail);
  }

  private static String firstText(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode value = node.path(name);
      if (value.isValueNode() && !value.isNull()) {
        return value.asText();
      }
    }
    return null;
  }

  private static Duration retryAfter(HttpResponse<?> response) {
    Optional<String> header = response.headers().firstValue("Retry-After");
    if (header.isEmpty()) {
      return null;
    }
    try {
      long seconds = Long.parseLong(header.get().trim());
      return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException e) {
      logger.fine(() -> "Ignoring non-numeric Retry-After: " + header.get());
      return null;
    }
  }

  private static String queryString(Map<String, String> query) {
    if (query == null || query.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder("?");
    for (Map.Entry<String, String> entry : query.entrySet()) {
      if (sb.length() > 1) sb.append('&');
      sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8));
    }
    return sb.toString();
  }

  /**
   * Flattens scalar members into a map, joining nested object keys and array indexes with dots.
   * {@code null} members are dropped.
   */
  static Map<String, String> flatten(JsonNode node) {
    Map<String, String> out = new LinkedHashMap<>();
    flatten("", node, out);
    return out;
  }

  private static void flatten(String prefix, JsonNode node, Map<String, String> out) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return;
    }
    if (node.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        flatten(prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey(), field.getValue(), out);
      }
    } else if (node.isArray()) {
      for (int i = 0; i < node.size(); i++) {
        flatten(prefix.isEmpty() ? Integer.toString(i) : prefix + "." + i, node.get(i), out);
      }
    } else if (node.isNumber()) {
      out.put(prefix, node.decimalValue().toPlainString());
    } else {
      out.put(prefix, node.asText());
    }
  }
}
