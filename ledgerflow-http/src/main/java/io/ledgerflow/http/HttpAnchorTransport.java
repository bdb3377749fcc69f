package io.ledgerflow.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledgerflow.spi.AnchorTransport;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link AnchorTransport} over {@code java.net.http} with Jackson.
 *
 * <p>Query parameters are URL-encoded, POST bodies are sent as JSON objects, and JSON
 * replies are flattened to dotted keys ({@code transaction.status}, {@code assets.0.code}).
 * Numbers keep their exact decimal text.
 */
public final class HttpAnchorTransport implements AnchorTransport {
  private final JsonHttpClient client;

  private HttpAnchorTransport(Builder builder) {
    this.client = new JsonHttpClient(
        builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
            .connectTimeout(builder.requestTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        builder.objectMapper != null ? builder.objectMapper : new ObjectMapper(),
        builder.requestTimeout);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Map<String, String> get(String url, Map<String, String> query, String bearerToken) {
    Objects.requireNonNull(url, "url");
    return JsonHttpClient.flatten(client.get(url, query, bearerToken));
  }

  @Override
  public Map<String, String> post(String url, Map<String, String> body, String bearerToken) {
    Objects.requireNonNull(url, "url");
    return JsonHttpClient.flatten(client.post(url, body == null ? Map.of() : body, bearerToken));
  }

  public static final class Builder {
    private HttpClient httpClient;
    private ObjectMapper objectMapper;
    private Duration requestTimeout = Duration.ofSeconds(30);

    private Builder() {}

    /** Optional. Defaults to a client following normal redirects. */
    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    /** Optional. Defaults to a plain {@link ObjectMapper}. */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /** Optional. Per-request timeout. Defaults to 30 seconds. */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      if (requestTimeout.isZero() || requestTimeout.isNegative()) {
        throw new IllegalArgumentException("requestTimeout must be positive, got: " + requestTimeout);
      }
      return this;
    }

    public HttpAnchorTransport build() {
      return new HttpAnchorTransport(this);
    }
  }
}
