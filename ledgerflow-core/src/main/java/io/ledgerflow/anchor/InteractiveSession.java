package io.ledgerflow.anchor;

import java.util.Objects;

/**
 * An interactive deposit or withdrawal flow opened at the anchor. The user completes it
 * at {@code url}; progress is tracked by {@code id}.
 */
public record InteractiveSession(String id, String url, Type type, String authToken) {
  public enum Type { DEPOSIT, WITHDRAW }

  public InteractiveSession {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(authToken, "authToken");
  }

  @Override
  public String toString() {
    return "InteractiveSession[id=" + id + ", url=" + url + ", type=" + type + "]";
  }
}
