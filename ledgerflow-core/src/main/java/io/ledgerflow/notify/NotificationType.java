package io.ledgerflow.notify;

public enum NotificationType {
  INFO,
  SUCCESS,
  WARNING,
  ERROR
}
