package io.ledgerflow.notify;

@FunctionalInterface
public interface NotificationListener {

  void onNotification(Notification notification);
}
