package io.ledgerflow.notify;

import io.ledgerflow.event.ContractEvent;
import io.ledgerflow.event.ContractEventListener;
import io.ledgerflow.spi.MetricsExporter;
import io.ledgerflow.util.Registration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, newest-first log of user-facing notifications.
 *
 * <p>Only the six known contract event kinds produce notifications; unknown events are
 * ignored. Listener failures are logged and do not affect the log.
 */
public final class NotificationManager {
  private static final Logger logger = Logger.getLogger(NotificationManager.class.getName());

  public static final int DEFAULT_CAPACITY = 50;

  private final int capacity;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final LinkedList<Notification> log = new LinkedList<>();
  private final List<NotificationListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicLong ids = new AtomicLong();

  public NotificationManager() {
    this(DEFAULT_CAPACITY, Clock.systemUTC(), MetricsExporter.NOOP);
  }

  public NotificationManager(int capacity, Clock clock, MetricsExporter metrics) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
    }
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Prepends a notification, trimming the oldest beyond capacity, and pushes it to listeners.
   */
  public Notification notify(NotificationType type, String title, String message, Map<String, String> data) {
    Notification notification = new Notification("notif-" + clock.millis() + "-" + ids.incrementAndGet(),
        type, title, message, data, clock.instant(), false);
    synchronized (log) {
      log.addFirst(notification);
      while (log.size() > capacity) {
        log.removeLast();
      }
    }
    metrics.incrementNotification();
    for (NotificationListener listener : listeners) {
      try {
        listener.onNotification(notification);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Notification listener failed", e);
      }
    }
    return notification;
  }

  /**
   * Maps a known contract event to its canned notification.
   *
   * @return the notification, or empty for unknown events
   */
  public Optional<Notification> createEventNotification(ContractEvent event) {
    Map<String, String> data = new LinkedHashMap<>(event.metadata().payload());
    data.put("contractId", event.contractId());
    data.put("eventType", event.metadata().type());
    if (event.metadata().ledger() > 0) {
      data.put("ledger", Long.toString(event.metadata().ledger()));
    }
    Notification n;
    if (event instanceof ContractEvent.EscrowCreated) {
      n = notify(NotificationType.SUCCESS, "Escrow Created", "A new escrow contract has been created", data);
    } else if (event instanceof ContractEvent.MilestoneCompleted) {
      n = notify(NotificationType.SUCCESS, "Milestone Completed", "A milestone has been marked as completed", data);
    } else if (event instanceof ContractEvent.FundsReleased) {
      n = notify(NotificationType.SUCCESS, "Funds Released", "Funds have been released from escrow", data);
    } else if (event instanceof ContractEvent.DisputeInitiated) {
      n = notify(NotificationType.WARNING, "Dispute Initiated", "A dispute has been raised on an escrow contract", data);
    } else if (event instanceof ContractEvent.PoolFunded) {
      n = notify(NotificationType.SUCCESS, "Pool Funded", "A crowdfunding pool has reached its goal", data);
    } else if (event instanceof ContractEvent.ContributionReceived) {
      n = notify(NotificationType.INFO, "Contribution Received", "A new contribution has been made to a pool", data);
    } else {
      return Optional.empty();
    }
    return Optional.of(n);
  }

  /** Adapter feeding subscribed events into {@link #createEventNotification}. */
  public ContractEventListener asEventListener() {
    return this::createEventNotification;
  }

  public List<Notification> getNotifications() {
    synchronized (log) {
      return List.copyOf(log);
    }
  }

  public List<Notification> getUnreadNotifications() {
    synchronized (log) {
      List<Notification> unread = new ArrayList<>();
      for (Notification n : log) {
        if (!n.read()) unread.add(n);
      }
      return unread;
    }
  }

  public int getUnreadCount() {
    return getUnreadNotifications().size();
  }

  public boolean markAsRead(String id) {
    synchronized (log) {
      ListIterator<Notification> it = log.listIterator();
      while (it.hasNext()) {
        Notification n = it.next();
        if (n.id().equals(id)) {
          it.set(n.markedRead());
          return true;
        }
      }
      return false;
    }
  }

  public void markAllAsRead() {
    synchronized (log) {
      log.replaceAll(Notification::markedRead);
    }
  }

  public boolean clearNotification(String id) {
    synchronized (log) {
      return log.removeIf(n -> n.id().equals(id));
    }
  }

  public void clearAll() {
    synchronized (log) {
      log.clear();
    }
  }

  public Registration addListener(NotificationListener listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }
}
