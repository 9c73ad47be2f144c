package mailbridge.notify;

import mailbridge.TransportException;
import mailbridge.spi.NotificationChannel;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-local {@link NotificationChannel}. Listeners are called synchronously on the
 * publishing thread.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryNotificationChannel implements NotificationChannel {
  private static final Logger logger = Logger.getLogger(InMemoryNotificationChannel.class.getName());

  private final Map<Integer, List<LocalSubscription>> subscriptions = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  @Override
  public void publish(int consumerId, String mailId) {
    Objects.requireNonNull(mailId, "mailId");
    if (closed.get()) {
      throw new TransportException("Notification channel is closed");
    }
    List<LocalSubscription> subs = subscriptions.get(consumerId);
    if (subs == null) {
      return;
    }
    for (LocalSubscription sub : subs) {
      try {
        sub.listener.onNotification(consumerId, mailId);
      } catch (RuntimeException ex) {
        logger.log(Level.WARNING, "Notification listener failed for consumer " + consumerId, ex);
      }
    }
  }

  @Override
  public Subscription subscribe(int consumerId, Listener listener) {
    Objects.requireNonNull(listener, "listener");
    if (closed.get()) {
      throw new TransportException("Notification channel is closed");
    }
    LocalSubscription sub = new LocalSubscription(consumerId, listener);
    subscriptions.computeIfAbsent(consumerId, id -> new CopyOnWriteArrayList<>()).add(sub);
    return sub;
  }

  /**
   * Returns the number of active subscriptions on a consumer's channel.
   */
  public int subscriberCount(int consumerId) {
    List<LocalSubscription> subs = subscriptions.get(consumerId);
    return subs == null ? 0 : subs.size();
  }

  /**
   * Closes every subscription; later publishes and subscribes fail with
   * {@link TransportException}.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    subscriptions.values().forEach(subs -> subs.forEach(sub -> sub.active.set(false)));
    subscriptions.clear();
  }

  private final class LocalSubscription implements Subscription {
    private final int consumerId;
    private final Listener listener;
    private final AtomicBoolean active = new AtomicBoolean(true);

    LocalSubscription(int consumerId, Listener listener) {
      this.consumerId = consumerId;
      this.listener = listener;
    }

    @Override
    public boolean isActive() {
      return active.get();
    }

    @Override
    public void close() {
      if (active.compareAndSet(true, false)) {
        List<LocalSubscription> subs = subscriptions.get(consumerId);
        if (subs != null) {
          subs.remove(this);
        }
      }
    }
  }
}
