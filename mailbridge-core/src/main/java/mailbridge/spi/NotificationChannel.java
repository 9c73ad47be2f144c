package mailbridge.spi;

/**
 * Best-effort publish/subscribe used to wake a consumer's scheduler when a dispatch row
 * is created.
 *
 * <p>Delivery is at-most-once, unordered and not persisted. A notification published
 * while no subscriber listens is lost; schedulers poll to cover for that.
 */
public interface NotificationChannel extends AutoCloseable {

  /**
   * Publishes a notification on the channel of {@code consumerId}.
   *
   * @throws mailbridge.TransportException if the channel is unavailable
   */
  void publish(int consumerId, String mailId);

  /**
   * Subscribes to the channel of {@code consumerId}.
   *
   * @throws mailbridge.TransportException if the subscription cannot be established
   */
  Subscription subscribe(int consumerId, Listener listener);

  @Override
  default void close() {
  }

  /**
   * Receives notifications. Called from a channel-owned thread; must not block.
   */
  @FunctionalInterface
  interface Listener {
    void onNotification(int consumerId, String mailId);
  }

  /**
   * Handle of an active subscription.
   */
  interface Subscription extends AutoCloseable {

    /**
     * Returns {@code false} once the subscription was closed or lost its transport.
     */
    boolean isActive();

    @Override
    void close();
  }
}
