package mailbridge.registry;

import mailbridge.model.Consumer;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.ConsumerLock;
import mailbridge.spi.ConsumerStore;
import mailbridge.spi.DispatchStore;
import mailbridge.spi.TxContext;
import mailbridge.util.ConnectionScope;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates, lists and deletes consumers.
 *
 * <p>Deleting a consumer takes its {@link ConsumerLock}, waiting up to the configured
 * timeout for a running burst to finish, so no scheduler delivers to a consumer that is
 * being removed. The consumer's dispatch rows and the consumer itself are deleted in one
 * transaction of their own.
 *
 * <p>This class is thread-safe.
 */
public final class ConsumerRegistry {
  private static final Logger logger = Logger.getLogger(ConsumerRegistry.class.getName());

  private final ConnectionScope scope;
  private final ConsumerStore consumerStore;
  private final DispatchStore dispatchStore;
  private final ConsumerLock lock;
  private final Duration lockWaitTimeout;
  private final List<ConsumerLifecycleListener> listeners = new CopyOnWriteArrayList<>();

  public ConsumerRegistry(ConnectionProvider connectionProvider, TxContext txContext,
                          ConsumerStore consumerStore, DispatchStore dispatchStore,
                          ConsumerLock lock, Duration lockWaitTimeout) {
    this.scope = new ConnectionScope(connectionProvider, txContext);
    this.consumerStore = Objects.requireNonNull(consumerStore, "consumerStore");
    this.dispatchStore = Objects.requireNonNull(dispatchStore, "dispatchStore");
    this.lock = Objects.requireNonNull(lock, "lock");
    this.lockWaitTimeout = Objects.requireNonNull(lockWaitTimeout, "lockWaitTimeout");
    if (lockWaitTimeout.isNegative()) {
      throw new IllegalArgumentException("lockWaitTimeout must be >= 0");
    }
  }

  public void addListener(ConsumerLifecycleListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ConsumerLifecycleListener listener) {
    listeners.remove(listener);
  }

  /**
   * Registers a consumer. Listeners hear about it once the enclosing transaction, if any,
   * commits.
   */
  public Consumer create(String name) {
    Objects.requireNonNull(name, "name");
    Consumer consumer = scope.call(conn -> consumerStore.insert(conn, name));
    logger.log(Level.INFO, "Created consumer {0} ({1})", new Object[]{consumer.id(), name});
    scope.afterCommit(() -> notifyListeners("onCreated", l -> l.onCreated(consumer)));
    return consumer;
  }

  public Optional<Consumer> find(int consumerId) {
    return scope.call(conn -> consumerStore.find(conn, consumerId));
  }

  /**
   * Returns all consumers ordered by id.
   */
  public List<Consumer> list() {
    return scope.call(consumerStore::findAll);
  }

  /**
   * Deletes a consumer and every dispatch pending for it.
   *
   * @return {@code false} if the consumer did not exist
   * @throws IllegalStateException if the consumer lock cannot be taken within the wait timeout
   */
  public boolean delete(int consumerId) {
    boolean acquired;
    try {
      acquired = lock.tryAcquire(consumerId, lockWaitTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for consumer " + consumerId, e);
    }
    if (!acquired) {
      throw new IllegalStateException("Consumer " + consumerId + " is busy; lock not acquired within "
          + lockWaitTimeout);
    }
    boolean deleted;
    int dropped;
    try {
      int[] removed = new int[1];
      deleted = scope.inNewTransaction(conn -> {
        removed[0] = dispatchStore.deleteForConsumer(conn, consumerId);
        return consumerStore.delete(conn, consumerId);
      });
      dropped = removed[0];
    } finally {
      lock.release(consumerId);
    }
    if (deleted) {
      logger.log(Level.INFO, "Deleted consumer {0} with {1} pending dispatches",
          new Object[]{consumerId, dropped});
      notifyListeners("onDeleted", l -> l.onDeleted(consumerId));
    }
    return deleted;
  }

  private void notifyListeners(String phase, java.util.function.Consumer<ConsumerLifecycleListener> action) {
    for (ConsumerLifecycleListener listener : listeners) {
      try {
        action.accept(listener);
      } catch (RuntimeException ex) {
        logger.log(Level.WARNING, "ConsumerLifecycleListener." + phase + " failed", ex);
      }
    }
  }
}
