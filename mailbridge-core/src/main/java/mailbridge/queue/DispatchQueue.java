package mailbridge.queue;

import mailbridge.InvariantViolationException;
import mailbridge.model.Dispatch;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.DispatchStore;
import mailbridge.spi.MetricsExporter;
import mailbridge.spi.TxContext;
import mailbridge.util.ConnectionScope;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable per-consumer queue of pending deliveries.
 *
 * <p>Every operation joins the caller's transaction when the {@link TxContext} reports
 * one, and otherwise runs auto-committed on a connection of its own. When
 * {@link #enqueue} creates a row, the configured {@link EnqueueHook} fires once the row
 * is committed.
 *
 * <p>Timestamps are taken from the configured {@link Clock} and kept at millisecond
 * precision, so they survive a round trip through any supported database unchanged.
 *
 * @see mailbridge.scheduler.DispatchScheduler
 */
public final class DispatchQueue {
  private static final Logger logger = Logger.getLogger(DispatchQueue.class.getName());

  static final int MAX_ERROR_LENGTH = 2000;

  private final ConnectionScope scope;
  private final DispatchStore store;
  private final EnqueueHook hook;
  private final MetricsExporter metrics;
  private final Clock clock;

  private DispatchQueue(Builder builder) {
    this.scope = new ConnectionScope(
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider"), builder.txContext);
    this.store = Objects.requireNonNull(builder.store, "store");
    this.hook = builder.hook == null ? EnqueueHook.NOOP : builder.hook;
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the current time as used for queue timestamps.
   */
  public Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  /**
   * Creates a dispatch row due immediately. Enqueuing an existing pair leaves the row as
   * it is, including its schedule and attempt count.
   *
   * @return {@code true} if a row was created
   * @throws mailbridge.ReferenceException if the consumer or the mail does not exist
   */
  public boolean enqueue(int consumerId, String mailId) {
    Objects.requireNonNull(mailId, "mailId");
    Instant now = now();
    boolean created = scope.call(conn -> store.insert(conn, consumerId, mailId, now));
    if (!created) {
      logger.log(Level.FINE, "Dispatch already queued for consumer {0}, mail {1}",
          new Object[]{consumerId, mailId});
      return false;
    }
    scope.afterCommit(() -> {
      metrics.incrementEnqueued();
      try {
        hook.afterCommit(consumerId, mailId);
      } catch (RuntimeException ex) {
        logger.log(Level.WARNING, "EnqueueHook.afterCommit failed for consumer "
            + consumerId + ", mail " + mailId, ex);
      }
    });
    return true;
  }

  /**
   * Returns the rows of a consumer due at {@code at}, earliest first.
   */
  public List<Dispatch> due(int consumerId, Instant at) {
    Objects.requireNonNull(at, "at");
    return scope.call(conn -> store.findDue(conn, consumerId, at));
  }

  /**
   * Deletes the row after a successful delivery.
   *
   * @return {@code true} if the row existed
   */
  public boolean recordSuccess(int consumerId, String mailId) {
    return scope.call(conn -> store.delete(conn, consumerId, mailId)) > 0;
  }

  public boolean recordFailure(int consumerId, String mailId, Instant attemptedAt, Duration backoff) {
    return recordFailure(consumerId, mailId, attemptedAt, backoff, null);
  }

  /**
   * Records a failed attempt: {@code last_time = attemptedAt},
   * {@code next_time = attemptedAt + backoff}, attempts incremented.
   *
   * @param error description of the failure, truncated before it is stored; may be {@code null}
   * @return {@code true} if the row existed
   * @throws InvariantViolationException if {@code backoff} is not strictly positive, or the
   *                                     store rejects the row
   */
  public boolean recordFailure(int consumerId, String mailId, Instant attemptedAt,
                               Duration backoff, String error) {
    Objects.requireNonNull(attemptedAt, "attemptedAt");
    Objects.requireNonNull(backoff, "backoff");
    if (backoff.isZero() || backoff.isNegative()) {
      throw new InvariantViolationException(
          "Backoff must be strictly positive, got " + backoff + " for consumer "
              + consumerId + ", mail " + mailId);
    }
    Instant last = attemptedAt.truncatedTo(ChronoUnit.MILLIS);
    Instant next = attemptedAt.plus(backoff).truncatedTo(ChronoUnit.MILLIS);
    if (!next.isAfter(last)) {
      next = last.plusMillis(1);
    }
    Instant nextTime = next;
    String stored = truncate(error);
    return scope.call(conn -> store.markFailed(conn, consumerId, mailId, last, nextTime, stored)) > 0;
  }

  /**
   * Removes every row of a consumer.
   *
   * @return the number of rows removed
   */
  public int deleteForConsumer(int consumerId) {
    return scope.call(conn -> store.deleteForConsumer(conn, consumerId));
  }

  public Optional<Dispatch> find(int consumerId, String mailId) {
    return scope.call(conn -> store.find(conn, consumerId, mailId));
  }

  /**
   * Lists up to {@code limit} rows of a consumer, earliest {@code next_time} first,
   * whether due or not.
   */
  public List<Dispatch> pending(int consumerId, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
    return scope.call(conn -> store.findByConsumer(conn, consumerId, limit));
  }

  public int count(int consumerId) {
    return scope.call(conn -> store.countByConsumer(conn, consumerId));
  }

  /**
   * Returns the earliest {@code next_time} of a consumer, empty when it has no rows.
   */
  public Optional<Instant> nextDueTime(int consumerId) {
    return scope.call(conn -> store.nextDueTime(conn, consumerId));
  }

  /**
   * Acknowledges a mail on behalf of its consumer, removing the row whether or not it
   * was due.
   *
   * @return {@code false} if there was nothing to acknowledge
   */
  public boolean acknowledge(int consumerId, String mailId) {
    boolean removed = recordSuccess(consumerId, mailId);
    if (removed) {
      logger.log(Level.FINE, "Consumer {0} acknowledged mail {1}", new Object[]{consumerId, mailId});
    }
    return removed;
  }

  static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }

  /** Builder for {@link DispatchQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TxContext txContext;
    private DispatchStore store;
    private EnqueueHook hook;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * <b>Required.</b> Supplies connections when no caller transaction is active.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Optional. Without it every operation is auto-committed.
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder store(DispatchStore store) {
      this.store = store;
      return this;
    }

    /**
     * Optional. Defaults to {@link EnqueueHook#NOOP}.
     */
    public Builder hook(EnqueueHook hook) {
      this.hook = hook;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException if {@code connectionProvider} or {@code store} is null
     */
    public DispatchQueue build() {
      return new DispatchQueue(this);
    }
  }
}
