package mailbridge.scheduler;

import mailbridge.DeliveryFailureException;
import mailbridge.DeliveryResult;
import mailbridge.MailDelivery;
import mailbridge.StorageException;
import mailbridge.TransportException;
import mailbridge.archive.MailArchive;
import mailbridge.lock.LocalConsumerLock;
import mailbridge.model.Dispatch;
import mailbridge.model.Mail;
import mailbridge.queue.DispatchQueue;
import mailbridge.spi.ConsumerLock;
import mailbridge.spi.MetricsExporter;
import mailbridge.spi.NotificationChannel;
import mailbridge.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-lived worker that delivers the due dispatches of one consumer.
 *
 * <p>The scheduler listens on the consumer's {@link NotificationChannel} and keeps a
 * timer armed for {@code min(pollInterval, time until the earliest next_time)}. On a
 * notification or on timer expiry it runs a burst: it takes the consumer lock without
 * waiting, loads the due rows and hands each mail to the {@link MailDelivery} in
 * {@code next_time} order. A successful delivery removes the row; a failed one is
 * rescheduled with the {@link BackoffPolicy}. If the lock is held elsewhere the wake-up
 * does nothing.
 *
 * <p>Deliveries run on a separate executor so each attempt is bounded by the delivery
 * timeout. Notifications are only a latency optimisation: with a lost subscription or no
 * channel at all, the poll timer alone keeps the consumer served.
 *
 * <p>Create instances via {@link #builder()} and call {@link #start()}. {@link #close()}
 * stops wake-ups and lets a running burst finish within the drain timeout; after that the
 * burst is abandoned between deliveries and an interrupted delivery is not recorded.
 *
 * @see DispatchScheduler.Builder
 * @see mailbridge.queue.DispatchQueue
 */
public final class DispatchScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DispatchScheduler.class.getName());

  static final long MIN_WAIT_MS = 10;

  private enum Signal { NOTIFIED, STOP }

  private enum Outcome { DELIVERED, FAILED, SKIPPED }

  private final int consumerId;
  private final DispatchQueue queue;
  private final MailArchive archive;
  private final MailDelivery delivery;
  private final ConsumerLock lock;
  private final NotificationChannel channel;
  private final BackoffPolicy backoffPolicy;
  private final MetricsExporter metrics;
  private final long pollIntervalMs;
  private final long deliveryTimeoutMs;
  private final long drainTimeoutMs;

  private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean abandon = new AtomicBoolean(false);
  private final ExecutorService deliveryExecutor;

  private ExecutorService loopExecutor;
  private volatile boolean closed;
  private volatile NotificationChannel.Subscription subscription;
  private boolean catchUp = true;
  private boolean holdOff;

  private DispatchScheduler(Builder builder) {
    this.consumerId = builder.consumerId;
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.archive = Objects.requireNonNull(builder.archive, "archive");
    this.delivery = Objects.requireNonNull(builder.delivery, "delivery");
    this.lock = builder.lock != null ? builder.lock : new LocalConsumerLock();
    this.channel = builder.channel;
    this.backoffPolicy = builder.backoffPolicy != null
        ? builder.backoffPolicy
        : new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofHours(1));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.pollInterval.toMillis() <= 0) {
      throw new IllegalArgumentException("pollInterval must be >= 1ms");
    }
    if (builder.deliveryTimeout.toMillis() <= 0) {
      throw new IllegalArgumentException("deliveryTimeout must be >= 1ms");
    }
    if (builder.drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.pollIntervalMs = builder.pollInterval.toMillis();
    this.deliveryTimeoutMs = builder.deliveryTimeout.toMillis();
    this.drainTimeoutMs = builder.drainTimeout.toMillis();
    this.deliveryExecutor = Executors.newCachedThreadPool(
        new DaemonThreadFactory("mailbridge-delivery-" + consumerId + "-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  public int consumerId() {
    return consumerId;
  }

  /**
   * Returns {@code true} while the background loop is accepting wake-ups.
   */
  public boolean isRunning() {
    return running.get();
  }

  /**
   * Subscribes to the consumer's channel and starts the background loop. The first burst
   * runs immediately to pick up rows left from earlier runs. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the scheduler has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DispatchScheduler has been closed");
    }
    if (loopExecutor != null) {
      return;
    }
    running.set(true);
    loopExecutor = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory("mailbridge-scheduler-" + consumerId + "-"));
    loopExecutor.submit(this::loop);
    logger.log(Level.INFO, "Started dispatch scheduler for consumer {0}", consumerId);
  }

  /**
   * Runs one burst synchronously on the calling thread.
   *
   * @return the burst outcome; {@link BurstResult#LOCKED_OUT} if another worker held the lock
   * @throws StorageException if the queue or the archive fails; the lock is released and the
   *                          remaining rows stay due
   */
  public BurstResult processOnce() {
    if (!lock.tryAcquire(consumerId)) {
      metrics.incrementLockContended();
      logger.log(Level.FINE, "Consumer {0} is locked by another worker; skipping burst", consumerId);
      return BurstResult.LOCKED_OUT;
    }
    int delivered = 0;
    int failed = 0;
    try {
      List<Dispatch> due = queue.due(consumerId, queue.now());
      for (Dispatch dispatch : due) {
        if (abandon.get() || Thread.currentThread().isInterrupted()) {
          break;
        }
        Outcome outcome = attempt(dispatch);
        if (outcome == Outcome.DELIVERED) {
          delivered++;
        } else if (outcome == Outcome.FAILED) {
          failed++;
        }
      }
    } finally {
      lock.release(consumerId);
    }
    return new BurstResult(true, delivered, failed);
  }

  private void loop() {
    try {
      while (running.get()) {
        ensureSubscribed();
        Signal signal = signals.poll(computeWaitMs(), TimeUnit.MILLISECONDS);
        List<Signal> pending = new ArrayList<>();
        signals.drainTo(pending);
        if (!running.get() || signal == Signal.STOP || pending.contains(Signal.STOP)) {
          break;
        }
        if (signal == Signal.NOTIFIED) {
          metrics.incrementNotifiedWakeup();
        } else {
          metrics.incrementPolledWakeup();
        }
        runBurst();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      closeSubscription();
    }
  }

  private void runBurst() {
    try {
      BurstResult result = processOnce();
      holdOff = !result.lockAcquired();
      if (result.attempted() > 0) {
        logger.log(Level.FINE, "Consumer {0}: delivered {1}, failed {2}",
            new Object[]{consumerId, result.delivered(), result.failed()});
      }
    } catch (StorageException e) {
      holdOff = true;
      metrics.incrementStorageFailure();
      logger.log(Level.SEVERE, "Dispatch burst failed for consumer " + consumerId
          + "; retrying on next wake-up", e);
    } catch (RuntimeException e) {
      holdOff = true;
      logger.log(Level.SEVERE, "Dispatch loop error for consumer " + consumerId, e);
    }
  }

  long computeWaitMs() {
    if (catchUp) {
      catchUp = false;
      return 0L;
    }
    if (holdOff) {
      holdOff = false;
      return pollIntervalMs;
    }
    Optional<Instant> next;
    try {
      next = queue.nextDueTime(consumerId);
    } catch (StorageException e) {
      metrics.incrementStorageFailure();
      logger.log(Level.SEVERE, "Failed to read next due time for consumer " + consumerId, e);
      return pollIntervalMs;
    }
    if (next.isEmpty()) {
      return pollIntervalMs;
    }
    long untilDue = Duration.between(queue.now(), next.get()).toMillis();
    return Math.max(MIN_WAIT_MS, Math.min(pollIntervalMs, untilDue));
  }

  private void ensureSubscribed() {
    if (channel == null) {
      return;
    }
    NotificationChannel.Subscription current = subscription;
    if (current != null && current.isActive()) {
      return;
    }
    if (current != null) {
      logger.log(Level.WARNING, "Notification subscription lost for consumer {0}; resubscribing", consumerId);
      current.close();
    }
    try {
      subscription = channel.subscribe(consumerId, (id, mailId) -> {
        if (running.get()) {
          signals.offer(Signal.NOTIFIED);
        }
      });
      if (current != null) {
        // notifications may have been missed while unsubscribed
        catchUp = true;
      }
    } catch (TransportException e) {
      subscription = null;
      logger.log(Level.WARNING, "Cannot subscribe to notifications for consumer "
          + consumerId + "; relying on polling", e);
    }
  }

  private Outcome attempt(Dispatch dispatch) {
    String mailId = dispatch.mailId();
    Optional<Mail> mail = archive.find(mailId);
    if (mail.isEmpty()) {
      // mail deleted since the burst started; its rows went with it
      return Outcome.SKIPPED;
    }
    Instant attemptedAt = queue.now();
    long startNanos = System.nanoTime();
    String error = null;
    try {
      invoke(mail.get());
    } catch (DeliveryFailureException e) {
      error = e.getMessage();
      logger.log(Level.WARNING, "Delivery of mail " + mailId + " to consumer " + consumerId
          + " failed (attempt " + (dispatch.attempts() + 1) + ")", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Delivery of mail {0} to consumer {1} interrupted; left due",
          new Object[]{mailId, consumerId});
      return Outcome.SKIPPED;
    }
    metrics.recordDeliveryDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));

    if (error == null) {
      queue.recordSuccess(consumerId, mailId);
      metrics.incrementDeliverySuccess();
      long latencyMs = Duration.between(dispatch.createdAt(), queue.now()).toMillis();
      metrics.recordDispatchLatencyMs(Math.max(0L, latencyMs));
      return Outcome.DELIVERED;
    }
    Duration backoff = backoffPolicy.computeDelay(dispatch.attempts() + 1);
    queue.recordFailure(consumerId, mailId, attemptedAt, backoff, error);
    metrics.incrementDeliveryFailure();
    return Outcome.FAILED;
  }

  private void invoke(Mail mail) throws DeliveryFailureException, InterruptedException {
    Future<DeliveryResult> future = deliveryExecutor.submit(() -> delivery.deliver(mail));
    DeliveryResult result;
    try {
      result = future.get(deliveryTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new DeliveryFailureException("Delivery timed out after " + deliveryTimeoutMs + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      throw new DeliveryFailureException(describe(cause), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
    if (result == null) {
      throw new DeliveryFailureException("Delivery returned no result");
    }
    if (result instanceof DeliveryResult.Failed failed) {
      throw new DeliveryFailureException(failed.reason());
    }
  }

  private static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null ? t.getClass().getName() : t.getClass().getSimpleName() + ": " + message;
  }

  private void closeSubscription() {
    NotificationChannel.Subscription current = subscription;
    subscription = null;
    if (current != null) {
      try {
        current.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close subscription for consumer " + consumerId, e);
      }
    }
  }

  /**
   * Stops accepting wake-ups and waits up to the drain timeout for a running burst. A
   * burst still running after that is abandoned before its next delivery, and the delivery
   * in progress is interrupted without being recorded.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    running.set(false);
    signals.offer(Signal.STOP);
    if (loopExecutor != null) {
      loopExecutor.shutdown();
      try {
        if (!loopExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "Drain timeout exceeded for consumer {0}; abandoning burst", consumerId);
          abandon.set(true);
          loopExecutor.shutdownNow();
          loopExecutor.awaitTermination(5, TimeUnit.SECONDS);
        }
      } catch (InterruptedException e) {
        abandon.set(true);
        loopExecutor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    closeSubscription();
    deliveryExecutor.shutdownNow();
    logger.log(Level.INFO, "Stopped dispatch scheduler for consumer {0}", consumerId);
  }

  /** Builder for {@link DispatchScheduler}. */
  public static final class Builder {
    private int consumerId;
    private DispatchQueue queue;
    private MailArchive archive;
    private MailDelivery delivery;
    private ConsumerLock lock;
    private NotificationChannel channel;
    private BackoffPolicy backoffPolicy;
    private MetricsExporter metrics;
    private Duration pollInterval = Duration.ofSeconds(30);
    private Duration deliveryTimeout = Duration.ofSeconds(30);
    private Duration drainTimeout = Duration.ofSeconds(5);

    private Builder() {}

    /**
     * <b>Required.</b> The consumer this scheduler serves.
     */
    public Builder consumerId(int consumerId) {
      this.consumerId = consumerId;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder queue(DispatchQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * <b>Required.</b> Source of the mail handed to the delivery.
     */
    public Builder archive(MailArchive archive) {
      this.archive = archive;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder delivery(MailDelivery delivery) {
      this.delivery = delivery;
      return this;
    }

    /**
     * Optional. Defaults to a private {@link LocalConsumerLock}; schedulers that may serve
     * the same consumer must share one lock.
     */
    public Builder lock(ConsumerLock lock) {
      this.lock = lock;
      return this;
    }

    /**
     * Optional. Without a channel the scheduler polls only.
     */
    public Builder channel(NotificationChannel channel) {
      this.channel = channel;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffPolicy} from 1 second up to 1 hour.
     */
    public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
      this.backoffPolicy = backoffPolicy;
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
     * Optional. Longest time between bursts. Defaults to 30 seconds.
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
      return this;
    }

    /**
     * Optional. Bound on a single delivery attempt. Defaults to 30 seconds.
     */
    public Builder deliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = Objects.requireNonNull(deliveryTimeout, "deliveryTimeout");
      return this;
    }

    /**
     * Optional. Time {@link #close()} waits for a running burst. Defaults to 5 seconds.
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
      return this;
    }

    /**
     * @throws NullPointerException     if {@code queue}, {@code archive} or {@code delivery} is null
     * @throws IllegalArgumentException if a timeout or the poll interval is out of range
     */
    public DispatchScheduler build() {
      return new DispatchScheduler(this);
    }
  }
}
