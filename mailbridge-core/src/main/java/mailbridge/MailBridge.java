package mailbridge;

import mailbridge.archive.MailArchive;
import mailbridge.ingest.InterestPolicy;
import mailbridge.ingest.MailIngestor;
import mailbridge.lock.LocalConsumerLock;
import mailbridge.model.Consumer;
import mailbridge.notify.ChangePublisher;
import mailbridge.notify.InMemoryNotificationChannel;
import mailbridge.queue.DispatchQueue;
import mailbridge.queue.EnqueueHook;
import mailbridge.registry.ConsumerLifecycleListener;
import mailbridge.registry.ConsumerRegistry;
import mailbridge.scheduler.BackoffPolicy;
import mailbridge.scheduler.DispatchScheduler;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.ConsumerLock;
import mailbridge.spi.ConsumerStore;
import mailbridge.spi.DispatchStore;
import mailbridge.spi.MailStore;
import mailbridge.spi.MetricsExporter;
import mailbridge.spi.NotificationChannel;
import mailbridge.spi.TxContext;
import mailbridge.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the archive, the dispatch queue, the consumer
 * registry, the ingestor and one {@link DispatchScheduler} per consumer into a single
 * {@link AutoCloseable} unit.
 *
 * <p>With a {@link DeliveryResolver}, {@link #start()} starts a scheduler for every
 * consumer the resolver serves and keeps the set in step with the registry: creating a
 * consumer starts its scheduler, deleting it stops the scheduler, and a periodic
 * reconciliation catches changes made by other processes. Without a resolver the
 * bridge only ingests, leaving delivery to other processes.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (MailBridge bridge = MailBridge.builder()
 *     .connectionProvider(connProvider)
 *     .txContext(txContext)
 *     .dispatchStore(dispatchStore)
 *     .mailStore(mailStore)
 *     .consumerStore(consumerStore)
 *     .deliveryResolver(consumer -> mail -> push(consumer, mail))
 *     .build()) {
 *   bridge.start();
 *   txManager.inTransaction(() -> bridge.ingestor().ingest(mail));
 * }
 * }</pre>
 *
 * @see MailIngestor
 * @see DispatchScheduler
 */
public final class MailBridge implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MailBridge.class.getName());
  private static final Duration DEFAULT_RECONCILE_INTERVAL = Duration.ofSeconds(30);

  private final DispatchQueue queue;
  private final MailArchive archive;
  private final ConsumerRegistry registry;
  private final MailIngestor ingestor;
  private final DeliveryResolver deliveryResolver;
  private final ConsumerLock lock;
  private final NotificationChannel channel;
  private final BackoffPolicy backoffPolicy;
  private final MetricsExporter metrics;
  private final Duration pollInterval;
  private final Duration deliveryTimeout;
  private final Duration drainTimeout;

  private final long reconcileIntervalMs;

  private final Map<Integer, DispatchScheduler> schedulers = new ConcurrentHashMap<>();
  private final Set<Integer> declined = ConcurrentHashMap.newKeySet();
  private final Object monitor = new Object();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private ScheduledExecutorService reconciler;
  private volatile boolean closed;

  private MailBridge(Builder builder) {
    ConnectionProvider connectionProvider =
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    TxContext txContext = Objects.requireNonNull(builder.txContext, "txContext");
    DispatchStore dispatchStore = Objects.requireNonNull(builder.dispatchStore, "dispatchStore");
    MailStore mailStore = Objects.requireNonNull(builder.mailStore, "mailStore");
    ConsumerStore consumerStore = Objects.requireNonNull(builder.consumerStore, "consumerStore");

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.lock = builder.lock != null ? builder.lock : new LocalConsumerLock();
    this.channel = builder.notificationsEnabled
        ? (builder.channel != null ? builder.channel : new InMemoryNotificationChannel())
        : null;
    this.deliveryResolver = builder.deliveryResolver;
    this.backoffPolicy = builder.backoffPolicy;
    this.pollInterval = builder.pollInterval;
    this.deliveryTimeout = builder.deliveryTimeout;
    this.drainTimeout = builder.drainTimeout;
    Duration reconcileInterval = builder.reconcileInterval != null ? builder.reconcileInterval
        : (builder.pollInterval != null ? builder.pollInterval : DEFAULT_RECONCILE_INTERVAL);
    if (reconcileInterval.toMillis() <= 0) {
      throw new IllegalArgumentException("reconcileInterval must be >= 1ms");
    }
    this.reconcileIntervalMs = reconcileInterval.toMillis();

    EnqueueHook hook = channel != null ? new ChangePublisher(channel, metrics) : EnqueueHook.NOOP;
    this.queue = DispatchQueue.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .store(dispatchStore)
        .hook(hook)
        .metrics(metrics)
        .clock(builder.clock)
        .build();
    this.archive = new MailArchive(connectionProvider, txContext, mailStore);
    this.registry = new ConsumerRegistry(connectionProvider, txContext, consumerStore,
        dispatchStore, lock, builder.lockWaitTimeout);
    this.ingestor = new MailIngestor(txContext, mailStore, consumerStore, queue, builder.interestPolicy);
  }

  public static Builder builder() {
    return new Builder();
  }

  public DispatchQueue queue() {
    return queue;
  }

  public MailArchive archive() {
    return archive;
  }

  public ConsumerRegistry registry() {
    return registry;
  }

  public MailIngestor ingestor() {
    return ingestor;
  }

  /**
   * Returns the scheduler running for a consumer in this process, if any.
   */
  public Optional<DispatchScheduler> scheduler(int consumerId) {
    return Optional.ofNullable(schedulers.get(consumerId));
  }

  /**
   * Starts schedulers for all existing consumers and follows registry changes. Does
   * nothing without a {@link DeliveryResolver}. Subsequent calls are no-ops.
   *
   * <p>Besides the local registry events, the consumer table is re-read every reconcile
   * interval so consumers created or deleted by other processes gain or lose their
   * scheduler here too.
   *
   * @throws IllegalStateException if the bridge has been closed
   */
  public void start() {
    if (closed) {
      throw new IllegalStateException("MailBridge has been closed");
    }
    if (deliveryResolver == null) {
      logger.info("No DeliveryResolver configured; running ingest-only");
      return;
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    registry.addListener(new ConsumerLifecycleListener() {
      @Override
      public void onCreated(Consumer consumer) {
        startScheduler(consumer);
      }

      @Override
      public void onDeleted(int consumerId) {
        stopScheduler(consumerId);
      }
    });
    for (Consumer consumer : registry.list()) {
      startScheduler(consumer);
    }
    synchronized (monitor) {
      if (closed) {
        return;
      }
      reconciler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mailbridge-reconcile-"));
      reconciler.scheduleWithFixedDelay(this::reconcile, reconcileIntervalMs, reconcileIntervalMs,
          TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Brings the running schedulers in line with the consumer table: starts schedulers for
   * consumers this process does not serve yet and stops those whose consumer is gone.
   * Called periodically once started; may also be invoked directly.
   */
  public void reconcile() {
    if (closed || !started.get()) {
      return;
    }
    try {
      Set<Integer> present = new HashSet<>();
      for (Consumer consumer : registry.list()) {
        present.add(consumer.id());
        if (!schedulers.containsKey(consumer.id()) && !declined.contains(consumer.id())) {
          startScheduler(consumer);
        }
      }
      for (Integer consumerId : new ArrayList<>(schedulers.keySet())) {
        // a consumer created after the listing above is found by the second look
        if (!present.contains(consumerId) && registry.find(consumerId).isEmpty()) {
          logger.log(Level.INFO, "Consumer {0} no longer exists; stopping its scheduler", consumerId);
          stopScheduler(consumerId);
        }
      }
      declined.retainAll(present);
    } catch (StorageException e) {
      logger.log(Level.WARNING, "Consumer reconciliation failed; retrying on next run", e);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Consumer reconciliation error", e);
    }
  }

  private void startScheduler(Consumer consumer) {
    if (closed || schedulers.containsKey(consumer.id())) {
      return;
    }
    MailDelivery delivery = deliveryResolver.resolve(consumer);
    if (delivery == null) {
      declined.add(consumer.id());
      logger.log(Level.INFO, "No delivery for consumer {0}; not scheduling", consumer.id());
      return;
    }
    DispatchScheduler.Builder builder = DispatchScheduler.builder()
        .consumerId(consumer.id())
        .queue(queue)
        .archive(archive)
        .delivery(delivery)
        .lock(lock)
        .channel(channel)
        .backoffPolicy(backoffPolicy)
        .metrics(metrics);
    if (pollInterval != null) builder.pollInterval(pollInterval);
    if (deliveryTimeout != null) builder.deliveryTimeout(deliveryTimeout);
    if (drainTimeout != null) builder.drainTimeout(drainTimeout);
    DispatchScheduler scheduler = builder.build();
    synchronized (monitor) {
      if (!closed && schedulers.putIfAbsent(consumer.id(), scheduler) == null) {
        scheduler.start();
        return;
      }
    }
    scheduler.close();
  }

  private void stopScheduler(int consumerId) {
    declined.remove(consumerId);
    DispatchScheduler scheduler;
    synchronized (monitor) {
      scheduler = schedulers.remove(consumerId);
    }
    if (scheduler != null) {
      scheduler.close();
    }
  }

  /**
   * Shuts down in order: reconciliation, schedulers, notification channel, consumer lock,
   * metrics.
   */
  @Override
  public void close() {
    List<DispatchScheduler> running;
    ScheduledExecutorService reconcileExecutor;
    synchronized (monitor) {
      if (closed) {
        return;
      }
      closed = true;
      running = new ArrayList<>(schedulers.values());
      schedulers.clear();
      reconcileExecutor = reconciler;
    }
    if (reconcileExecutor != null) {
      reconcileExecutor.shutdownNow();
    }
    RuntimeException first = null;
    for (DispatchScheduler scheduler : running) {
      try {
        scheduler.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    List<AutoCloseable> resources = new ArrayList<>();
    if (channel != null) resources.add(channel);
    resources.add(lock);
    if (metrics instanceof AutoCloseable closeable) resources.add(closeable);
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link MailBridge}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TxContext txContext;
    private DispatchStore dispatchStore;
    private MailStore mailStore;
    private ConsumerStore consumerStore;
    private DeliveryResolver deliveryResolver;
    private InterestPolicy interestPolicy;
    private NotificationChannel channel;
    private boolean notificationsEnabled = true;
    private ConsumerLock lock;
    private BackoffPolicy backoffPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration pollInterval;
    private Duration deliveryTimeout;
    private Duration drainTimeout;
    private Duration reconcileInterval;
    private Duration lockWaitTimeout = Duration.ofSeconds(30);

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b> Transaction context ingestion runs in.
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder dispatchStore(DispatchStore dispatchStore) {
      this.dispatchStore = dispatchStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder mailStore(MailStore mailStore) {
      this.mailStore = mailStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder consumerStore(ConsumerStore consumerStore) {
      this.consumerStore = consumerStore;
      return this;
    }

    /**
     * Optional. Without a resolver no schedulers run in this process.
     */
    public Builder deliveryResolver(DeliveryResolver deliveryResolver) {
      this.deliveryResolver = deliveryResolver;
      return this;
    }

    /**
     * Optional. Defaults to {@link InterestPolicy#ALL}.
     */
    public Builder interestPolicy(InterestPolicy interestPolicy) {
      this.interestPolicy = interestPolicy;
      return this;
    }

    /**
     * Optional. Defaults to an {@link InMemoryNotificationChannel}.
     */
    public Builder notificationChannel(NotificationChannel channel) {
      this.channel = channel;
      return this;
    }

    /**
     * Disables change notification; schedulers then poll only.
     */
    public Builder disableNotifications() {
      this.notificationsEnabled = false;
      return this;
    }

    /**
     * Optional. Defaults to a {@link LocalConsumerLock}; use a shared lock when several
     * processes serve the same consumers.
     */
    public Builder consumerLock(ConsumerLock lock) {
      this.lock = lock;
      return this;
    }

    /**
     * Optional. See {@link DispatchScheduler.Builder#backoffPolicy}.
     */
    public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
      this.backoffPolicy = backoffPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the bridge when it
     * is {@link AutoCloseable}.
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

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public Builder deliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = deliveryTimeout;
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Optional. How often the consumer table is re-read to pick up consumers created or
     * deleted by other processes. Defaults to the poll interval, or 30 seconds.
     */
    public Builder reconcileInterval(Duration reconcileInterval) {
      this.reconcileInterval = Objects.requireNonNull(reconcileInterval, "reconcileInterval");
      return this;
    }

    /**
     * Optional. How long consumer deletion waits for a running burst. Defaults to 30 seconds.
     */
    public Builder lockWaitTimeout(Duration lockWaitTimeout) {
      this.lockWaitTimeout = Objects.requireNonNull(lockWaitTimeout, "lockWaitTimeout");
      return this;
    }

    /**
     * @throws NullPointerException if a required component is null
     */
    public MailBridge build() {
      return new MailBridge(this);
    }
  }
}
