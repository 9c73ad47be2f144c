package mailbridge.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import mailbridge.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mailbridge.enqueue}: dispatch rows created</li>
 *   <li>{@code mailbridge.notify.published}: change notifications sent</li>
 *   <li>{@code mailbridge.notify.dropped}: change notifications lost to a transport failure</li>
 *   <li>{@code mailbridge.wakeup}: scheduler wake-ups, tagged {@code source=notify|poll}</li>
 *   <li>{@code mailbridge.delivery.success}: mails delivered</li>
 *   <li>{@code mailbridge.delivery.failure}: failed attempts (rescheduled)</li>
 *   <li>{@code mailbridge.lock.contended}: bursts skipped on a held consumer lock</li>
 *   <li>{@code mailbridge.storage.failure}: bursts aborted by a database failure</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code mailbridge.delivery.duration}: time spent in one delivery attempt</li>
 *   <li>{@code mailbridge.dispatch.latency}: time from enqueue to successful delivery</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter published;
  private final Counter dropped;
  private final Counter notifiedWakeups;
  private final Counter polledWakeups;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter lockContended;
  private final Counter storageFailure;
  private final Timer deliveryDuration;
  private final Timer dispatchLatency;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "mailbridge"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "mailbridge");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "support.mailbridge"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = Counter.builder(namePrefix + ".enqueue")
        .description("Dispatch rows created")
        .register(registry);
    this.published = Counter.builder(namePrefix + ".notify.published")
        .description("Change notifications sent")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".notify.dropped")
        .description("Change notifications lost")
        .register(registry);
    this.notifiedWakeups = Counter.builder(namePrefix + ".wakeup")
        .description("Scheduler wake-ups")
        .tag("source", "notify")
        .register(registry);
    this.polledWakeups = Counter.builder(namePrefix + ".wakeup")
        .description("Scheduler wake-ups")
        .tag("source", "poll")
        .register(registry);
    this.deliverySuccess = Counter.builder(namePrefix + ".delivery.success")
        .description("Mails delivered")
        .register(registry);
    this.deliveryFailure = Counter.builder(namePrefix + ".delivery.failure")
        .description("Failed delivery attempts (will retry)")
        .register(registry);
    this.lockContended = Counter.builder(namePrefix + ".lock.contended")
        .description("Bursts skipped because the consumer lock was held")
        .register(registry);
    this.storageFailure = Counter.builder(namePrefix + ".storage.failure")
        .description("Bursts aborted by a storage failure")
        .register(registry);
    this.deliveryDuration = Timer.builder(namePrefix + ".delivery.duration")
        .description("Time spent in one delivery attempt")
        .register(registry);
    this.dispatchLatency = Timer.builder(namePrefix + ".dispatch.latency")
        .description("Time from enqueue to successful delivery")
        .register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementNotificationPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementNotificationDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementNotifiedWakeup() {
    if (closed) return;
    notifiedWakeups.increment();
  }

  @Override
  public void incrementPolledWakeup() {
    if (closed) return;
    polledWakeups.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementLockContended() {
    if (closed) return;
    lockContended.increment();
  }

  @Override
  public void incrementStorageFailure() {
    if (closed) return;
    storageFailure.increment();
  }

  @Override
  public void recordDeliveryDurationMs(long durationMs) {
    if (closed) return;
    deliveryDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void recordDispatchLatencyMs(long latencyMs) {
    if (closed) return;
    dispatchLatency.record(latencyMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link mailbridge.MailBridge#close()} so a closed bridge leaves no stale meters.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, published, dropped, notifiedWakeups, polledWakeups,
        deliverySuccess, deliveryFailure, lockContended, storageFailure,
        deliveryDuration, dispatchLatency)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
