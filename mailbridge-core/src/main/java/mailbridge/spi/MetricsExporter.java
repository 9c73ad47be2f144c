package mailbridge.spi;

/**
 * Observability hook for exporting dispatch counters and timers to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of dispatch rows created.
     */
    void incrementEnqueued();

    void incrementNotificationPublished();

    /**
     * Increments the count of notifications lost to a transport failure.
     */
    void incrementNotificationDropped();

    /**
     * Increments the count of scheduler wake-ups caused by a notification.
     */
    void incrementNotifiedWakeup();

    /**
     * Increments the count of scheduler wake-ups caused by the poll timer.
     */
    void incrementPolledWakeup();

    void incrementDeliverySuccess();

    void incrementDeliveryFailure();

    /**
     * Increments the count of bursts skipped because another worker held the consumer lock.
     */
    void incrementLockContended();

    void incrementStorageFailure();

    /**
     * Records the time spent in the delivery capability for one attempt.
     *
     * @param durationMs always non-negative
     */
    default void recordDeliveryDurationMs(long durationMs) {
    }

    /**
     * Records end-to-end latency: from row creation to successful delivery.
     *
     * @param latencyMs always non-negative
     */
    default void recordDispatchLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementNotificationPublished() {
        }

        @Override
        public void incrementNotificationDropped() {
        }

        @Override
        public void incrementNotifiedWakeup() {
        }

        @Override
        public void incrementPolledWakeup() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void incrementLockContended() {
        }

        @Override
        public void incrementStorageFailure() {
        }
    }
}
