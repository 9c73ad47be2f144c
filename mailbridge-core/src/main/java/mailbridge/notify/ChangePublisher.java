package mailbridge.notify;

import mailbridge.TransportException;
import mailbridge.queue.EnqueueHook;
import mailbridge.spi.MetricsExporter;
import mailbridge.spi.NotificationChannel;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges {@link mailbridge.queue.DispatchQueue} to a {@link NotificationChannel} by
 * implementing {@link EnqueueHook}: every committed dispatch row is announced on its
 * consumer's channel.
 *
 * <p>Notifications are best-effort. A transport failure is logged and counted; the
 * consumer's scheduler picks the row up on its next poll.
 */
public final class ChangePublisher implements EnqueueHook {
    private static final Logger logger = Logger.getLogger(ChangePublisher.class.getName());

    private final NotificationChannel channel;
    private final MetricsExporter metrics;

    public ChangePublisher(NotificationChannel channel) {
        this(channel, null);
    }

    public ChangePublisher(NotificationChannel channel, MetricsExporter metrics) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    @Override
    public void afterCommit(int consumerId, String mailId) {
        try {
            channel.publish(consumerId, mailId);
            metrics.incrementNotificationPublished();
        } catch (TransportException ex) {
            metrics.incrementNotificationDropped();
            logger.log(Level.WARNING, "Notification channel unavailable, falling back to polling for consumer "
                    + consumerId + ", mail " + mailId, ex);
        } catch (RuntimeException ex) {
            metrics.incrementNotificationDropped();
            logger.log(Level.WARNING, "Failed to publish notification for consumer "
                    + consumerId + ", mail " + mailId, ex);
        }
    }
}
