package mailbridge.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the mail bridge.
 *
 * @see MailBridgeAutoConfiguration
 */
@ConfigurationProperties(prefix = "mailbridge")
public class MailBridgeProperties {

    /**
     * Whether this instance delivers mail or only ingests it.
     */
    private Mode mode = Mode.FULL;

    private final Scheduler scheduler = new Scheduler();
    private final Backoff backoff = new Backoff();
    private final Lock lock = new Lock();
    private final Notification notification = new Notification();
    private final Metrics metrics = new Metrics();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public Lock getLock() {
        return lock;
    }

    public Notification getNotification() {
        return notification;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Mode {
        /** Ingests and runs a scheduler per consumer. */
        FULL,
        /** Ingests only; delivery happens in other instances. */
        INGEST_ONLY
    }

    public enum LockType {
        /** PostgreSQL advisory locks on PostgreSQL, in-process locks otherwise. */
        AUTO,
        LOCAL,
        ADVISORY
    }

    public enum NotificationType {
        /** PostgreSQL LISTEN/NOTIFY on PostgreSQL, in-process otherwise. */
        AUTO,
        IN_MEMORY,
        POSTGRES,
        /** Polling only. */
        NONE
    }

    public static class Scheduler {
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration deliveryTimeout = Duration.ofSeconds(30);
        private Duration drainTimeout = Duration.ofSeconds(5);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getDeliveryTimeout() {
            return deliveryTimeout;
        }

        public void setDeliveryTimeout(Duration deliveryTimeout) {
            this.deliveryTimeout = deliveryTimeout;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Backoff {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofHours(1);
        private double jitter = 0.0;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class Lock {
        private LockType type = LockType.AUTO;
        private Duration waitTimeout = Duration.ofSeconds(30);

        public LockType getType() {
            return type;
        }

        public void setType(LockType type) {
            this.type = type;
        }

        public Duration getWaitTimeout() {
            return waitTimeout;
        }

        public void setWaitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
        }
    }

    public static class Notification {
        private NotificationType type = NotificationType.AUTO;
        private Duration pollTimeout = Duration.ofMillis(500);

        public NotificationType getType() {
            return type;
        }

        public void setType(NotificationType type) {
            this.type = type;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "mailbridge";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
