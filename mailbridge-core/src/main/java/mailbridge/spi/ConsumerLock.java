package mailbridge.spi;

import java.time.Duration;

/**
 * Per-consumer mutual exclusion held for the duration of a processing burst or a
 * consumer deletion.
 *
 * <p>Locks are owned by the component instance that acquired them, not by a thread;
 * {@link #release(int)} on a lock that is not held is a no-op.
 *
 * @see mailbridge.lock.LocalConsumerLock
 */
public interface ConsumerLock extends AutoCloseable {

    /**
     * Attempts to acquire the lock without waiting.
     *
     * @return {@code true} if acquired
     */
    boolean tryAcquire(int consumerId);

    /**
     * Attempts to acquire the lock, waiting up to {@code timeout}.
     *
     * @return {@code true} if acquired within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    boolean tryAcquire(int consumerId, Duration timeout) throws InterruptedException;

    void release(int consumerId);

    /**
     * Releases every lock held by this instance.
     */
    @Override
    default void close() {
    }
}
