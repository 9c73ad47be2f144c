package mailbridge.lock;

import mailbridge.spi.ConsumerLock;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * {@link ConcurrentHashMap}-based {@link ConsumerLock} for schedulers sharing one process.
 *
 * <p>A lock is held until released; it never expires. Delivery timeouts bound how long a
 * burst keeps it.
 *
 * <p>This class is thread-safe.
 */
public final class LocalConsumerLock implements ConsumerLock {
  private final Set<Integer> held = ConcurrentHashMap.newKeySet();
  private final Object monitor = new Object();

  @Override
  public boolean tryAcquire(int consumerId) {
    return held.add(consumerId);
  }

  @Override
  public boolean tryAcquire(int consumerId, Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (monitor) {
      while (!tryAcquire(consumerId)) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
      }
      return true;
    }
  }

  @Override
  public void release(int consumerId) {
    if (held.remove(consumerId)) {
      synchronized (monitor) {
        monitor.notifyAll();
      }
    }
  }

  /**
   * Returns {@code true} if the lock of a consumer is currently held.
   */
  public boolean isHeld(int consumerId) {
    return held.contains(consumerId);
  }

  @Override
  public void close() {
    held.clear();
    synchronized (monitor) {
      monitor.notifyAll();
    }
  }
}
