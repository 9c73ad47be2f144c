package mailbridge.scheduler;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff policy doubling the delay on every failed attempt.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}. With a
 * non-zero jitter {@code j} the capped delay is scaled by a random factor in
 * {@code [1-j, 1+j)} and capped again. Without jitter successive delays never decrease.
 * Every delay is at least one millisecond.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay) {
    this(baseDelay, maxDelay, 0.0);
  }

  /**
   * @param baseDelay delay after the first failure
   * @param maxDelay  cap on every delay; not less than {@code baseDelay}
   * @param jitter    relative jitter in {@code [0, 1)}; {@code 0} disables it
   */
  public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay, double jitter) {
    long baseMs = baseDelay.toMillis();
    long maxMs = maxDelay.toMillis();
    if (baseMs <= 0) {
      throw new IllegalArgumentException("baseDelay must be >= 1ms, got: " + baseDelay);
    }
    if (maxMs < baseMs) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseMs;
    this.maxDelayMs = maxMs;
    this.jitter = jitter;
  }

  @Override
  public Duration computeDelay(int attempts) {
    int attempt = Math.max(1, attempts);
    long expDelay;
    if (attempt >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempt - 1);
      // overflow guard
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (jitter > 0.0) {
      double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
      capped = Math.min(maxDelayMs, (long) (capped * factor));
    }
    return Duration.ofMillis(Math.max(1L, capped));
  }
}
