package mailbridge.scheduler;

import java.time.Duration;

/**
 * Strategy for computing the delay before the next delivery attempt of a failed dispatch.
 *
 * @see ExponentialBackoffPolicy
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attempts number of failed attempts including the one just made (1-based)
     * @return a strictly positive delay
     */
    Duration computeDelay(int attempts);
}
