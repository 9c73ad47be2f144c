package mailbridge.model;

import java.time.Instant;

/**
 * Read-only view of a persisted dispatch row: the obligation to deliver one mail to one
 * consumer, with its attempt history.
 *
 * <p>While {@code lastTime} is non-null, {@code nextTime} is strictly after it.
 *
 * @param consumerId the consumer to deliver to
 * @param mailId     the mail to deliver
 * @param lastTime   time of the most recent failed attempt, {@code null} before any attempt
 * @param nextTime   earliest time of the next attempt
 * @param createdAt  time the dispatch was enqueued
 * @param attempts   number of failed attempts so far
 * @param lastError  description of the most recent failure, may be {@code null}
 * @see mailbridge.queue.DispatchQueue
 */
public record Dispatch(
    int consumerId,
    String mailId,
    Instant lastTime,
    Instant nextTime,
    Instant createdAt,
    int attempts,
    String lastError
) {}
