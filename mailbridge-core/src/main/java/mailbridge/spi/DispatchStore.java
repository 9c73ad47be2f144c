package mailbridge.spi;

import mailbridge.model.Dispatch;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for dispatch rows, keyed by {@code (consumerId, mailId)}.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code mailbridge-jdbc} module.
 * SQL failures surface as {@link mailbridge.StorageException} or one of its more
 * specific siblings.
 */
public interface DispatchStore {

    /**
     * Inserts a fresh row with {@code next_time = created_at = now} and zero attempts.
     *
     * @return {@code true} if a row was created, {@code false} if the pair already existed
     * @throws mailbridge.ReferenceException if the consumer or the mail does not exist
     */
    boolean insert(Connection conn, int consumerId, String mailId, Instant now);

    /**
     * Returns the rows of a consumer with {@code next_time <= at}, ordered by
     * {@code next_time} then mail id.
     */
    List<Dispatch> findDue(Connection conn, int consumerId, Instant at);

    Optional<Dispatch> find(Connection conn, int consumerId, String mailId);

    /**
     * @return the number of rows deleted (0 or 1)
     */
    int delete(Connection conn, int consumerId, String mailId);

    /**
     * Records a failed attempt: sets {@code last_time}, {@code next_time} and
     * {@code last_error}, and increments {@code attempts}.
     *
     * @return the number of rows updated (0 or 1)
     * @throws mailbridge.InvariantViolationException if the storage rejects the row
     */
    int markFailed(Connection conn, int consumerId, String mailId,
                   Instant attemptedAt, Instant nextTime, String error);

    /**
     * @return the number of rows deleted
     */
    int deleteForConsumer(Connection conn, int consumerId);

    /**
     * Returns the earliest {@code next_time} of a consumer, if it has any row.
     */
    Optional<Instant> nextDueTime(Connection conn, int consumerId);

    /**
     * Lists up to {@code limit} rows of a consumer ordered by {@code next_time}.
     */
    List<Dispatch> findByConsumer(Connection conn, int consumerId, int limit);

    int countByConsumer(Connection conn, int consumerId);
}
