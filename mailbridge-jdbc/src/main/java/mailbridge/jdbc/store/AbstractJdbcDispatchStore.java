package mailbridge.jdbc.store;

import mailbridge.jdbc.JdbcTemplate;
import mailbridge.model.Dispatch;
import mailbridge.spi.DispatchStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC dispatch store with standard SQL implementations over the {@code dispatch}
 * table.
 *
 * <p>Subclasses override {@link #insert} where the database has a native idempotent
 * insert. Register custom implementations via
 * {@code META-INF/services/mailbridge.jdbc.store.AbstractJdbcDispatchStore}.
 *
 * @see JdbcDispatchStores
 */
public abstract class AbstractJdbcDispatchStore implements DispatchStore {
  protected static final String TABLE = "dispatch";

  protected static final String COLUMNS =
      "consumer_id, mail_id, last_time, next_time, created_at, attempts, last_error";

  protected static final JdbcTemplate.RowMapper<Dispatch> DISPATCH_ROW_MAPPER = rs -> new Dispatch(
      rs.getInt("consumer_id"),
      rs.getString("mail_id"),
      JdbcTemplate.getInstant(rs, "last_time"),
      JdbcTemplate.getInstant(rs, "next_time"),
      JdbcTemplate.getInstant(rs, "created_at"),
      rs.getInt("attempts"),
      rs.getString("last_error"));

  /**
   * Unique identifier for this store (e.g. "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g. "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Plain insert; a duplicate key is reported as "not created". Databases that abort
   * the transaction on a failed statement must override this.
   */
  @Override
  public boolean insert(Connection conn, int consumerId, String mailId, Instant now) {
    String sql = "INSERT INTO " + TABLE + " (consumer_id, mail_id, attempts, next_time, created_at)" +
        " VALUES (?,?,0,?,?)";
    return JdbcTemplate.updateIgnoringDuplicate(conn, sql, consumerId, mailId, now, now) > 0;
  }

  @Override
  public List<Dispatch> findDue(Connection conn, int consumerId, Instant at) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE consumer_id=? AND next_time<=? ORDER BY next_time, mail_id";
    return JdbcTemplate.query(conn, sql, DISPATCH_ROW_MAPPER, consumerId, at);
  }

  @Override
  public Optional<Dispatch> find(Connection conn, int consumerId, String mailId) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE consumer_id=? AND mail_id=?";
    return JdbcTemplate.queryOne(conn, sql, DISPATCH_ROW_MAPPER, consumerId, mailId);
  }

  @Override
  public int delete(Connection conn, int consumerId, String mailId) {
    String sql = "DELETE FROM " + TABLE + " WHERE consumer_id=? AND mail_id=?";
    return JdbcTemplate.update(conn, sql, consumerId, mailId);
  }

  @Override
  public int markFailed(Connection conn, int consumerId, String mailId,
                        Instant attemptedAt, Instant nextTime, String error) {
    String sql = "UPDATE " + TABLE +
        " SET last_time=?, next_time=?, attempts=attempts+1, last_error=?" +
        " WHERE consumer_id=? AND mail_id=?";
    return JdbcTemplate.update(conn, sql, attemptedAt, nextTime, error, consumerId, mailId);
  }

  @Override
  public int deleteForConsumer(Connection conn, int consumerId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + TABLE + " WHERE consumer_id=?", consumerId);
  }

  @Override
  public Optional<Instant> nextDueTime(Connection conn, int consumerId) {
    String sql = "SELECT MIN(next_time) AS next_time FROM " + TABLE + " WHERE consumer_id=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> JdbcTemplate.getInstant(rs, "next_time"), consumerId);
  }

  @Override
  public List<Dispatch> findByConsumer(Connection conn, int consumerId, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE consumer_id=? ORDER BY next_time, mail_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, DISPATCH_ROW_MAPPER, consumerId, limit);
  }

  @Override
  public int countByConsumer(Connection conn, int consumerId) {
    String sql = "SELECT COUNT(*) AS n FROM " + TABLE + " WHERE consumer_id=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt("n"), consumerId).orElse(0);
  }
}
