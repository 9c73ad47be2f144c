package mailbridge.jdbc.store;

import mailbridge.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL dispatch store.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING} for the idempotent insert, since a failed
 * statement would abort the caller's transaction.
 */
public final class PostgresDispatchStore extends AbstractJdbcDispatchStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean insert(Connection conn, int consumerId, String mailId, Instant now) {
    String sql = "INSERT INTO " + TABLE + " (consumer_id, mail_id, attempts, next_time, created_at)" +
        " VALUES (?,?,0,?,?) ON CONFLICT (consumer_id, mail_id) DO NOTHING";
    return JdbcTemplate.update(conn, sql, consumerId, mailId, now, now) > 0;
  }
}
