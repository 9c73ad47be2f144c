package mailbridge.jdbc.store;

import mailbridge.jdbc.JdbcTemplate;
import mailbridge.model.Consumer;
import mailbridge.spi.ConsumerStore;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC consumer store over the {@code consumer} table; ids come from its identity column.
 */
public final class JdbcConsumerStore implements ConsumerStore {

  private static final JdbcTemplate.RowMapper<Consumer> CONSUMER_ROW_MAPPER =
      rs -> new Consumer(rs.getInt("id"), rs.getString("name"));

  @Override
  public Consumer insert(Connection conn, String name) {
    int id = JdbcTemplate.insertReturningKey(conn, "INSERT INTO consumer (name) VALUES (?)", "id", name);
    return new Consumer(id, name);
  }

  @Override
  public Optional<Consumer> find(Connection conn, int consumerId) {
    return JdbcTemplate.queryOne(conn, "SELECT id, name FROM consumer WHERE id=?",
        CONSUMER_ROW_MAPPER, consumerId);
  }

  @Override
  public List<Consumer> findAll(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT id, name FROM consumer ORDER BY id", CONSUMER_ROW_MAPPER);
  }

  @Override
  public boolean delete(Connection conn, int consumerId) {
    return JdbcTemplate.update(conn, "DELETE FROM consumer WHERE id=?", consumerId) > 0;
  }
}
