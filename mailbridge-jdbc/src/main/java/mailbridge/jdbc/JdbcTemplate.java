package mailbridge.jdbc;

import mailbridge.InvariantViolationException;
import mailbridge.ReferenceException;
import mailbridge.StorageException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper shared by the stores.
 *
 * <p>{@link Instant} parameters are bound as UTC {@link OffsetDateTime} values for
 * {@code TIMESTAMP WITH TIME ZONE} columns. Every {@link SQLException} leaves this class
 * translated by SQLState: integrity violations on references become
 * {@link ReferenceException}, unique and check violations become
 * {@link InvariantViolationException}, anything else {@link StorageException}.
 */
public final class JdbcTemplate {

  static final String UNIQUE_VIOLATION = "23505";

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw translate("Failed to execute update", e);
    }
  }

  /**
   * Execute INSERT, returning 0 instead of failing when the row's key already exists.
   * Only safe where a failed statement does not abort the enclosing transaction.
   */
  public static int updateIgnoringDuplicate(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
        return 0;
      }
      throw translate("Failed to execute insert", e);
    }
  }

  /** Execute INSERT with a generated integer key, return the key. */
  public static int insertReturningKey(Connection conn, String sql, String keyColumn, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      bindParams(ps, params);
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new StorageException("No generated key returned", null);
        }
        return keys.getInt(keyColumn);
      }
    } catch (SQLException e) {
      throw translate("Failed to execute insert", e);
    }
  }

  /** Execute the same statement for every parameter row. */
  public static void batch(Connection conn, String sql, List<Object[]> rows) {
    if (rows.isEmpty()) {
      return;
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] row : rows) {
        bindParams(ps, row);
        ps.addBatch();
      }
      ps.executeBatch();
    } catch (SQLException e) {
      throw translate("Failed to execute batch", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw translate("Failed to execute query", e);
    }
  }

  /** Execute SELECT expected to return at most one row. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  /** Reads a nullable {@code TIMESTAMP WITH TIME ZONE} column. */
  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
    return value == null ? null : value.toInstant();
  }

  /**
   * Maps a SQL failure to the unchecked exception taxonomy.
   */
  public static RuntimeException translate(String action, SQLException e) {
    String state = sqlState(e);
    if (state == null) {
      return new StorageException(action, e);
    }
    switch (state) {
      case "23503":
      case "23506":
        return new ReferenceException(action + ": referenced row does not exist", e);
      case UNIQUE_VIOLATION:
        return new InvariantViolationException(action + ": duplicate key", e);
      case "23513":
      case "23514":
        return new InvariantViolationException(action + ": check constraint violated", e);
      default:
        return new StorageException(action, e);
    }
  }

  private static String sqlState(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current.getSQLState() != null) {
        return current.getSQLState();
      }
    }
    return null;
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setObject(i + 1, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
      } else if (param instanceof byte[] bytes) {
        ps.setBytes(i + 1, bytes);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
