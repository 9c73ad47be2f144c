package mailbridge.jdbc.lock;

import mailbridge.StorageException;
import mailbridge.jdbc.JdbcTemplate;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.ConsumerLock;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConsumerLock} over PostgreSQL session advisory locks,
 * {@code pg_try_advisory_lock(namespace, consumer_id)}, so schedulers in different
 * processes exclude each other.
 *
 * <p>A held lock pins the connection it was taken on until release. Locks are unlocked
 * explicitly before the connection goes back to its pool, since a pooled session keeps
 * its advisory locks. Locks are not re-entrant: a second acquire through the same
 * instance fails while the first is held.
 *
 * <p>This class is thread-safe.
 */
public final class PostgresAdvisoryConsumerLock implements ConsumerLock {
  private static final Logger logger = Logger.getLogger(PostgresAdvisoryConsumerLock.class.getName());

  /** Default first key of the two-key advisory lock, keeping our locks apart from others. */
  public static final int DEFAULT_NAMESPACE = 0x6D62;

  private static final long RETRY_INTERVAL_MS = 100;

  private final ConnectionProvider connectionProvider;
  private final int namespace;
  private final Map<Integer, Connection> held = new ConcurrentHashMap<>();

  public PostgresAdvisoryConsumerLock(ConnectionProvider connectionProvider) {
    this(connectionProvider, DEFAULT_NAMESPACE);
  }

  public PostgresAdvisoryConsumerLock(ConnectionProvider connectionProvider, int namespace) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.namespace = namespace;
  }

  @Override
  public synchronized boolean tryAcquire(int consumerId) {
    if (held.containsKey(consumerId)) {
      return false;
    }
    Connection conn = null;
    try {
      conn = connectionProvider.getConnection();
      conn.setAutoCommit(true);
      boolean locked = JdbcTemplate.queryOne(conn, "SELECT pg_try_advisory_lock(?, ?) AS locked",
          rs -> rs.getBoolean("locked"), namespace, consumerId).orElse(false);
      if (locked) {
        held.put(consumerId, conn);
        return true;
      }
      conn.close();
      return false;
    } catch (SQLException | RuntimeException e) {
      closeQuietly(conn);
      if (e instanceof RuntimeException re) {
        throw re;
      }
      throw new StorageException("Failed to acquire advisory lock for consumer " + consumerId, e);
    }
  }

  @Override
  public boolean tryAcquire(int consumerId, Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!tryAcquire(consumerId)) {
      long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
      if (remainingMs <= 0) {
        return false;
      }
      Thread.sleep(Math.min(remainingMs, RETRY_INTERVAL_MS));
    }
    return true;
  }

  @Override
  public synchronized void release(int consumerId) {
    Connection conn = held.remove(consumerId);
    if (conn == null) {
      return;
    }
    try {
      JdbcTemplate.queryOne(conn, "SELECT pg_advisory_unlock(?, ?) AS unlocked",
          rs -> rs.getBoolean("unlocked"), namespace, consumerId);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to unlock consumer " + consumerId
          + "; the lock ends with its session", e);
    } finally {
      closeQuietly(conn);
    }
  }

  @Override
  public synchronized void close() {
    for (Integer consumerId : Map.copyOf(held).keySet()) {
      release(consumerId);
    }
  }

  private static void closeQuietly(Connection conn) {
    if (conn == null) {
      return;
    }
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close lock connection", e);
    }
  }
}
