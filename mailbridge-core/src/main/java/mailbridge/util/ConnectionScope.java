package mailbridge.util;

import mailbridge.StorageException;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chooses the connection a unit of store work runs on.
 *
 * <p>When the {@link TxContext} reports an active transaction, work joins it through
 * {@link TxContext#currentConnection()}. Otherwise a connection is borrowed from the
 * {@link ConnectionProvider} for the duration of the work and closed afterwards.
 * Failing to obtain, configure or commit a borrowed connection raises
 * {@link StorageException}.
 */
public final class ConnectionScope {
  private static final Logger logger = Logger.getLogger(ConnectionScope.class.getName());

  private final ConnectionProvider connectionProvider;
  private final TxContext txContext;

  /**
   * @param connectionProvider source of connections when no transaction is active
   * @param txContext          caller transaction context; {@code null} never joins
   */
  public ConnectionScope(ConnectionProvider connectionProvider, TxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = txContext;
  }

  /**
   * Returns {@code true} if work would join a caller transaction.
   */
  public boolean inCallerTransaction() {
    return txContext != null && txContext.isTransactionActive();
  }

  /**
   * Runs {@code callback} after the caller transaction commits, or immediately when
   * there is none.
   */
  public void afterCommit(Runnable callback) {
    if (inCallerTransaction()) {
      txContext.afterCommit(callback);
    } else {
      callback.run();
    }
  }

  /**
   * Runs a single statement's worth of work: on the caller transaction if one is active,
   * otherwise on an auto-committed connection.
   */
  public <T> T call(Work<T> work) {
    if (inCallerTransaction()) {
      return work.apply(txContext.currentConnection());
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.apply(conn);
    } catch (SQLException e) {
      throw new StorageException("Failed to use connection", e);
    }
  }

  /**
   * Runs multi-statement work atomically: on the caller transaction if one is active,
   * otherwise in a transaction of its own.
   */
  public <T> T inTransaction(Work<T> work) {
    if (inCallerTransaction()) {
      return work.apply(txContext.currentConnection());
    }
    return inNewTransaction(work);
  }

  /**
   * Runs work in a transaction of its own on a borrowed connection, regardless of any
   * caller transaction.
   */
  public <T> T inNewTransaction(Work<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      T result;
      try {
        result = work.apply(conn);
        conn.commit();
      } catch (RuntimeException | SQLException e) {
        rollbackQuietly(conn, e);
        throw e;
      }
      return result;
    } catch (SQLException e) {
      throw new StorageException("Transaction failed", e);
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  /**
   * Store work bound to a connection.
   */
  @FunctionalInterface
  public interface Work<T> {
    T apply(Connection conn);
  }
}
