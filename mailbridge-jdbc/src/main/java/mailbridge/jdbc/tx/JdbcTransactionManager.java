package mailbridge.jdbc.tx;

import mailbridge.StorageException;
import mailbridge.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection,
 * disables auto-commit, and binds it to a {@link ThreadLocalTxContext}.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     ingestor.ingest(mail);
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>After-commit callbacks run once the connection has committed, after the context is
 * unbound, so a callback that touches the database gets a connection of its own.
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @throws SQLException          if a connection cannot be obtained
   * @throws IllegalStateException if this thread already has a transaction
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Runs {@code work} in a new transaction, committing when it returns and rolling back
   * when it throws.
   *
   * @throws StorageException if the transaction cannot be started or committed
   */
  public <T> T inTransaction(Supplier<T> work) {
    try (Transaction tx = begin()) {
      T result = work.get();
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw new StorageException("Transaction failed", e);
    }
  }

  public void inTransaction(Runnable work) {
    inTransaction(() -> {
      work.run();
      return null;
    });
  }

  /**
   * An active transaction handle. If neither {@link #commit()} nor {@link #rollback()} is
   * called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        safeRollback(e);
        throw e;
      } finally {
        finalizeTx(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(boolean committed) throws SQLException {
      completed = true;
      try {
        try {
          connection.setAutoCommit(true);
        } finally {
          connection.close();
        }
      } finally {
        txContext.clear(committed);
      }
    }

    private void safeRollback(SQLException cause) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        cause.addSuppressed(e);
      }
    }
  }
}
