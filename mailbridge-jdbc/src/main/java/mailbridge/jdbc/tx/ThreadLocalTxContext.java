package mailbridge.jdbc.tx;

import mailbridge.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TxContext} that keeps transaction state in a {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}; not meant to be driven directly.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return require().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    require().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    require().afterRollback.add(callback);
  }

  private TxState require() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  /**
   * Unbinds the transaction and runs the callbacks for its outcome. All callbacks run;
   * the first failure is rethrown with later ones suppressed.
   */
  void clear(boolean committed) {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    state.remove();
    RuntimeException first = null;
    for (Runnable callback : committed ? current.afterCommit : current.afterRollback) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
