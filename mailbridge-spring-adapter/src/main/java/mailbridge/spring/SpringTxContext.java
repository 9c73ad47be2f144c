package mailbridge.spring;

import mailbridge.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} backed by Spring's transaction synchronization, so mail can be
 * ingested inside {@code @Transactional} methods or a {@code TransactionTemplate}.
 *
 * <p>The connection is the one Spring bound to the current transaction for the
 * configured {@link DataSource}, obtained through {@link DataSourceUtils}. Callbacks are
 * registered as {@link TransactionSynchronization}s and run after Spring completes the
 * transaction.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  /**
   * @throws IllegalStateException if no Spring transaction is active
   */
  @Override
  public Connection currentConnection() {
    requireTransaction();
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    register("afterCommit", new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        callback.run();
      }
    });
  }

  @Override
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    register("afterRollback", new TransactionSynchronization() {
      @Override
      public void afterCompletion(int status) {
        if (status == STATUS_ROLLED_BACK) {
          callback.run();
        }
      }
    });
  }

  private void register(String phase, TransactionSynchronization synchronization) {
    requireTransaction();
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register " + phase + " callback");
    }
    TransactionSynchronizationManager.registerSynchronization(synchronization);
  }

  private void requireTransaction() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active Spring transaction");
    }
  }
}
