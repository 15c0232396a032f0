package eventflow.spring;

import eventflow.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link TxContext} implementation that bridges to Spring's transaction infrastructure
 * via {@link TransactionSynchronizationManager}.
 *
 * <p>Connections are obtained through {@link DataSourceUtils} to participate in
 * Spring-managed transactions. After-commit and after-rollback callbacks are
 * registered as {@link TransactionSynchronization} instances.
 *
 * <p>Spring still reports the finished transaction as active while its synchronizations
 * run. This context reports no active transaction inside its own callbacks, so work they
 * start (a saga reacting to committed events, for example) opens a fresh transaction
 * through {@link SpringTransactionRunner}.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
  private static final ThreadLocal<Boolean> COMPLETING = ThreadLocal.withInitial(() -> Boolean.FALSE);

  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public boolean isTransactionActive() {
    return !isCompleting() && TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronizationActive("afterCommit");
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        runCompleting(callback);
      }
    });
  }

  @Override
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronizationActive("afterRollback");
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCompletion(int status) {
        if (status == STATUS_ROLLED_BACK) {
          runCompleting(callback);
        }
      }
    });
  }

  /**
   * Whether the calling thread is running a completion callback of an already finished
   * transaction.
   */
  static boolean isCompleting() {
    return COMPLETING.get();
  }

  private static void runCompleting(Runnable callback) {
    withCompleting(Boolean.TRUE, () -> {
      callback.run();
      return null;
    });
  }

  /**
   * Runs work that owns a new transaction, started from inside a completion callback.
   */
  static <T> T runOutsideCompletion(Supplier<T> work) {
    return withCompleting(Boolean.FALSE, work);
  }

  private static <T> T withCompleting(Boolean completing, Supplier<T> work) {
    Boolean outer = COMPLETING.get();
    COMPLETING.set(completing);
    try {
      return work.get();
    } finally {
      COMPLETING.set(outer);
    }
  }

  private void requireSynchronizationActive(String operation) {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register " + operation + " callback");
    }
  }
}
