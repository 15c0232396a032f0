package eventflow.jdbc.tx;

import eventflow.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} implementation that stores transaction state in a {@link ThreadLocal}.
 *
 * <p>Used with {@link JdbcTransactionManager}, which binds the connection and runs the
 * registered callbacks. The state is unbound before any callback runs, so an
 * after-commit callback sees no active transaction and may start its own. Callback
 * failures are logged; they cannot change the outcome of a transaction that already
 * ended.
 *
 * @see JdbcTransactionManager
 * @see TxContext
 */
public final class ThreadLocalTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(ThreadLocalTxContext.class.getName());

  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return requireState().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    requireState().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    requireState().afterRollback.add(callback);
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  /**
   * Unbinds the current transaction and returns the callbacks for its outcome.
   */
  List<Runnable> unbind(boolean committed) {
    TxState current = state.get();
    if (current == null) {
      return List.of();
    }
    state.remove();
    return committed ? current.afterCommit : current.afterRollback;
  }

  static void runCallbacks(List<Runnable> callbacks, boolean committed) {
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, (committed ? "After-commit" : "After-rollback") + " callback failed", e);
      }
    }
  }

  private TxState requireState() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
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
