package eventflow.jdbc.tx;

import eventflow.jdbc.JdbcStoreException;
import eventflow.spi.ConnectionProvider;
import eventflow.spi.TransactionRunner;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection,
 * disables auto-commit, and binds it to a {@link ThreadLocalTxContext}.
 *
 * <p>Either hand the work to {@link #inTransaction}, which joins a transaction that is
 * already active on the thread, or drive the transaction explicitly with
 * try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     repository.execute(userId, metadata, user -> user.activate());
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>The connection is returned before after-commit callbacks run, so a callback that
 * opens its own transaction never holds two connections at once.
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager implements TransactionRunner {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException          if a connection cannot be obtained
   * @throws IllegalStateException if a transaction is already active on this thread
   */
  public Transaction begin() throws SQLException {
    if (txContext.isTransactionActive()) {
      throw new IllegalStateException("Transaction already active");
    }
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

  @Override
  public <T> T inTransaction(TransactionalWork<T> work) {
    Objects.requireNonNull(work, "work");
    if (txContext.isTransactionActive()) {
      return work.execute();
    }
    Transaction tx;
    try {
      tx = begin();
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to begin transaction", e);
    }
    try (tx) {
      T result = work.execute();
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to complete transaction", e);
    }
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
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
      List<Runnable> callbacks = txContext.unbind(committed);
      completed = true;
      try {
        try {
          connection.setAutoCommit(true);
        } finally {
          connection.close();
        }
      } finally {
        ThreadLocalTxContext.runCallbacks(callbacks, committed);
      }
    }

    private void safeRollback(SQLException cause) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        cause.addSuppressed(e);
        logger.log(Level.FINE, "Rollback after failed commit also failed", e);
      }
    }
  }
}
