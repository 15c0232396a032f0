package eventflow.support;

import eventflow.spi.ConnectionProvider;
import eventflow.spi.TransactionRunner;
import eventflow.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-bound transactions for the in-memory stores. Stores register undo actions that
 * run on rollback, so rolled-back work leaves no trace.
 */
public final class InMemoryTransactions implements TxContext, TransactionRunner, ConnectionProvider {

  private final ThreadLocal<Tx> current = new ThreadLocal<>();
  private final AtomicInteger commits = new AtomicInteger();
  private final AtomicInteger rollbacks = new AtomicInteger();
  private volatile RuntimeException nextCommitFailure;
  private volatile boolean nextCommitFailurePersists;

  @Override
  public boolean isTransactionActive() {
    return current.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return active().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    active().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    active().afterRollback.add(callback);
  }

  @Override
  public Connection getConnection() {
    return StubConnection.create();
  }

  /**
   * Registers an undo action with the active transaction; no-op outside one.
   */
  public void undoOnRollback(Runnable undo) {
    Tx tx = current.get();
    if (tx != null) {
      tx.undo.add(undo);
    }
  }

  /**
   * Makes the next commit throw {@code failure}.
   *
   * @param persisted whether the transaction's changes survive, as when the database
   *                  committed but the acknowledgement was lost
   */
  public void failNextCommit(RuntimeException failure, boolean persisted) {
    this.nextCommitFailurePersists = persisted;
    this.nextCommitFailure = failure;
  }

  public int commits() {
    return commits.get();
  }

  public int rollbacks() {
    return rollbacks.get();
  }

  @Override
  public <T> T inTransaction(TransactionalWork<T> work) {
    if (current.get() != null) {
      return work.execute();
    }
    Tx tx = new Tx();
    current.set(tx);
    T result;
    try {
      result = work.execute();
    } catch (RuntimeException e) {
      rollback(tx);
      throw e;
    }
    RuntimeException commitFailure = nextCommitFailure;
    if (commitFailure != null) {
      nextCommitFailure = null;
      if (nextCommitFailurePersists) {
        current.remove();
        commits.incrementAndGet();
      } else {
        rollback(tx);
      }
      throw commitFailure;
    }
    current.remove();
    commits.incrementAndGet();
    tx.afterCommit.forEach(Runnable::run);
    return result;
  }

  private void rollback(Tx tx) {
    current.remove();
    rollbacks.incrementAndGet();
    for (int i = tx.undo.size() - 1; i >= 0; i--) {
      tx.undo.get(i).run();
    }
    tx.afterRollback.forEach(Runnable::run);
  }

  private Tx active() {
    Tx tx = current.get();
    if (tx == null) {
      throw new IllegalStateException("No active transaction");
    }
    return tx;
  }

  private static final class Tx {
    private final Connection connection = StubConnection.create();
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();
    private final List<Runnable> undo = new ArrayList<>();
  }
}
