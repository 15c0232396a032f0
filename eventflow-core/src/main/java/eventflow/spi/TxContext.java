package eventflow.spi;

import java.sql.Connection;

/**
 * Abstracts the transaction lifecycle so event store appends, outbox staging and saga
 * state updates share the caller's transaction without depending on a specific
 * transaction manager.
 *
 * <p>Implementations: {@code eventflow.jdbc.tx.ThreadLocalTxContext} (manual JDBC),
 * {@code eventflow.spring.SpringTxContext} (Spring-managed).
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Registers a callback to run after the current transaction commits.
   *
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);

  /**
   * Registers a callback to run after the current transaction rolls back.
   *
   * @throws IllegalStateException if no transaction is active
   */
  void afterRollback(Runnable callback);
}
