package eventflow.spi;

/**
 * Runs work inside a transaction bound to the {@link TxContext}.
 *
 * <p>If a transaction is already active on the calling thread the work joins it and
 * commit or rollback is left to the outer scope. Otherwise a new transaction is
 * started, committed when the work returns normally and rolled back when it throws.
 * A failed commit surfaces as an unchecked exception; the outcome of such a commit
 * is unknown to the caller.
 */
public interface TransactionRunner {

  <T> T inTransaction(TransactionalWork<T> work);

  default void inTransaction(Runnable work) {
    inTransaction(() -> {
      work.run();
      return null;
    });
  }

  /**
   * Unit of transactional work.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface TransactionalWork<T> {
    T execute();
  }
}
