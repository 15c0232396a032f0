package eventflow.saga;

/**
 * Work of one saga step, or the compensation of a saga.
 *
 * <p>Runs inside the step's transaction. Commands issued through an
 * {@link eventflow.aggregate.AggregateRepository} join that transaction, so their events
 * commit exactly when the saga advances. Effects outside the database must be idempotent,
 * keyed by {@link SagaContext#idempotencyKey()}.
 */
@FunctionalInterface
public interface SagaAction {

  /**
   * @throws RuntimeException to fail the attempt; throw {@link eventflow.RetryAfterException}
   *                          to choose the retry delay
   */
  void execute(SagaContext context);
}
