package eventflow.spring;

import eventflow.spi.TransactionRunner;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;

/**
 * {@link TransactionRunner} backed by a Spring {@link PlatformTransactionManager}.
 *
 * <p>Work joins the caller's Spring transaction when there is one
 * ({@code PROPAGATION_REQUIRED}). Inside a completion callback registered through
 * {@link SpringTxContext} the work runs in a new transaction instead, since the
 * finished one can no longer be joined.
 */
public final class SpringTransactionRunner implements TransactionRunner {
  private final TransactionTemplate required;
  private final TransactionTemplate requiresNew;

  public SpringTransactionRunner(PlatformTransactionManager transactionManager) {
    Objects.requireNonNull(transactionManager, "transactionManager");
    this.required = new TransactionTemplate(transactionManager);
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public <T> T inTransaction(TransactionalWork<T> work) {
    Objects.requireNonNull(work, "work");
    if (SpringTxContext.isCompleting()) {
      return requiresNew.execute(status -> SpringTxContext.runOutsideCompletion(work::execute));
    }
    return required.execute(status -> work.execute());
  }
}
