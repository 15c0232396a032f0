/**
 * Manual JDBC transaction management.
 *
 * <p>{@link eventflow.jdbc.tx.JdbcTransactionManager} implements
 * {@link eventflow.spi.TransactionRunner} on top of
 * {@link eventflow.jdbc.tx.ThreadLocalTxContext}.
 */
package eventflow.jdbc.tx;
