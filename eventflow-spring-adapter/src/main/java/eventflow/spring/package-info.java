/**
 * Spring transaction integration: {@link eventflow.spring.SpringTxContext} and
 * {@link eventflow.spring.SpringTransactionRunner} let aggregates, consumers and sagas
 * take part in transactions driven by a Spring {@code PlatformTransactionManager}.
 */
package eventflow.spring;
