/**
 * Spring Boot auto-configuration: stores detected from the DataSource, Spring-managed
 * transactions, {@link eventflow.spring.boot.EventFlowConsumer} registration and
 * {@code eventflow.*} properties.
 */
package eventflow.spring.boot;
