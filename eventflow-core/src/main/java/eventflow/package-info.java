/**
 * Event-sourced aggregates with a transactional outbox and saga coordination.
 *
 * <p>The domain event model ({@link eventflow.DomainEvent}), the error types and the composite
 * entry point {@link eventflow.EventFlow} live here; see the sub-packages for the aggregate
 * engine, the outbox publisher and the saga coordinator.
 */
package eventflow;
