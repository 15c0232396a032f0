/**
 * Event-sourced aggregates.
 *
 * <p>An {@link eventflow.aggregate.AggregateRoot} changes state only by applying events
 * through its {@link eventflow.aggregate.EventMutators}; the
 * {@link eventflow.aggregate.AggregateRepository} rebuilds it by replay and saves pending
 * events with an optimistic version check.
 *
 * @see eventflow.aggregate.AggregateRoot
 * @see eventflow.aggregate.AggregateRepository
 */
package eventflow.aggregate;
