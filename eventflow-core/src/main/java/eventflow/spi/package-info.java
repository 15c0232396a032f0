/**
 * Service Provider Interfaces for plugging persistence, transactions, the external
 * event bus and metrics into the engine.
 *
 * @see eventflow.spi.EventStore
 * @see eventflow.spi.OutboxStore
 * @see eventflow.spi.SagaStore
 * @see eventflow.spi.ProcessedEventStore
 * @see eventflow.spi.TxContext
 * @see eventflow.spi.TransactionRunner
 * @see eventflow.spi.EventBus
 */
package eventflow.spi;
