/**
 * Long-running workflows driven by events and persisted timers.
 *
 * <p>A {@link eventflow.saga.SagaDefinition} lists ordered steps. The
 * {@link eventflow.saga.SagaCoordinator} starts sagas from trigger events and advances
 * them with a compare-and-set on the saga row, so duplicate events and timers are harmless.
 * {@link eventflow.saga.SagaTimerPoller} fires due timers, including those left behind by
 * a restart.
 */
package eventflow.saga;
