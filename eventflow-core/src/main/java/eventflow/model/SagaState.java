package eventflow.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted progress of one saga instance.
 *
 * <p>{@code step} is the 1-based index of the next step to run and equals
 * {@code steps + 1} once every step completed. {@code wakeAt} is the persisted timer:
 * the time a delayed step becomes due, or the end of a retry backoff. It is
 * {@code null} while the saga waits for an event. {@code version} grows by one on
 * every update and guards the compare-and-set advance.
 *
 * <p>{@code retryEvent} holds the event a failed run of the current step was given, in
 * wire form, so the retry fired by the timer sees the same event. It is cleared when the
 * saga advances.
 */
public record SagaState(
    String sagaId,
    String sagaType,
    String correlationId,
    int step,
    SagaStatus status,
    Map<String, String> data,
    Instant wakeAt,
    int attempts,
    String lastError,
    String triggerEventId,
    Instant triggerOccurredAt,
    long version,
    Instant createdAt,
    Instant updatedAt,
    String retryEvent
) {

  public SagaState {
    Objects.requireNonNull(sagaId, "sagaId");
    Objects.requireNonNull(sagaType, "sagaType");
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(status, "status");
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  public SagaState(String sagaId, String sagaType, String correlationId, int step, SagaStatus status,
                   Map<String, String> data, Instant wakeAt, int attempts, String lastError,
                   String triggerEventId, Instant triggerOccurredAt, long version, Instant createdAt,
                   Instant updatedAt) {
    this(sagaId, sagaType, correlationId, step, status, data, wakeAt, attempts, lastError, triggerEventId,
        triggerOccurredAt, version, createdAt, updatedAt, null);
  }

  /**
   * Moves to {@code nextStep} with fresh attempts, replacing the data and timer.
   */
  public SagaState advance(int nextStep, Map<String, String> nextData, Instant nextWakeAt, Instant now) {
    return new SagaState(sagaId, sagaType, correlationId, nextStep, SagaStatus.ACTIVE, nextData,
        nextWakeAt, 0, null, triggerEventId, triggerOccurredAt, version + 1, createdAt, now, null);
  }

  /**
   * Records a failed attempt of the current step and schedules its retry, keeping the
   * stored retry event.
   */
  public SagaState retryAt(Instant nextWakeAt, String error, Instant now) {
    return retryAt(nextWakeAt, error, now, retryEvent);
  }

  /**
   * Records a failed attempt of the current step and schedules its retry with the given event.
   */
  public SagaState retryAt(Instant nextWakeAt, String error, Instant now, String nextRetryEvent) {
    return new SagaState(sagaId, sagaType, correlationId, step, SagaStatus.ACTIVE, data,
        nextWakeAt, attempts + 1, error, triggerEventId, triggerOccurredAt, version + 1, createdAt, now,
        nextRetryEvent);
  }

  /**
   * Ends the saga with a terminal status.
   */
  public SagaState finish(SagaStatus terminal, int finalStep, Map<String, String> finalData, int finalAttempts,
                          String error, Instant now) {
    if (!terminal.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal status: " + terminal);
    }
    return new SagaState(sagaId, sagaType, correlationId, finalStep, terminal, finalData,
        null, finalAttempts, error, triggerEventId, triggerOccurredAt, version + 1, createdAt, now, null);
  }
}
