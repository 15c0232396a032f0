package eventflow.saga;

import eventflow.DomainEvent;
import eventflow.EventMetadata;
import eventflow.model.SagaState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * What a running step or compensation sees of its saga.
 *
 * <p>Changes to {@link #put data} are persisted only if the step succeeds.
 */
public final class SagaContext {

  private final SagaState state;
  private final SagaStep step;
  private final DomainEvent event;
  private final Instant now;
  private final Map<String, String> data;

  SagaContext(SagaState state, SagaStep step, DomainEvent event, Instant now) {
    this.state = state;
    this.step = step;
    this.event = event;
    this.now = now;
    this.data = new LinkedHashMap<>(state.data());
  }

  public String sagaId() {
    return state.sagaId();
  }

  public String sagaType() {
    return state.sagaType();
  }

  public String correlationId() {
    return state.correlationId();
  }

  /**
   * 1-based index of the running step.
   */
  public int step() {
    return state.step();
  }

  public String stepName() {
    return step.name();
  }

  /**
   * 1-based attempt number of the running step.
   */
  public int attempt() {
    return state.attempts() + 1;
  }

  /**
   * Stable key for the running step, identical across its retries.
   */
  public String idempotencyKey() {
    return state.sagaId() + ":" + state.step();
  }

  /**
   * The event that caused this run: the trigger when the saga starts, the awaited event
   * for event steps. A retry sees the event its failed run was given; empty for delayed
   * steps and the steps that follow them.
   */
  public Optional<DomainEvent> event() {
    return Optional.ofNullable(event);
  }

  public String triggerEventId() {
    return state.triggerEventId();
  }

  public Instant triggerOccurredAt() {
    return state.triggerOccurredAt();
  }

  /**
   * Metadata for commands issued by this step: the saga's correlation id, caused by the
   * current event or, for runs without one, by the trigger.
   */
  public EventMetadata metadata() {
    return EventMetadata.of(state.correlationId(), event != null ? event.eventId() : state.triggerEventId());
  }

  public Instant now() {
    return now;
  }

  public String get(String key) {
    return data.get(key);
  }

  /**
   * Sets a data entry; a {@code null} value removes it.
   */
  public SagaContext put(String key, String value) {
    if (value == null) {
      data.remove(key);
    } else {
      data.put(key, value);
    }
    return this;
  }

  public Map<String, String> data() {
    return Collections.unmodifiableMap(data);
  }

  Map<String, String> snapshot() {
    return new LinkedHashMap<>(data);
  }

  /**
   * Last failure message; set when running a compensation.
   */
  public String lastError() {
    return state.lastError();
  }
}
