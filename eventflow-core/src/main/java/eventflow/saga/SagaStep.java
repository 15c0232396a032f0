package eventflow.saga;

import eventflow.EventType;

import java.time.Duration;
import java.util.Objects;

/**
 * One step of a {@link SagaDefinition} and the condition that starts it.
 */
public final class SagaStep {

  /**
   * When a step becomes due.
   */
  public enum Start {
    /** Right after the previous step (or the trigger). */
    IMMEDIATELY,
    /** A fixed delay after the triggering event occurred. */
    AFTER_DELAY,
    /** When an event with the saga's correlation id and a given name arrives. */
    ON_EVENT
  }

  private final String name;
  private final Start start;
  private final Duration delay;
  private final String eventName;
  private final SagaAction action;

  private SagaStep(String name, Start start, Duration delay, String eventName, SagaAction action) {
    this.name = Objects.requireNonNull(name, "name");
    this.start = start;
    this.delay = delay;
    this.eventName = eventName;
    this.action = Objects.requireNonNull(action, "action");
  }

  public static SagaStep immediately(String name, SagaAction action) {
    return new SagaStep(name, Start.IMMEDIATELY, Duration.ZERO, null, action);
  }

  /**
   * A step due {@code delay} after the triggering event's {@code occurredAt}.
   */
  public static SagaStep after(String name, Duration delay, SagaAction action) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    return new SagaStep(name, Start.AFTER_DELAY, delay, null, action);
  }

  public static SagaStep onEvent(String name, String eventName, SagaAction action) {
    Objects.requireNonNull(eventName, "eventName");
    return new SagaStep(name, Start.ON_EVENT, null, eventName, action);
  }

  public static SagaStep onEvent(String name, EventType eventType, SagaAction action) {
    return onEvent(name, Objects.requireNonNull(eventType, "eventType").eventName(), action);
  }

  public String name() {
    return name;
  }

  public Start start() {
    return start;
  }

  /**
   * Delay after the trigger for {@link Start#AFTER_DELAY} steps; zero for immediate steps,
   * {@code null} for event steps.
   */
  public Duration delay() {
    return delay;
  }

  /**
   * Awaited event name for {@link Start#ON_EVENT} steps, otherwise {@code null}.
   */
  public String eventName() {
    return eventName;
  }

  public SagaAction action() {
    return action;
  }

  boolean awaits(String name) {
    return start == Start.ON_EVENT && eventName.equals(name);
  }

  @Override
  public String toString() {
    return "SagaStep{" + name + ", " + start + '}';
  }
}
