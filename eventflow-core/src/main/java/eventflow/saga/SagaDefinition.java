package eventflow.saga;

import eventflow.DomainEvent;
import eventflow.EventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Declares a saga: its type name, the events that start it, its ordered steps and an
 * optional compensation.
 *
 * <pre>{@code
 * SagaDefinition onboarding = SagaDefinition.builder("tutor-onboarding")
 *     .startOn("user.role_changed")
 *     .startWhen(event -> event.payloadJson().contains("\"TUTOR\""))
 *     .step(SagaStep.immediately("open-tutor-profile", ctx -> ...))
 *     .step(SagaStep.after("send-reminder", Duration.ofHours(24), ctx -> ...))
 *     .compensation(ctx -> ...)
 *     .build();
 * }</pre>
 */
public final class SagaDefinition {

  private final String sagaType;
  private final Set<String> triggers;
  private final Predicate<DomainEvent> startCondition;
  private final Function<DomainEvent, Map<String, String>> initialData;
  private final List<SagaStep> steps;
  private final SagaAction compensation;
  private final int maxAttempts;

  private SagaDefinition(Builder builder) {
    this.sagaType = builder.sagaType;
    if (builder.triggers.isEmpty()) {
      throw new IllegalArgumentException("Saga " + sagaType + " needs at least one trigger event");
    }
    if (builder.steps.isEmpty()) {
      throw new IllegalArgumentException("Saga " + sagaType + " needs at least one step");
    }
    this.triggers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.triggers));
    this.startCondition = builder.startCondition;
    this.initialData = builder.initialData;
    this.steps = List.copyOf(builder.steps);
    this.compensation = builder.compensation;
    this.maxAttempts = builder.maxAttempts;
  }

  public static Builder builder(String sagaType) {
    return new Builder(sagaType);
  }

  public String sagaType() {
    return sagaType;
  }

  public Set<String> triggers() {
    return triggers;
  }

  public List<SagaStep> steps() {
    return steps;
  }

  /**
   * Returns the step at a 1-based index.
   */
  public SagaStep step(int index) {
    if (index < 1 || index > steps.size()) {
      throw new IllegalArgumentException("Saga " + sagaType + " has no step " + index);
    }
    return steps.get(index - 1);
  }

  public SagaAction compensation() {
    return compensation;
  }

  /**
   * Attempts per step before the saga gives up, or {@code 0} to use the coordinator default.
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  boolean startsOn(DomainEvent event) {
    return triggers.contains(event.eventName()) && startCondition.test(event);
  }

  Map<String, String> initialData(DomainEvent trigger) {
    Map<String, String> data = initialData.apply(trigger);
    return data == null ? Map.of() : data;
  }

  /**
   * Builder for {@link SagaDefinition}.
   */
  public static final class Builder {
    private final String sagaType;
    private final Set<String> triggers = new LinkedHashSet<>();
    private final List<SagaStep> steps = new ArrayList<>();
    private Predicate<DomainEvent> startCondition = event -> true;
    private Function<DomainEvent, Map<String, String>> initialData = Builder::aggregateData;
    private SagaAction compensation;
    private int maxAttempts;

    private Builder(String sagaType) {
      this.sagaType = Objects.requireNonNull(sagaType, "sagaType");
      if (sagaType.isEmpty()) {
        throw new IllegalArgumentException("sagaType cannot be empty");
      }
    }

    /**
     * Adds an event name that starts the saga. <b>At least one required.</b>
     */
    public Builder startOn(String eventName) {
      triggers.add(Objects.requireNonNull(eventName, "eventName"));
      return this;
    }

    public Builder startOn(EventType eventType) {
      return startOn(Objects.requireNonNull(eventType, "eventType").eventName());
    }

    /**
     * Further filters trigger events, e.g. on payload content. Default: accept all.
     */
    public Builder startWhen(Predicate<DomainEvent> startCondition) {
      this.startCondition = Objects.requireNonNull(startCondition, "startCondition");
      return this;
    }

    /**
     * Extracts the saga's initial data from the trigger. Default: {@code aggregateType}
     * and {@code aggregateId} of the trigger.
     */
    public Builder initialData(Function<DomainEvent, Map<String, String>> initialData) {
      this.initialData = Objects.requireNonNull(initialData, "initialData");
      return this;
    }

    /**
     * Appends a step. <b>At least one required.</b>
     */
    public Builder step(SagaStep step) {
      steps.add(Objects.requireNonNull(step, "step"));
      return this;
    }

    /**
     * Runs once when a step exhausted its attempts; the saga then ends COMPENSATED.
     */
    public Builder compensation(SagaAction compensation) {
      this.compensation = compensation;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      if (maxAttempts < 0) {
        throw new IllegalArgumentException("maxAttempts must be >= 0, got: " + maxAttempts);
      }
      this.maxAttempts = maxAttempts;
      return this;
    }

    public SagaDefinition build() {
      return new SagaDefinition(this);
    }

    private static Map<String, String> aggregateData(DomainEvent trigger) {
      Map<String, String> data = new LinkedHashMap<>();
      data.put("aggregateType", trigger.aggregateType());
      data.put("aggregateId", trigger.aggregateId());
      return data;
    }
  }
}
