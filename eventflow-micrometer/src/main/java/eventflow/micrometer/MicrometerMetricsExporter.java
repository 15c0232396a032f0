package eventflow.micrometer;

import eventflow.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventflow.append.success}: appends committed to the event store</li>
 *   <li>{@code eventflow.append.conflict}: appends rejected by optimistic concurrency</li>
 *   <li>{@code eventflow.outbox.delivered}: entries confirmed by the bus</li>
 *   <li>{@code eventflow.outbox.failed}: entries scheduled for another attempt</li>
 *   <li>{@code eventflow.outbox.dead}: entries moved to DEAD</li>
 *   <li>{@code eventflow.saga.step.completed}: saga steps that ran to completion</li>
 *   <li>{@code eventflow.saga.step.failed}: saga step attempts that threw</li>
 *   <li>{@code eventflow.saga.failed}: sagas that ended FAILED or COMPENSATED</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventflow.outbox.lag.oldest.ms}: age of the oldest claimed undelivered entry</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter appendSuccess;
  private final Counter appendConflict;
  private final Counter delivered;
  private final Counter deliveryFailed;
  private final Counter deliveryDead;
  private final Counter sagaStepCompleted;
  private final Counter sagaStepFailed;
  private final Counter sagaFailed;
  private final Gauge lagGauge;

  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventflow"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventflow");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several instances in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "courses.eventflow"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.appendSuccess = counter(namePrefix + ".append.success", "Appends committed to the event store");
    this.appendConflict = counter(namePrefix + ".append.conflict", "Appends rejected by a version conflict");
    this.delivered = counter(namePrefix + ".outbox.delivered", "Outbox entries confirmed by the bus");
    this.deliveryFailed = counter(namePrefix + ".outbox.failed", "Outbox entries scheduled for retry");
    this.deliveryDead = counter(namePrefix + ".outbox.dead", "Outbox entries moved to DEAD");
    this.sagaStepCompleted = counter(namePrefix + ".saga.step.completed", "Saga steps completed");
    this.sagaStepFailed = counter(namePrefix + ".saga.step.failed", "Saga step attempts that failed");
    this.sagaFailed = counter(namePrefix + ".saga.failed", "Sagas ended FAILED or COMPENSATED");
    this.lagGauge = Gauge.builder(namePrefix + ".outbox.lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .description("Age of the oldest undelivered outbox entry")
        .baseUnit("milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementAppendSuccess() {
    if (closed) return;
    appendSuccess.increment();
  }

  @Override
  public void incrementAppendConflict() {
    if (closed) return;
    appendConflict.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementDeliveryFailed() {
    if (closed) return;
    deliveryFailed.increment();
  }

  @Override
  public void incrementDeliveryDead() {
    if (closed) return;
    deliveryDead.increment();
  }

  @Override
  public void incrementSagaStepCompleted() {
    if (closed) return;
    sagaStepCompleted.increment();
  }

  @Override
  public void incrementSagaStepFailed() {
    if (closed) return;
    sagaStepFailed.increment();
  }

  @Override
  public void incrementSagaFailed() {
    if (closed) return;
    sagaFailed.increment();
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    this.oldestLagMs.set(lagMs);
  }

  /**
   * Removes every meter registered by this exporter so no stale gauge outlives the
   * {@link eventflow.EventFlow} instance it belonged to.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(appendSuccess, appendConflict, delivered, deliveryFailed, deliveryDead,
        sagaStepCompleted, sagaStepFailed, sagaFailed, lagGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
