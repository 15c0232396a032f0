package eventflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void appendCounters() {
    exporter.incrementAppendSuccess();
    exporter.incrementAppendSuccess();
    exporter.incrementAppendConflict();
    assertEquals(2.0, counter("eventflow.append.success").count());
    assertEquals(1.0, counter("eventflow.append.conflict").count());
  }

  @Test
  void deliveryCounters() {
    exporter.incrementDelivered();
    exporter.incrementDeliveryFailed();
    exporter.incrementDeliveryFailed();
    exporter.incrementDeliveryDead();
    assertEquals(1.0, counter("eventflow.outbox.delivered").count());
    assertEquals(2.0, counter("eventflow.outbox.failed").count());
    assertEquals(1.0, counter("eventflow.outbox.dead").count());
  }

  @Test
  void sagaCounters() {
    exporter.incrementSagaStepCompleted();
    exporter.incrementSagaStepFailed();
    exporter.incrementSagaStepFailed();
    exporter.incrementSagaFailed();
    assertEquals(1.0, counter("eventflow.saga.step.completed").count());
    assertEquals(2.0, counter("eventflow.saga.step.failed").count());
    assertEquals(1.0, counter("eventflow.saga.failed").count());
  }

  @Test
  void recordOldestLagMs() {
    exporter.recordOldestLagMs(12345L);
    assertEquals(12345.0, gauge("eventflow.outbox.lag.oldest.ms").value());

    exporter.recordOldestLagMs(0L);
    assertEquals(0.0, gauge("eventflow.outbox.lag.oldest.ms").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "courses.eventflow");
    custom.incrementDelivered();
    custom.recordOldestLagMs(500L);

    assertEquals(1.0, counter("courses.eventflow.outbox.delivered").count());
    assertEquals(500.0, gauge("courses.eventflow.outbox.lag.oldest.ms").value());
    assertEquals(0.0, counter("eventflow.outbox.delivered").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementDelivered();
    exporter.recordOldestLagMs(10L);

    assertNull(registry.find("eventflow.outbox.delivered").counter());
    assertNull(registry.find("eventflow.outbox.lag.oldest.ms").gauge());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "eventflow."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
