package eventflow.support;

import eventflow.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public final class RecordingMetrics implements MetricsExporter {
  public final AtomicInteger appendSuccess = new AtomicInteger();
  public final AtomicInteger appendConflict = new AtomicInteger();
  public final AtomicInteger delivered = new AtomicInteger();
  public final AtomicInteger deliveryFailed = new AtomicInteger();
  public final AtomicInteger deliveryDead = new AtomicInteger();
  public final AtomicInteger sagaStepCompleted = new AtomicInteger();
  public final AtomicInteger sagaStepFailed = new AtomicInteger();
  public final AtomicInteger sagaFailed = new AtomicInteger();
  public final AtomicLong oldestLagMs = new AtomicLong(-1);

  @Override
  public void incrementAppendSuccess() {
    appendSuccess.incrementAndGet();
  }

  @Override
  public void incrementAppendConflict() {
    appendConflict.incrementAndGet();
  }

  @Override
  public void incrementDelivered() {
    delivered.incrementAndGet();
  }

  @Override
  public void incrementDeliveryFailed() {
    deliveryFailed.incrementAndGet();
  }

  @Override
  public void incrementDeliveryDead() {
    deliveryDead.incrementAndGet();
  }

  @Override
  public void incrementSagaStepCompleted() {
    sagaStepCompleted.incrementAndGet();
  }

  @Override
  public void incrementSagaStepFailed() {
    sagaStepFailed.incrementAndGet();
  }

  @Override
  public void incrementSagaFailed() {
    sagaFailed.incrementAndGet();
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    oldestLagMs.set(lagMs);
  }
}
