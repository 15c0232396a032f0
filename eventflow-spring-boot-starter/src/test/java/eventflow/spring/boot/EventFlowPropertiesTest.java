package eventflow.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EventFlowPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(EventFlowProperties.class);
      assertEquals("eventflow", props.getServiceName());
      assertTrue(props.getPublisher().isEnabled());
      assertEquals(1, props.getPublisher().getWorkerCount());
      assertEquals(50, props.getPublisher().getBatchSize());
      assertEquals(10, props.getPublisher().getMaxEntriesPerCall());
      assertEquals(1000, props.getPublisher().getIntervalMs());
      assertEquals(Duration.ofMinutes(5), props.getPublisher().getLockTimeout());
      assertEquals(10, props.getPublisher().getMaxAttempts());
      assertNull(props.getPublisher().getOwnerId());
      assertEquals(200, props.getRetry().getBaseDelayMs());
      assertEquals(60_000, props.getRetry().getMaxDelayMs());
      assertEquals(1000, props.getSaga().getTimerIntervalMs());
      assertEquals(50, props.getSaga().getTimerBatchSize());
      assertEquals(5, props.getSaga().getMaxAttempts());
      assertEquals(3, props.getRepository().getMaxConflictRetries());
      assertFalse(props.getPurge().isEnabled());
      assertEquals(Duration.ofDays(7), props.getPurge().getRetention());
      assertEquals(3_600_000, props.getPurge().getIntervalMs());
      assertEquals(500, props.getPurge().getBatchSize());
      assertEquals("event_store", props.getTables().getEvents());
      assertEquals("outbox_entry", props.getTables().getOutbox());
      assertEquals("saga_state", props.getTables().getSagas());
      assertEquals("processed_event", props.getTables().getProcessed());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("eventflow", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "eventflow.service-name=school.accounts",
        "eventflow.publisher.enabled=false",
        "eventflow.publisher.worker-count=3",
        "eventflow.publisher.batch-size=20",
        "eventflow.publisher.max-entries-per-call=5",
        "eventflow.publisher.interval-ms=250",
        "eventflow.publisher.lock-timeout=PT30S",
        "eventflow.publisher.max-attempts=4",
        "eventflow.publisher.owner-id=node-a",
        "eventflow.retry.base-delay-ms=100",
        "eventflow.retry.max-delay-ms=5000",
        "eventflow.saga.timer-interval-ms=500",
        "eventflow.saga.timer-batch-size=25",
        "eventflow.saga.max-attempts=8",
        "eventflow.repository.max-conflict-retries=6",
        "eventflow.purge.enabled=true",
        "eventflow.purge.retention=P2D",
        "eventflow.purge.interval-ms=600000",
        "eventflow.purge.batch-size=100",
        "eventflow.tables.events=account_events",
        "eventflow.tables.outbox=account_outbox",
        "eventflow.tables.sagas=account_sagas",
        "eventflow.tables.processed=account_processed",
        "eventflow.metrics.name-prefix=accounts"
    ).run(ctx -> {
      var props = ctx.getBean(EventFlowProperties.class);
      assertEquals("school.accounts", props.getServiceName());
      assertFalse(props.getPublisher().isEnabled());
      assertEquals(3, props.getPublisher().getWorkerCount());
      assertEquals(20, props.getPublisher().getBatchSize());
      assertEquals(5, props.getPublisher().getMaxEntriesPerCall());
      assertEquals(250, props.getPublisher().getIntervalMs());
      assertEquals(Duration.ofSeconds(30), props.getPublisher().getLockTimeout());
      assertEquals(4, props.getPublisher().getMaxAttempts());
      assertEquals("node-a", props.getPublisher().getOwnerId());
      assertEquals(100, props.getRetry().getBaseDelayMs());
      assertEquals(5000, props.getRetry().getMaxDelayMs());
      assertEquals(500, props.getSaga().getTimerIntervalMs());
      assertEquals(25, props.getSaga().getTimerBatchSize());
      assertEquals(8, props.getSaga().getMaxAttempts());
      assertEquals(6, props.getRepository().getMaxConflictRetries());
      assertTrue(props.getPurge().isEnabled());
      assertEquals(Duration.ofDays(2), props.getPurge().getRetention());
      assertEquals(600_000, props.getPurge().getIntervalMs());
      assertEquals(100, props.getPurge().getBatchSize());
      assertEquals("account_events", props.getTables().getEvents());
      assertEquals("account_outbox", props.getTables().getOutbox());
      assertEquals("account_sagas", props.getTables().getSagas());
      assertEquals("account_processed", props.getTables().getProcessed());
      assertEquals("accounts", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(EventFlowProperties.class)
  static class PropsConfig {
  }
}
