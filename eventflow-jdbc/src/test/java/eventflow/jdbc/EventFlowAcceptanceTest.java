package eventflow.jdbc;

import eventflow.ConcurrencyConflictException;
import eventflow.DomainEvent;
import eventflow.EventFlow;
import eventflow.EventMetadata;
import eventflow.aggregate.AggregateRepository;
import eventflow.bus.BusEntry;
import eventflow.bus.EventWireCodec;
import eventflow.bus.PublishResult;
import eventflow.consumer.DefaultConsumerRegistry;
import eventflow.consumer.InboundEventRouter;
import eventflow.jdbc.consumer.JdbcProcessedEventStore;
import eventflow.jdbc.event.JdbcEventStore;
import eventflow.jdbc.outbox.H2OutboxStore;
import eventflow.jdbc.saga.JdbcSagaStore;
import eventflow.jdbc.support.Course;
import eventflow.jdbc.support.H2Database;
import eventflow.jdbc.support.MutableClock;
import eventflow.jdbc.tx.JdbcTransactionManager;
import eventflow.jdbc.tx.ThreadLocalTxContext;
import eventflow.model.DeliveryStatus;
import eventflow.model.OutboxEntry;
import eventflow.model.SagaState;
import eventflow.model.SagaStatus;
import eventflow.saga.SagaDefinition;
import eventflow.saga.SagaStep;
import eventflow.spi.EventBus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios on H2: aggregate commands, outbox delivery to an idempotent
 * consumer, and a saga with a persisted timer.
 */
class EventFlowAcceptanceTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Duration LOCK_TIMEOUT = Duration.ofMinutes(5);

  private JdbcDataSource dataSource;
  private MutableClock clock;
  private DataSourceConnectionProvider connectionProvider;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionManager txManager;
  private JdbcEventStore eventStore;
  private H2OutboxStore outboxStore;
  private JdbcSagaStore sagaStore;
  private JdbcProcessedEventStore processedEventStore;
  private final List<BusEntry> busTraffic = new CopyOnWriteArrayList<>();
  private final List<String> enrolmentMails = new CopyOnWriteArrayList<>();
  private final AtomicInteger announcements = new AtomicInteger();
  private InboundEventRouter router;
  private EventFlow flow;

  @BeforeEach
  void setUp() {
    dataSource = H2Database.create();
    clock = new MutableClock(T0);
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(connectionProvider, txContext);
    eventStore = new JdbcEventStore();
    outboxStore = new H2OutboxStore();
    sagaStore = new JdbcSagaStore(JdbcDialect.H2);
    processedEventStore = new JdbcProcessedEventStore(JdbcDialect.H2);

    SagaDefinition courseLaunch = SagaDefinition.builder("course-launch")
        .startOn(Course.Events.CREATED)
        .step(SagaStep.after("announce", Duration.ofHours(1), ctx -> {
          announcements.incrementAndGet();
          ctx.put("announced", "yes");
        }))
        .step(SagaStep.onEvent("confirm-title", Course.Events.RETITLED, ctx ->
            ctx.put("finalTitle", ctx.event().orElseThrow().eventName())))
        .build();

    EventBus loopback = entries -> {
      busTraffic.addAll(entries);
      entries.forEach(router::route);
      return PublishResult.allAccepted(entries.size());
    };

    flow = EventFlow.builder()
        .serviceName("school.courses")
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .transactionRunner(txManager)
        .eventStore(eventStore)
        .outboxStore(outboxStore)
        .sagaStore(sagaStore)
        .processedEventStore(processedEventStore)
        .eventBus(loopback)
        .saga(courseLaunch)
        .lockTimeout(LOCK_TIMEOUT)
        .clock(clock)
        .build();
    flow.localDispatcher().register(events -> events.forEach(flow.sagaCoordinator()::onEvent));

    router = new InboundEventRouter(new DefaultConsumerRegistry()
        .register(Course.Events.CREATED, flow.idempotent("enrolment-mail", e -> enrolmentMails.add(e.aggregateId()))));
  }

  @AfterEach
  void tearDown() {
    flow.close();
  }

  @Test
  void secondWriterWithStaleVersionIsRejected() throws SQLException {
    AggregateRepository<Course> courses = flow.repository(Course.TYPE, Course::new);

    courses.execute("c-1", EventMetadata.correlatedWith("req-1"), c -> c.create("Algebra I", "t-1"));
    courses.execute("c-1", EventMetadata.correlatedWith("req-2"), c -> c.retitle("Algebra I (2024)"));

    DomainEvent stale = DomainEvent.builder(Course.Events.RETITLED)
        .aggregate(Course.TYPE, "c-1")
        .version(1)
        .payloadJson("{\"title\":\"Geometry\"}")
        .build();
    try (Connection conn = dataSource.getConnection()) {
      ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
          () -> eventStore.append(conn, Course.TYPE, "c-1", 0, List.of(stale)));
      assertEquals(2, e.actualVersion());

      List<DomainEvent> history = eventStore.load(conn, Course.TYPE, "c-1");
      assertEquals(List.of(1L, 2L), history.stream().map(DomainEvent::version).toList());
    }

    Course reloaded = courses.load("c-1").orElseThrow();
    assertEquals("Algebra I (2024)", reloaded.title());
    assertEquals(2, reloaded.version());
  }

  @Test
  void redeliveryAfterCrashBeforeMarkDeliveredIsConsumedOnce() throws SQLException {
    AggregateRepository<Course> courses = flow.repository(Course.TYPE, Course::new);
    courses.execute("c-1", EventMetadata.correlatedWith("req-1"), c -> c.create("Algebra I", "t-1"));

    // A worker claims the entry, the bus acknowledges it, then the worker dies before marking it.
    EventWireCodec codec = new EventWireCodec();
    List<OutboxEntry> claimed;
    try (Connection conn = dataSource.getConnection()) {
      claimed = outboxStore.claimDue(conn, "crashed-worker", clock.instant(), clock.instant().minus(LOCK_TIMEOUT), 10);
    }
    assertEquals(1, claimed.size());
    router.route(codec.encode("school.courses", claimed.get(0).event()));
    assertEquals(List.of("c-1"), enrolmentMails);

    assertEquals(0, flow.publisher().drainOnce(), "entry is still held by the crashed worker's claim");

    clock.advance(LOCK_TIMEOUT.plusSeconds(1));
    assertEquals(1, flow.publisher().drainOnce());

    assertEquals(1, busTraffic.size());
    assertEquals(List.of("c-1"), enrolmentMails);
    try (Connection conn = dataSource.getConnection()) {
      assertTrue(processedEventStore.isProcessed(conn, "enrolment-mail", claimed.get(0).eventId()));
      assertTrue(outboxStore.oldestPendingCreatedAt(conn).isEmpty());
    }
    assertEquals(1, H2Database.count(dataSource,
        "SELECT COUNT(*) FROM outbox_entry WHERE status = " + DeliveryStatus.DELIVERED.code()));
  }

  @Test
  void delayedSagaStepFiresOnceAndAdvances() {
    AggregateRepository<Course> courses = flow.repository(Course.TYPE, Course::new);
    courses.execute("c-1", EventMetadata.correlatedWith("req-1"), c -> c.create("Algebra I", "t-1"));

    SagaState started = flow.sagaCoordinator().find("course-launch", "req-1").orElseThrow();
    assertEquals(1, started.step());
    assertEquals(T0.plus(Duration.ofHours(1)), started.wakeAt());

    assertFalse(flow.sagaCoordinator().fireTimer(started.sagaId(), 1), "timer is not due yet");
    assertEquals(0, announcements.get());

    clock.advance(Duration.ofHours(1));
    assertTrue(flow.sagaCoordinator().fireTimer(started.sagaId(), 1));
    assertFalse(flow.sagaCoordinator().fireTimer(started.sagaId(), 1), "duplicate timer for step 1");
    assertEquals(1, announcements.get());

    SagaState waiting = flow.sagaCoordinator().find(started.sagaId()).orElseThrow();
    assertEquals(2, waiting.step());
    assertEquals(SagaStatus.ACTIVE, waiting.status());
    assertNull(waiting.wakeAt());
    assertEquals("yes", waiting.data().get("announced"));

    courses.execute("c-1", EventMetadata.correlatedWith("req-1"), c -> c.retitle("Algebra I (2024)"));

    SagaState done = flow.sagaCoordinator().find(started.sagaId()).orElseThrow();
    assertEquals(SagaStatus.COMPLETED, done.status());
    assertEquals("course.retitled", done.data().get("finalTitle"));
  }

  @Test
  void concurrentAppendsWithSameExpectedVersionHaveOneWinner() throws Exception {
    int writers = 6;
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    CountDownLatch ready = new CountDownLatch(writers);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    for (int i = 0; i < writers; i++) {
      String title = "Title " + i;
      results.add(executor.submit(() -> {
        DomainEvent created = DomainEvent.builder(Course.Events.CREATED)
            .aggregate(Course.TYPE, "c-race")
            .version(1)
            .payloadJson("{\"title\":\"" + title + "\",\"tutorId\":\"t-1\"}")
            .build();
        ready.countDown();
        go.await();
        try (Connection conn = dataSource.getConnection()) {
          conn.setAutoCommit(false);
          try {
            eventStore.append(conn, Course.TYPE, "c-race", 0, List.of(created));
            conn.commit();
            return true;
          } catch (ConcurrencyConflictException e) {
            conn.rollback();
            return false;
          }
        }
      }));
    }
    assertTrue(ready.await(5, TimeUnit.SECONDS));
    go.countDown();

    int winners = 0;
    for (Future<Boolean> result : results) {
      if (result.get(10, TimeUnit.SECONDS)) {
        winners++;
      }
    }
    executor.shutdown();

    assertEquals(1, winners);
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(1, eventStore.currentVersion(conn, Course.TYPE, "c-race"));
    }
  }

  @Test
  void concurrentCommandsOnOneCourseKeepAGaplessStream() throws Exception {
    AggregateRepository<Course> courses = AggregateRepository.builder(Course::new)
        .aggregateType(Course.TYPE)
        .eventStore(eventStore)
        .outboxWriter(flow.writer())
        .txContext(txContext)
        .transactionRunner(txManager)
        .clock(clock)
        .maxConflictRetries(50)
        .build();
    courses.execute("c-1", null, c -> c.create("Draft", "t-1"));

    int threads = 4;
    int commandsPerThread = 5;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      int thread = t;
      futures.add(executor.submit(() -> {
        for (int i = 0; i < commandsPerThread; i++) {
          String title = "Draft " + thread + "." + i;
          courses.execute("c-1", null, c -> c.retitle(title));
        }
      }));
    }
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }
    executor.shutdown();

    List<Long> versions;
    try (Connection conn = dataSource.getConnection()) {
      versions = eventStore.load(conn, Course.TYPE, "c-1").stream().map(DomainEvent::version).toList();
    }
    List<Long> expected = new ArrayList<>();
    for (long v = 1; v <= 1 + threads * commandsPerThread; v++) {
      expected.add(v);
    }
    assertEquals(expected, versions);
    assertEquals(expected.size(), H2Database.count(dataSource, "SELECT COUNT(*) FROM outbox_entry"));
    assertEquals(Collections.emptyList(), busTraffic);
  }
}
