package eventflow.demo;

import eventflow.ConcurrencyConflictException;
import eventflow.DomainEvent;
import eventflow.EventFlow;
import eventflow.EventMetadata;
import eventflow.aggregate.AggregateRepository;
import eventflow.bus.BusEntry;
import eventflow.bus.PublishResult;
import eventflow.consumer.DefaultConsumerRegistry;
import eventflow.consumer.InboundEventRouter;
import eventflow.jdbc.DataSourceConnectionProvider;
import eventflow.jdbc.JdbcDialect;
import eventflow.jdbc.consumer.JdbcProcessedEventStore;
import eventflow.jdbc.event.JdbcEventStore;
import eventflow.jdbc.outbox.JdbcOutboxStores;
import eventflow.jdbc.saga.JdbcSagaStore;
import eventflow.jdbc.tx.JdbcTransactionManager;
import eventflow.jdbc.tx.ThreadLocalTxContext;
import eventflow.model.SagaState;
import eventflow.model.SagaStatus;
import eventflow.spi.EventBus;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Education-platform demo without Spring: user accounts, a tutor onboarding saga and an
 * in-process bus looped back to an idempotent consumer.
 *
 * Run with: mvn -pl samples/eventflow-demo exec:java
 */
public final class EventFlowDemo {

  public static void main(String[] args) throws Exception {
    // 1. Setup H2 in-memory database
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:eventflow_demo;DB_CLOSE_DELAY=-1");
    createSchema(dataSource);

    // 2. Core components
    DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
    ThreadLocalTxContext txContext = new ThreadLocalTxContext();
    JdbcTransactionManager txManager = new JdbcTransactionManager(connectionProvider, txContext);
    JdbcDialect dialect = JdbcDialect.detect(dataSource);

    // 3. Loopback bus: what the publisher sends is routed straight back to local consumers
    AtomicReference<InboundEventRouter> router = new AtomicReference<>();
    EventBus loopback = entries -> {
      for (BusEntry entry : entries) {
        System.out.println("[Bus] " + entry.source() + " -> " + entry.detailType());
        router.get().route(entry);
      }
      return PublishResult.allAccepted(entries.size());
    };

    EventFlow flow = EventFlow.builder()
        .serviceName("school.identity")
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .transactionRunner(txManager)
        .eventStore(new JdbcEventStore())
        .outboxStore(JdbcOutboxStores.detect(dataSource))
        .sagaStore(new JdbcSagaStore(dialect))
        .processedEventStore(new JdbcProcessedEventStore(dialect))
        .eventBus(loopback)
        .saga(TutorOnboardingSaga.definition(Duration.ofSeconds(1)))
        .intervalMs(200)
        .sagaTimerIntervalMs(200)
        .build();
    flow.localDispatcher().register(events -> events.forEach(flow.sagaCoordinator()::onEvent));

    router.set(new InboundEventRouter(new DefaultConsumerRegistry()
        .register(UserAccount.Events.CREATED, flow.idempotent("welcome-mail",
            event -> System.out.println("[Consumer] Welcome mail for " + event.aggregateId())))
        .register(UserAccount.Events.ROLE_CHANGED, flow.idempotent("directory-sync",
            event -> System.out.println("[Consumer] Directory updated: " + event.payloadJson())))));

    AggregateRepository<UserAccount> users = flow.repository(UserAccount.TYPE, UserAccount::new);

    System.out.println("=== EventFlow Demo ===\n");
    flow.start();

    // 4. Commands on the user account aggregate
    EventMetadata onboarding = EventMetadata.correlatedWith("onboard-u-1");
    users.execute("u-1", onboarding, u -> u.create("ada@school.test", "Ada", UserAccount.Role.STUDENT));
    users.execute("u-1", onboarding, u -> u.updateProfile("Ada Lovelace"));
    users.execute("u-1", onboarding, u -> u.changeRole(UserAccount.Role.TUTOR));
    System.out.println("Role changed, onboarding saga started\n");

    users.execute("u-1", onboarding, u -> u.activate());
    System.out.println("Account activated\n");

    // 5. Optimistic concurrency: two copies loaded at the same version, only one can save
    UserAccount first = users.loadOrCreate("u-1");
    UserAccount second = users.loadOrCreate("u-1");
    first.updateProfile("Augusta Ada King");
    second.deactivate("duplicate account");
    users.save(first);
    try {
      users.save(second);
    } catch (ConcurrencyConflictException e) {
      System.out.println("Stale write rejected: expected version " + e.expectedVersion()
          + ", stream is at " + e.actualVersion() + "\n");
    }

    // 6. Wait for the delayed saga step and the publisher
    SagaState saga = awaitSaga(flow, Duration.ofSeconds(10));
    System.out.println("\nSaga " + saga.sagaType() + " finished as " + saga.status() + " with " + saga.data());

    UserAccount current = users.load("u-1").orElseThrow();
    System.out.println("User u-1: " + current.name() + ", " + current.role() + ", " + current.status()
        + " at version " + current.version());

    System.out.println("\nEvent stream:");
    List<DomainEvent> history = txManager.inTransaction(() ->
        new JdbcEventStore().load(txContext.currentConnection(), UserAccount.TYPE, "u-1"));
    for (DomainEvent event : history) {
      System.out.println("  v" + event.version() + " " + event.eventName() + " " + event.payloadJson());
    }

    Thread.sleep(500);
    flow.close();
    System.out.println("\n=== Demo Complete ===");
  }

  private static SagaState awaitSaga(EventFlow flow, Duration timeout) throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeout.toMillis();
    while (true) {
      SagaState state = flow.sagaCoordinator().find(TutorOnboardingSaga.TYPE, "onboard-u-1").orElseThrow();
      if (state.status() != SagaStatus.ACTIVE || System.currentTimeMillis() > deadline) {
        return state;
      }
      Thread.sleep(100);
    }
  }

  private static void createSchema(JdbcDataSource dataSource) throws IOException, SQLException {
    String script;
    try (InputStream is = EventFlowDemo.class.getResourceAsStream("/schema/h2.sql")) {
      if (is == null) {
        throw new IOException("schema/h2.sql not found on the classpath");
      }
      script = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String stmt : script.split(";")) {
        if (!stmt.isBlank()) {
          st.execute(stmt.trim());
        }
      }
    }
  }
}
