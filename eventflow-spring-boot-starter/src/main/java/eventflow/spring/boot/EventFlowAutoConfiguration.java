package eventflow.spring.boot;

import eventflow.EventFlow;
import eventflow.consumer.DefaultConsumerRegistry;
import eventflow.consumer.InboundEventRouter;
import eventflow.dispatch.LocalEventHandler;
import eventflow.jdbc.DataSourceConnectionProvider;
import eventflow.jdbc.JdbcDialect;
import eventflow.jdbc.JdbcTemplate;
import eventflow.jdbc.consumer.JdbcProcessedEventStore;
import eventflow.jdbc.event.JdbcEventStore;
import eventflow.jdbc.outbox.JdbcOutboxStores;
import eventflow.jdbc.saga.JdbcSagaStore;
import eventflow.outbox.DeadEntryManager;
import eventflow.outbox.OutboxWriter;
import eventflow.retry.ExponentialBackoffRetryPolicy;
import eventflow.saga.SagaDefinition;
import eventflow.spi.ConnectionProvider;
import eventflow.spi.EventBus;
import eventflow.spi.EventStore;
import eventflow.spi.MetricsExporter;
import eventflow.spi.OutboxStore;
import eventflow.spi.ProcessedEventStore;
import eventflow.spi.SagaStore;
import eventflow.spi.TransactionRunner;
import eventflow.spi.TxContext;
import eventflow.spring.SpringTransactionRunner;
import eventflow.spring.SpringTxContext;
import eventflow.util.JsonCodec;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;

/**
 * Auto-configuration for event-sourced aggregates, the transactional outbox and sagas.
 *
 * <p>Wires an {@link EventFlow} from a {@link DataSource} and {@link EventFlowProperties}.
 * The JDBC dialect is detected from the DataSource URL. Publishing starts only when an
 * {@link EventBus} bean exists and {@code eventflow.publisher.enabled} is true; sagas are
 * collected from {@link SagaDefinition} beans and receive committed events locally.
 *
 * @see EventFlowProperties
 * @see EventFlowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(EventFlow.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventFlowProperties.class)
public class EventFlowAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public JdbcDialect jdbcDialect(DataSource dataSource) {
    return JdbcDialect.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(EventStore.class)
  public JdbcEventStore eventStore(EventFlowProperties props) {
    return new JdbcEventStore(props.getTables().getEvents(), JdbcTemplate.DEFAULT);
  }

  @Bean
  @ConditionalOnMissingBean(OutboxStore.class)
  public OutboxStore outboxStore(DataSource dataSource, EventFlowProperties props) {
    return JdbcOutboxStores.detect(dataSource).withTable(props.getTables().getOutbox(), JdbcTemplate.DEFAULT);
  }

  @Bean
  @ConditionalOnMissingBean(SagaStore.class)
  public JdbcSagaStore sagaStore(JdbcDialect dialect, EventFlowProperties props) {
    return new JdbcSagaStore(dialect, props.getTables().getSagas(), JdbcTemplate.DEFAULT, JsonCodec.getDefault());
  }

  @Bean
  @ConditionalOnMissingBean(ProcessedEventStore.class)
  public JdbcProcessedEventStore processedEventStore(JdbcDialect dialect, EventFlowProperties props) {
    return new JdbcProcessedEventStore(dialect, props.getTables().getProcessed(), JdbcTemplate.DEFAULT);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TransactionRunner.class)
  public SpringTransactionRunner transactionRunner(DataSource dataSource,
      ObjectProvider<PlatformTransactionManager> transactionManager) {
    return new SpringTransactionRunner(
        transactionManager.getIfAvailable(() -> new DataSourceTransactionManager(dataSource)));
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultConsumerRegistry consumerRegistry() {
    return new DefaultConsumerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public InboundEventRouter inboundEventRouter(DefaultConsumerRegistry consumerRegistry) {
    return new InboundEventRouter(consumerRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public EventFlowConsumerRegistrar eventFlowConsumerRegistrar(ListableBeanFactory beanFactory,
      DefaultConsumerRegistry consumerRegistry, ObjectProvider<EventFlow> eventFlow) {
    return new EventFlowConsumerRegistrar(beanFactory, consumerRegistry, eventFlow);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventFlow eventFlow(EventFlowProperties props,
      ConnectionProvider connectionProvider,
      TxContext txContext,
      TransactionRunner transactionRunner,
      EventStore eventStore,
      OutboxStore outboxStore,
      SagaStore sagaStore,
      ProcessedEventStore processedEventStore,
      ObjectProvider<EventBus> eventBusProvider,
      ObjectProvider<SagaDefinition> sagaProvider,
      ObjectProvider<LocalEventHandler> localHandlerProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var publisher = props.getPublisher();
    var saga = props.getSaga();
    var builder = EventFlow.builder()
        .serviceName(props.getServiceName())
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .transactionRunner(transactionRunner)
        .eventStore(eventStore)
        .outboxStore(outboxStore)
        .sagaStore(sagaStore)
        .processedEventStore(processedEventStore)
        .maxConflictRetries(props.getRepository().getMaxConflictRetries())
        .publisherRetryPolicy(new ExponentialBackoffRetryPolicy(
            props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
        .workerCount(publisher.getWorkerCount())
        .batchSize(publisher.getBatchSize())
        .maxEntriesPerCall(publisher.getMaxEntriesPerCall())
        .intervalMs(publisher.getIntervalMs())
        .maxAttempts(publisher.getMaxAttempts())
        .lockTimeout(publisher.getLockTimeout())
        .sagaMaxAttempts(saga.getMaxAttempts())
        .sagaTimerIntervalMs(saga.getTimerIntervalMs())
        .sagaTimerBatchSize(saga.getTimerBatchSize());
    if (publisher.getOwnerId() != null && !publisher.getOwnerId().isEmpty()) {
      builder.ownerId(publisher.getOwnerId());
    }
    var purge = props.getPurge();
    if (purge.isEnabled()) {
      builder.purgeRetention(purge.getRetention())
          .purgeInterval(Duration.ofMillis(purge.getIntervalMs()))
          .purgeBatchSize(purge.getBatchSize());
    }
    if (publisher.isEnabled()) {
      EventBus eventBus = eventBusProvider.getIfAvailable();
      if (eventBus != null) {
        builder.eventBus(eventBus);
      }
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    List<SagaDefinition> sagas = sagaProvider.orderedStream().toList();
    sagas.forEach(builder::saga);

    EventFlow flow = builder.build();
    localHandlerProvider.orderedStream().forEach(flow.localDispatcher()::register);
    if (!sagas.isEmpty()) {
      flow.localDispatcher().register(events -> events.forEach(flow.sagaCoordinator()::onEvent));
    }
    return flow;
  }

  @Bean
  @ConditionalOnMissingBean
  public OutboxWriter outboxWriter(EventFlow eventFlow) {
    return eventFlow.writer();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadEntryManager deadEntryManager(EventFlow eventFlow) {
    return eventFlow.deadEntries();
  }
}
