package eventflow.spring.boot;

import eventflow.micrometer.MicrometerMetricsExporter;
import eventflow.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code eventflow.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link EventFlowAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the {@link eventflow.EventFlow} instance.
 */
@AutoConfiguration(before = EventFlowAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "eventflow.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EventFlowProperties.class)
public class EventFlowMicrometerAutoConfiguration {

  // Closed by EventFlow.close(), which removes its meters from the registry
  @Bean(destroyMethod = "")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, EventFlowProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
