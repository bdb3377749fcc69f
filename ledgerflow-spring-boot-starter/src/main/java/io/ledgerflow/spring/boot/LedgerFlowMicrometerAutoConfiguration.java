package io.ledgerflow.spring.boot;

import io.ledgerflow.micrometer.MicrometerMetricsExporter;
import io.ledgerflow.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code ledgerflow.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link LedgerFlowAutoConfiguration} so the exporter is wired into the
 * account queues and notification manager.
 */
@AutoConfiguration(before = LedgerFlowAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "ledgerflow.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LedgerFlowProperties.class)
public class LedgerFlowMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, LedgerFlowProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
