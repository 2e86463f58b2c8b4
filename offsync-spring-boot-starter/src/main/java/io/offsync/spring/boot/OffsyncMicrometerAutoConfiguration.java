package io.offsync.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.offsync.micrometer.MicrometerMetricsExporter;
import io.offsync.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code offsync.metrics.enabled} is true (default).
 *
 * <p>Runs after Boot's metrics auto-configuration, so an actuator-provided registry is
 * visible to the condition, and before {@link OffsyncAutoConfiguration} so the exporter is
 * injected into the {@link io.offsync.Offsync} composite.
 */
@AutoConfiguration(before = OffsyncAutoConfiguration.class, afterName = {
    "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"})
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "offsync.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(OffsyncProperties.class)
public class OffsyncMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, OffsyncProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
