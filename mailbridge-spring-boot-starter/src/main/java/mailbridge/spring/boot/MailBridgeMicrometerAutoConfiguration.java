package mailbridge.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import mailbridge.micrometer.MicrometerMetricsExporter;
import mailbridge.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code mailbridge.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link MailBridgeAutoConfiguration} so the exporter is injected into the
 * bridge.
 */
@AutoConfiguration(before = MailBridgeAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "mailbridge.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MailBridgeProperties.class)
public class MailBridgeMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, MailBridgeProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
