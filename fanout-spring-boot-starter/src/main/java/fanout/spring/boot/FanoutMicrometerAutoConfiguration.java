package fanout.spring.boot;

import fanout.micrometer.MicrometerMetricsExporter;
import fanout.spi.MetricsExporter;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers a {@link MicrometerMetricsExporter} when Micrometer and {@code fanout-micrometer}
 * are on the classpath. Disable with {@code fanout.metrics.enabled=false}.
 */
@AutoConfiguration(
    before = FanoutAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "fanout.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(FanoutProperties.class)
public class FanoutMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry registry, FanoutProperties props) {
    return new MicrometerMetricsExporter(registry, props.getMetrics().getNamePrefix());
  }
}
