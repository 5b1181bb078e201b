package fanout.spring.boot;

import fanout.FanoutConfig;
import fanout.FanoutEngine;
import fanout.jdbc.DataSourceConnectionProvider;
import fanout.jdbc.store.AbstractJdbcFanoutStore;
import fanout.jdbc.store.JdbcFanoutStores;
import fanout.spi.ConnectionProvider;
import fanout.spi.Mailer;
import fanout.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the fan-out engine.
 *
 * <p>Detects the JDBC store from the {@link DataSource} and, once a {@link Mailer} bean is
 * available, starts a {@link FanoutEngine} that is closed with the application context.
 *
 * @see FanoutProperties
 * @see FanoutMailAutoConfiguration
 * @see FanoutMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, FanoutMailAutoConfiguration.class})
@ConditionalOnClass(FanoutEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(FanoutProperties.class)
public class FanoutAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcFanoutStore fanoutStore(DataSource dataSource) {
    return JdbcFanoutStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public ConnectionProvider fanoutConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(Mailer.class)
  public FanoutEngine fanoutEngine(
      AbstractJdbcFanoutStore store,
      ConnectionProvider connectionProvider,
      Mailer mailer,
      FanoutProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    return FanoutEngine.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .mailer(mailer)
        .metrics(metrics != null ? metrics : MetricsExporter.NOOP)
        .config(toConfig(props))
        .build();
  }

  static FanoutConfig toConfig(FanoutProperties props) {
    FanoutProperties.Worker worker = props.getWorker();
    FanoutConfig config = new FanoutConfig()
        .setPollIntervalMs(props.getScheduler().getPollInterval().toMillis())
        .setBatchSize(props.getScheduler().getBatchSize())
        .setWorkerCount(worker.getPoolSize())
        .setAttemptTimeoutMs(worker.getAttemptTimeout().toMillis())
        .setBufferCapacity(worker.getBufferCapacity())
        .setQueuePollIntervalMs(worker.getPollInterval().toMillis())
        .setDrainTimeoutMs(worker.getDrainTimeout().toMillis())
        .setEmailsPerSecond(props.getRateLimit().getEmailsPerSecond())
        .setMaxAttempts(props.getRetry().getMaxAttempts())
        .setRetryBaseDelayMs(props.getRetry().getBaseDelay().toMillis())
        .setRetryMaxDelayMs(props.getRetry().getMaxDelay().toMillis())
        .setPurgeEnabled(props.getPurge().isEnabled())
        .setDeadRetentionMs(props.getPurge().getRetention().toMillis())
        .setPurgeIntervalSeconds(props.getPurge().getIntervalSeconds())
        .setPurgeBatchSize(props.getPurge().getBatchSize())
        .setDefaultSubject(props.getDefaultSubject());
    if (worker.getLeaseTimeout() != null) {
      config.setLeaseTimeoutMs(worker.getLeaseTimeout().toMillis());
    }
    return config;
  }
}
