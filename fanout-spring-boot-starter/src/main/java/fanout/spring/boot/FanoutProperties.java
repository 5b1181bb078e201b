package fanout.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the fan-out engine, bound under {@code fanout.*}.
 *
 * @see FanoutAutoConfiguration
 */
@ConfigurationProperties(prefix = "fanout")
public class FanoutProperties {

  /** Subject used when a content item has no title. */
  private String defaultSubject = "Newsletter";

  private final Scheduler scheduler = new Scheduler();
  private final Worker worker = new Worker();
  private final RateLimit rateLimit = new RateLimit();
  private final Retry retry = new Retry();
  private final Purge purge = new Purge();
  private final Metrics metrics = new Metrics();
  private final Mail mail = new Mail();

  public String getDefaultSubject() {
    return defaultSubject;
  }

  public void setDefaultSubject(String defaultSubject) {
    this.defaultSubject = defaultSubject;
  }

  public Scheduler getScheduler() {
    return scheduler;
  }

  public Worker getWorker() {
    return worker;
  }

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public Retry getRetry() {
    return retry;
  }

  public Purge getPurge() {
    return purge;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Mail getMail() {
    return mail;
  }

  public static class Scheduler {
    /** Interval between discovery passes over due content. */
    private Duration pollInterval = Duration.ofSeconds(60);
    /** Maximum content items claimed per pass. */
    private int batchSize = 10;

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }

  public static class Worker {
    private int poolSize = 10;
    private Duration attemptTimeout = Duration.ofSeconds(120);
    private int bufferCapacity = 100;
    /** How often the feeder polls the task queue when it is empty. */
    private Duration pollInterval = Duration.ofMillis(250);
    private Duration drainTimeout = Duration.ofSeconds(5);
    /** Lease on claimed tasks. Defaults to the attempt timeout plus 30 seconds when unset. */
    private Duration leaseTimeout;

    public int getPoolSize() {
      return poolSize;
    }

    public void setPoolSize(int poolSize) {
      this.poolSize = poolSize;
    }

    public Duration getAttemptTimeout() {
      return attemptTimeout;
    }

    public void setAttemptTimeout(Duration attemptTimeout) {
      this.attemptTimeout = attemptTimeout;
    }

    public int getBufferCapacity() {
      return bufferCapacity;
    }

    public void setBufferCapacity(int bufferCapacity) {
      this.bufferCapacity = bufferCapacity;
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public Duration getDrainTimeout() {
      return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
    }

    public Duration getLeaseTimeout() {
      return leaseTimeout;
    }

    public void setLeaseTimeout(Duration leaseTimeout) {
      this.leaseTimeout = leaseTimeout;
    }
  }

  public static class RateLimit {
    private int emailsPerSecond = 10;

    public int getEmailsPerSecond() {
      return emailsPerSecond;
    }

    public void setEmailsPerSecond(int emailsPerSecond) {
      this.emailsPerSecond = emailsPerSecond;
    }
  }

  public static class Retry {
    /** Total delivery attempts, the first one included. */
    private int maxAttempts = 3;
    private Duration baseDelay = Duration.ofSeconds(2);
    private Duration maxDelay = Duration.ofSeconds(60);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }

  public static class Purge {
    private boolean enabled = true;
    /** How long dead tasks are kept before they are deleted. */
    private Duration retention = Duration.ofHours(24);
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "fanout";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  public static class Mail {
    /** Sender address. Falls back to the mail session default when unset. */
    private String fromAddress;
    private String fromName = "Newsletter Service";

    public String getFromAddress() {
      return fromAddress;
    }

    public void setFromAddress(String fromAddress) {
      this.fromAddress = fromAddress;
    }

    public String getFromName() {
      return fromName;
    }

    public void setFromName(String fromName) {
      this.fromName = fromName;
    }
  }
}
