package fanout;

/**
 * Tunables for {@link FanoutEngine}. Setters are fluent; all values have defaults.
 */
public final class FanoutConfig {
  private long pollIntervalMs = 60_000L;
  private int batchSize = 10;

  private int workerCount = 10;
  private int emailsPerSecond = 10;
  private long attemptTimeoutMs = 120_000L;
  private int bufferCapacity = 100;
  private long queuePollIntervalMs = 250L;
  private long drainTimeoutMs = 5000L;
  private long leaseTimeoutMs;

  private int maxAttempts = 3;
  private long retryBaseDelayMs = 2000L;
  private long retryMaxDelayMs = 60_000L;

  private boolean purgeEnabled = true;
  private long deadRetentionMs = 24L * 60 * 60 * 1000;
  private long purgeIntervalSeconds = 3600L;
  private int purgeBatchSize = 500;

  private String defaultSubject = "Newsletter";

  public long getPollIntervalMs() {
    return pollIntervalMs;
  }

  public FanoutConfig setPollIntervalMs(long pollIntervalMs) {
    this.pollIntervalMs = pollIntervalMs;
    return this;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public FanoutConfig setBatchSize(int batchSize) {
    this.batchSize = batchSize;
    return this;
  }

  public int getWorkerCount() {
    return workerCount;
  }

  public FanoutConfig setWorkerCount(int workerCount) {
    this.workerCount = workerCount;
    return this;
  }

  public int getEmailsPerSecond() {
    return emailsPerSecond;
  }

  public FanoutConfig setEmailsPerSecond(int emailsPerSecond) {
    this.emailsPerSecond = emailsPerSecond;
    return this;
  }

  public long getAttemptTimeoutMs() {
    return attemptTimeoutMs;
  }

  public FanoutConfig setAttemptTimeoutMs(long attemptTimeoutMs) {
    this.attemptTimeoutMs = attemptTimeoutMs;
    return this;
  }

  public int getBufferCapacity() {
    return bufferCapacity;
  }

  public FanoutConfig setBufferCapacity(int bufferCapacity) {
    this.bufferCapacity = bufferCapacity;
    return this;
  }

  public long getQueuePollIntervalMs() {
    return queuePollIntervalMs;
  }

  public FanoutConfig setQueuePollIntervalMs(long queuePollIntervalMs) {
    this.queuePollIntervalMs = queuePollIntervalMs;
    return this;
  }

  public long getDrainTimeoutMs() {
    return drainTimeoutMs;
  }

  public FanoutConfig setDrainTimeoutMs(long drainTimeoutMs) {
    this.drainTimeoutMs = drainTimeoutMs;
    return this;
  }

  /**
   * Lease duration for claimed tasks. Unless set explicitly, the attempt timeout plus 30 s.
   */
  public long getLeaseTimeoutMs() {
    return leaseTimeoutMs > 0 ? leaseTimeoutMs : attemptTimeoutMs + 30_000L;
  }

  public FanoutConfig setLeaseTimeoutMs(long leaseTimeoutMs) {
    this.leaseTimeoutMs = leaseTimeoutMs;
    return this;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public FanoutConfig setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public long getRetryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public FanoutConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
    this.retryBaseDelayMs = retryBaseDelayMs;
    return this;
  }

  public long getRetryMaxDelayMs() {
    return retryMaxDelayMs;
  }

  public FanoutConfig setRetryMaxDelayMs(long retryMaxDelayMs) {
    this.retryMaxDelayMs = retryMaxDelayMs;
    return this;
  }

  public boolean isPurgeEnabled() {
    return purgeEnabled;
  }

  public FanoutConfig setPurgeEnabled(boolean purgeEnabled) {
    this.purgeEnabled = purgeEnabled;
    return this;
  }

  public long getDeadRetentionMs() {
    return deadRetentionMs;
  }

  public FanoutConfig setDeadRetentionMs(long deadRetentionMs) {
    this.deadRetentionMs = deadRetentionMs;
    return this;
  }

  public long getPurgeIntervalSeconds() {
    return purgeIntervalSeconds;
  }

  public FanoutConfig setPurgeIntervalSeconds(long purgeIntervalSeconds) {
    this.purgeIntervalSeconds = purgeIntervalSeconds;
    return this;
  }

  public int getPurgeBatchSize() {
    return purgeBatchSize;
  }

  public FanoutConfig setPurgeBatchSize(int purgeBatchSize) {
    this.purgeBatchSize = purgeBatchSize;
    return this;
  }

  public String getDefaultSubject() {
    return defaultSubject;
  }

  public FanoutConfig setDefaultSubject(String defaultSubject) {
    this.defaultSubject = defaultSubject;
    return this;
  }
}
