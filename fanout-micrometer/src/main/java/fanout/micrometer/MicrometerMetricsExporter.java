package fanout.micrometer;

import fanout.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code fanout.tick}: discovery passes started</li>
 *   <li>{@code fanout.tick.skipped}: ticks skipped because a pass was still running</li>
 *   <li>{@code fanout.claim.success} / {@code fanout.claim.conflict}: content claims won and lost</li>
 *   <li>{@code fanout.enqueue} / {@code fanout.enqueue.failed}: delivery tasks enqueued or rejected</li>
 *   <li>{@code fanout.delivery.sent}, {@code fanout.delivery.retried}, {@code fanout.delivery.failed}:
 *       per-attempt outcomes</li>
 *   <li>{@code fanout.content.finalized}: content moved to SENT</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code fanout.queue.depth}: ready and retrying tasks</li>
 *   <li>{@code fanout.ratelimit.wait.ms}: last rate limiter wait</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter ticks;
  private final Counter ticksSkipped;
  private final Counter claimSuccess;
  private final Counter claimConflict;
  private final Counter enqueued;
  private final Counter enqueueFailed;
  private final Counter deliverySent;
  private final Counter deliveryRetried;
  private final Counter deliveryFailed;
  private final Counter contentFinalized;
  private final Gauge queueDepthGauge;
  private final Gauge rateLimitWaitGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicLong rateLimitWaitMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "fanout"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "fanout");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "newsletter.fanout"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.ticks = counter(namePrefix + ".tick", "Discovery passes started");
    this.ticksSkipped = counter(namePrefix + ".tick.skipped", "Ticks skipped while a pass was running");
    this.claimSuccess = counter(namePrefix + ".claim.success", "Content items claimed");
    this.claimConflict = counter(namePrefix + ".claim.conflict", "Content claims lost to another actor");
    this.enqueued = counter(namePrefix + ".enqueue", "Delivery tasks enqueued");
    this.enqueueFailed = counter(namePrefix + ".enqueue.failed", "Delivery tasks that could not be enqueued");
    this.deliverySent = counter(namePrefix + ".delivery.sent", "Deliveries sent");
    this.deliveryRetried = counter(namePrefix + ".delivery.retried", "Delivery attempts failed and rescheduled");
    this.deliveryFailed = counter(namePrefix + ".delivery.failed", "Deliveries failed after the last attempt");
    this.contentFinalized = counter(namePrefix + ".content.finalized", "Content items finalized as sent");

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.rateLimitWaitGauge = Gauge.builder(namePrefix + ".ratelimit.wait.ms", rateLimitWaitMs, AtomicLong::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementTicks() {
    if (closed) return;
    ticks.increment();
  }

  @Override
  public void incrementTicksSkipped() {
    if (closed) return;
    ticksSkipped.increment();
  }

  @Override
  public void incrementClaimSuccess() {
    if (closed) return;
    claimSuccess.increment();
  }

  @Override
  public void incrementClaimConflict() {
    if (closed) return;
    claimConflict.increment();
  }

  @Override
  public void incrementEnqueued(int count) {
    if (closed || count <= 0) return;
    enqueued.increment(count);
  }

  @Override
  public void incrementEnqueueFailed() {
    if (closed) return;
    enqueueFailed.increment();
  }

  @Override
  public void incrementDeliverySent() {
    if (closed) return;
    deliverySent.increment();
  }

  @Override
  public void incrementDeliveryRetried() {
    if (closed) return;
    deliveryRetried.increment();
  }

  @Override
  public void incrementDeliveryFailed() {
    if (closed) return;
    deliveryFailed.increment();
  }

  @Override
  public void incrementContentFinalized() {
    if (closed) return;
    contentFinalized.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordRateLimitWaitMs(long waitMs) {
    if (closed) return;
    rateLimitWaitMs.set(waitMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   * {@link fanout.FanoutEngine#close()} calls this on shutdown.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(ticks, ticksSkipped, claimSuccess, claimConflict, enqueued,
        enqueueFailed, deliverySent, deliveryRetried, deliveryFailed, contentFinalized,
        queueDepthGauge, rateLimitWaitGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
