package fanout.queue;

import fanout.model.DeadTask;
import fanout.model.DeliveryTask;
import fanout.spi.TaskQueue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Non-durable, delay-ordered {@link TaskQueue} for tests and embedded use.
 *
 * <p>Leases behave like the durable queue: a claimed task that is not acknowledged
 * within {@code leaseTimeout} becomes claimable again. Dead tasks are kept in memory and
 * can be inspected with {@link #deadTasks()}.
 *
 * <p>All operations are synchronized on the queue instance.
 */
public final class InMemoryTaskQueue implements TaskQueue {

  private static final Comparator<Entry> DUE_ORDER = Comparator
      .comparing((Entry e) -> e.availableAt)
      .thenComparing(e -> e.task.createdAt())
      .thenComparing(e -> e.task.taskId());

  private final Map<String, Entry> entries = new LinkedHashMap<>();
  private final List<DeadTask> dead = new ArrayList<>();
  private final Duration leaseTimeout;
  private final Clock clock;

  public InMemoryTaskQueue() {
    this(Duration.ofSeconds(150), Clock.systemUTC());
  }

  public InMemoryTaskQueue(Duration leaseTimeout, Clock clock) {
    this.leaseTimeout = Objects.requireNonNull(leaseTimeout, "leaseTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (leaseTimeout.isNegative() || leaseTimeout.isZero()) {
      throw new IllegalArgumentException("leaseTimeout must be positive");
    }
  }

  @Override
  public synchronized void enqueue(DeliveryTask task) {
    Objects.requireNonNull(task, "task");
    if (entries.containsKey(task.taskId())) {
      throw new IllegalStateException("Duplicate taskId: " + task.taskId());
    }
    entries.put(task.taskId(), new Entry(task, clock.instant()));
  }

  @Override
  public synchronized List<DeliveryTask> claim(int limit) {
    if (limit <= 0 || entries.isEmpty()) {
      return List.of();
    }
    Instant now = clock.instant();
    List<Entry> due = new ArrayList<>();
    for (Entry entry : entries.values()) {
      boolean leased = entry.leasedUntil != null && entry.leasedUntil.isAfter(now);
      if (!leased && !entry.availableAt.isAfter(now)) {
        due.add(entry);
      }
    }
    due.sort(DUE_ORDER);
    List<DeliveryTask> claimed = new ArrayList<>(Math.min(limit, due.size()));
    for (Entry entry : due) {
      if (claimed.size() >= limit) {
        break;
      }
      entry.leasedUntil = now.plus(leaseTimeout);
      claimed.add(entry.task);
    }
    return claimed;
  }

  @Override
  public synchronized void complete(DeliveryTask task) {
    entries.remove(task.taskId());
  }

  @Override
  public synchronized void retry(DeliveryTask task, Instant nextAttemptAt, String error) {
    Entry entry = entries.get(task.taskId());
    if (entry == null) {
      return;
    }
    entry.task = entry.task.withAttempts(entry.task.attempts() + 1);
    entry.availableAt = nextAttemptAt;
    entry.leasedUntil = null;
    entry.lastError = error;
  }

  @Override
  public synchronized void moveToDead(DeliveryTask task, String error) {
    Entry entry = entries.remove(task.taskId());
    if (entry == null) {
      return;
    }
    dead.add(new DeadTask(entry.task.withAttempts(entry.task.attempts() + 1), error, clock.instant()));
  }

  @Override
  public synchronized int depth() {
    return entries.size();
  }

  /** Returns a snapshot of the dead sink, oldest first. */
  public synchronized List<DeadTask> deadTasks() {
    return List.copyOf(dead);
  }

  /** Returns the last recorded error of a queued task, or {@code null}. */
  public synchronized String lastError(String taskId) {
    Entry entry = entries.get(taskId);
    return entry == null ? null : entry.lastError;
  }

  private static final class Entry {
    private DeliveryTask task;
    private Instant availableAt;
    private Instant leasedUntil;
    private String lastError;

    private Entry(DeliveryTask task, Instant availableAt) {
      this.task = task;
      this.availableAt = availableAt;
    }
  }
}
