package fanout.worker;

import fanout.completion.CompletionEvaluator;
import fanout.model.Content;
import fanout.model.ContentStatus;
import fanout.model.DeadTask;
import fanout.model.DeliveryLogEntry;
import fanout.model.DeliveryStatus;
import fanout.model.DeliveryTask;
import fanout.model.Subscriber;
import fanout.queue.ExponentialBackoffRetryPolicy;
import fanout.queue.InMemoryTaskQueue;
import fanout.spi.Mailer;
import fanout.spi.MailerException;
import fanout.testing.InMemoryFanoutStore;
import fanout.testing.MutableClock;
import fanout.testing.RecordingMetrics;
import fanout.testing.StubConnections;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryWorkerPoolTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);
  private final RecordingMetrics metrics = new RecordingMetrics();
  private InMemoryFanoutStore store;
  private InMemoryTaskQueue queue;
  private DeliveryWorkerPool pool;

  @BeforeEach
  void setUp() {
    store = new InMemoryFanoutStore();
    queue = new InMemoryTaskQueue(Duration.ofMinutes(5), clock);
  }

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  private DeliveryTask prepare(long contentId, long... subscriberIds) {
    Content content = store.addContent(contentId, 10L, "Title " + contentId, NOW);
    store.claimForProcessing(null, contentId);
    store.recordExpectedDeliveries(null, contentId, subscriberIds.length);
    DeliveryTask first = null;
    for (long id : subscriberIds) {
      DeliveryTask task = DeliveryTask.create(content, new Subscriber(id, "s" + id + "@example.com", true),
          content.title(), clock.instant());
      queue.enqueue(task);
      if (first == null) {
        first = task;
      }
    }
    return first;
  }

  private DeliveryWorkerPool pool(Mailer mailer, int maxAttempts, long attemptTimeoutMs) {
    CompletionEvaluator evaluator = new CompletionEvaluator(StubConnections.dummyProvider(), store, store,
        metrics, clock);
    pool = DeliveryWorkerPool.builder()
        .taskQueue(queue)
        .mailer(mailer)
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .retryPolicy(new ExponentialBackoffRetryPolicy(2000, 60_000))
        .maxAttempts(maxAttempts)
        .attemptTimeoutMs(attemptTimeoutMs)
        .workerCount(0)
        .metrics(metrics)
        .clock(clock)
        .build();
    return pool;
  }

  private DeliveryTask claimOne() {
    List<DeliveryTask> claimed = queue.claim(1);
    assertEquals(1, claimed.size());
    return claimed.get(0);
  }

  @Test
  void successfulDeliveryIsLoggedAndFinalizesContent() {
    prepare(1L, 100L);
    DeliveryWorkerPool workers = pool((to, subject, body) -> "<msg-1@example.com>", 3, 5000);

    assertEquals(DeliveryOutcome.SENT, workers.process(claimOne()));

    DeliveryLogEntry entry = store.findDeliveryLog(null, 1L, 100L).orElseThrow();
    assertEquals(DeliveryStatus.SENT, entry.status());
    assertEquals("<msg-1@example.com>", entry.messageId());
    assertEquals(NOW, entry.sentAt());
    assertEquals(0, queue.depth());
    assertEquals(ContentStatus.SENT, store.content(1L).status());
    assertEquals(1, metrics.sent.get());
  }

  @Test
  void alwaysFailingMailerIsCalledExactlyMaxAttemptsTimes() {
    prepare(1L, 100L);
    AtomicInteger calls = new AtomicInteger();
    DeliveryWorkerPool workers = pool((to, subject, body) -> {
      calls.incrementAndGet();
      throw new MailerException("550 mailbox unavailable");
    }, 3, 5000);

    assertEquals(DeliveryOutcome.RETRY_SCHEDULED, workers.process(claimOne()));
    DeliveryLogEntry pending = store.findDeliveryLog(null, 1L, 100L).orElseThrow();
    assertEquals(DeliveryStatus.PENDING, pending.status());
    assertEquals("550 mailbox unavailable", pending.errorMessage());
    assertTrue(queue.claim(1).isEmpty(), "retry must wait for its backoff");

    clock.advance(Duration.ofSeconds(2));
    assertEquals(DeliveryOutcome.RETRY_SCHEDULED, workers.process(claimOne()));
    assertTrue(queue.claim(1).isEmpty());

    clock.advance(Duration.ofSeconds(4));
    assertEquals(DeliveryOutcome.FAILED, workers.process(claimOne()));

    assertEquals(3, calls.get());
    DeliveryLogEntry failed = store.findDeliveryLog(null, 1L, 100L).orElseThrow();
    assertEquals(DeliveryStatus.FAILED, failed.status());
    assertEquals("550 mailbox unavailable", failed.errorMessage());
    List<DeadTask> dead = queue.deadTasks();
    assertEquals(1, dead.size());
    assertEquals(3, dead.get(0).task().attempts());
    assertEquals(ContentStatus.SENT, store.content(1L).status());
    assertEquals(2, metrics.retried.get());
    assertEquals(1, metrics.failed.get());
  }

  @Test
  void transientFailureThenSuccess() {
    prepare(1L, 100L);
    AtomicInteger calls = new AtomicInteger();
    DeliveryWorkerPool workers = pool((to, subject, body) -> {
      if (calls.incrementAndGet() == 1) {
        throw new MailerException("421 try again later");
      }
      return "<ok@example.com>";
    }, 3, 5000);

    assertEquals(DeliveryOutcome.RETRY_SCHEDULED, workers.process(claimOne()));
    clock.advance(Duration.ofSeconds(2));
    assertEquals(DeliveryOutcome.SENT, workers.process(claimOne()));

    assertEquals(DeliveryStatus.SENT, store.findDeliveryLog(null, 1L, 100L).orElseThrow().status());
    assertTrue(queue.deadTasks().isEmpty());
    assertEquals(ContentStatus.SENT, store.content(1L).status());
  }

  @Test
  void attemptExceedingTimeoutCountsAsFailure() {
    prepare(1L, 100L);
    DeliveryWorkerPool workers = pool((to, subject, body) -> {
      try {
        Thread.sleep(5000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return "late";
    }, 1, 100);

    long started = System.nanoTime();
    assertEquals(DeliveryOutcome.FAILED, workers.process(claimOne()));
    assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 4000);

    DeliveryLogEntry entry = store.findDeliveryLog(null, 1L, 100L).orElseThrow();
    assertEquals(DeliveryStatus.FAILED, entry.status());
    assertTrue(entry.errorMessage().contains("timed out"), entry.errorMessage());
  }

  @Test
  void alreadyResolvedPairIsNotSentAgain() {
    prepare(1L, 100L);
    store.upsertDeliveryLog(null, 1L, 100L, DeliveryStatus.SENT, "<earlier@example.com>", null, NOW);
    AtomicInteger calls = new AtomicInteger();
    DeliveryWorkerPool workers = pool((to, subject, body) -> {
      calls.incrementAndGet();
      return "dup";
    }, 3, 5000);

    assertEquals(DeliveryOutcome.ALREADY_RESOLVED, workers.process(claimOne()));

    assertEquals(0, calls.get());
    assertEquals(0, queue.depth());
    assertEquals("<earlier@example.com>", store.findDeliveryLog(null, 1L, 100L).orElseThrow().messageId());
  }

  @Test
  void contentWaitsForAllSubscribers() {
    prepare(1L, 100L, 101L);
    DeliveryWorkerPool workers = pool((to, subject, body) -> "id-" + to, 3, 5000);

    assertEquals(DeliveryOutcome.SENT, workers.process(claimOne()));
    assertEquals(ContentStatus.PROCESSING, store.content(1L).status());

    assertEquals(DeliveryOutcome.SENT, workers.process(claimOne()));
    assertEquals(ContentStatus.SENT, store.content(1L).status());
  }

  @Test
  void feedMovesClaimedTasksIntoBuffer() {
    prepare(1L, 100L, 101L, 102L);
    DeliveryWorkerPool workers = pool((to, subject, body) -> "id", 3, 5000);

    assertEquals(3, workers.feed());
    assertEquals(3, workers.buffered());
    assertEquals(0, workers.feed());
  }

  @Test
  void startedPoolDeliversQueuedTasks() throws Exception {
    prepare(1L, 100L, 101L, 102L, 103L);
    AtomicInteger calls = new AtomicInteger();
    CompletionEvaluator evaluator = new CompletionEvaluator(StubConnections.dummyProvider(), store, store,
        metrics, clock);
    pool = DeliveryWorkerPool.builder()
        .taskQueue(queue)
        .mailer((to, subject, body) -> "id-" + calls.incrementAndGet())
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .workerCount(2)
        .pollIntervalMs(20)
        .clock(clock)
        .build();
    pool.start();

    long deadline = System.currentTimeMillis() + 5000;
    while (store.content(1L).status() != ContentStatus.SENT && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    assertEquals(ContentStatus.SENT, store.content(1L).status());
    assertEquals(4, calls.get());
  }

  @Test
  void feedClaimsNoMoreThanIdleWorkers() {
    prepare(1L, 100L, 101L, 102L, 103L, 104L);
    CompletionEvaluator evaluator = new CompletionEvaluator(StubConnections.dummyProvider(), store, store,
        metrics, clock);
    pool = DeliveryWorkerPool.builder()
        .taskQueue(queue)
        .mailer((to, subject, body) -> "id")
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .workerCount(2)
        .clock(clock)
        .build();

    assertEquals(2, pool.feed());
    assertEquals(0, pool.feed());
    assertEquals(2, pool.buffered());
  }

  @Test
  void slowMailerWithShortLeaseSendsEachRecipientOnce() throws Exception {
    Clock realClock = Clock.systemUTC();
    InMemoryTaskQueue shortLeaseQueue = new InMemoryTaskQueue(Duration.ofMillis(1000), realClock);
    Content content = store.addContent(1L, 10L, "Digest", NOW);
    store.claimForProcessing(null, 1L);
    int subscribers = 100;
    store.recordExpectedDeliveries(null, 1L, subscribers);
    for (long id = 1; id <= subscribers; id++) {
      shortLeaseQueue.enqueue(DeliveryTask.create(content, new Subscriber(id, "r" + id + "@example.com", true),
          content.title(), NOW));
    }
    Map<String, AtomicInteger> sends = new ConcurrentHashMap<>();
    CompletionEvaluator evaluator = new CompletionEvaluator(StubConnections.dummyProvider(), store, store,
        metrics, clock);
    pool = DeliveryWorkerPool.builder()
        .taskQueue(shortLeaseQueue)
        .mailer((to, subject, body) -> {
          sends.computeIfAbsent(to, k -> new AtomicInteger()).incrementAndGet();
          try {
            Thread.sleep(150);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return "<" + to + ">";
        })
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .workerCount(10)
        .attemptTimeoutMs(800)
        .leaseTimeoutMs(1000)
        .pollIntervalMs(20)
        .clock(realClock)
        .build();
    pool.start();

    long deadline = System.currentTimeMillis() + 20_000;
    while (store.content(1L).status() != ContentStatus.SENT && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }

    assertEquals(ContentStatus.SENT, store.content(1L).status());
    assertEquals(subscribers, sends.size());
    for (Map.Entry<String, AtomicInteger> e : sends.entrySet()) {
      assertEquals(1, e.getValue().get(), "sends to " + e.getKey());
    }
  }

  @Test
  void taskWhoseLeaseRunsOutBeforeSendingIsLeftForRedelivery() throws Exception {
    prepare(1L, 100L);
    AtomicInteger calls = new AtomicInteger();
    AtomicBoolean firstAcquire = new AtomicBoolean(true);
    CompletionEvaluator evaluator = new CompletionEvaluator(StubConnections.dummyProvider(), store, store,
        metrics, clock);
    InMemoryTaskQueue leasedQueue = new InMemoryTaskQueue(Duration.ofMillis(1000), clock);
    leasedQueue.enqueue(queue.claim(1).get(0));
    pool = DeliveryWorkerPool.builder()
        .taskQueue(leasedQueue)
        .mailer((to, subject, body) -> "id-" + calls.incrementAndGet())
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .rateLimiter(() -> {
          if (firstAcquire.compareAndSet(true, false)) {
            clock.advance(Duration.ofMillis(600));
          }
          return 0L;
        })
        .workerCount(1)
        .attemptTimeoutMs(500)
        .leaseTimeoutMs(1000)
        .pollIntervalMs(20)
        .clock(clock)
        .build();
    pool.start();

    Thread.sleep(300);
    assertEquals(0, calls.get());
    assertFalse(firstAcquire.get());
    assertEquals(1, leasedQueue.depth());

    clock.advance(Duration.ofSeconds(1));
    long deadline = System.currentTimeMillis() + 5000;
    while (store.content(1L).status() != ContentStatus.SENT && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    assertEquals(ContentStatus.SENT, store.content(1L).status());
    assertEquals(1, calls.get());
    assertEquals(0, leasedQueue.depth());
  }

  @Test
  void attemptsIgnoringInterruptsDoNotGrowTheAttemptThreads() {
    prepare(1L, 100L, 101L, 102L, 103L);
    CountDownLatch release = new CountDownLatch(1);
    Set<Thread> attemptThreads = ConcurrentHashMap.newKeySet();
    CompletionEvaluator evaluator = new CompletionEvaluator(StubConnections.dummyProvider(), store, store,
        metrics, clock);
    pool = DeliveryWorkerPool.builder()
        .taskQueue(queue)
        .mailer((to, subject, body) -> {
          attemptThreads.add(Thread.currentThread());
          boolean done = false;
          while (!done) {
            try {
              done = release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ignored) {
              // keeps running after cancellation
            }
          }
          return "late";
        })
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .maxAttempts(5)
        .attemptTimeoutMs(50)
        .workerCount(2)
        .clock(clock)
        .build();

    try {
      for (DeliveryTask task : queue.claim(4)) {
        assertEquals(DeliveryOutcome.RETRY_SCHEDULED, pool.process(task));
      }
      assertTrue(attemptThreads.size() <= 2, "attempt threads: " + attemptThreads.size());
    } finally {
      release.countDown();
    }
  }

  @Test
  void rejectsInvalidConfiguration() {
    CompletionEvaluator evaluator = new CompletionEvaluator(StubConnections.dummyProvider(), store, store,
        metrics, clock);
    assertThrows(IllegalArgumentException.class, () -> DeliveryWorkerPool.builder()
        .taskQueue(queue)
        .mailer((to, subject, body) -> "id")
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .maxAttempts(0)
        .build());
    assertThrows(IllegalArgumentException.class, () -> DeliveryWorkerPool.builder()
        .taskQueue(queue)
        .mailer((to, subject, body) -> "id")
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .attemptTimeoutMs(1000)
        .leaseTimeoutMs(1000)
        .build());
    assertThrows(NullPointerException.class, () -> DeliveryWorkerPool.builder()
        .taskQueue(queue)
        .connectionProvider(StubConnections.dummyProvider())
        .deliveryLogStore(store)
        .completionEvaluator(evaluator)
        .build());
  }
}
