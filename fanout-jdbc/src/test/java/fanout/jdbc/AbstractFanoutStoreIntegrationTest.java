package fanout.jdbc;

import fanout.jdbc.store.AbstractJdbcFanoutStore;
import fanout.model.Content;
import fanout.model.ContentStatus;
import fanout.model.DeadTask;
import fanout.model.DeliveryLogEntry;
import fanout.model.DeliveryStats;
import fanout.model.DeliveryStatus;
import fanout.model.DeliveryTask;
import fanout.model.Subscriber;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behavior shared by every database. Subclasses supply an empty schema per test.
 */
abstract class AbstractFanoutStoreIntegrationTest {

  protected static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

  abstract DataSource dataSource();

  abstract AbstractJdbcFanoutStore store();

  private long topicWithSubscribers(Connection conn, String name, int active, int inactive) throws Exception {
    long topicId = TestSchema.insertTopic(conn, name);
    for (int i = 0; i < active; i++) {
      TestSchema.subscribe(conn, TestSchema.insertSubscriber(conn, name + "-a" + i + "@example.com", true), topicId);
    }
    for (int i = 0; i < inactive; i++) {
      TestSchema.subscribe(conn, TestSchema.insertSubscriber(conn, name + "-i" + i + "@example.com", false), topicId);
    }
    return topicId;
  }

  private DeliveryTask task(long contentId, long subscriberId, Instant createdAt) {
    Content content = new Content(contentId, 1L, "T", "Body", createdAt, ContentStatus.PROCESSING, false, null);
    return DeliveryTask.create(content, new Subscriber(subscriberId, "s" + subscriberId + "@example.com", true),
        "T", createdAt);
  }

  @Test
  void findDueContentReturnsPendingDueRowsInScheduleOrder() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      long topic = TestSchema.insertTopic(conn, "news");
      long later = TestSchema.insertContent(conn, topic, "later", "b", NOW.minusSeconds(10));
      long earlier = TestSchema.insertContent(conn, topic, "earlier", "b", NOW.minusSeconds(100));
      TestSchema.insertContent(conn, topic, "future", "b", NOW.plusSeconds(600));
      long claimed = TestSchema.insertContent(conn, topic, "claimed", "b", NOW.minusSeconds(50));
      assertTrue(store().claimForProcessing(conn, claimed));

      List<Content> due = store().findDueContent(conn, NOW, 10);

      assertEquals(List.of(earlier, later), due.stream().map(Content::id).toList());
      Content first = due.get(0);
      assertEquals(topic, first.topicId());
      assertEquals("earlier", first.title());
      assertEquals(ContentStatus.PENDING, first.status());
      assertFalse(first.sent());
      assertNull(first.sentAt());
      assertEquals(1, store().findDueContent(conn, NOW, 1).size());
    }
  }

  @Test
  void claimSucceedsOnlyOnce() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      long topic = TestSchema.insertTopic(conn, "news");
      long id = TestSchema.insertContent(conn, topic, "t", "b", NOW);

      assertTrue(store().claimForProcessing(conn, id));
      assertFalse(store().claimForProcessing(conn, id));
      assertEquals("processing", TestSchema.contentStatus(conn, id));
    }
  }

  @Test
  void concurrentClaimsHaveExactlyOneWinner() throws Exception {
    long id;
    try (Connection conn = dataSource().getConnection()) {
      id = TestSchema.insertContent(conn, TestSchema.insertTopic(conn, "news"), "t", "b", NOW);
    }
    int threads = 6;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        Callable<Boolean> claim = () -> {
          start.await();
          try (Connection conn = dataSource().getConnection()) {
            return store().claimForProcessing(conn, id);
          }
        };
        results.add(pool.submit(claim));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> f : results) {
        if (f.get()) winners++;
      }
      assertEquals(1, winners);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void finalizeRequiresProcessingAndHappensOnce() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      long id = TestSchema.insertContent(conn, TestSchema.insertTopic(conn, "news"), "t", "b", NOW);

      assertFalse(store().finalizeAsSent(conn, id, NOW));
      assertTrue(store().claimForProcessing(conn, id));
      assertTrue(store().finalizeAsSent(conn, id, NOW));
      assertFalse(store().finalizeAsSent(conn, id, NOW));

      assertEquals("sent", TestSchema.contentStatus(conn, id));
      assertEquals(1, TestSchema.count(conn, "SELECT COUNT(*) FROM content WHERE id = ? AND is_sent = TRUE", id));
      assertTrue(store().findDueContent(conn, NOW.plusSeconds(60), 10).isEmpty());
    }
  }

  @Test
  void expectedDeliveriesAreEmptyUntilRecorded() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      long id = TestSchema.insertContent(conn, TestSchema.insertTopic(conn, "news"), "t", "b", NOW);

      assertEquals(OptionalInt.empty(), store().countExpectedDeliveries(conn, id));
      store().recordExpectedDeliveries(conn, id, 3);
      assertEquals(OptionalInt.of(3), store().countExpectedDeliveries(conn, id));
      assertEquals(OptionalInt.empty(), store().countExpectedDeliveries(conn, id + 1000));
    }
  }

  @Test
  void activeSubscribersAreScopedToTopic() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      long news = topicWithSubscribers(conn, "news", 3, 2);
      long sports = topicWithSubscribers(conn, "sports", 1, 0);
      long empty = topicWithSubscribers(conn, "empty", 0, 1);

      List<Subscriber> subscribers = store().activeSubscribersForTopic(conn, news);
      assertEquals(3, subscribers.size());
      assertTrue(subscribers.stream().allMatch(Subscriber::active));
      assertTrue(subscribers.stream().allMatch(s -> s.email().startsWith("news-a")));
      assertEquals(1, store().activeSubscribersForTopic(conn, sports).size());
      assertTrue(store().activeSubscribersForTopic(conn, empty).isEmpty());
    }
  }

  @Test
  void deliveryLogUpsertKeepsOneRowPerPair() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      store().upsertDeliveryLog(conn, 1L, 10L, DeliveryStatus.PENDING, null, "timeout", null);
      store().upsertDeliveryLog(conn, 1L, 10L, DeliveryStatus.PENDING, null, "timeout again", null);
      store().upsertDeliveryLog(conn, 1L, 10L, DeliveryStatus.SENT, "<m1>", null, NOW);
      store().upsertDeliveryLog(conn, 1L, 11L, DeliveryStatus.FAILED, null, "550", NOW);
      store().upsertDeliveryLog(conn, 1L, 12L, DeliveryStatus.PENDING, null, "421", null);

      assertEquals(1, TestSchema.count(conn,
          "SELECT COUNT(*) FROM delivery_log WHERE content_id = ? AND subscriber_id = ?", 1L, 10L));
      DeliveryLogEntry entry = store().findDeliveryLog(conn, 1L, 10L).orElseThrow();
      assertEquals(DeliveryStatus.SENT, entry.status());
      assertEquals("<m1>", entry.messageId());
      assertNull(entry.errorMessage());
      assertEquals(NOW, entry.sentAt());
      assertTrue(store().findDeliveryLog(conn, 2L, 10L).isEmpty());

      assertEquals(2, store().countResolvedDeliveries(conn, 1L));
      DeliveryStats stats = store().deliveryStats(conn, 1L);
      assertEquals(1, stats.sent());
      assertEquals(1, stats.failed());
      assertEquals(1, stats.pending());
      assertEquals(3, stats.total());
    }
  }

  @Test
  void pendingUpsertDoesNotDowngradeTerminalRow() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      store().upsertDeliveryLog(conn, 1L, 10L, DeliveryStatus.SENT, "<m1>", null, NOW);
      store().upsertDeliveryLog(conn, 1L, 10L, DeliveryStatus.PENDING, null, "late retry", null);
      store().upsertDeliveryLog(conn, 1L, 11L, DeliveryStatus.FAILED, null, "bounced", NOW);
      store().upsertDeliveryLog(conn, 1L, 11L, DeliveryStatus.PENDING, null, "late retry", null);

      DeliveryLogEntry sent = store().findDeliveryLog(conn, 1L, 10L).orElseThrow();
      assertEquals(DeliveryStatus.SENT, sent.status());
      assertEquals("<m1>", sent.messageId());
      assertEquals(DeliveryStatus.FAILED, store().findDeliveryLog(conn, 1L, 11L).orElseThrow().status());
      assertEquals(2, store().countResolvedDeliveries(conn, 1L));
    }
  }

  @Test
  void pendingRowIsUpgradedToTerminal() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      store().upsertDeliveryLog(conn, 1L, 10L, DeliveryStatus.PENDING, null, "timeout", null);
      store().upsertDeliveryLog(conn, 1L, 10L, DeliveryStatus.SENT, "<m2>", null, NOW);

      DeliveryLogEntry entry = store().findDeliveryLog(conn, 1L, 10L).orElseThrow();
      assertEquals(DeliveryStatus.SENT, entry.status());
      assertEquals("<m2>", entry.messageId());
      assertNull(entry.errorMessage());
      assertEquals(1, store().countResolvedDeliveries(conn, 1L));
    }
  }

  @Test
  void longErrorMessagesAreTruncated() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      store().upsertDeliveryLog(conn, 1L, 10L, DeliveryStatus.FAILED, null, "x".repeat(5000), NOW);

      String stored = store().findDeliveryLog(conn, 1L, 10L).orElseThrow().errorMessage();
      assertEquals(4000, stored.length());
      assertTrue(stored.endsWith("..."));
    }
  }

  @Test
  void claimedTasksAreLeasedUntilExpiry() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      DeliveryTask first = task(1L, 10L, NOW.minusSeconds(2));
      DeliveryTask second = task(1L, 11L, NOW.minusSeconds(1));
      store().insertTask(conn, first, first.createdAt());
      store().insertTask(conn, second, second.createdAt());
      store().insertTask(conn, task(1L, 12L, NOW), NOW.plusSeconds(60));
      assertEquals(3, store().countReady(conn));

      conn.setAutoCommit(false);
      List<DeliveryTask> claimed = store().claimTasks(conn, "owner-a", NOW, NOW.minusSeconds(30), 10);
      conn.commit();

      assertEquals(Set.of(first.taskId(), second.taskId()),
          claimed.stream().map(DeliveryTask::taskId).collect(Collectors.toSet()));
      DeliveryTask mapped = claimed.stream().filter(t -> t.taskId().equals(first.taskId())).findFirst().orElseThrow();
      assertEquals(first.email(), mapped.email());
      assertEquals(first.subject(), mapped.subject());
      assertEquals(first.body(), mapped.body());
      assertEquals(0, mapped.attempts());

      Instant later = NOW.plusMillis(5);
      assertTrue(store().claimTasks(conn, "owner-b", later, later.minusSeconds(30), 10).isEmpty());
      conn.commit();

      Instant afterLease = NOW.plusSeconds(40);
      List<DeliveryTask> reclaimed = store().claimTasks(conn, "owner-b", afterLease, afterLease.minusSeconds(30), 10);
      conn.commit();
      assertEquals(2, reclaimed.size());
      conn.setAutoCommit(true);
    }
  }

  @Test
  void retryDeadAndDeleteLifecycle() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      DeliveryTask retried = task(7L, 10L, NOW);
      DeliveryTask dead = task(7L, 11L, NOW);
      DeliveryTask done = task(8L, 12L, NOW);
      store().insertTask(conn, retried, NOW);
      store().insertTask(conn, dead, NOW);
      store().insertTask(conn, done, NOW);

      assertEquals(1, store().markRetry(conn, retried.taskId(), NOW.plusSeconds(2), "421 busy"));
      assertEquals(1, store().markDead(conn, dead.taskId(), "550 unknown", NOW));
      assertEquals(0, store().markRetry(conn, dead.taskId(), NOW, "late"));
      assertEquals(1, store().deleteTask(conn, done.taskId()));
      assertEquals(0, store().deleteTask(conn, done.taskId()));

      assertEquals(1, store().countReady(conn));
      assertTrue(store().claimTasks(conn, "o", NOW.plusSeconds(1), NOW.minusSeconds(30), 10).isEmpty());
      List<DeliveryTask> due = store().claimTasks(conn, "o", NOW.plusSeconds(3), NOW.minusSeconds(30), 10);
      assertEquals(1, due.size());
      assertEquals(1, due.get(0).attempts());

      List<DeadTask> deadTasks = store().queryDead(conn, null, 10);
      assertEquals(1, deadTasks.size());
      assertEquals(dead.taskId(), deadTasks.get(0).task().taskId());
      assertEquals(1, deadTasks.get(0).task().attempts());
      assertEquals("550 unknown", deadTasks.get(0).lastError());
      assertEquals(NOW, deadTasks.get(0).deadAt());
      assertEquals(1, store().countDead(conn, 7L));
      assertEquals(0, store().countDead(conn, 8L));
      assertTrue(store().queryDead(conn, 8L, 10).isEmpty());
    }
  }

  @Test
  void purgeDeletesOnlyOldDeadTasks() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      for (int i = 0; i < 3; i++) {
        DeliveryTask t = task(1L, 100L + i, NOW);
        store().insertTask(conn, t, NOW);
        store().markDead(conn, t.taskId(), "boom", NOW.minus(Duration.ofHours(30)));
      }
      DeliveryTask recent = task(1L, 200L, NOW);
      store().insertTask(conn, recent, NOW);
      store().markDead(conn, recent.taskId(), "boom", NOW.minus(Duration.ofHours(1)));
      store().insertTask(conn, task(1L, 300L, NOW), NOW);

      Instant cutoff = NOW.minus(Duration.ofHours(24));
      assertEquals(2, store().purgeDead(conn, cutoff, 2));
      assertEquals(1, store().purgeDead(conn, cutoff, 2));
      assertEquals(0, store().purgeDead(conn, cutoff, 2));

      assertEquals(1, store().countDead(conn, null));
      assertEquals(1, store().countReady(conn));
    }
  }
}
