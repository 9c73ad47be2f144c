package mailbridge.jdbc;

import mailbridge.DeliveryResult;
import mailbridge.MailBridge;
import mailbridge.jdbc.store.H2DispatchStore;
import mailbridge.jdbc.store.JdbcConsumerStore;
import mailbridge.jdbc.store.JdbcMailStore;
import mailbridge.jdbc.tx.JdbcTransactionManager;
import mailbridge.jdbc.tx.ThreadLocalTxContext;
import mailbridge.model.Consumer;
import mailbridge.model.Mail;
import mailbridge.scheduler.DispatchScheduler;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class MailBridgeTest {
  private JdbcDataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionManager txManager;
  private CountingMetrics metrics;
  private final Map<String, List<String>> inbox = new ConcurrentHashMap<>();
  private MailBridge bridge;

  @BeforeEach
  void setUp() {
    dataSource = TestDatabase.h2();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(connectionProvider, txContext);
    metrics = new CountingMetrics();
  }

  @AfterEach
  void tearDown() {
    if (bridge != null) {
      bridge.close();
    }
  }

  private MailBridge.Builder builder() {
    return MailBridge.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .dispatchStore(new H2DispatchStore())
        .mailStore(new JdbcMailStore())
        .consumerStore(new JdbcConsumerStore())
        .metrics(metrics)
        .pollInterval(Duration.ofSeconds(30))
        .drainTimeout(Duration.ofSeconds(2));
  }

  private MailBridge.Builder delivering() {
    return builder().deliveryResolver(consumer -> mail -> {
      inbox.computeIfAbsent(consumer.name(), k -> new CopyOnWriteArrayList<>()).add(mail.id());
      return DeliveryResult.delivered();
    });
  }

  @Test
  void ingestedMailReachesEveryConsumer() throws Exception {
    bridge = delivering().build();
    bridge.start();
    bridge.registry().create("crm");
    bridge.registry().create("search");

    txManager.inTransaction(() -> bridge.ingestor().ingest(TestDatabase.mail("m1")));

    awaitTrue(() -> inbox.getOrDefault("crm", List.of()).contains("m1")
        && inbox.getOrDefault("search", List.of()).contains("m1"), 5_000);
    awaitTrue(() -> TestDatabase.count(dataSource, "dispatch") == 0, 2_000);
    assertEquals(2, metrics.published.get());
  }

  @Test
  void startServesExistingConsumersAndBacklog() throws Exception {
    try (MailBridge ingestOnly = builder().build()) {
      ingestOnly.start();
      Consumer crm = ingestOnly.registry().create("crm");
      txManager.inTransaction(() -> ingestOnly.ingestor().ingest(TestDatabase.mail("m1")));
      assertTrue(ingestOnly.scheduler(crm.id()).isEmpty());
      assertEquals(1, ingestOnly.queue().count(crm.id()));
    }

    bridge = delivering().build();
    bridge.start();

    awaitTrue(() -> inbox.getOrDefault("crm", List.of()).contains("m1"), 5_000);
  }

  @Test
  void consumerLifecycleStartsAndStopsSchedulers() throws Exception {
    bridge = delivering().build();
    bridge.start();

    Consumer crm = bridge.registry().create("crm");
    assertTrue(bridge.scheduler(crm.id()).orElseThrow().isRunning());

    assertTrue(bridge.registry().delete(crm.id()));

    assertTrue(bridge.scheduler(crm.id()).isEmpty());
  }

  @Test
  void consumerAddedByAnotherProcessIsServed() throws Exception {
    bridge = delivering().reconcileInterval(Duration.ofMillis(100)).build();
    bridge.start();

    TestDatabase.insertConsumer(dataSource, 9);
    TestDatabase.insertMail(dataSource, "m1");
    assertTrue(bridge.queue().enqueue(9, "m1"));

    awaitTrue(() -> inbox.getOrDefault("consumer-9", List.of()).contains("m1"), 5_000);
    assertTrue(bridge.scheduler(9).orElseThrow().isRunning());
    awaitTrue(() -> bridge.queue().count(9) == 0, 2_000);
  }

  @Test
  void consumerRemovedByAnotherProcessLosesScheduler() throws Exception {
    bridge = delivering().reconcileInterval(Duration.ofMillis(100)).build();
    bridge.start();
    Consumer crm = bridge.registry().create("crm");
    DispatchScheduler scheduler = bridge.scheduler(crm.id()).orElseThrow();

    TestDatabase.execute(dataSource, "DELETE FROM consumer WHERE id = ?", crm.id());

    awaitTrue(() -> bridge.scheduler(crm.id()).isEmpty(), 5_000);
    assertFalse(scheduler.isRunning());
  }

  @Test
  void reconcileDoesNotResolveDeclinedConsumerAgain() {
    AtomicInteger resolved = new AtomicInteger();
    bridge = builder()
        .deliveryResolver(consumer -> {
          resolved.incrementAndGet();
          return null;
        })
        .build();
    bridge.start();
    bridge.registry().create("elsewhere");
    assertEquals(1, resolved.get());

    bridge.reconcile();
    bridge.reconcile();

    assertEquals(1, resolved.get());
  }

  @Test
  void consumerCreatedAfterCloseGetsNoScheduler() {
    bridge = delivering().reconcileInterval(Duration.ofMillis(100)).build();
    bridge.start();
    bridge.close();

    Consumer late = bridge.registry().create("late");
    bridge.reconcile();

    assertTrue(bridge.scheduler(late.id()).isEmpty());
  }

  @Test
  void resolverMayDeclineConsumer() {
    bridge = builder()
        .deliveryResolver(consumer -> consumer.name().equals("crm") ? mail -> DeliveryResult.delivered() : null)
        .build();
    bridge.start();

    Consumer crm = bridge.registry().create("crm");
    Consumer other = bridge.registry().create("elsewhere");

    assertTrue(bridge.scheduler(crm.id()).isPresent());
    assertTrue(bridge.scheduler(other.id()).isEmpty());
  }

  @Test
  void pollOnlyBridgeStillDelivers() throws Exception {
    bridge = delivering().disableNotifications().pollInterval(Duration.ofMillis(100)).build();
    bridge.start();
    bridge.registry().create("crm");

    txManager.inTransaction(() -> bridge.ingestor().ingest(TestDatabase.mail("m1")));

    awaitTrue(() -> inbox.getOrDefault("crm", List.of()).contains("m1"), 5_000);
    assertEquals(0, metrics.published.get());
  }

  @Test
  void deletingMailCancelsPendingDispatches() {
    bridge = builder().build();
    Consumer crm = bridge.registry().create("crm");
    txManager.inTransaction(() -> bridge.ingestor().ingest(TestDatabase.mail("m1")));

    assertTrue(bridge.archive().delete("m1"));

    assertEquals(0, bridge.queue().count(crm.id()));
    assertTrue(bridge.archive().find("m1").isEmpty());
  }

  @Test
  void archiveRoundTripsMail() {
    bridge = builder().build();
    Mail mail = TestDatabase.mail("m1");

    bridge.archive().archive(mail);

    assertTrue(bridge.archive().exists("m1"));
    assertEquals(mail, bridge.archive().find("m1").orElseThrow());
  }

  @Test
  void startAfterCloseIsRejected() {
    MailBridge closed = delivering().build();
    closed.close();

    assertThrows(IllegalStateException.class, closed::start);
  }

  @Test
  void builderRequiresStores() {
    assertThrows(NullPointerException.class, () -> MailBridge.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .build());
  }

  private static void awaitTrue(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeoutMs;
    while (System.currentTimeMillis() < deadline) {
      if (condition.getAsBoolean()) {
        return;
      }
      Thread.sleep(20);
    }
    fail("Condition not met within " + timeoutMs + " ms");
  }
}
