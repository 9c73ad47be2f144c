package mailbridge.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import mailbridge.DeliveryResult;
import mailbridge.MailBridge;
import mailbridge.ReferenceException;
import mailbridge.jdbc.lock.PostgresAdvisoryConsumerLock;
import mailbridge.jdbc.notify.PostgresNotificationChannel;
import mailbridge.jdbc.store.JdbcConsumerStore;
import mailbridge.jdbc.store.JdbcDispatchStores;
import mailbridge.jdbc.store.JdbcMailStore;
import mailbridge.jdbc.store.PostgresDispatchStore;
import mailbridge.jdbc.tx.JdbcTransactionManager;
import mailbridge.jdbc.tx.ThreadLocalTxContext;
import mailbridge.model.Consumer;
import mailbridge.model.Mail;
import mailbridge.spi.NotificationChannel;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("mailbridge_test");

  private static HikariDataSource dataSource;
  private static DataSourceConnectionProvider connectionProvider;

  private final PostgresDispatchStore store = new PostgresDispatchStore();

  @BeforeAll
  static void initSchema() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(postgres.getJdbcUrl());
    config.setUsername(postgres.getUsername());
    config.setPassword(postgres.getPassword());
    config.setMaximumPoolSize(10);
    config.setPoolName("mailbridge-test-pool");
    dataSource = new HikariDataSource(config);
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    TestDatabase.runScript(dataSource, "/schema/postgresql.sql");
  }

  @AfterAll
  static void closePool() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @BeforeEach
  void truncate() {
    TestDatabase.execute(dataSource, "TRUNCATE TABLE dispatch, attachment, mail, consumer RESTART IDENTITY");
  }

  @Test
  void detectsPostgresStore() {
    assertInstanceOf(PostgresDispatchStore.class, JdbcDispatchStores.detect(dataSource));
  }

  @Test
  void duplicateEnqueueDoesNotAbortTransaction() throws Exception {
    TestDatabase.insertConsumer(dataSource, 1);
    TestDatabase.insertMail(dataSource, "m1");
    TestDatabase.insertMail(dataSource, "m2");
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      assertTrue(store.insert(conn, 1, "m1", now));
      assertFalse(store.insert(conn, 1, "m1", now));
      assertTrue(store.insert(conn, 1, "m2", now));
      conn.commit();
    }

    try (Connection conn = dataSource.getConnection()) {
      assertEquals(2, store.countByConsumer(conn, 1));
      assertEquals(now, store.find(conn, 1, "m1").orElseThrow().nextTime());
    }
  }

  @Test
  void foreignKeysAreEnforced() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      assertThrows(ReferenceException.class, () -> store.insert(conn, 1, "nope", Instant.now()));
    }
  }

  @Test
  void mailRoundTripsThroughPostgres() throws Exception {
    Mail mail = TestDatabase.mail("<m1@example.org>");
    JdbcMailStore mailStore = new JdbcMailStore();
    try (Connection conn = dataSource.getConnection()) {
      mailStore.insert(conn, mail);
      assertEquals(mail, mailStore.find(conn, "<m1@example.org>").orElseThrow());
    }
  }

  @Test
  void notificationsReachSubscriberOfSameConsumerOnly() throws Exception {
    LinkedBlockingQueue<String> received = new LinkedBlockingQueue<>();
    try (PostgresNotificationChannel channel =
             new PostgresNotificationChannel(connectionProvider, Duration.ofMillis(100))) {
      NotificationChannel.Subscription subscription =
          channel.subscribe(3, (consumerId, mailId) -> received.add(consumerId + "/" + mailId));

      channel.publish(4, "other");
      channel.publish(3, "m1");

      assertEquals("3/m1", received.poll(5, TimeUnit.SECONDS));
      assertNull(received.poll(300, TimeUnit.MILLISECONDS));
      assertTrue(subscription.isActive());

      subscription.close();
      assertFalse(subscription.isActive());
    }
  }

  @Test
  void advisoryLockExcludesOtherInstances() throws Exception {
    try (PostgresAdvisoryConsumerLock first = new PostgresAdvisoryConsumerLock(connectionProvider);
         PostgresAdvisoryConsumerLock second = new PostgresAdvisoryConsumerLock(connectionProvider)) {
      assertTrue(first.tryAcquire(5));
      assertFalse(second.tryAcquire(5));
      assertTrue(second.tryAcquire(6));
      assertFalse(second.tryAcquire(5, Duration.ofMillis(250)));

      first.release(5);

      assertTrue(second.tryAcquire(5, Duration.ofSeconds(2)));
      second.release(5);
      second.release(6);
    }
  }

  @Test
  void bridgeDeliversAcrossPostgres() throws Exception {
    ThreadLocalTxContext txContext = new ThreadLocalTxContext();
    JdbcTransactionManager txManager = new JdbcTransactionManager(connectionProvider, txContext);
    List<String> delivered = new CopyOnWriteArrayList<>();
    CountDownLatch latch = new CountDownLatch(1);

    try (MailBridge bridge = MailBridge.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .dispatchStore(store)
        .mailStore(new JdbcMailStore())
        .consumerStore(new JdbcConsumerStore())
        .notificationChannel(new PostgresNotificationChannel(connectionProvider))
        .consumerLock(new PostgresAdvisoryConsumerLock(connectionProvider))
        .pollInterval(Duration.ofSeconds(30))
        .deliveryResolver(consumer -> mail -> {
          delivered.add(consumer.name() + ":" + mail.id());
          latch.countDown();
          return DeliveryResult.delivered();
        })
        .build()) {
      bridge.start();
      Consumer crm = bridge.registry().create("crm");

      txManager.inTransaction(() -> bridge.ingestor().ingest(TestDatabase.mail("m1")));

      assertTrue(latch.await(10, TimeUnit.SECONDS));
      assertEquals(List.of("crm:m1"), delivered);
      long deadline = System.currentTimeMillis() + 2_000;
      while (bridge.queue().count(crm.id()) > 0 && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
      assertEquals(0, bridge.queue().count(crm.id()));
    }
  }
}
