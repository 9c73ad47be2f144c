package mailbridge.jdbc.store;

import mailbridge.InvariantViolationException;
import mailbridge.ReferenceException;
import mailbridge.jdbc.JdbcTemplate;
import mailbridge.jdbc.TestDatabase;
import mailbridge.model.Dispatch;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDispatchStoreTest {
  private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

  private final AbstractJdbcDispatchStore store = new H2DispatchStore();
  private JdbcDataSource dataSource;
  private Connection conn;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = TestDatabase.h2();
    TestDatabase.insertConsumer(dataSource, 1);
    TestDatabase.insertConsumer(dataSource, 2);
    TestDatabase.insertMail(dataSource, "m1");
    TestDatabase.insertMail(dataSource, "m2");
    TestDatabase.insertMail(dataSource, "m3");
    conn = dataSource.getConnection();
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void insertCreatesRowDueImmediately() {
    assertTrue(store.insert(conn, 1, "m1", T0));

    Dispatch dispatch = store.find(conn, 1, "m1").orElseThrow();
    assertEquals(1, dispatch.consumerId());
    assertEquals("m1", dispatch.mailId());
    assertNull(dispatch.lastTime());
    assertEquals(T0, dispatch.nextTime());
    assertEquals(T0, dispatch.createdAt());
    assertEquals(0, dispatch.attempts());
    assertNull(dispatch.lastError());
  }

  @Test
  void rowInsertedWithoutTimesIsDueNow() {
    Instant before = Instant.now().minusSeconds(1);
    TestDatabase.execute(dataSource, "INSERT INTO dispatch (consumer_id, mail_id) VALUES (?, ?)", 1, "m1");

    Dispatch dispatch = store.find(conn, 1, "m1").orElseThrow();
    assertNotNull(dispatch.nextTime());
    assertNotNull(dispatch.createdAt());
    assertFalse(dispatch.nextTime().isBefore(before));
    assertEquals(0, dispatch.attempts());
    assertEquals(List.of("m1"),
        store.findDue(conn, 1, Instant.now().plusSeconds(1)).stream().map(Dispatch::mailId).toList());
  }

  @Test
  void insertIsIdempotentAndKeepsExistingSchedule() {
    assertTrue(store.insert(conn, 1, "m1", T0));
    store.markFailed(conn, 1, "m1", T0, T0.plusSeconds(60), "refused");

    assertFalse(store.insert(conn, 1, "m1", T0.plusSeconds(5)));

    Dispatch dispatch = store.find(conn, 1, "m1").orElseThrow();
    assertEquals(1, dispatch.attempts());
    assertEquals(T0.plusSeconds(60), dispatch.nextTime());
    assertEquals(1, store.countByConsumer(conn, 1));
  }

  @Test
  void insertRejectsUnknownConsumer() {
    assertThrows(ReferenceException.class, () -> store.insert(conn, 99, "m1", T0));
  }

  @Test
  void insertRejectsUnknownMail() {
    assertThrows(ReferenceException.class, () -> store.insert(conn, 1, "missing", T0));
  }

  @Test
  void findDueReturnsOnlyDueRowsOrderedByNextTime() {
    store.insert(conn, 1, "m1", T0);
    store.insert(conn, 1, "m2", T0.minusSeconds(30));
    store.insert(conn, 1, "m3", T0);
    store.markFailed(conn, 1, "m3", T0, T0.plusSeconds(10), null);
    store.insert(conn, 2, "m1", T0.minusSeconds(60));

    List<Dispatch> due = store.findDue(conn, 1, T0);

    assertEquals(List.of("m2", "m1"), due.stream().map(Dispatch::mailId).toList());
    assertEquals(List.of("m2", "m1", "m3"),
        store.findDue(conn, 1, T0.plusSeconds(10)).stream().map(Dispatch::mailId).toList());
  }

  @Test
  void markFailedRecordsAttempt() {
    store.insert(conn, 1, "m1", T0);

    assertEquals(1, store.markFailed(conn, 1, "m1", T0.plusSeconds(1), T0.plusSeconds(3), "503 busy"));
    assertEquals(1, store.markFailed(conn, 1, "m1", T0.plusSeconds(3), T0.plusSeconds(7), "503 busy"));

    Dispatch dispatch = store.find(conn, 1, "m1").orElseThrow();
    assertEquals(2, dispatch.attempts());
    assertEquals(T0.plusSeconds(3), dispatch.lastTime());
    assertEquals(T0.plusSeconds(7), dispatch.nextTime());
    assertEquals("503 busy", dispatch.lastError());
    assertEquals(T0, dispatch.createdAt());
  }

  @Test
  void markFailedOnMissingRowReturnsZero() {
    assertEquals(0, store.markFailed(conn, 1, "m1", T0, T0.plusSeconds(1), null));
  }

  @Test
  void nextTimeMustFollowLastTime() {
    store.insert(conn, 1, "m1", T0);

    assertThrows(InvariantViolationException.class,
        () -> store.markFailed(conn, 1, "m1", T0, T0, null));
    assertThrows(InvariantViolationException.class,
        () -> store.markFailed(conn, 1, "m1", T0, T0.minusSeconds(1), null));
    assertEquals(0, store.find(conn, 1, "m1").orElseThrow().attempts());
  }

  @Test
  void directUpdateViolatingScheduleIsRejected() {
    store.insert(conn, 1, "m1", T0);

    assertThrows(InvariantViolationException.class, () -> JdbcTemplate.update(conn,
        "UPDATE dispatch SET last_time = next_time WHERE consumer_id = ?", 1));
  }

  @Test
  void deleteRemovesSingleRow() {
    store.insert(conn, 1, "m1", T0);
    store.insert(conn, 1, "m2", T0);

    assertEquals(1, store.delete(conn, 1, "m1"));
    assertEquals(0, store.delete(conn, 1, "m1"));
    assertTrue(store.find(conn, 1, "m1").isEmpty());
    assertTrue(store.find(conn, 1, "m2").isPresent());
  }

  @Test
  void deleteForConsumerLeavesOtherConsumers() {
    store.insert(conn, 1, "m1", T0);
    store.insert(conn, 1, "m2", T0);
    store.insert(conn, 2, "m1", T0);

    assertEquals(2, store.deleteForConsumer(conn, 1));

    assertEquals(0, store.countByConsumer(conn, 1));
    assertEquals(1, store.countByConsumer(conn, 2));
  }

  @Test
  void deletingMailCascadesToDispatches() {
    store.insert(conn, 1, "m1", T0);
    store.insert(conn, 2, "m1", T0);
    store.insert(conn, 1, "m2", T0);

    assertTrue(new JdbcMailStore().delete(conn, "m1"));

    assertEquals(1, TestDatabase.count(dataSource, "dispatch"));
    assertTrue(store.find(conn, 1, "m2").isPresent());
  }

  @Test
  void deletingConsumerCascadesToDispatches() {
    store.insert(conn, 1, "m1", T0);
    store.insert(conn, 2, "m1", T0);

    assertTrue(new JdbcConsumerStore().delete(conn, 2));

    assertEquals(0, store.countByConsumer(conn, 2));
    assertEquals(1, store.countByConsumer(conn, 1));
  }

  @Test
  void nextDueTimeIsEarliestNextTime() {
    assertTrue(store.nextDueTime(conn, 1).isEmpty());

    store.insert(conn, 1, "m1", T0.plusSeconds(20));
    store.insert(conn, 1, "m2", T0.plusSeconds(5));
    store.insert(conn, 2, "m3", T0);

    assertEquals(T0.plusSeconds(5), store.nextDueTime(conn, 1).orElseThrow());
  }

  @Test
  void findByConsumerIncludesFutureRowsUpToLimit() {
    store.insert(conn, 1, "m1", T0);
    store.insert(conn, 1, "m2", T0.plusSeconds(1));
    store.insert(conn, 1, "m3", T0.plusSeconds(3600));

    assertEquals(List.of("m1", "m2", "m3"),
        store.findByConsumer(conn, 1, 10).stream().map(Dispatch::mailId).toList());
    assertEquals(List.of("m1", "m2"),
        store.findByConsumer(conn, 1, 2).stream().map(Dispatch::mailId).toList());
    assertEquals(3, store.countByConsumer(conn, 1));
  }
}
