package mailbridge.jdbc.notify;

import mailbridge.TransportException;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.NotificationChannel;
import mailbridge.util.DaemonThreadFactory;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link NotificationChannel} over PostgreSQL {@code LISTEN/NOTIFY}.
 *
 * <p>The channel of consumer {@code N} is named {@code consumer_id=N}; the payload is the
 * mail id. Publishing runs {@code pg_notify} on a short-lived auto-committed connection.
 * Each subscription holds a dedicated connection for as long as it is open and polls it
 * for notifications on a daemon thread. When that connection fails the subscription turns
 * inactive and its scheduler resubscribes.
 */
public final class PostgresNotificationChannel implements NotificationChannel {
  private static final Logger logger = Logger.getLogger(PostgresNotificationChannel.class.getName());

  private final ConnectionProvider connectionProvider;
  private final int pollTimeoutMs;
  private final ThreadFactory threadFactory = new DaemonThreadFactory("mailbridge-listen-");
  private final Set<PgSubscription> subscriptions = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public PostgresNotificationChannel(ConnectionProvider connectionProvider) {
    this(connectionProvider, Duration.ofMillis(500));
  }

  /**
   * @param pollTimeout how long a listening thread blocks waiting for notifications
   *                    before checking whether it should stop
   */
  public PostgresNotificationChannel(ConnectionProvider connectionProvider, Duration pollTimeout) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    long ms = pollTimeout.toMillis();
    if (ms <= 0 || ms > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("pollTimeout out of range: " + pollTimeout);
    }
    this.pollTimeoutMs = (int) ms;
  }

  static String channelName(int consumerId) {
    return "consumer_id=" + consumerId;
  }

  @Override
  public void publish(int consumerId, String mailId) {
    Objects.requireNonNull(mailId, "mailId");
    if (closed.get()) {
      throw new TransportException("Notification channel is closed");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      try (PreparedStatement ps = conn.prepareStatement("SELECT pg_notify(?, ?)")) {
        ps.setString(1, channelName(consumerId));
        ps.setString(2, mailId);
        ps.execute();
      }
    } catch (SQLException e) {
      throw new TransportException("Failed to notify consumer " + consumerId, e);
    }
  }

  @Override
  public Subscription subscribe(int consumerId, Listener listener) {
    Objects.requireNonNull(listener, "listener");
    if (closed.get()) {
      throw new TransportException("Notification channel is closed");
    }
    Connection conn = null;
    try {
      conn = connectionProvider.getConnection();
      conn.setAutoCommit(true);
      PGConnection pg = conn.unwrap(PGConnection.class);
      try (Statement st = conn.createStatement()) {
        st.execute("LISTEN \"" + channelName(consumerId) + "\"");
      }
      PgSubscription sub = new PgSubscription(consumerId, listener, conn, pg);
      subscriptions.add(sub);
      sub.thread.start();
      return sub;
    } catch (SQLException e) {
      closeQuietly(conn, consumerId);
      throw new TransportException("Failed to listen for consumer " + consumerId, e);
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (PgSubscription sub : subscriptions) {
      sub.close();
    }
  }

  private static void closeQuietly(Connection conn, int consumerId) {
    if (conn == null) {
      return;
    }
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close listen connection for consumer " + consumerId, e);
    }
  }

  private final class PgSubscription implements Subscription {
    private final int consumerId;
    private final Listener listener;
    private final Connection conn;
    private final PGConnection pg;
    private final Thread thread;
    private final AtomicBoolean active = new AtomicBoolean(true);

    PgSubscription(int consumerId, Listener listener, Connection conn, PGConnection pg) {
      this.consumerId = consumerId;
      this.listener = listener;
      this.conn = conn;
      this.pg = pg;
      this.thread = threadFactory.newThread(this::listen);
    }

    private void listen() {
      try {
        while (active.get()) {
          PGNotification[] notifications = pg.getNotifications(pollTimeoutMs);
          if (notifications == null) {
            continue;
          }
          for (PGNotification n : notifications) {
            dispatch(n);
          }
        }
      } catch (SQLException e) {
        if (active.get()) {
          logger.log(Level.WARNING, "Listen connection lost for consumer " + consumerId, e);
        }
      } finally {
        active.set(false);
        subscriptions.remove(this);
        closeQuietly(conn, consumerId);
      }
    }

    private void dispatch(PGNotification n) {
      if (!channelName(consumerId).equals(n.getName())) {
        return;
      }
      try {
        listener.onNotification(consumerId, n.getParameter());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Notification listener failed for consumer " + consumerId, e);
      }
    }

    @Override
    public boolean isActive() {
      return active.get();
    }

    @Override
    public void close() {
      if (!active.compareAndSet(true, false)) {
        return;
      }
      // the listening thread closes the connection once its current poll returns
      try {
        thread.join(pollTimeoutMs * 2L);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
