package mailbridge.spring.boot;

import mailbridge.DeliveryResolver;
import mailbridge.MailBridge;
import mailbridge.archive.MailArchive;
import mailbridge.ingest.InterestPolicy;
import mailbridge.ingest.MailIngestor;
import mailbridge.jdbc.DataSourceConnectionProvider;
import mailbridge.jdbc.lock.PostgresAdvisoryConsumerLock;
import mailbridge.jdbc.notify.PostgresNotificationChannel;
import mailbridge.jdbc.store.AbstractJdbcDispatchStore;
import mailbridge.jdbc.store.JdbcConsumerStore;
import mailbridge.jdbc.store.JdbcDispatchStores;
import mailbridge.jdbc.store.JdbcMailStore;
import mailbridge.lock.LocalConsumerLock;
import mailbridge.notify.InMemoryNotificationChannel;
import mailbridge.queue.DispatchQueue;
import mailbridge.registry.ConsumerRegistry;
import mailbridge.scheduler.BackoffPolicy;
import mailbridge.scheduler.ExponentialBackoffPolicy;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.ConsumerLock;
import mailbridge.spi.ConsumerStore;
import mailbridge.spi.MailStore;
import mailbridge.spi.MetricsExporter;
import mailbridge.spi.NotificationChannel;
import mailbridge.spi.TxContext;
import mailbridge.spring.SpringTxContext;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;

import javax.sql.DataSource;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the mail bridge.
 *
 * <p>Wires a {@link MailBridge} from a {@link DataSource} and {@link MailBridgeProperties}.
 * The dispatch store is detected from the JDBC URL. On PostgreSQL, consumer locks and
 * change notifications use advisory locks and {@code LISTEN/NOTIFY} unless configured
 * otherwise.
 *
 * <p>Delivery needs a {@link DeliveryResolver} bean. Without one, or in
 * {@link MailBridgeProperties.Mode#INGEST_ONLY} mode, the bridge only ingests.
 *
 * @see MailBridgeProperties
 * @see MailBridgeMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MailBridge.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MailBridgeProperties.class)
public class MailBridgeAutoConfiguration {
  private static final Logger logger = Logger.getLogger(MailBridgeAutoConfiguration.class.getName());

  private static final String PG_CONNECTION_CLASS = "org.postgresql.PGConnection";

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcDispatchStore dispatchStore(DataSource dataSource) {
    return JdbcDispatchStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(MailStore.class)
  public JdbcMailStore mailStore() {
    return new JdbcMailStore();
  }

  @Bean
  @ConditionalOnMissingBean(ConsumerStore.class)
  public JdbcConsumerStore consumerStore() {
    return new JdbcConsumerStore();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public BackoffPolicy backoffPolicy(MailBridgeProperties props) {
    MailBridgeProperties.Backoff backoff = props.getBackoff();
    return new ExponentialBackoffPolicy(backoff.getBaseDelay(), backoff.getMaxDelay(), backoff.getJitter());
  }

  /**
   * The bridge closes its lock and notification channel. User-supplied ones are picked up
   * through {@link ObjectProvider}; otherwise they are created from the properties.
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MailBridge mailBridge(MailBridgeProperties props,
      ConnectionProvider connectionProvider,
      TxContext txContext,
      AbstractJdbcDispatchStore dispatchStore,
      MailStore mailStore,
      ConsumerStore consumerStore,
      BackoffPolicy backoffPolicy,
      ObjectProvider<DeliveryResolver> resolverProvider,
      ObjectProvider<InterestPolicy> interestPolicyProvider,
      ObjectProvider<ConsumerLock> lockProvider,
      ObjectProvider<NotificationChannel> channelProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    boolean postgres = "postgresql".equals(dispatchStore.name());
    var builder = MailBridge.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .dispatchStore(dispatchStore)
        .mailStore(mailStore)
        .consumerStore(consumerStore)
        .backoffPolicy(backoffPolicy)
        .interestPolicy(interestPolicyProvider.getIfAvailable())
        .consumerLock(lockProvider.getIfAvailable(() -> createLock(props, postgres, connectionProvider)))
        .pollInterval(props.getScheduler().getPollInterval())
        .deliveryTimeout(props.getScheduler().getDeliveryTimeout())
        .drainTimeout(props.getScheduler().getDrainTimeout())
        .lockWaitTimeout(props.getLock().getWaitTimeout());

    NotificationChannel channel = channelProvider.getIfAvailable();
    if (channel == null) {
      channel = createChannel(props, postgres, connectionProvider);
    }
    if (channel == null) {
      builder.disableNotifications();
    } else {
      builder.notificationChannel(channel);
    }

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }

    DeliveryResolver resolver = resolverProvider.getIfAvailable();
    if (props.getMode() == MailBridgeProperties.Mode.FULL) {
      if (resolver == null) {
        logger.warning("No DeliveryResolver bean found; mail bridge will only ingest");
      }
      builder.deliveryResolver(resolver);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public MailBridgeLifecycle mailBridgeLifecycle(MailBridge mailBridge) {
    return new MailBridgeLifecycle(mailBridge);
  }

  @Bean
  @ConditionalOnMissingBean
  public MailIngestor mailIngestor(MailBridge mailBridge) {
    return mailBridge.ingestor();
  }

  @Bean
  @ConditionalOnMissingBean
  public MailArchive mailArchive(MailBridge mailBridge) {
    return mailBridge.archive();
  }

  @Bean
  @ConditionalOnMissingBean
  public ConsumerRegistry consumerRegistry(MailBridge mailBridge) {
    return mailBridge.registry();
  }

  @Bean
  @ConditionalOnMissingBean
  public DispatchQueue dispatchQueue(MailBridge mailBridge) {
    return mailBridge.queue();
  }

  private static ConsumerLock createLock(MailBridgeProperties props, boolean postgres,
                                         ConnectionProvider connectionProvider) {
    return switch (props.getLock().getType()) {
      case LOCAL -> new LocalConsumerLock();
      case ADVISORY -> {
        requirePostgres(postgres, "mailbridge.lock.type=advisory");
        yield new PostgresAdvisoryConsumerLock(connectionProvider);
      }
      case AUTO -> postgres && pgDriverPresent()
          ? new PostgresAdvisoryConsumerLock(connectionProvider)
          : new LocalConsumerLock();
    };
  }

  private static NotificationChannel createChannel(MailBridgeProperties props, boolean postgres,
                                                   ConnectionProvider connectionProvider) {
    MailBridgeProperties.Notification notification = props.getNotification();
    return switch (notification.getType()) {
      case NONE -> null;
      case IN_MEMORY -> new InMemoryNotificationChannel();
      case POSTGRES -> {
        requirePostgres(postgres, "mailbridge.notification.type=postgres");
        yield new PostgresNotificationChannel(connectionProvider, notification.getPollTimeout());
      }
      case AUTO -> postgres && pgDriverPresent()
          ? new PostgresNotificationChannel(connectionProvider, notification.getPollTimeout())
          : new InMemoryNotificationChannel();
    };
  }

  private static void requirePostgres(boolean postgres, String setting) {
    if (!postgres || !pgDriverPresent()) {
      throw new IllegalStateException(setting + " requires a PostgreSQL DataSource and driver");
    }
  }

  private static boolean pgDriverPresent() {
    boolean present = ClassUtils.isPresent(PG_CONNECTION_CLASS, MailBridgeAutoConfiguration.class.getClassLoader());
    if (!present) {
      logger.log(Level.FINE, "PostgreSQL driver not on classpath");
    }
    return present;
  }
}
