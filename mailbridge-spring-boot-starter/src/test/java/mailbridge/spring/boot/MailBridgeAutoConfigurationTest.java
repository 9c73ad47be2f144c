package mailbridge.spring.boot;

import mailbridge.DeliveryResolver;
import mailbridge.DeliveryResult;
import mailbridge.MailBridge;
import mailbridge.archive.MailArchive;
import mailbridge.ingest.MailIngestor;
import mailbridge.jdbc.DataSourceConnectionProvider;
import mailbridge.jdbc.store.AbstractJdbcDispatchStore;
import mailbridge.jdbc.store.H2DispatchStore;
import mailbridge.model.Consumer;
import mailbridge.model.Mail;
import mailbridge.queue.DispatchQueue;
import mailbridge.registry.ConsumerRegistry;
import mailbridge.scheduler.BackoffPolicy;
import mailbridge.scheduler.ExponentialBackoffPolicy;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.TxContext;
import mailbridge.spring.SpringTxContext;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class MailBridgeAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          MailBridgeAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:mailbridge_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(DeliveryConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("dispatchStore"));
      assertTrue(ctx.containsBean("mailStore"));
      assertTrue(ctx.containsBean("consumerStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("txContext"));
      assertTrue(ctx.containsBean("backoffPolicy"));
      assertTrue(ctx.containsBean("mailBridge"));
      assertTrue(ctx.containsBean("mailBridgeLifecycle"));

      assertInstanceOf(H2DispatchStore.class, ctx.getBean(AbstractJdbcDispatchStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(SpringTxContext.class, ctx.getBean(TxContext.class));
      assertInstanceOf(ExponentialBackoffPolicy.class, ctx.getBean(BackoffPolicy.class));

      MailBridge bridge = ctx.getBean(MailBridge.class);
      assertSame(bridge.ingestor(), ctx.getBean(MailIngestor.class));
      assertSame(bridge.archive(), ctx.getBean(MailArchive.class));
      assertSame(bridge.registry(), ctx.getBean(ConsumerRegistry.class));
      assertSame(bridge.queue(), ctx.getBean(DispatchQueue.class));
      assertTrue(ctx.getBean(MailBridgeLifecycle.class).isRunning());
    });
  }

  @Test
  void deliversMailIngestedInSpringTransaction() {
    runner.withUserConfiguration(DeliveryConfig.class).run(ctx -> {
      MailBridge bridge = ctx.getBean(MailBridge.class);
      Consumer crm = bridge.registry().create("crm");
      assertTrue(bridge.scheduler(crm.id()).isPresent());

      TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(ctx.getBean(DataSource.class)));
      tx.executeWithoutResult(status -> bridge.ingestor().ingest(mail("m1")));

      List<String> delivered = ctx.getBean(DeliveryConfig.class).delivered;
      long deadline = System.currentTimeMillis() + 5_000;
      while (delivered.isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
      assertEquals(List.of("crm:m1"), delivered);
    });
  }

  @Test
  void ingestOnlyModeRunsNoSchedulers() {
    runner.withPropertyValues("mailbridge.mode=INGEST_ONLY")
        .withUserConfiguration(DeliveryConfig.class).run(ctx -> {
          MailBridge bridge = ctx.getBean(MailBridge.class);
          Consumer crm = bridge.registry().create("crm");
          assertTrue(bridge.scheduler(crm.id()).isEmpty());
        });
  }

  @Test
  void withoutResolverOnlyIngests() {
    runner.run(ctx -> {
      MailBridge bridge = ctx.getBean(MailBridge.class);
      Consumer crm = bridge.registry().create("crm");
      assertTrue(bridge.scheduler(crm.id()).isEmpty());
    });
  }

  @Test
  void schedulerSettingsAreApplied() {
    runner.withPropertyValues(
            "mailbridge.scheduler.poll-interval=PT0.1S",
            "mailbridge.notification.type=none")
        .withUserConfiguration(DeliveryConfig.class).run(ctx -> {
          MailBridge bridge = ctx.getBean(MailBridge.class);
          bridge.registry().create("crm");
          TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(ctx.getBean(DataSource.class)));
          tx.executeWithoutResult(status -> bridge.ingestor().ingest(mail("m1")));

          List<String> delivered = ctx.getBean(DeliveryConfig.class).delivered;
          long deadline = System.currentTimeMillis() + 5_000;
          while (delivered.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
          }
          assertEquals(List.of("crm:m1"), delivered);
        });
  }

  @Test
  void backoffPropertiesBuildPolicy() {
    runner.withPropertyValues(
            "mailbridge.backoff.base-delay=PT2S",
            "mailbridge.backoff.max-delay=PT10S")
        .run(ctx -> {
          BackoffPolicy policy = ctx.getBean(BackoffPolicy.class);
          assertEquals(Duration.ofSeconds(2), policy.computeDelay(1));
          assertEquals(Duration.ofSeconds(4), policy.computeDelay(2));
          assertEquals(Duration.ofSeconds(10), policy.computeDelay(10));
        });
  }

  @Test
  void advisoryLockRequiresPostgres() {
    runner.withPropertyValues("mailbridge.lock.type=advisory").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(MailBridgeAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("mailBridge")));
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
      assertEquals("myDispatchStore", ctx.getBeanNamesForType(AbstractJdbcDispatchStore.class)[0]);
      assertFalse(ctx.containsBean("dispatchStore"));
    });
  }

  private static Mail mail(String id) {
    return Mail.builder(id)
        .date(Instant.parse("2024-03-01T10:15:30Z"))
        .text("Hello")
        .data(new byte[]{1, 2, 3})
        .build();
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class DeliveryConfig {
    final List<String> delivered = new CopyOnWriteArrayList<>();

    @Bean
    DeliveryResolver deliveryResolver() {
      return consumer -> mail -> {
        delivered.add(consumer.name() + ":" + mail.id());
        return DeliveryResult.delivered();
      };
    }
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean("myDispatchStore")
    AbstractJdbcDispatchStore dispatchStore() {
      return new H2DispatchStore();
    }
  }
}
