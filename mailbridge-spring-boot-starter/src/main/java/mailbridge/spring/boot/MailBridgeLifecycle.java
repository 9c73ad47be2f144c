package mailbridge.spring.boot;

import mailbridge.MailBridge;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the {@link MailBridge} schedulers once the application context is refreshed and
 * closes the bridge when the context stops, before the {@link javax.sql.DataSource} goes away.
 */
public class MailBridgeLifecycle implements SmartLifecycle {
  private final MailBridge mailBridge;
  private volatile boolean running;

  public MailBridgeLifecycle(MailBridge mailBridge) {
    this.mailBridge = Objects.requireNonNull(mailBridge, "mailBridge");
  }

  @Override
  public void start() {
    mailBridge.start();
    running = true;
  }

  @Override
  public void stop() {
    running = false;
    mailBridge.close();
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
