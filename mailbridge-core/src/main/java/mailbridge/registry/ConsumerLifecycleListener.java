package mailbridge.registry;

import mailbridge.model.Consumer;

/**
 * Observes consumers being created and deleted. Called after the change is committed;
 * exceptions are logged and swallowed.
 */
public interface ConsumerLifecycleListener {

  default void onCreated(Consumer consumer) {
  }

  default void onDeleted(int consumerId) {
  }
}
