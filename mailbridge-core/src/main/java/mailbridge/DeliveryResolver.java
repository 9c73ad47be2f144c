package mailbridge;

import mailbridge.model.Consumer;

/**
 * Chooses the {@link MailDelivery} used for a consumer when its scheduler starts.
 *
 * <p>Returning {@code null} leaves the consumer without a scheduler in this process;
 * its dispatches stay queued for another instance or a later start.
 */
@FunctionalInterface
public interface DeliveryResolver {

  MailDelivery resolve(Consumer consumer);
}
