package mailbridge;

import mailbridge.model.Mail;

/**
 * Capability that hands an archived mail to one consumer.
 *
 * <p>Injected per consumer through a {@link DeliveryResolver}. The transport is up to
 * the implementation: an HTTP push, a message broker, a local callback.
 *
 * <h2>Execution Model</h2>
 * <p>Called from the consumer's {@link mailbridge.scheduler.DispatchScheduler}, one mail
 * at a time, in {@code next_time} order. Each call is bounded by the scheduler's delivery
 * timeout; a call that overruns is interrupted and counted as a failure.
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once. A consumer may see the same mail again if the process
 * dies between the consumer accepting it and the dispatch row being deleted. Use
 * {@link Mail#id()} for deduplication.
 */
@FunctionalInterface
public interface MailDelivery {

  /**
   * Delivers a mail.
   *
   * @param mail the archived mail, attachments included
   * @return {@link DeliveryResult#delivered()} or a {@link DeliveryResult.Failed}
   * @throws Exception if delivery fails; treated like {@link DeliveryResult.Failed}
   */
  DeliveryResult deliver(Mail mail) throws Exception;
}
