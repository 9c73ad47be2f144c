/**
 * Mail archive with durable, per-consumer dispatch.
 *
 * <p>{@link mailbridge.MailBridge} is the composite entry point. Mail enters through
 * {@link mailbridge.ingest.MailIngestor}, which archives it and enqueues one dispatch per
 * interested consumer. Each consumer's {@link mailbridge.scheduler.DispatchScheduler}
 * delivers due dispatches through an injected {@link mailbridge.MailDelivery}.
 *
 * @see mailbridge.MailBridge
 * @see mailbridge.queue.DispatchQueue
 * @see mailbridge.scheduler.DispatchScheduler
 */
package mailbridge;
