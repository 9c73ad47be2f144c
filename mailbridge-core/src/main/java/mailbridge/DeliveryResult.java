package mailbridge;

import java.util.Objects;

/**
 * Outcome reported by {@link MailDelivery#deliver}.
 *
 * <ul>
 *   <li>{@link Delivered}: the consumer accepted the mail; the dispatch row is deleted.</li>
 *   <li>{@link Failed}: the consumer rejected or could not take the mail; the dispatch
 *       is rescheduled with backoff.</li>
 * </ul>
 *
 * <p>Throwing from {@code deliver} is equivalent to returning {@link Failed} with the
 * exception message.
 */
public sealed interface DeliveryResult permits DeliveryResult.Delivered, DeliveryResult.Failed {

  /** Singleton indicating successful delivery. */
  Delivered DELIVERED = new Delivered();

  static Delivered delivered() {
    return DELIVERED;
  }

  /**
   * Creates a failed result.
   *
   * @param reason short description stored as the dispatch's last error
   * @return a failed result
   */
  static Failed failed(String reason) {
    return new Failed(reason);
  }

  /** Mail accepted by the consumer. */
  record Delivered() implements DeliveryResult {
  }

  /**
   * Mail not accepted.
   *
   * @param reason description of the failure (must not be null)
   */
  record Failed(String reason) implements DeliveryResult {
    public Failed {
      Objects.requireNonNull(reason, "reason must not be null");
    }
  }
}
