package mailbridge;

/**
 * A delivery attempt did not succeed: the {@link MailDelivery} threw, returned
 * {@link DeliveryResult.Failed}, or exceeded the delivery timeout.
 *
 * <p>Never escapes a scheduler; it is turned into a rescheduled dispatch.
 */
public class DeliveryFailureException extends Exception {
  public DeliveryFailureException(String message) {
    super(message);
  }

  public DeliveryFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
