package mailbridge;

/**
 * Thrown by a {@link mailbridge.spi.NotificationChannel} when it cannot publish
 * or subscribe. Callers recover by relying on polling.
 */
public final class TransportException extends RuntimeException {
  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
