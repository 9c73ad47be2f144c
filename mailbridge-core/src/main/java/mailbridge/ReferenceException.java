package mailbridge;

/**
 * Thrown when an operation references a consumer or mail that does not exist,
 * e.g. enqueueing a dispatch for an unknown consumer. Not retried.
 */
public final class ReferenceException extends RuntimeException {
  public ReferenceException(String message) {
    super(message);
  }

  public ReferenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
