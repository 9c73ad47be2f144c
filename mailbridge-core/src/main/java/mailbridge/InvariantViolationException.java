package mailbridge;

/**
 * Thrown when a state transition would break a dispatch invariant: a retry
 * scheduled at or before its last attempt, or a duplicate primary key.
 *
 * <p>The offending transition is rejected as a whole; values are never coerced.
 */
public final class InvariantViolationException extends RuntimeException {
  public InvariantViolationException(String message) {
    super(message);
  }

  public InvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
