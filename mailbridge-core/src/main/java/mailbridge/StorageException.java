package mailbridge;

/**
 * Unchecked exception for failures of the underlying store: an unobtainable
 * connection or a SQL error that is neither a reference nor an invariant
 * violation.
 *
 * <p>This is the one failure class the dispatch subsystem escalates to the
 * operator. A scheduler burst that hits it is aborted and retried from scratch
 * on the next wake-up.
 */
public final class StorageException extends RuntimeException {
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
