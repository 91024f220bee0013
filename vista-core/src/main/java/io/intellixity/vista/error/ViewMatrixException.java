package io.intellixity.vista.error;

/**
 * Base of the view engine's error taxonomy.
 * <p>
 * Everything the engine lets escape to a caller is one of the subclasses; invariant violations are corrected
 * in place and reported through response metadata instead.
 */
public abstract class ViewMatrixException extends RuntimeException {
  protected ViewMatrixException(String message) {
    super(message);
  }

  protected ViewMatrixException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Stable, machine-readable error code. */
  public abstract String code();
}
