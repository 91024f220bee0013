package io.intellixity.vista.error;

/**
 * Raised when a request is rejected before any cache is touched: malformed override payloads,
 * out-of-range pagination, unsupported table overrides.
 */
public final class InvalidViewInputException extends ViewMatrixException {
  public InvalidViewInputException(String message) {
    super(message);
  }

  @Override
  public String code() { return "invalid_input"; }
}
