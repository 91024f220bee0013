package io.intellixity.vista.error;

/** Raised for an unknown view, table or record. */
public final class ViewNotFoundException extends ViewMatrixException {
  public ViewNotFoundException(String message) {
    super(message);
  }

  public ViewNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String code() { return "not_found"; }
}
