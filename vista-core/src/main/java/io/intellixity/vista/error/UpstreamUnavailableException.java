package io.intellixity.vista.error;

/**
 * Raised by record store adapters when the backing store cannot be read.
 * <p>
 * The table cache recovers from it when a previous snapshot exists; callers only see it on a cold start.
 */
public final class UpstreamUnavailableException extends ViewMatrixException {
  public UpstreamUnavailableException(String message) {
    super(message);
  }

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String code() { return "upstream_unavailable"; }
}
