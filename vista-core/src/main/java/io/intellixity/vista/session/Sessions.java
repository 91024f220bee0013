package io.intellixity.vista.session;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thread-bound session context for the duration of one request.
 * <p>
 * Usage:
 * <pre>
 *   Sessions.inSession(ctx, () -&gt; viewService.postMatrix(...));
 * </pre>
 */
public final class Sessions {
  private static final ThreadLocal<SessionContext> CURRENT = new ThreadLocal<>();

  private Sessions() {}

  public static <T> T inSession(SessionContext ctx, Supplier<T> body) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(body, "body");
    SessionContext previous = CURRENT.get();
    CURRENT.set(ctx);
    try {
      return body.get();
    } finally {
      if (previous == null) CURRENT.remove();
      else CURRENT.set(previous);
    }
  }

  public static SessionContext currentOrNull() {
    return CURRENT.get();
  }

  public static SessionContext currentOrThrow() {
    SessionContext ctx = CURRENT.get();
    if (ctx == null) throw new IllegalStateException("No session bound to the current thread");
    return ctx;
  }
}
