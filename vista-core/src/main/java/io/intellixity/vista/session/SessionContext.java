package io.intellixity.vista.session;

import io.intellixity.vista.temporal.PdvmStamp;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Who is asking, and as of when.
 *
 * @param sessionId owner of the per-session caches
 * @param asOf as-of date of every temporal projection in this session
 */
public record SessionContext(String sessionId, String userId, PdvmStamp asOf, Set<String> roles) {
  public SessionContext {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(asOf, "asOf");
    if (sessionId.isBlank()) throw new IllegalArgumentException("sessionId is blank");
    userId = userId == null || userId.isBlank() ? sessionId : userId;
    roles = roles == null ? Set.of() : Set.copyOf(roles);
  }

  public static SessionContext of(String sessionId, String userId, PdvmStamp asOf, String... roles) {
    return new SessionContext(sessionId, userId, asOf, Set.of(roles));
  }

  public boolean hasRole(String role) {
    if (role == null) return false;
    for (String r : roles) if (r.toLowerCase(Locale.ROOT).equals(role.toLowerCase(Locale.ROOT))) return true;
    return false;
  }
}
