package io.intellixity.vista.engine;

import io.intellixity.vista.session.SessionContext;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Role gate for tables that only some callers may read. Unlisted tables are open. */
public final class TableAccessPolicy {
  private final Map<String, Set<String>> restricted;

  public TableAccessPolicy(Map<String, Set<String>> restricted) {
    this.restricted = restricted == null ? Map.of() : restricted;
  }

  public boolean canRead(String table, SessionContext ctx) {
    Set<String> roles = restricted.get(table.toLowerCase(Locale.ROOT));
    if (roles == null) return true;
    for (String role : roles) if (ctx.hasRole(role)) return true;
    return false;
  }
}
