package io.intellixity.vista.engine;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * @param defaultLimit page size when a request names none
 * @param maxLimit largest accepted page size
 * @param maxBaseRows default table cache cap of a request
 * @param systemTablePrefix tables sharing this prefix may stand in for each other
 * @param restrictedTables table -> roles of which a caller needs at least one
 */
public record EngineSettings(
    int defaultLimit,
    int maxLimit,
    int maxBaseRows,
    String systemTablePrefix,
    Map<String, Set<String>> restrictedTables
) {
  public static final EngineSettings DEFAULTS =
      new EngineSettings(200, 2000, 20_000, "sys_", Map.of("sys_benutzer", Set.of("admin")));

  public EngineSettings {
    if (maxLimit <= 0) throw new IllegalArgumentException("maxLimit must be > 0");
    if (defaultLimit <= 0 || defaultLimit > maxLimit) {
      throw new IllegalArgumentException("defaultLimit must be in [1, maxLimit]");
    }
    if (maxBaseRows <= 0) throw new IllegalArgumentException("maxBaseRows must be > 0");
    systemTablePrefix = systemTablePrefix == null ? "" : systemTablePrefix.toLowerCase(Locale.ROOT);
    Map<String, Set<String>> normalized = new TreeMap<>();
    if (restrictedTables != null) {
      restrictedTables.forEach((t, roles) ->
          normalized.put(t.trim().toLowerCase(Locale.ROOT), roles == null ? Set.of() : Set.copyOf(roles)));
    }
    restrictedTables = Map.copyOf(normalized);
  }
}
