package io.intellixity.vista.engine;

import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.model.ViewDefinition;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides which table a request actually reads.\n
 *
 * A requested table other than the view's root table is accepted when both are system tables (same prefix)
 * or when the view explicitly allows overrides. Table names must be plain SQL identifiers.\n
 */
public final class TableOverridePolicy {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  private final String systemPrefix;

  public TableOverridePolicy(String systemPrefix) {
    this.systemPrefix = Objects.requireNonNull(systemPrefix, "systemPrefix").toLowerCase(Locale.ROOT);
  }

  public String resolve(ViewDefinition definition, String requestedTable) {
    String root = definition.rootTable();
    if (root.isEmpty()) throw new InvalidViewInputException("view " + definition.id() + " has no table");
    requireIdentifier(root);

    if (requestedTable == null || requestedTable.isBlank()) return root;
    String requested = requestedTable.trim();
    requireIdentifier(requested);
    if (requested.equalsIgnoreCase(root)) return root;

    if (definition.allowTableOverride() || (isSystemTable(root) && isSystemTable(requested))) return requested;
    throw new InvalidViewInputException("view " + definition.id() + " cannot be rendered over table " + requested);
  }

  boolean isSystemTable(String table) {
    return !systemPrefix.isEmpty() && table.toLowerCase(Locale.ROOT).startsWith(systemPrefix);
  }

  public static String requireIdentifier(String table) {
    if (table == null || !IDENTIFIER.matcher(table).matches()) {
      throw new InvalidViewInputException("invalid table name: " + table);
    }
    return table;
  }
}
