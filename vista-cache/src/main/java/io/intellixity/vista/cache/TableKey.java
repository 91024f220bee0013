package io.intellixity.vista.cache;

import java.util.Objects;

public record TableKey(String table, boolean includeRetired) {
  public TableKey {
    Objects.requireNonNull(table, "table");
  }

  @Override
  public String toString() {
    return table + (includeRetired ? "+retired" : "");
  }
}
