package io.intellixity.vista.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Page grouping request.
 *
 * @param by control whose value forms the group key
 * @param sumBy numeric control summed per group and globally
 */
public record GroupSpec(boolean enabled, String by, @JsonProperty("sum_control_guid") String sumBy) {
  public static final GroupSpec DISABLED = new GroupSpec(false, null, null);

  public boolean groupsPage() {
    return enabled && by != null && !by.isBlank();
  }
}
