package io.intellixity.vista.state;

import java.util.List;

/**
 * Outcome of normalizing untrusted input.
 *
 * @param sourceOk false when the input was not an object at all and defaults were used wholesale
 */
public record Sanitized<T>(T value, List<String> warnings, boolean sourceOk) {
  public Sanitized {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}
