package io.intellixity.vista.model;

import io.intellixity.vista.temporal.PdvmStamp;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/** A stored field: either a single current value or a history of timestamped versions. */
public sealed interface FieldValue permits FieldValue.Scalar, FieldValue.Temporal {

  static FieldValue scalar(Object value) {
    return new Scalar(value);
  }

  static FieldValue temporal(NavigableMap<PdvmStamp, Object> versions) {
    return new Temporal(versions);
  }

  record Scalar(Object value) implements FieldValue {}

  record Temporal(NavigableMap<PdvmStamp, Object> versions) implements FieldValue {
    public Temporal {
      Objects.requireNonNull(versions, "versions");
      versions = Collections.unmodifiableNavigableMap(new TreeMap<>(versions));
    }
  }
}
