package io.intellixity.vista.cache;

import io.intellixity.vista.query.PipelineResult;

import java.time.Instant;
import java.util.Objects;

/** A pipeline result, pinned to the table version it was computed from. */
public record CachedResult(PipelineResult result, long tableVersion, Instant insertedAt) {
  public CachedResult {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(insertedAt, "insertedAt");
  }
}
