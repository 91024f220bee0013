package io.intellixity.vista.query;

import io.intellixity.vista.model.Control;
import io.intellixity.vista.temporal.ProjectedRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Groups one page of rows by a control's projected value.\n
 *
 * Groups appear in order of first appearance; each header is followed by its rows. Counts and sums are
 * page-local.\n
 */
public final class PageGrouper {
  private PageGrouper() {}

  public static List<MatrixRow> group(List<ProjectedRow> page,
                                      Control by,
                                      Control sum,
                                      Function<ProjectedRow, MatrixRow> toData) {
    if (by == null) {
      List<MatrixRow> out = new ArrayList<>(page.size());
      for (ProjectedRow r : page) out.add(toData.apply(r));
      return out;
    }

    Map<String, Bucket> buckets = new LinkedHashMap<>();
    for (ProjectedRow r : page) {
      Object raw = by.isBound() ? r.value(by.fieldKey()) : null;
      String key = raw == null ? "" : String.valueOf(raw);
      buckets.computeIfAbsent(key, k -> new Bucket(raw)).rows.add(r);
    }

    List<MatrixRow> out = new ArrayList<>(page.size() + buckets.size());
    for (var e : buckets.entrySet()) {
      Bucket b = e.getValue();
      out.add(MatrixRow.group(e.getKey(), b.raw, b.rows.size(), QueryPipeline.sum(b.rows, sum)));
      for (ProjectedRow r : b.rows) out.add(toData.apply(r).inGroup(e.getKey()));
    }
    return out;
  }

  private static final class Bucket {
    final Object raw;
    final List<ProjectedRow> rows = new ArrayList<>();

    Bucket(Object raw) { this.raw = raw; }
  }
}
