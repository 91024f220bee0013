package io.intellixity.vista.query;

import io.intellixity.vista.model.Control;
import io.intellixity.vista.state.SortDirection;
import io.intellixity.vista.temporal.ProjectedRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stable single-column sort.\n
 *
 * Numeric values order before strings; numbers by value, strings case-sensitively. Descending reverses the
 * comparator, rows with equal keys keep their input order either way.\n
 */
public final class RowSorter {
  private RowSorter() {}

  public static List<ProjectedRow> sort(List<ProjectedRow> rows, Control control, SortDirection direction) {
    if (control == null || !control.isBound() || direction == null || direction == SortDirection.NONE) return rows;

    List<Keyed> keyed = new ArrayList<>(rows.size());
    for (ProjectedRow r : rows) keyed.add(new Keyed(r, SortKey.of(r.value(control.fieldKey()))));

    Comparator<Keyed> cmp = Comparator.comparing(Keyed::key);
    keyed.sort(direction == SortDirection.DESC ? cmp.reversed() : cmp);

    List<ProjectedRow> out = new ArrayList<>(keyed.size());
    for (Keyed k : keyed) out.add(k.row());
    return out;
  }

  private record Keyed(ProjectedRow row, SortKey key) {}

  record SortKey(Double number, String text) implements Comparable<SortKey> {
    static SortKey of(Object raw) {
      Double n = Numbers.parse(raw);
      if (n != null) return new SortKey(n, null);
      return new SortKey(null, raw == null ? "" : String.valueOf(raw));
    }

    @Override
    public int compareTo(SortKey o) {
      if (number != null && o.number != null) return Double.compare(number, o.number);
      if (number != null) return -1;
      if (o.number != null) return 1;
      return text.compareTo(o.text);
    }
  }
}
