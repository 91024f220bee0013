package io.intellixity.vista.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One line of a matrix page: a data row or, when the page is grouped, a group header.
 *
 * @param values control id -> projected value
 * @param effectiveFrom control id -> history stamp the value was taken from
 * @param groupKey for data rows of a grouped page: key of the enclosing group
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatrixRow(
    String kind,
    String id,
    String name,
    Map<String, Object> values,
    Map<String, Double> effectiveFrom,
    String groupKey,
    String key,
    Object raw,
    Long count,
    Double sum
) {
  public static final String DATA = "data";
  public static final String GROUP = "group";

  public static MatrixRow data(String id, String name, Map<String, Object> values, Map<String, Double> effectiveFrom) {
    return new MatrixRow(DATA, id, name, values, effectiveFrom, null, null, null, null, null);
  }

  public static MatrixRow group(String key, Object raw, long count, Double sum) {
    return new MatrixRow(GROUP, null, null, null, null, null, key, raw, count, sum);
  }

  public MatrixRow inGroup(String groupKey) {
    return new MatrixRow(kind, id, name, values, effectiveFrom, groupKey, key, raw, count, sum);
  }

  public boolean isData() {
    return DATA.equals(kind);
  }
}
