package io.intellixity.vista.store.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** JSONB column codec. */
final class JsonColumns {
  private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() {};

  private final ObjectMapper mapper;

  JsonColumns(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /** Decodes a JSON object column; null for SQL NULL, JSON null and non-object documents. */
  Map<String, Object> readObject(Object raw, String column) {
    if (raw == null) return null;
    if (raw instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      m.forEach((k, v) -> out.put(String.valueOf(k), v));
      return out;
    }
    String json = raw instanceof PGobject pg ? pg.getValue() : String.valueOf(raw);
    if (json == null || json.isBlank()) return null;
    try {
      var tree = mapper.readTree(json);
      if (tree == null || !tree.isObject()) return null;
      return mapper.convertValue(tree, OBJECT);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Column '" + column + "' does not hold valid JSON", e);
    }
  }

  PGobject jsonb(Object value) throws SQLException {
    PGobject pg = new PGobject();
    pg.setType("jsonb");
    try {
      pg.setValue(value == null ? null : mapper.writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode value as JSON", e);
    }
    return pg;
  }
}
