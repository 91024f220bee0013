package io.intellixity.vista.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.intellixity.vista.temporal.PdvmStamp;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inputs that determine a pipeline result. {@link #hash()} is a SHA-1 over their canonical JSON form (keys
 * sorted at every level), so equal inputs hash equally regardless of map ordering.
 *
 * @param tableState table state wire form
 * @param currentDay today's {@code YYYYDDD}; retirement depends on it
 */
public record ResultCacheKey(
    String viewId,
    String table,
    long tableVersion,
    Map<String, Object> tableState,
    boolean includeRetired,
    PdvmStamp asOf,
    int currentDay
) {
  private static final ObjectMapper CANONICAL = JsonMapper.builder()
      .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .build();

  public String canonicalJson() {
    Map<String, Object> blob = new LinkedHashMap<>();
    blob.put("viewId", viewId);
    blob.put("table", table);
    blob.put("tableVersion", tableVersion);
    blob.put("tableState", tableState);
    blob.put("includeRetired", includeRetired);
    blob.put("asOf", asOf.value());
    blob.put("asOfDay", asOf.day());
    blob.put("currentDay", currentDay);
    try {
      return CANONICAL.writeValueAsString(blob);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize result cache key", e);
    }
  }

  public String hash() {
    try {
      MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
      return HexFormat.of().formatHex(sha1.digest(canonicalJson().getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 not available", e);
    }
  }
}
