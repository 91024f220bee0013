package io.intellixity.vista.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "vista")
public class VistaProperties {
  private final Db db = new Db();
  private final Views views = new Views();
  private final TableCache tableCache = new TableCache();
  private final ResultCache resultCache = new ResultCache();
  private final Sessions sessions = new Sessions();
  private final Paging paging = new Paging();
  private String systemTablePrefix = "sys_";

  /** Table -> roles allowed to read it. */
  private Map<String, List<String>> restrictedTables = new LinkedHashMap<>(Map.of("sys_benutzer", List.of("admin")));

  public Db getDb() { return db; }
  public Views getViews() { return views; }
  public TableCache getTableCache() { return tableCache; }
  public ResultCache getResultCache() { return resultCache; }
  public Sessions getSessions() { return sessions; }
  public Paging getPaging() { return paging; }
  public String getSystemTablePrefix() { return systemTablePrefix; }
  public void setSystemTablePrefix(String systemTablePrefix) { this.systemTablePrefix = systemTablePrefix; }
  public Map<String, List<String>> getRestrictedTables() { return restrictedTables; }
  public void setRestrictedTables(Map<String, List<String>> restrictedTables) { this.restrictedTables = restrictedTables; }

  public static class Db {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maxPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
  }

  public static class Views {
    private String definitionTable = "sys_viewdaten";
    private String stateTable = "sys_view_state";

    public String getDefinitionTable() { return definitionTable; }
    public void setDefinitionTable(String definitionTable) { this.definitionTable = definitionTable; }
    public String getStateTable() { return stateTable; }
    public void setStateTable(String stateTable) { this.stateTable = stateTable; }
  }

  public static class TableCache {
    private int maxRows = 20_000;
    private int chunkSize = 2_000;
    private Duration refreshInterval = Duration.ofSeconds(2);

    public int getMaxRows() { return maxRows; }
    public void setMaxRows(int maxRows) { this.maxRows = maxRows; }
    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
    public Duration getRefreshInterval() { return refreshInterval; }
    public void setRefreshInterval(Duration refreshInterval) { this.refreshInterval = refreshInterval; }
  }

  public static class ResultCache {
    private int maxEntries = 200;

    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
  }

  public static class Sessions {
    private int maxSessions = 1000;
    private Duration idle = Duration.ofMinutes(30);

    public int getMaxSessions() { return maxSessions; }
    public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
    public Duration getIdle() { return idle; }
    public void setIdle(Duration idle) { this.idle = idle; }
  }

  public static class Paging {
    private int defaultLimit = 200;
    private int maxLimit = 2000;

    public int getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }
    public int getMaxLimit() { return maxLimit; }
    public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }
  }
}
