package io.intellixity.vista.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.vista.cache.SessionCacheRegistry;
import io.intellixity.vista.cache.TableCacheSettings;
import io.intellixity.vista.engine.EngineSettings;
import io.intellixity.vista.engine.ViewService;
import io.intellixity.vista.spi.RecordStore;
import io.intellixity.vista.spi.ViewDefinitionStore;
import io.intellixity.vista.spi.ViewStateStore;
import io.intellixity.vista.store.jdbc.JdbcHandle;
import io.intellixity.vista.store.jdbc.JdbcRecordStore;
import io.intellixity.vista.store.jdbc.JdbcViewDefinitionStore;
import io.intellixity.vista.store.jdbc.JdbcViewStateStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Configuration
@EnableConfigurationProperties(VistaProperties.class)
public class VistaServerConfig {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean(destroyMethod = "close")
  public HikariDataSource vistaDataSource(VistaProperties props) {
    VistaProperties.Db db = props.getDb();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalStateException("Missing vista.db.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("vista");
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaxPoolSize());
    hc.setReadOnly(false);
    return new HikariDataSource(hc);
  }

  @Bean
  public JdbcHandle jdbcHandle(HikariDataSource vistaDataSource, VistaProperties props) {
    return new JdbcHandle("jdbc:vista", vistaDataSource, props.getDb().getSchema());
  }

  @Bean
  public RecordStore recordStore(JdbcHandle handle, ObjectMapper mapper) {
    return new JdbcRecordStore(handle, mapper);
  }

  @Bean
  public ViewDefinitionStore viewDefinitionStore(JdbcHandle handle, VistaProperties props, ObjectMapper mapper) {
    return new JdbcViewDefinitionStore(handle, props.getViews().getDefinitionTable(), mapper);
  }

  @Bean
  public ViewStateStore viewStateStore(JdbcHandle handle, VistaProperties props, ObjectMapper mapper) {
    return new JdbcViewStateStore(handle, props.getViews().getStateTable(), mapper);
  }

  @Bean
  public SessionCacheRegistry sessionCacheRegistry(RecordStore records, VistaProperties props, Clock clock) {
    VistaProperties.TableCache tc = props.getTableCache();
    return new SessionCacheRegistry(
        records,
        new TableCacheSettings(tc.getMaxRows(), tc.getChunkSize(), tc.getRefreshInterval()),
        props.getResultCache().getMaxEntries(),
        props.getSessions().getMaxSessions(),
        props.getSessions().getIdle(),
        clock);
  }

  @Bean
  public EngineSettings engineSettings(VistaProperties props) {
    return engineSettingsOf(props);
  }

  @Bean
  public ViewService viewService(ViewDefinitionStore definitions,
                                 ViewStateStore states,
                                 SessionCacheRegistry caches,
                                 EngineSettings settings,
                                 Clock clock) {
    return new ViewService(definitions, states, caches, settings, clock);
  }

  static EngineSettings engineSettingsOf(VistaProperties props) {
    Map<String, Set<String>> restricted = new LinkedHashMap<>();
    if (props.getRestrictedTables() != null) {
      props.getRestrictedTables().forEach((table, roles) ->
          restricted.put(table, roles == null ? Set.of() : Set.copyOf(roles)));
    }
    return new EngineSettings(
        props.getPaging().getDefaultLimit(),
        props.getPaging().getMaxLimit(),
        props.getTableCache().getMaxRows(),
        props.getSystemTablePrefix(),
        restricted);
  }
}
