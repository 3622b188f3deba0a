package com.flamingo.ai.timelineqa.service.structured;

import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException.Reason;
import io.micrometer.core.instrument.MeterRegistry;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * {@link StructuredStore} over the SQLite database written by the aggregation job. The connection
 * is opened read-only, and every query runs with a row cap and a timeout.
 */
@Slf4j
@Repository
public class JdbcStructuredStore implements StructuredStore {

  private final JdbcTemplate jdbcTemplate;
  private final int maxRows;
  private final MeterRegistry meterRegistry;

  @Autowired
  public JdbcStructuredStore(QaConfig qaConfig, MeterRegistry meterRegistry) {
    this(readOnlyTemplate(qaConfig.getStructured()), qaConfig.getStructured(), meterRegistry);
  }

  JdbcStructuredStore(
      JdbcTemplate jdbcTemplate, QaConfig.Structured config, MeterRegistry meterRegistry) {
    this.jdbcTemplate = jdbcTemplate;
    this.maxRows = Math.max(1, config.getMaxRows());
    this.meterRegistry = meterRegistry;
    // one extra row tells a full result apart from a truncated one
    this.jdbcTemplate.setMaxRows(maxRows + 1);
    this.jdbcTemplate.setQueryTimeout(config.getQueryTimeoutSeconds());
  }

  @Override
  public TabularResult execute(ValidatedQuery query) {
    log.debug("Executing structured query on {}: {}", query.view().name(), query.sql());
    try {
      TabularResult result =
          jdbcTemplate.query(
              query.sql(),
              rs -> {
                ResultSetMetaData meta = rs.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                  columns.add(meta.getColumnLabel(i));
                }
                List<List<Object>> rows = new ArrayList<>();
                boolean truncated = false;
                while (rs.next()) {
                  if (rows.size() == maxRows) {
                    truncated = true;
                    break;
                  }
                  List<Object> row = new ArrayList<>(columns.size());
                  for (int i = 1; i <= columns.size(); i++) {
                    row.add(rs.getObject(i));
                  }
                  rows.add(row);
                }
                return new TabularResult(List.copyOf(columns), rows, truncated);
              });
      meterRegistry.counter("structured.query.executed").increment();
      return result;
    } catch (DataAccessException e) {
      meterRegistry.counter("structured.query.execution_failed").increment();
      log.warn("Structured query failed on {}: {}", query.view().name(), e.getMessage());
      throw new QueryGenerationException(
          Reason.EXECUTION_FAILED, "Query execution failed: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean viewExists(String viewName) {
    try {
      Integer count =
          jdbcTemplate.queryForObject(
              "SELECT COUNT(*) FROM sqlite_master WHERE type IN ('table', 'view') AND name = ?",
              Integer.class,
              viewName);
      return count != null && count > 0;
    } catch (DataAccessException e) {
      log.warn("Could not check structured view {}: {}", viewName, e.getMessage());
      return false;
    }
  }

  private static JdbcTemplate readOnlyTemplate(QaConfig.Structured config) {
    SQLiteConfig sqliteConfig = new SQLiteConfig();
    sqliteConfig.setReadOnly(true);
    SQLiteDataSource dataSource = new SQLiteDataSource(sqliteConfig);
    dataSource.setUrl(config.getJdbcUrl());
    return new JdbcTemplate(dataSource);
  }
}
