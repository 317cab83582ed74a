package com.sqlopt.optimizer.service.engine;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import com.sqlopt.optimizer.exception.QueryExecutionException;

import lombok.extern.slf4j.Slf4j;

/** {@link QueryEngine} over a single JDBC connection to Trino. */
@Slf4j
public class TrinoQueryEngine implements QueryEngine {

  private static final int LOG_TRUNCATE_LENGTH = 100;

  private final Connection connection;
  private final int queryTimeoutSeconds;

  public TrinoQueryEngine(Connection connection, int queryTimeoutSeconds) {
    this.connection = connection;
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public List<List<Object>> execute(String sql) throws QueryExecutionException {
    log.debug("Executing: {}", truncateStatement(sql));
    try (Statement stmt = connection.createStatement()) {
      if (queryTimeoutSeconds > 0) {
        stmt.setQueryTimeout(queryTimeoutSeconds);
      }
      try (ResultSet rs = stmt.executeQuery(sql)) {
        int columnCount = rs.getMetaData().getColumnCount();
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
          List<Object> row = new ArrayList<>(columnCount);
          for (int i = 1; i <= columnCount; i++) {
            row.add(rs.getObject(i));
          }
          rows.add(row);
        }
        return rows;
      }
    } catch (SQLException e) {
      log.debug("Statement failed: {}. Error: {}", truncateStatement(sql), e.getMessage());
      throw new QueryExecutionException(
          e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("Failed to close Trino connection: {}", e.getMessage());
    }
  }

  private String truncateStatement(String sql) {
    if (sql == null) {
      return null;
    }
    return sql.length() <= LOG_TRUNCATE_LENGTH
        ? sql
        : sql.substring(0, LOG_TRUNCATE_LENGTH) + "...";
  }
}
