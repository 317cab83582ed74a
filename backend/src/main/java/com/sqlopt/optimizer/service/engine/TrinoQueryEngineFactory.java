package com.sqlopt.optimizer.service.engine;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.sqlopt.optimizer.config.TrinoProperties;
import com.sqlopt.optimizer.exception.QueryExecutionException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class TrinoQueryEngineFactory implements QueryEngineFactory {

  private final TrinoProperties trinoProperties;

  @Override
  public QueryEngine open() throws QueryExecutionException {
    String url = jdbcUrl();
    try {
      Connection connection = DriverManager.getConnection(url, connectionProperties());
      log.debug("Opened Trino connection to {}", url);
      return new TrinoQueryEngine(connection, trinoProperties.getQueryTimeoutSeconds());
    } catch (SQLException e) {
      log.warn("Could not connect to Trino at {}: {}", url, e.getMessage());
      throw new QueryExecutionException("Could not connect to Trino: " + e.getMessage(), e);
    }
  }

  String jdbcUrl() {
    return String.format(
        "jdbc:trino://%s:%d/%s/%s",
        trinoProperties.getHost(),
        trinoProperties.getPort(),
        trinoProperties.getCatalog(),
        trinoProperties.getSchema());
  }

  Properties connectionProperties() {
    Properties props = new Properties();
    props.setProperty("user", trinoProperties.getUser());
    props.setProperty("SSL", String.valueOf(trinoProperties.isSsl()));
    if (trinoProperties.getSource() != null && !trinoProperties.getSource().isBlank()) {
      props.setProperty("source", trinoProperties.getSource());
    }
    if (trinoProperties.hasBasicAuth()) {
      // Authenticate as the basic-auth principal, run queries as the configured user.
      props.setProperty("user", trinoProperties.getBasicUser());
      props.setProperty("password", trinoProperties.getBasicPassword());
      if (!trinoProperties.getBasicUser().equals(trinoProperties.getUser())) {
        props.setProperty("sessionUser", trinoProperties.getUser());
      }
    }
    Map<String, String> session = trinoProperties.getSessionProperties();
    if (session != null && !session.isEmpty()) {
      props.setProperty(
          "sessionProperties",
          session.entrySet().stream()
              .map(e -> e.getKey() + ":" + e.getValue())
              .collect(Collectors.joining(";")));
    }
    return props;
  }
}
