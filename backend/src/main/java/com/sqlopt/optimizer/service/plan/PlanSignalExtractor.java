package com.sqlopt.optimizer.service.plan;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.sqlopt.optimizer.dto.plan.PlanResult;
import com.sqlopt.optimizer.service.engine.QueryEngine;

import lombok.extern.slf4j.Slf4j;

/**
 * Asks the engine to EXPLAIN a statement and scrapes what it can from the plan text. Plan text
 * layout differs across Trino versions, so only the row-count estimate is read and a missing one
 * is not an error.
 */
@Slf4j
@Service
public class PlanSignalExtractor {

  private static final String EXPLAIN_PREFIX = "EXPLAIN ";

  // Trino prints e.g. "Estimates: {rows: 1.23E6 (10MB), cpu: ...}"
  private static final Pattern ESTIMATED_ROWS_PATTERN = Pattern.compile("rows:\\s*([0-9.eE+]+)");

  /** Never throws; engine failures come back as {@link PlanResult#failure(String)}. */
  public PlanResult explain(QueryEngine engine, String sql) {
    List<List<Object>> rows;
    try {
      rows = engine.execute(EXPLAIN_PREFIX + sql);
    } catch (Exception e) {
      String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      log.warn("EXPLAIN failed: {}", error);
      return PlanResult.failure(error);
    }

    String plan =
        rows.stream()
            .filter(Objects::nonNull)
            .filter(row -> !row.isEmpty() && row.get(0) != null)
            .map(row -> String.valueOf(row.get(0)))
            .collect(Collectors.joining("\n"));
    Double estimatedRows = extractEstimatedRows(plan);
    log.debug(
        "EXPLAIN returned {} chars of plan text, estimated rows={}", plan.length(), estimatedRows);
    return PlanResult.success(plan, estimatedRows);
  }

  /** First {@code rows: <number>} in the plan, or null when absent or unparseable. */
  public Double extractEstimatedRows(String planText) {
    if (planText == null || planText.isEmpty()) {
      return null;
    }
    Matcher matcher = ESTIMATED_ROWS_PATTERN.matcher(planText);
    if (!matcher.find()) {
      return null;
    }
    try {
      return Double.parseDouble(matcher.group(1));
    } catch (NumberFormatException e) {
      log.debug("Ignoring unparseable row estimate '{}'", matcher.group(1));
      return null;
    }
  }
}
