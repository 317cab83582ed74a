package com.sqlopt.optimizer.dto.plan;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Outcome of asking the engine to EXPLAIN one statement. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlanResult {

  boolean success;
  String text;
  String error;

  /** Row-count estimate scraped from the plan text, or null when none was found. */
  Double estimatedRows;

  public static PlanResult success(String text, Double estimatedRows) {
    return new PlanResult(true, text == null ? "" : text, null, estimatedRows);
  }

  public static PlanResult failure(String error) {
    return new PlanResult(false, "", error, null);
  }

  public boolean hasEstimatedRows() {
    return estimatedRows != null;
  }
}
