package com.sqlopt.optimizer.dto.rewrite;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/** Parsed result of one generative-model call. */
@Value
@Builder
public class RewriteResult {

  boolean success;
  String optimizedSql;
  List<String> changes;
  List<String> assumptions;
  RiskLevel risk;
  String rawText;
  String error;

  public static RewriteResult failure(String error) {
    return failure(error, null);
  }

  public static RewriteResult failure(String error, String rawText) {
    return RewriteResult.builder().success(false).error(error).rawText(rawText).build();
  }
}
