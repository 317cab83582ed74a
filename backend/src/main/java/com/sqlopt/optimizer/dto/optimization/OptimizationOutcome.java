package com.sqlopt.optimizer.dto.optimization;

import java.util.List;

import com.sqlopt.optimizer.dto.metadata.TableMetadata;
import com.sqlopt.optimizer.dto.plan.PlanResult;
import com.sqlopt.optimizer.dto.rewrite.RiskLevel;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Terminal record of one optimization run. When {@code success} is true the final SQL and final
 * plan are present and the final plan passed the improvement check; otherwise {@code error} is
 * set.
 */
@Value
@Builder
public class OptimizationOutcome {

  boolean success;
  String originalSql;
  String finalSql;
  PlanResult baselinePlan;
  PlanResult finalPlan;
  @Singular List<String> tables;
  @Singular("tableMetadata") List<TableMetadata> metadata;
  int attempts;
  @Builder.Default String diff = "";
  String error;
  List<String> changes;
  List<String> assumptions;
  RiskLevel risk;
}
