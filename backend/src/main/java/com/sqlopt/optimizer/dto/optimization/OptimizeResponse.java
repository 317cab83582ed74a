package com.sqlopt.optimizer.dto.optimization;

import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sqlopt.optimizer.dto.metadata.ColumnInfo;
import com.sqlopt.optimizer.dto.metadata.TableMetadata;
import com.sqlopt.optimizer.dto.plan.PlanResult;
import com.sqlopt.optimizer.dto.rewrite.RiskLevel;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Wire shape of an {@link OptimizationOutcome}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of an optimization run")
public class OptimizeResponse {

  @JsonProperty("ok")
  private boolean ok;

  @JsonProperty("attempts")
  private int attempts;

  @JsonProperty("tables")
  private List<String> tables;

  @JsonProperty("llm")
  private LlmSummary llm;

  @JsonProperty("original_sql")
  private String originalSql;

  @JsonProperty("optimized_sql")
  private String optimizedSql;

  @JsonProperty("diff")
  private String diff;

  @JsonProperty("explain_before")
  private Explain explainBefore;

  @JsonProperty("explain_after")
  private Explain explainAfter;

  @JsonProperty("metadata")
  private List<TableSummary> metadata;

  @JsonProperty("error")
  private String error;

  public static OptimizeResponse from(OptimizationOutcome outcome) {
    return OptimizeResponse.builder()
        .ok(outcome.isSuccess())
        .attempts(outcome.getAttempts())
        .tables(outcome.getTables())
        .llm(
            LlmSummary.builder()
                .risk(outcome.getRisk())
                .changes(outcome.getChanges())
                .assumptions(outcome.getAssumptions())
                .build())
        .originalSql(outcome.getOriginalSql())
        .optimizedSql(outcome.getFinalSql())
        .diff(outcome.getDiff())
        .explainBefore(Explain.from(outcome.getBaselinePlan()))
        .explainAfter(Explain.from(outcome.getFinalPlan()))
        .metadata(
            outcome.getMetadata().stream().map(TableSummary::from).collect(Collectors.toList()))
        .error(outcome.getError())
        .build();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class LlmSummary {

    @JsonProperty("risk")
    private RiskLevel risk;

    @JsonProperty("changes")
    private List<String> changes;

    @JsonProperty("assumptions")
    private List<String> assumptions;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Explain {

    @JsonProperty("ok")
    private boolean ok;

    @JsonProperty("error")
    private String error;

    @JsonProperty("text")
    private String text;

    @JsonProperty("estimated_rows")
    private Double estimatedRows;

    static Explain from(PlanResult plan) {
      if (plan == null) {
        return null;
      }
      return Explain.builder()
          .ok(plan.isSuccess())
          .error(plan.getError())
          .text(plan.getText())
          .estimatedRows(plan.getEstimatedRows())
          .build();
    }
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class TableSummary {

    @JsonProperty("table")
    private String table;

    @JsonProperty("partition_candidates")
    private List<String> partitionCandidates;

    @JsonProperty("columns")
    private List<ColumnInfo> columns;

    static TableSummary from(TableMetadata metadata) {
      return TableSummary.builder()
          .table(metadata.getTable().qualifiedName())
          .partitionCandidates(metadata.getPartitionCandidates())
          .columns(metadata.getColumns())
          .build();
    }
  }
}
