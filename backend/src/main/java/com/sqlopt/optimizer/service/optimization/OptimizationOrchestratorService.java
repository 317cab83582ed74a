package com.sqlopt.optimizer.service.optimization;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.sqlopt.optimizer.config.OptimizerProperties;
import com.sqlopt.optimizer.config.TrinoProperties;
import com.sqlopt.optimizer.dto.metadata.TableMetadata;
import com.sqlopt.optimizer.dto.optimization.OptimizationOutcome;
import com.sqlopt.optimizer.dto.plan.PlanResult;
import com.sqlopt.optimizer.dto.rewrite.RewriteResult;
import com.sqlopt.optimizer.dto.rewrite.RiskLevel;
import com.sqlopt.optimizer.dto.sql.TableReference;
import com.sqlopt.optimizer.exception.QueryExecutionException;
import com.sqlopt.optimizer.service.engine.QueryEngine;
import com.sqlopt.optimizer.service.engine.QueryEngineFactory;
import com.sqlopt.optimizer.service.metadata.SchemaMetadataGatherer;
import com.sqlopt.optimizer.service.plan.PlanSignalExtractor;
import com.sqlopt.optimizer.service.prompt.RewritePromptBuilder;
import com.sqlopt.optimizer.service.rewrite.SqlRewriteClient;
import com.sqlopt.optimizer.service.sql.TableExtractor;
import com.sqlopt.optimizer.service.validation.CandidateValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one optimization: explain the original query, gather table metadata, then ask the model
 * for a rewrite and validate it, feeding each rejection back as a fix prompt until a candidate is
 * accepted or {@code maxFixAttempts + 1} attempts are used.
 *
 * <p>The service is stateless; everything a run accumulates lives in a per-call {@link
 * AttemptState}, so concurrent runs share nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizationOrchestratorService {

  static final String EMPTY_SQL = "Empty SQL";
  static final String NOT_READ_ONLY = "Only SELECT queries are allowed in read_only_mode";
  static final String CANDIDATE_NOT_READ_ONLY = "Candidate SQL is not SELECT-only (read_only_mode).";
  static final String NOT_IMPROVED =
      "Candidate SQL is not a measurable improvement based on EXPLAIN signals";
  static final String EMPTY_MODEL_OUTPUT = "LLM returned empty output";

  private final OptimizerProperties optimizerProperties;
  private final TrinoProperties trinoProperties;
  private final QueryEngineFactory queryEngineFactory;
  private final TableExtractor tableExtractor;
  private final PlanSignalExtractor planSignalExtractor;
  private final SchemaMetadataGatherer metadataGatherer;
  private final RewritePromptBuilder promptBuilder;
  private final SqlRewriteClient rewriteClient;
  private final CandidateValidator candidateValidator;

  /** Opens an engine handle for this run only and closes it when the run ends. */
  public OptimizationOutcome optimize(String sql) {
    String originalSql = sql == null ? "" : sql.strip();
    OptimizationOutcome rejected = checkInput(originalSql);
    if (rejected != null) {
      return rejected;
    }

    try (QueryEngine engine = queryEngineFactory.open()) {
      return runPipeline(originalSql, engine);
    } catch (QueryExecutionException e) {
      return inputFailure(originalSql, e.getMessage());
    }
  }

  /** Runs against a caller-supplied engine handle, which the caller keeps ownership of. */
  public OptimizationOutcome optimize(String sql, QueryEngine engine) {
    String originalSql = sql == null ? "" : sql.strip();
    OptimizationOutcome rejected = checkInput(originalSql);
    if (rejected != null) {
      return rejected;
    }
    return runPipeline(originalSql, engine);
  }

  private OptimizationOutcome checkInput(String originalSql) {
    if (originalSql.isEmpty()) {
      log.info("Rejected: empty SQL");
      return inputFailure("", EMPTY_SQL);
    }
    if (optimizerProperties.isReadOnlyMode() && !candidateValidator.passesSafetyGate(originalSql)) {
      log.info("Rejected: original SQL is not a read-only query");
      return inputFailure(originalSql, NOT_READ_ONLY);
    }
    return null;
  }

  private OptimizationOutcome runPipeline(String originalSql, QueryEngine engine) {
    PlanResult baseline = planSignalExtractor.explain(engine, originalSql);
    if (!baseline.isSuccess()) {
      log.info("Baseline EXPLAIN failed, no rewrite attempted");
      return OptimizationOutcome.builder()
          .success(false)
          .originalSql(originalSql)
          .baselinePlan(baseline)
          .attempts(0)
          .error("EXPLAIN failed for original SQL: " + baseline.getError())
          .build();
    }
    log.info("Baseline explained, estimated rows={}", baseline.getEstimatedRows());

    List<TableReference> refs = tableExtractor.extractTables(originalSql);
    List<String> tables =
        refs.stream().map(TableReference::qualifiedName).collect(Collectors.toList());
    List<TableMetadata> metadata =
        metadataGatherer.gather(
            engine, refs, trinoProperties.getCatalog(), trinoProperties.getSchema());
    log.info("Query references {} table(s): {}", tables.size(), tables);

    String initialPrompt = promptBuilder.buildOptimizePrompt(originalSql, baseline, metadata);
    int maxAttempts = optimizerProperties.getMaxFixAttempts() + 1;
    AttemptState state = new AttemptState();

    for (int i = 0; i < maxAttempts; i++) {
      state.attempts = i + 1;
      String prompt =
          i == 0
              ? initialPrompt
              : promptBuilder.buildFixPrompt(
                  originalSql,
                  state.candidateSql != null ? state.candidateSql : "",
                  state.lastError != null ? state.lastError : "Unknown failure",
                  baseline,
                  metadata);

      RewriteResult rewrite = rewriteClient.rewrite(prompt);
      if (!rewrite.isSuccess() || isBlank(rewrite.getOptimizedSql())) {
        state.reject(rewrite.getError() != null ? rewrite.getError() : EMPTY_MODEL_OUTPUT);
        continue;
      }
      state.recordCandidate(rewrite);

      if (!candidateValidator.passesSafetyGate(state.candidateSql)) {
        state.reject(CANDIDATE_NOT_READ_ONLY);
        continue;
      }

      PlanResult candidatePlan = planSignalExtractor.explain(engine, state.candidateSql);
      state.candidatePlan = candidatePlan;
      if (!candidatePlan.isSuccess()) {
        state.reject("EXPLAIN failed: " + candidatePlan.getError());
        continue;
      }

      if (candidateValidator.isImproved(baseline, candidatePlan)) {
        log.info(
            "Attempt {}/{} accepted, estimated rows {} -> {}",
            state.attempts,
            maxAttempts,
            baseline.getEstimatedRows(),
            candidatePlan.getEstimatedRows());
        return OptimizationOutcome.builder()
            .success(true)
            .originalSql(originalSql)
            .finalSql(state.candidateSql)
            .baselinePlan(baseline)
            .finalPlan(candidatePlan)
            .tables(tables)
            .metadata(metadata)
            .attempts(state.attempts)
            .diff(SqlDiff.unified(originalSql, state.candidateSql))
            .changes(state.changes)
            .assumptions(state.assumptions)
            .risk(state.risk)
            .build();
      }

      state.reject(
          String.format(
              "%s (estimated rows %s vs baseline %s).",
              NOT_IMPROVED, candidatePlan.getEstimatedRows(), baseline.getEstimatedRows()));
    }

    log.info("No candidate accepted after {} attempt(s): {}", state.attempts, state.lastError);
    return OptimizationOutcome.builder()
        .success(false)
        .originalSql(originalSql)
        .finalSql(state.candidateSql)
        .baselinePlan(baseline)
        .finalPlan(state.candidatePlan)
        .tables(tables)
        .metadata(metadata)
        .attempts(state.attempts)
        .diff(state.candidateSql != null ? SqlDiff.unified(originalSql, state.candidateSql) : "")
        .error(
            state.lastError != null
                ? state.lastError
                : "Failed to produce a valid optimized query")
        .changes(state.changes)
        .assumptions(state.assumptions)
        .risk(state.risk)
        .build();
  }

  private OptimizationOutcome inputFailure(String originalSql, String error) {
    return OptimizationOutcome.builder()
        .success(false)
        .originalSql(originalSql)
        .baselinePlan(PlanResult.failure(error))
        .attempts(0)
        .error(error)
        .build();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  /** Mutable bookkeeping for a single run; never shared. */
  private static final class AttemptState {
    private int attempts;
    private String candidateSql;
    private PlanResult candidatePlan;
    private String lastError;
    private List<String> changes;
    private List<String> assumptions;
    private RiskLevel risk;

    void recordCandidate(RewriteResult rewrite) {
      candidateSql = rewrite.getOptimizedSql().strip();
      candidatePlan = null;
      changes = rewrite.getChanges() != null ? rewrite.getChanges() : List.of();
      assumptions = rewrite.getAssumptions() != null ? rewrite.getAssumptions() : List.of();
      risk = rewrite.getRisk() != null ? rewrite.getRisk() : RiskLevel.UNKNOWN;
    }

    void reject(String reason) {
      lastError = reason;
      log.info("Attempt {} rejected: {}", attempts, reason);
    }
  }
}
