package com.sqlopt.optimizer.service.validation;

import org.springframework.stereotype.Service;

import com.sqlopt.optimizer.config.OptimizerProperties;
import com.sqlopt.optimizer.dto.plan.PlanResult;
import com.sqlopt.optimizer.service.sql.TableExtractor;

import lombok.RequiredArgsConstructor;

/** Safety gate and improvement check applied to each rewrite candidate. */
@Service
@RequiredArgsConstructor
public class CandidateValidator {

  private final TableExtractor tableExtractor;
  private final OptimizerProperties properties;

  /** Passes everything when read-only mode is off; otherwise only parseable queries. */
  public boolean passesSafetyGate(String sql) {
    return !properties.isReadOnlyMode() || tableExtractor.isQueryOnly(sql);
  }

  /**
   * A candidate is improved when its plan was obtained and, if both sides carry a row estimate,
   * the candidate's is within the configured tolerance of the baseline's. A missing estimate on
   * either side counts as no visible regression.
   */
  public boolean isImproved(PlanResult baseline, PlanResult candidate) {
    if (candidate == null || !candidate.isSuccess()) {
      return false;
    }
    if (baseline != null && baseline.hasEstimatedRows() && candidate.hasEstimatedRows()) {
      double limit = baseline.getEstimatedRows() * (1.0 + properties.getImprovementTolerance());
      return candidate.getEstimatedRows() <= limit;
    }
    return true;
  }
}
