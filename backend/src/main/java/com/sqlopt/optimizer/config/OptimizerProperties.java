package com.sqlopt.optimizer.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

  /** Fix attempts after the initial rewrite; total model calls are at most this plus one. */
  @Min(0)
  private int maxFixAttempts = 2;

  private boolean readOnlyMode = true;

  /** Fraction by which a candidate's estimated rows may exceed the baseline's. */
  @DecimalMin("0.0")
  private double improvementTolerance = 0.05;

  /** Checked in order, case-insensitively, against fetched column names. */
  @NotNull
  private List<String> partitionColumnCandidates =
      new ArrayList<>(
          List.of(
              "ds", "date", "event_date", "dt", "day", "hour", "event_hour", "partition_date"));

  @Min(1)
  private int planTextMaxChars = 12000;

  @Min(1)
  private int metadataJsonMaxChars = 12000;

  @Min(1)
  private int maxColumnsPerTable = 200;

  @Min(1)
  private int ddlSnippetMaxChars = 2000;
}
