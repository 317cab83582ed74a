package com.sqlopt.optimizer.dto.optimization;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to optimize a single SQL query")
public class OptimizeRequest {

  @NotNull
  @Schema(description = "Query to rewrite", example = "SELECT * FROM hive.web.events WHERE ts > TIMESTAMP '2024-01-01 00:00:00'")
  private String sql;
}
