package com.sqlopt.optimizer.controller;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sqlopt.optimizer.dto.optimization.OptimizationOutcome;
import com.sqlopt.optimizer.dto.optimization.OptimizeRequest;
import com.sqlopt.optimizer.dto.optimization.OptimizeResponse;
import com.sqlopt.optimizer.service.optimization.OptimizationOrchestratorService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "SQL Optimization", description = "Model-driven Trino query rewriting")
public class OptimizerController {

  private final OptimizationOrchestratorService orchestratorService;

  @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Liveness check")
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("ok", true));
  }

  /**
   * Pipeline failures (rejected input, EXPLAIN errors, exhausted attempts) come back as 200 with
   * {@code ok=false}; only malformed requests are 4xx.
   */
  @PostMapping(
      value = "/optimize",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Optimize a query",
      description =
          "Explains the query, gathers table metadata and asks the model for a cheaper rewrite,"
              + " retrying with feedback until a candidate validates")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Optimization finished, successfully or not",
            content = @Content(schema = @Schema(implementation = OptimizeResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content)
      })
  public ResponseEntity<OptimizeResponse> optimize(@Valid @RequestBody OptimizeRequest request) {
    log.info("Received optimization request ({} chars)", request.getSql().length());
    OptimizationOutcome outcome = orchestratorService.optimize(request.getSql());
    log.info("Optimization finished: ok={}, attempts={}", outcome.isSuccess(), outcome.getAttempts());
    return ResponseEntity.ok(OptimizeResponse.from(outcome));
  }
}
