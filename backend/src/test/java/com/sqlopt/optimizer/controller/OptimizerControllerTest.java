package com.sqlopt.optimizer.controller;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqlopt.optimizer.dto.metadata.ColumnInfo;
import com.sqlopt.optimizer.dto.metadata.TableMetadata;
import com.sqlopt.optimizer.dto.optimization.OptimizationOutcome;
import com.sqlopt.optimizer.dto.optimization.OptimizeRequest;
import com.sqlopt.optimizer.dto.plan.PlanResult;
import com.sqlopt.optimizer.dto.rewrite.RiskLevel;
import com.sqlopt.optimizer.dto.sql.TableReference;
import com.sqlopt.optimizer.service.optimization.OptimizationOrchestratorService;

@WebMvcTest(OptimizerController.class)
@DisplayName("OptimizerController Tests")
class OptimizerControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @MockBean private OptimizationOrchestratorService orchestratorService;

  @Nested
  @DisplayName("GET /api/health")
  class HealthTests {

    @Test
    @DisplayName("Should report ok")
    void shouldReportOk() throws Exception {
      mockMvc
          .perform(get("/api/health"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.ok").value(true))
          .andExpect(header().exists("X-Correlation-Id"));
    }
  }

  @Nested
  @DisplayName("POST /api/optimize")
  class OptimizeTests {

    @Test
    @DisplayName("Should return the optimized query in snake_case")
    void shouldReturnOptimizedQuery() throws Exception {
      OptimizationOutcome outcome =
          OptimizationOutcome.builder()
              .success(true)
              .originalSql("SELECT * FROM hive.web.events")
              .finalSql("SELECT * FROM hive.web.events WHERE ds >= '2024-01-01'")
              .baselinePlan(PlanResult.success("before", 1000.0))
              .finalPlan(PlanResult.success("after", 100.0))
              .table("hive.web.events")
              .tableMetadata(
                  TableMetadata.builder()
                      .table(TableReference.of("hive", "web", "events"))
                      .column(new ColumnInfo("ds", "varchar"))
                      .partitionCandidate("ds")
                      .build())
              .attempts(1)
              .diff("--- original.sql\n+++ optimized.sql")
              .changes(List.of("Added partition predicate"))
              .assumptions(List.of())
              .risk(RiskLevel.LOW)
              .build();
      when(orchestratorService.optimize("SELECT * FROM hive.web.events")).thenReturn(outcome);

      mockMvc
          .perform(
              post("/api/optimize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      objectMapper.writeValueAsString(
                          OptimizeRequest.builder().sql("SELECT * FROM hive.web.events").build())))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.ok").value(true))
          .andExpect(jsonPath("$.attempts").value(1))
          .andExpect(jsonPath("$.tables[0]").value("hive.web.events"))
          .andExpect(jsonPath("$.llm.risk").value("low"))
          .andExpect(jsonPath("$.llm.changes[0]").value("Added partition predicate"))
          .andExpect(
              jsonPath("$.optimized_sql")
                  .value("SELECT * FROM hive.web.events WHERE ds >= '2024-01-01'"))
          .andExpect(jsonPath("$.explain_before.estimated_rows").value(1000.0))
          .andExpect(jsonPath("$.explain_after.estimated_rows").value(100.0))
          .andExpect(jsonPath("$.metadata[0].table").value("hive.web.events"))
          .andExpect(jsonPath("$.metadata[0].partition_candidates[0]").value("ds"));
    }

    @Test
    @DisplayName("Should return pipeline failures as a normal response")
    void shouldReturnFailureOutcome() throws Exception {
      when(orchestratorService.optimize("DELETE FROM t"))
          .thenReturn(
              OptimizationOutcome.builder()
                  .success(false)
                  .originalSql("DELETE FROM t")
                  .baselinePlan(
                      PlanResult.failure("Only SELECT queries are allowed in read_only_mode"))
                  .attempts(0)
                  .error("Only SELECT queries are allowed in read_only_mode")
                  .build());

      mockMvc
          .perform(
              post("/api/optimize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"sql\":\"DELETE FROM t\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.ok").value(false))
          .andExpect(jsonPath("$.attempts").value(0))
          .andExpect(jsonPath("$.error").value("Only SELECT queries are allowed in read_only_mode"))
          .andExpect(jsonPath("$.explain_before.ok").value(false));
    }

    @Test
    @DisplayName("Should reject a request without sql")
    void shouldRejectMissingSql() throws Exception {
      mockMvc
          .perform(post("/api/optimize").contentType(MediaType.APPLICATION_JSON).content("{}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors.sql").exists());

      verify(orchestratorService, never()).optimize(anyString());
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
      mockMvc
          .perform(post("/api/optimize").contentType(MediaType.APPLICATION_JSON).content("{sql"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Malformed JSON request"));
    }
  }
}
