package com.sqlopt.optimizer.service.rewrite;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.sqlopt.optimizer.dto.rewrite.RewriteResult;
import com.sqlopt.optimizer.dto.rewrite.RiskLevel;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses model output of the form
 *
 * <pre>
 * {"optimized_sql": "...", "changes": ["..."], "assumptions": ["..."], "risk": "low|medium|high"}
 * </pre>
 *
 * A surrounding markdown code fence is stripped first. Anything else that is not exactly one JSON
 * object of this shape is reported as a failed result, never thrown.
 */
@Slf4j
@Service
public class RewriteResponseParser {

  static final String EMPTY_OUTPUT = "LLM returned empty output";
  private static final String CODE_FENCE = "```";

  private final ObjectReader strictReader;

  public RewriteResponseParser(ObjectMapper objectMapper) {
    this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public RewriteResult parse(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      return RewriteResult.failure(EMPTY_OUTPUT, rawText);
    }

    JsonNode root;
    try {
      root = strictReader.readTree(stripCodeFence(rawText));
    } catch (JsonProcessingException e) {
      log.debug("Model output is not valid JSON: {}", truncateForLog(rawText, 300));
      return RewriteResult.failure(
          "LLM returned invalid output: not valid JSON (" + e.getOriginalMessage() + ")", rawText);
    }
    if (root == null || !root.isObject()) {
      return RewriteResult.failure("LLM returned invalid output: expected a JSON object", rawText);
    }

    JsonNode sqlNode = root.get("optimized_sql");
    if (sqlNode == null || sqlNode.isNull()) {
      return RewriteResult.failure(EMPTY_OUTPUT, rawText);
    }
    if (!sqlNode.isTextual()) {
      return RewriteResult.failure(
          "LLM returned invalid output: optimized_sql must be a string", rawText);
    }
    if (sqlNode.asText().isBlank()) {
      return RewriteResult.failure(EMPTY_OUTPUT, rawText);
    }

    List<String> changes;
    List<String> assumptions;
    try {
      changes = readStringArray(root, "changes");
      assumptions = readStringArray(root, "assumptions");
    } catch (IllegalArgumentException e) {
      return RewriteResult.failure("LLM returned invalid output: " + e.getMessage(), rawText);
    }

    RiskLevel risk = RiskLevel.UNKNOWN;
    JsonNode riskNode = root.get("risk");
    if (riskNode != null && !riskNode.isNull()) {
      if (!riskNode.isTextual() || RiskLevel.fromModelValue(riskNode.asText()).isEmpty()) {
        return RewriteResult.failure(
            "LLM returned invalid output: risk must be one of low, medium, high", rawText);
      }
      risk = RiskLevel.fromModelValue(riskNode.asText()).get();
    }

    return RewriteResult.builder()
        .success(true)
        .optimizedSql(sqlNode.asText())
        .changes(changes)
        .assumptions(assumptions)
        .risk(risk)
        .rawText(rawText)
        .build();
  }

  /** Removes a leading {@code ```lang} line and trailing backticks, if the text is fenced. */
  static String stripCodeFence(String text) {
    String t = text.trim();
    if (!t.startsWith(CODE_FENCE)) {
      return t;
    }
    t = t.replaceAll("^`+", "").replaceAll("`+$", "");
    int newline = t.indexOf('\n');
    return (newline >= 0 ? t.substring(newline + 1) : t).trim();
  }

  private static List<String> readStringArray(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (!node.isArray()) {
      throw new IllegalArgumentException(field + " must be an array of strings");
    }
    List<String> values = new ArrayList<>(node.size());
    for (JsonNode item : node) {
      if (!item.isTextual()) {
        throw new IllegalArgumentException(field + " must be an array of strings");
      }
      values.add(item.asText());
    }
    return List.copyOf(values);
  }

  private static String truncateForLog(String s, int max) {
    return s.length() <= max ? s : s.substring(0, max) + "…";
  }
}
