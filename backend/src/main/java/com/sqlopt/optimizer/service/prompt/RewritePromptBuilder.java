package com.sqlopt.optimizer.service.prompt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sqlopt.optimizer.config.OptimizerProperties;
import com.sqlopt.optimizer.dto.metadata.TableMetadata;
import com.sqlopt.optimizer.dto.plan.PlanResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Renders the model prompts. Templates are read from {@code prompts/} on the classpath once, at
 * construction; building a prompt does no I/O.
 */
@Slf4j
@Service
public class RewritePromptBuilder {

  private static final String PROMPTS_PATH = "prompts/";
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z_]+)\\}\\}");

  private final OptimizerProperties properties;
  private final ObjectWriter compactWriter;
  private final String systemPrompt;
  private final String optimizeTemplate;
  private final String fixTemplate;

  public RewritePromptBuilder(OptimizerProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.compactWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    this.systemPrompt = loadPromptTemplate("sql-optimizer-system");
    this.optimizeTemplate = loadPromptTemplate("sql-optimize");
    this.fixTemplate = loadPromptTemplate("sql-fix");
  }

  /** Fixed instructions sent as the system message of every model call. */
  public String systemPrompt() {
    return systemPrompt;
  }

  public String buildOptimizePrompt(
      String originalSql, PlanResult baseline, List<TableMetadata> metadata) {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("ORIGINAL_SQL", originalSql);
    values.put("EXPLAIN_PLAN", cappedPlanText(baseline));
    values.put("TABLE_METADATA", metadataToCompactJson(metadata));
    return render(optimizeTemplate, values);
  }

  public String buildFixPrompt(
      String originalSql,
      String candidateSql,
      String feedback,
      PlanResult baseline,
      List<TableMetadata> metadata) {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("ORIGINAL_SQL", originalSql);
    values.put("CANDIDATE_SQL", candidateSql);
    values.put("FEEDBACK", feedback);
    values.put("EXPLAIN_PLAN", cappedPlanText(baseline));
    values.put("TABLE_METADATA", metadataToCompactJson(metadata));
    return render(fixTemplate, values);
  }

  /**
   * JSON array of {@code {table, partition_candidates, columns, properties_hint}}, with columns
   * capped per table and the whole text capped in length.
   */
  public String metadataToCompactJson(List<TableMetadata> metadata) {
    List<Map<String, Object>> payload = new ArrayList<>();
    for (TableMetadata tm : metadata) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("table", tm.getTable().qualifiedName());
      entry.put("partition_candidates", tm.getPartitionCandidates());
      entry.put(
          "columns",
          tm.getColumns().stream()
              .limit(properties.getMaxColumnsPerTable())
              .collect(Collectors.toList()));
      entry.put("properties_hint", tm.getProperties());
      payload.add(entry);
    }
    String json;
    try {
      json = compactWriter.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize table metadata for prompt: {}", e.getMessage());
      json = "[]";
    }
    return cap(json, properties.getMetadataJsonMaxChars());
  }

  private String cappedPlanText(PlanResult plan) {
    return cap(plan != null ? plan.getText() : "", properties.getPlanTextMaxChars());
  }

  private static String cap(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    return text.length() > maxChars ? text.substring(0, maxChars) : text;
  }

  /** Single pass, so substituted values are never re-scanned for placeholders. */
  private static String render(String template, Map<String, String> values) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String value = values.get(matcher.group(1));
      String replacement = value != null ? value : matcher.group(0);
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString().strip();
  }

  private static String loadPromptTemplate(String promptName) {
    String fileName = PROMPTS_PATH + promptName + ".txt";
    ClassPathResource resource = new ClassPathResource(fileName);
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      return reader.lines().collect(Collectors.joining("\n"));
    } catch (IOException e) {
      log.error("Failed to load prompt template: {}", fileName, e);
      throw new UncheckedIOException("Failed to load prompt template: " + fileName, e);
    }
  }
}
