package com.sqlopt.optimizer.service.metadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.sqlopt.optimizer.config.OptimizerProperties;
import com.sqlopt.optimizer.dto.metadata.ColumnInfo;
import com.sqlopt.optimizer.dto.metadata.TableMetadata;
import com.sqlopt.optimizer.dto.sql.TableReference;
import com.sqlopt.optimizer.exception.QueryExecutionException;
import com.sqlopt.optimizer.service.engine.QueryEngine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches columns and DDL for the tables a query touches. Tables are described one at a time, in
 * input order. Duplicate references are described again rather than rejected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaMetadataGatherer {

  static final String UNKNOWN_TYPE = "unknown";
  private static final String WITH_PROPERTIES_MARKER = "WITH (";

  private final OptimizerProperties properties;

  public List<TableMetadata> gather(
      QueryEngine engine,
      List<TableReference> tables,
      String defaultCatalog,
      String defaultSchema) {
    List<TableMetadata> out = new ArrayList<>(tables.size());
    for (TableReference ref : tables) {
      TableReference resolved = ref.withDefaults(defaultCatalog, defaultSchema);
      List<ColumnInfo> columns = fetchColumns(engine, resolved);
      Map<String, String> props = fetchPropertiesBestEffort(engine, resolved);
      out.add(
          TableMetadata.builder()
              .table(resolved)
              .columns(columns)
              .partitionCandidates(inferPartitionCandidates(columns))
              .properties(props)
              .build());
    }
    log.info("Gathered metadata for {} table(s)", out.size());
    return out;
  }

  /** Column list from DESCRIBE; an unreadable table yields an empty list. */
  List<ColumnInfo> fetchColumns(QueryEngine engine, TableReference table) {
    List<List<Object>> rows;
    try {
      rows = engine.execute("DESCRIBE " + table.quotedName());
    } catch (QueryExecutionException | RuntimeException e) {
      log.warn("DESCRIBE {} failed: {}", table.qualifiedName(), e.getMessage());
      return List.of();
    }

    List<ColumnInfo> columns = new ArrayList<>();
    for (List<Object> row : rows) {
      if (row == null || row.isEmpty() || row.get(0) == null) {
        continue;
      }
      String name = String.valueOf(row.get(0));
      if (name.isBlank()) {
        continue;
      }
      String type =
          row.size() > 1 && row.get(1) != null ? String.valueOf(row.get(1)) : UNKNOWN_TYPE;
      columns.add(new ColumnInfo(name, type));
    }
    return columns;
  }

  /** Hints from SHOW CREATE TABLE. Advisory: any failure means no properties. */
  Map<String, String> fetchPropertiesBestEffort(QueryEngine engine, TableReference table) {
    List<List<Object>> rows;
    try {
      rows = engine.execute("SHOW CREATE TABLE " + table.quotedName());
    } catch (QueryExecutionException | RuntimeException e) {
      log.warn("SHOW CREATE TABLE {} failed: {}", table.qualifiedName(), e.getMessage());
      return Map.of();
    }

    String ddl =
        rows.stream()
            .filter(Objects::nonNull)
            .filter(row -> !row.isEmpty() && row.get(0) != null)
            .map(row -> String.valueOf(row.get(0)))
            .filter(text -> !text.isEmpty())
            .collect(Collectors.joining("\n"));
    if (ddl.isBlank()) {
      return Map.of();
    }

    Map<String, String> props = new LinkedHashMap<>();
    if (ddl.contains(WITH_PROPERTIES_MARKER)) {
      props.put(TableMetadata.HAS_WITH_PROPERTIES, "true");
    }
    int cap = properties.getDdlSnippetMaxChars();
    props.put(TableMetadata.CREATE_TABLE_SNIPPET, ddl.length() > cap ? ddl.substring(0, cap) : ddl);
    return props;
  }

  /**
   * Column names matching the configured partition-name list, in list order. A naming heuristic
   * only; real partition specs are table-format specific (Iceberg {@code $partitions}, Hive
   * partitioned_by) and are not read.
   */
  public List<String> inferPartitionCandidates(Collection<ColumnInfo> columns) {
    Set<String> names =
        columns.stream()
            .map(c -> c.getName().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    return properties.getPartitionColumnCandidates().stream()
        .map(candidate -> candidate.toLowerCase(Locale.ROOT))
        .filter(names::contains)
        .distinct()
        .collect(Collectors.toList());
  }
}
