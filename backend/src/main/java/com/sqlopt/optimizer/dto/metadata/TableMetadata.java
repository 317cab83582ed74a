package com.sqlopt.optimizer.dto.metadata;

import java.util.List;
import java.util.Map;

import com.sqlopt.optimizer.dto.sql.TableReference;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Schema facts gathered for one table during a single optimization run. Never cached across
 * runs.
 */
@Value
@Builder
public class TableMetadata {

  public static final String HAS_WITH_PROPERTIES = "has_with_properties";
  public static final String CREATE_TABLE_SNIPPET = "create_table_snippet";

  /** Reference with the default catalog and schema filled in. */
  TableReference table;

  @Singular List<ColumnInfo> columns;

  /** Column names that look like partition keys. Heuristic, not read from the table format. */
  @Singular List<String> partitionCandidates;

  @Singular Map<String, String> properties;
}
