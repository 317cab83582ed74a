package com.sqlopt.optimizer.service.sql;

import java.util.List;

import com.sqlopt.optimizer.dto.sql.TableReference;

/** Reads table references and statement kind out of SQL text. */
public interface TableExtractor {

  /**
   * Tables referenced by the statement, de-duplicated, in order of first appearance. Returns an
   * empty list when the statement cannot be parsed.
   */
  List<TableReference> extractTables(String sql);

  /** True only when the statement parses and is a data-retrieval query. */
  boolean isQueryOnly(String sql);
}
