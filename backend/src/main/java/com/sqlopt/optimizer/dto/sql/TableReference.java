package com.sqlopt.optimizer.dto.sql;

import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.NonNull;
import lombok.Value;

/**
 * A table referenced by a query. Catalog and schema are optional; identity is the
 * (catalog, schema, table) triple.
 */
@Value
public class TableReference {

  private static final String SEPARATOR = ".";
  private static final String QUOTE = "\"";

  String catalog;
  String schema;
  @NonNull String table;

  public static TableReference of(String table) {
    return new TableReference(null, null, table);
  }

  public static TableReference of(String schema, String table) {
    return new TableReference(null, schema, table);
  }

  public static TableReference of(String catalog, String schema, String table) {
    return new TableReference(catalog, schema, table);
  }

  /** Fills in a missing catalog or schema, keeping any part that is already present. */
  public TableReference withDefaults(String defaultCatalog, String defaultSchema) {
    return new TableReference(
        isBlank(catalog) ? defaultCatalog : catalog,
        isBlank(schema) ? defaultSchema : schema,
        table);
  }

  /** Dot-joined name with absent parts omitted, e.g. {@code hive.sales.orders} or {@code orders}. */
  public String qualifiedName() {
    return Stream.of(catalog, schema, table)
        .filter(Objects::nonNull)
        .filter(part -> !part.isBlank())
        .collect(Collectors.joining(SEPARATOR));
  }

  /**
   * Name for use inside SQL text: every present part double-quoted, embedded quotes doubled, e.g.
   * {@code "hive"."sales"."order"}.
   */
  public String quotedName() {
    return Stream.of(catalog, schema, table)
        .filter(Objects::nonNull)
        .filter(part -> !part.isBlank())
        .map(part -> QUOTE + part.replace(QUOTE, QUOTE + QUOTE) + QUOTE)
        .collect(Collectors.joining(SEPARATOR));
  }

  @Override
  public String toString() {
    return qualifiedName();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
