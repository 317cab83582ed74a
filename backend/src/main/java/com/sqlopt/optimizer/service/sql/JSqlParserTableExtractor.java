package com.sqlopt.optimizer.service.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.sqlopt.optimizer.dto.sql.TableReference;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.util.TablesNamesFinder;

@Slf4j
@Service
public class JSqlParserTableExtractor implements TableExtractor {

  private static final Set<String> LEADING_QUERY_KEYWORDS = Set.of("SELECT", "WITH");

  private static final Set<String> WRITE_KEYWORDS =
      Set.of(
          "INSERT", "UPDATE", "DELETE", "MERGE", "CREATE", "DROP", "ALTER", "TRUNCATE", "GRANT",
          "REVOKE", "DENY", "CALL", "EXECUTE", "PREPARE", "DEALLOCATE", "SET", "RESET", "USE",
          "COMMIT", "ROLLBACK", "START", "COMMENT", "REFRESH", "ANALYZE");

  @Override
  public List<TableReference> extractTables(String sql) {
    List<String> names;
    try {
      Statement statement = parse(sql);
      names = new OrderedTablesFinder().tablesInVisitOrder(statement);
    } catch (JSQLParserException e) {
      log.warn("Could not extract tables, SQL did not parse: {}", e.getMessage());
      return List.of();
    } catch (RuntimeException e) {
      // TablesNamesFinder rejects some statement kinds (e.g. DROP) with UnsupportedOperationException
      log.warn("Could not extract tables: {}", e.getMessage());
      return List.of();
    }

    Set<TableReference> refs = new LinkedHashSet<>();
    for (String name : names) {
      TableReference ref = toReference(name);
      if (ref != null) {
        refs.add(ref);
      }
    }
    log.debug("Extracted {} table reference(s): {}", refs.size(), refs);
    return new ArrayList<>(refs);
  }

  @Override
  public boolean isQueryOnly(String sql) {
    try {
      return parse(sql) instanceof Select;
    } catch (JSQLParserException | RuntimeException e) {
      log.debug("Statement did not parse as a query: {}", e.getMessage());
    }
    String scrubbed = scrubLiteralsAndComments(sql == null ? "" : sql);
    if (!scrubbed.contains("->")) {
      return false;
    }
    // JSqlParser has no grammar for Trino lambdas (x -> x + 1); classify those by keywords.
    boolean queryOnly = isQueryOnlyByKeywords(scrubbed);
    log.debug("Lambda query classified by keywords, query only: {}", queryOnly);
    return queryOnly;
  }

  private Statement parse(String sql) throws JSQLParserException {
    if (sql == null || sql.isBlank()) {
      throw new JSQLParserException("Empty SQL");
    }
    return CCJSqlParserUtil.parse(sql);
  }

  /**
   * A single statement that starts with SELECT or WITH and carries no keyword that writes or
   * changes session state. Expects literals and comments to be scrubbed already.
   */
  static boolean isQueryOnlyByKeywords(String scrubbed) {
    String body = scrubbed.strip();
    while (body.endsWith(";")) {
      body = body.substring(0, body.length() - 1).strip();
    }
    if (body.isEmpty() || body.contains(";")) {
      return false;
    }
    List<String> tokens =
        Arrays.stream(body.toUpperCase(Locale.ROOT).split("[^A-Z0-9_]+"))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toList());
    return !tokens.isEmpty()
        && LEADING_QUERY_KEYWORDS.contains(tokens.get(0))
        && tokens.stream().noneMatch(WRITE_KEYWORDS::contains);
  }

  /** Blanks out string literals, quoted identifiers and comments. */
  static String scrubLiteralsAndComments(String sql) {
    StringBuilder out = new StringBuilder(sql.length());
    int i = 0;
    int n = sql.length();
    while (i < n) {
      char c = sql.charAt(i);
      if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        i = end < 0 ? n : end;
      } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int end = sql.indexOf("*/", i + 2);
        i = end < 0 ? n : end + 2;
        out.append(' ');
      } else if (c == '\'' || c == '"') {
        i = skipQuoted(sql, i, c);
        out.append(' ');
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  /** Index just past the closing quote; a doubled quote is an escape. */
  private static int skipQuoted(String sql, int start, char quote) {
    int i = start + 1;
    while (i < sql.length()) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  /** Splits {@code catalog.schema.table} on dots outside quotes; keeps at most the last three. */
  static TableReference toReference(String qualifiedName) {
    List<String> parts = splitIdentifier(qualifiedName);
    if (parts.isEmpty()) {
      return null;
    }
    int n = parts.size();
    String table = parts.get(n - 1);
    String schema = n >= 2 ? parts.get(n - 2) : null;
    String catalog = n >= 3 ? parts.get(n - 3) : null;
    return TableReference.of(catalog, schema, table);
  }

  private static List<String> splitIdentifier(String name) {
    List<String> parts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    char quote = 0;
    for (char c : name.toCharArray()) {
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (c == '"' || c == '`') {
        quote = c;
      } else if (c == '.') {
        addPart(parts, current);
      } else if (!Character.isWhitespace(c)) {
        current.append(c);
      }
    }
    addPart(parts, current);
    return parts;
  }

  private static void addPart(List<String> parts, StringBuilder current) {
    if (current.length() > 0) {
      parts.add(current.toString());
    }
    current.setLength(0);
  }

  /** Collects table names in the order the parser walks them, minus WITH item names. */
  private static final class OrderedTablesFinder extends TablesNamesFinder {

    private final Set<String> visited = new LinkedHashSet<>();

    @Override
    public void visit(Table table) {
      super.visit(table);
      visited.add(table.getFullyQualifiedName());
    }

    List<String> tablesInVisitOrder(Statement statement) {
      Set<String> tables = getTables(statement);
      List<String> ordered =
          visited.stream().filter(tables::contains).collect(Collectors.toList());
      tables.stream().filter(name -> !ordered.contains(name)).sorted().forEach(ordered::add);
      return ordered;
    }
  }
}
