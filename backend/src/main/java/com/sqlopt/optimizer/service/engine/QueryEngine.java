package com.sqlopt.optimizer.service.engine;

import java.util.List;

import com.sqlopt.optimizer.exception.QueryExecutionException;

/**
 * Exclusive handle to the query engine for one optimization run. Not assumed to be safe for
 * concurrent use.
 */
public interface QueryEngine extends AutoCloseable {

  /**
   * Executes a statement and returns every row as an ordered list of column values.
   *
   * @throws QueryExecutionException if the engine rejects or cannot run the statement
   */
  List<List<Object>> execute(String sql) throws QueryExecutionException;

  @Override
  void close();
}
