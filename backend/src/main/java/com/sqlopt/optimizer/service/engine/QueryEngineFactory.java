package com.sqlopt.optimizer.service.engine;

import com.sqlopt.optimizer.exception.QueryExecutionException;

/** Opens a fresh {@link QueryEngine} per run. */
public interface QueryEngineFactory {

  QueryEngine open() throws QueryExecutionException;
}
