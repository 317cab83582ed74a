package com.sqlopt.optimizer.exception;

/** Raised by a query engine handle when a statement cannot be executed. */
public class QueryExecutionException extends Exception {

  public QueryExecutionException(String message) {
    super(message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
