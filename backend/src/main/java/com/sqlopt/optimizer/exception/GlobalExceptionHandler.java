package com.sqlopt.optimizer.exception;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps request-level problems to an {@link ErrorResponse}. Optimization failures never reach this
 * class; the pipeline reports them inside a normal response.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> onInvalidRequest(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> fields = new LinkedHashMap<>();
    ex.getBindingResult()
        .getAllErrors()
        .forEach(
            error ->
                fields.put(
                    error instanceof FieldError
                        ? ((FieldError) error).getField()
                        : error.getObjectName(),
                    error.getDefaultMessage()));
    log.warn("Rejected optimize request: {}", fields);
    return respond(
        errorBody(HttpStatus.BAD_REQUEST, "Invalid request data", request)
            .error("Validation Failed")
            .validationErrors(fields));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> onUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return respond(errorBody(HttpStatus.BAD_REQUEST, "Malformed JSON request", request));
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ErrorResponse> onUnsupportedMediaType(
      HttpMediaTypeNotSupportedException ex, WebRequest request) {
    String message = "Content type '" + ex.getContentType() + "' is not supported";
    log.warn(message);
    return respond(errorBody(HttpStatus.UNSUPPORTED_MEDIA_TYPE, message, request));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> onMethodNotAllowed(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = "Request method '" + ex.getMethod() + "' is not supported";
    log.warn(message);
    return respond(errorBody(HttpStatus.METHOD_NOT_ALLOWED, message, request));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> onUnexpected(Exception ex, WebRequest request) {
    log.error("Unexpected error while serving {}", pathOf(request), ex);
    ErrorResponse.ErrorResponseBuilder body =
        errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    // Never leak internals from production, whatever the debug flag says.
    if (debugEnabled && !"production".equals(environment)) {
      body.debugMessage(ex.getMessage());
    }
    return respond(body);
  }

  private ErrorResponse.ErrorResponseBuilder errorBody(
      HttpStatus status, String message, WebRequest request) {
    return ErrorResponse.builder()
        .timestamp(LocalDateTime.now())
        .status(status.value())
        .error(status.getReasonPhrase())
        .message(message)
        .path(pathOf(request));
  }

  private static ResponseEntity<ErrorResponse> respond(ErrorResponse.ErrorResponseBuilder body) {
    ErrorResponse response = body.build();
    return ResponseEntity.status(response.getStatus()).body(response);
  }

  private static String pathOf(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }

  @lombok.Value
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Error returned for rejected requests")
  public static class ErrorResponse {
    LocalDateTime timestamp;
    int status;
    String error;
    String message;
    String path;
    Map<String, String> validationErrors;
    String debugMessage;
  }
}
