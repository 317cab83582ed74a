package com.sqlopt.optimizer.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.context.request.WebRequest;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

  @Mock private WebRequest webRequest;

  @Mock private BindingResult bindingResult;

  @InjectMocks private GlobalExceptionHandler exceptionHandler;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(exceptionHandler, "environment", "test");
    ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", false);
    when(webRequest.getDescription(false)).thenReturn("uri=/api/optimize");
  }

  @Nested
  @DisplayName("Validation Errors")
  class ValidationTests {

    @Test
    @DisplayName("Should list each invalid field")
    void shouldListInvalidFields() {
      MethodArgumentNotValidException ex = new MethodArgumentNotValidException(null, bindingResult);
      when(bindingResult.getAllErrors())
          .thenReturn(List.of(new FieldError("optimizeRequest", "sql", "must not be null")));

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.onInvalidRequest(ex, webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody()).isNotNull();
      assertThat(response.getBody().getError()).isEqualTo("Validation Failed");
      assertThat(response.getBody().getValidationErrors()).containsEntry("sql", "must not be null");
      assertThat(response.getBody().getPath()).isEqualTo("/api/optimize");
    }
  }

  @Nested
  @DisplayName("Method Not Allowed")
  class MethodNotAllowedTests {

    @Test
    @DisplayName("Should name the rejected method")
    void shouldNameMethod() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.onMethodNotAllowed(
              new HttpRequestMethodNotSupportedException("PUT"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
      assertThat(response.getBody().getMessage()).isEqualTo("Request method 'PUT' is not supported");
    }
  }

  @Nested
  @DisplayName("Unreadable Requests")
  class UnreadableRequestTests {

    @Test
    @DisplayName("Should report a malformed body as a bad request")
    void shouldReportMalformedBody() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.onUnreadableBody(
              new HttpMessageNotReadableException(
                  "JSON parse error", Mockito.mock(HttpInputMessage.class)),
              webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getMessage()).isEqualTo("Malformed JSON request");
      assertThat(response.getBody().getValidationErrors()).isNull();
    }

    @Test
    @DisplayName("Should name the unsupported content type")
    void shouldNameContentType() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.onUnsupportedMediaType(
              new HttpMediaTypeNotSupportedException(MediaType.TEXT_PLAIN, List.of()), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
      assertThat(response.getBody().getMessage())
          .isEqualTo("Content type 'text/plain' is not supported");
      assertThat(response.getBody().getPath()).isEqualTo("/api/optimize");
    }
  }

  @Nested
  @DisplayName("Unexpected Errors")
  class UnexpectedErrorTests {

    @Test
    @DisplayName("Should hide the cause outside debug mode")
    void shouldHideCause() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.onUnexpected(new RuntimeException("secret detail"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
      assertThat(response.getBody().getDebugMessage()).isNull();
    }

    @Test
    @DisplayName("Should expose the cause in debug mode outside production")
    void shouldExposeCauseInDebug() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.onUnexpected(new RuntimeException("secret detail"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isEqualTo("secret detail");
    }

    @Test
    @DisplayName("Should never expose the cause in production")
    void shouldHideCauseInProduction() {
      ReflectionTestUtils.setField(exceptionHandler, "environment", "production");
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.onUnexpected(new RuntimeException("secret detail"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isNull();
    }
  }
}
