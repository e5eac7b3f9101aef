package com.aiusage.canonicalizer.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Set<String> IGNORED_PATHS =
      Set.of(".well-known/appspecific/com.chrome.devtools.json", "favicon.ico");

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(EmptyInputException.class)
  public ResponseEntity<ErrorResponse> handleEmptyInput(
      EmptyInputException ex, WebRequest request) {
    log.error("Empty input: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(UnreadableSourceException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableSource(
      UnreadableSourceException ex, WebRequest request) {
    log.error("Unreadable source: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(InvalidRuleSetException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRuleSet(
      InvalidRuleSetException ex, WebRequest request) {
    log.error("Invalid rule set: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.error("Invalid argument: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> errors = new LinkedHashMap<>();
    ex.getBindingResult()
        .getAllErrors()
        .forEach(
            error -> {
              String name =
                  error instanceof FieldError
                      ? ((FieldError) error).getField()
                      : error.getObjectName();
              errors.put(name, error.getDefaultMessage());
            });

    log.error("Validation failed: {}", errors);

    ErrorResponse errorResponse =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error("Validation Failed")
            .message("Invalid request data")
            .validationErrors(errors)
            .path(extractPath(request))
            .build();

    return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ErrorResponse> handleMissingPart(
      MissingServletRequestPartException ex, WebRequest request) {
    log.warn("Missing request part: {}", ex.getRequestPartName());
    return buildErrorResponse(
        HttpStatus.BAD_REQUEST,
        String.format("Required part '%s' is missing", ex.getRequestPartName()),
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, WebRequest request) {
    log.warn("Upload too large: {}", ex.getMessage());
    return buildErrorResponse(
        HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file exceeds the maximum size", request);
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
      ResourceNotFoundException ex, WebRequest request) {
    log.error("Resource not found: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFoundExceptions(Exception ex, WebRequest request) {
    String path = extractPath(request);

    if (shouldIgnorePath(path)) {
      return buildErrorResponse(HttpStatus.NOT_FOUND, "Resource not found", request);
    }

    String message =
        ex instanceof NoHandlerFoundException
            ? String.format(
                "No endpoint %s %s",
                ((NoHandlerFoundException) ex).getHttpMethod(),
                ((NoHandlerFoundException) ex).getRequestURL())
            : "The requested resource was not found";

    log.warn("Not found: {}", message);
    return buildErrorResponse(HttpStatus.NOT_FOUND, message, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    log.warn("Method not allowed: {}", message);
    return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Bad request: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed JSON request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unexpected error occurred", ex);

    ErrorResponse.ErrorResponseBuilder builder =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
            .message("An unexpected error occurred")
            .path(extractPath(request));

    if (debugEnabled && !"production".equals(environment)) {
      builder.debugMessage(ex.getMessage());
    }

    return new ResponseEntity<>(builder.build(), HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private ResponseEntity<ErrorResponse> buildErrorResponse(
      HttpStatus status, String message, WebRequest request) {
    ErrorResponse errorResponse =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(message)
            .path(extractPath(request))
            .build();

    return new ResponseEntity<>(errorResponse, status);
  }

  private String extractPath(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }

  private boolean shouldIgnorePath(String path) {
    return IGNORED_PATHS.stream().anyMatch(path::contains);
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Standard error response")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
    private Map<String, String> validationErrors;
    private String debugMessage;

    public Map<String, String> getValidationErrors() {
      return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
    }
  }
}
