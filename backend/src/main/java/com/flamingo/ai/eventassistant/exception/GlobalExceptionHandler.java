package com.flamingo.ai.eventassistant.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for REST controllers. Backend failures are normally absorbed by the
 * pipeline; the model and catalog handlers only see errors that escape a degraded stage.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      SessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("session_not_found");
    String errorId = generateErrorId();
    log.warn("Session not found [{}]: {}", errorId, ex.getSessionId());

    return error(
        HttpStatus.NOT_FOUND, errorId, ApiError.SESSION_NOT_FOUND, "Session not found", request);
  }

  @ExceptionHandler(UnknownCollectionException.class)
  public ResponseEntity<ApiError> handleUnknownCollection(
      UnknownCollectionException ex, HttpServletRequest request) {

    incrementErrorCounter("unknown_collection");
    String errorId = generateErrorId();
    log.warn("Unknown collection [{}]: {}", errorId, ex.getTag());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.UNKNOWN_COLLECTION,
        "No curated collection named '" + ex.getTag() + "'",
        request);
  }

  @ExceptionHandler(ModelBackendException.class)
  public ResponseEntity<ApiError> handleModelBackend(
      ModelBackendException ex, HttpServletRequest request) {

    incrementErrorCounter("model_error");
    String errorId = generateErrorId();
    log.error("Model backend error [{}] on {}: {}", errorId, ex.getBackend(), ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.MODEL_UNAVAILABLE,
        "The assistant is temporarily unavailable. Please try again later.",
        request);
  }

  @ExceptionHandler(CatalogStoreException.class)
  public ResponseEntity<ApiError> handleCatalogStore(
      CatalogStoreException ex, HttpServletRequest request) {

    incrementErrorCounter("catalog_error");
    String errorId = generateErrorId();
    log.error("Catalog error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.CATALOG_UNAVAILABLE,
        "Event search is temporarily unavailable. Please try again.",
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
