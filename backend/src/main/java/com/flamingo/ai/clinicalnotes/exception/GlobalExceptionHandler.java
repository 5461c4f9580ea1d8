package com.flamingo.ai.clinicalnotes.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ProfileNotFoundException.class)
  public ResponseEntity<ApiError> handleProfileNotFound(
      ProfileNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("profile_not_found");
    String errorId = generateErrorId();
    log.warn("Profile not found [{}]: {}", errorId, ex.getProfileId());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.PROFILE_NOT_FOUND,
        "EMR profile not found: " + ex.getProfileId(),
        request);
  }

  @ExceptionHandler(NoteConfigurationException.class)
  public ResponseEntity<ApiError> handleNoteConfiguration(
      NoteConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("note_configuration");
    String errorId = generateErrorId();
    log.warn("Invalid note request [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.NOTE_CONFIGURATION_ERROR,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(MergeCancelledException.class)
  public ResponseEntity<ApiError> handleMergeCancelled(
      MergeCancelledException ex, HttpServletRequest request) {

    incrementErrorCounter("merge_cancelled");
    String errorId = generateErrorId();
    log.info("Merge cancelled [{}] during {}", errorId, ex.getState());

    return error(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.MERGE_CANCELLED,
        "Note update was cancelled",
        request);
  }

  @ExceptionHandler(ProvidersExhaustedException.class)
  public ResponseEntity<ApiError> handleProvidersExhausted(
      ProvidersExhaustedException ex, HttpServletRequest request) {

    incrementErrorCounter("llm_error");
    String errorId = generateErrorId();
    log.error("Generation providers exhausted [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.LLM_UNAVAILABLE,
        ex.getUserMessage(),
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

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Malformed request body",
        request);
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
