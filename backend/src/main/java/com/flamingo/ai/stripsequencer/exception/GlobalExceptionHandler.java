package com.flamingo.ai.stripsequencer.exception;

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
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(EmptyInputException.class)
  public ResponseEntity<ApiError> handleEmptyInput(
      EmptyInputException ex, HttpServletRequest request) {

    incrementErrorCounter("empty_input");
    String errorId = generateErrorId();
    log.warn("Empty sequencing input [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.EMPTY_INPUT, ex.getUserMessage(), request);
  }

  @ExceptionHandler(NoSelectableCandidateException.class)
  public ResponseEntity<ApiError> handleNoSelectableCandidate(
      NoSelectableCandidateException ex, HttpServletRequest request) {

    incrementErrorCounter("no_selectable_candidate");
    String errorId = generateErrorId();
    log.warn(
        "No selectable candidate [{}]: last={}, candidates={}",
        errorId,
        ex.getLastPlaced(),
        ex.getCandidateCount());

    return error(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.NO_SELECTABLE_CANDIDATE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(DistanceComputationException.class)
  public ResponseEntity<ApiError> handleDistanceComputation(
      DistanceComputationException ex, HttpServletRequest request) {

    incrementErrorCounter("distance_failed");
    String errorId = generateErrorId();
    log.error("Distance computation error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.DISTANCE_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(TextExtractionException.class)
  public ResponseEntity<ApiError> handleTextExtraction(
      TextExtractionException ex, HttpServletRequest request) {

    incrementErrorCounter("ocr_failed");
    String errorId = generateErrorId();
    log.error(
        "Text extraction error [{}] for '{}': {}", errorId, ex.getFileName(), ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.OCR_FAILED, ex.getUserMessage(), request);
  }

  @ExceptionHandler(InvalidUploadException.class)
  public ResponseEntity<ApiError> handleInvalidUpload(
      InvalidUploadException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_upload");
    String errorId = generateErrorId();
    log.warn("Invalid upload [{}] '{}': {}", errorId, ex.getFileName(), ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_UPLOAD, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_upload");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.INVALID_UPLOAD,
        "Upload exceeds the maximum allowed size",
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
