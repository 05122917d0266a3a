package com.flamingo.ai.stripsequencer.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String EMPTY_INPUT = "SEQUENCE_001";
  public static final String NO_SELECTABLE_CANDIDATE = "SEQUENCE_002";
  public static final String DISTANCE_FAILED = "DISTANCE_001";
  public static final String OCR_FAILED = "OCR_001";
  public static final String INVALID_UPLOAD = "UPLOAD_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
