package com.flamingo.deckcompiler.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes not covered by CompilationErrorCode
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String PAYLOAD_TOO_LARGE = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code, a {@link CompilationErrorCode} name for rejected documents. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Path of the offending node inside the submitted document, if any. */
  private final String nodePath;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
