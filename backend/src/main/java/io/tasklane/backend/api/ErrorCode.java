package io.tasklane.backend.api;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes carried in the {@code error.code} field of every failed {@link ApiResponse}.
 * Clients branch on these values, so they are never renamed.
 */
public enum ErrorCode {
  AUTHENTICATION_REQUIRED(HttpStatus.UNAUTHORIZED, "Authentication required"),
  INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
  NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Malformed request"),
  DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "Email already registered"),
  METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed"),
  UNSUPPORTED_MEDIA_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type"),
  STORE_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "Service temporarily unavailable"),
  INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

  private final HttpStatus status;
  private final String defaultMessage;

  ErrorCode(HttpStatus status, String defaultMessage) {
    this.status = status;
    this.defaultMessage = defaultMessage;
  }

  public HttpStatus status() {
    return status;
  }

  public String defaultMessage() {
    return defaultMessage;
  }

  /** Maps a bare HTTP status (framework-raised errors) to the closest code. */
  public static ErrorCode forStatus(int status) {
    return switch (status) {
      case 400 -> VALIDATION_ERROR;
      case 401 -> AUTHENTICATION_REQUIRED;
      case 404 -> NOT_FOUND;
      case 405 -> METHOD_NOT_ALLOWED;
      case 415 -> UNSUPPORTED_MEDIA_TYPE;
      default -> INTERNAL_ERROR;
    };
  }
}
