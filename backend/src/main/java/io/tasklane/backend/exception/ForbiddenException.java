package io.tasklane.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a caller targets data owned by another identity. Rendered exactly like {@link
 * ResourceNotFoundException} (404, {@code NOT_FOUND}) so that another user's resource cannot be told
 * apart from one that does not exist.
 */
public class ForbiddenException extends ErrorResponseException {

  private final String reason;

  public ForbiddenException(String resourceType, String reason) {
    super(HttpStatus.NOT_FOUND, ResourceNotFoundException.createProblem(resourceType), null);
    this.reason = reason;
  }

  /** Internal reason for the denial. Logged, never sent to the client. */
  public String getReason() {
    return reason;
  }
}
