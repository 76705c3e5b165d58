package io.tasklane.backend.exception;

import io.tasklane.backend.api.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType), null);
  }

  /**
   * Shared with {@link ForbiddenException}: the body must not reveal whether the resource exists,
   * so neither carries the requested id.
   */
  static ProblemDetail createProblem(String resourceType) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail(resourceType + " not found");
    problem.setProperty("code", ErrorCode.NOT_FOUND.name());
    return problem;
  }
}
