package io.tasklane.backend.exception;

import io.tasklane.backend.api.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Caller-correctable input defect. Results in HTTP 400 with code {@code VALIDATION_ERROR}. */
public class ValidationFailedException extends ErrorResponseException {

  public ValidationFailedException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(detail);
    problem.setProperty("code", ErrorCode.VALIDATION_ERROR.name());
    return problem;
  }
}
