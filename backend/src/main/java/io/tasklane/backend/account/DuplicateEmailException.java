package io.tasklane.backend.account;

import io.tasklane.backend.api.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class DuplicateEmailException extends ErrorResponseException {

  public DuplicateEmailException() {
    super(HttpStatus.BAD_REQUEST, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Duplicate email");
    problem.setDetail(ErrorCode.DUPLICATE_EMAIL.defaultMessage());
    problem.setProperty("code", ErrorCode.DUPLICATE_EMAIL.name());
    return problem;
  }
}
