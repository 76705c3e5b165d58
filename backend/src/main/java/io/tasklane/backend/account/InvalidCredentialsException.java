package io.tasklane.backend.account;

import io.tasklane.backend.api.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown for an unknown email or a wrong password; both produce the same response. */
public class InvalidCredentialsException extends ErrorResponseException {

  public InvalidCredentialsException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Sign-in failed");
    problem.setDetail(ErrorCode.INVALID_CREDENTIALS.defaultMessage());
    problem.setProperty("code", ErrorCode.INVALID_CREDENTIALS.name());
    return problem;
  }
}
