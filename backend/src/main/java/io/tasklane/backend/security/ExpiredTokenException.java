package io.tasklane.backend.security;

/** Token with a valid signature whose expiry has passed. */
public class ExpiredTokenException extends TokenVerificationException {

  public ExpiredTokenException() {
    super("Token has expired");
  }
}
