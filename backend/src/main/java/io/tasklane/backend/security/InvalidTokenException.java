package io.tasklane.backend.security;

/** Malformed token, unsupported algorithm, bad signature, or unusable claims. */
public class InvalidTokenException extends TokenVerificationException {

  public InvalidTokenException() {
    super("Invalid or malformed token");
  }
}
