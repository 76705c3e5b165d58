package io.tasklane.backend.security;

import org.springframework.security.core.AuthenticationException;

/**
 * Base for access token rejections. The message is client-safe: it never contains the token, the
 * signing secret, or parser output.
 */
public abstract class TokenVerificationException extends AuthenticationException {

  protected TokenVerificationException(String message) {
    super(message);
  }
}
