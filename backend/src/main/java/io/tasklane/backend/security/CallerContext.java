package io.tasklane.backend.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Access to the verified caller of the current request. Bound by {@link BearerTokenAuthFilter},
 * read by controllers and the logging filter.
 */
public final class CallerContext {

  /** Returns the current caller. Throws if no verified identity was bound by the filter chain. */
  public static CallerIdentity requireCaller() {
    CallerIdentity caller = getCallerOrNull();
    if (caller == null) {
      throw new CallerContextNotBoundException();
    }
    return caller;
  }

  /** Returns the current caller, or null for anonymous requests. */
  public static CallerIdentity getCallerOrNull() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth instanceof CallerAuthenticationToken token) {
      return token.getPrincipal();
    }
    return null;
  }

  private CallerContext() {}
}
