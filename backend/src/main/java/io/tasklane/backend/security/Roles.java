package io.tasklane.backend.security;

/** Spring Security authorities granted to verified callers. */
public final class Roles {

  public static final String AUTHORITY_USER = "ROLE_USER";

  private Roles() {}
}
