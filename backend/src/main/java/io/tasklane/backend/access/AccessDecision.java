package io.tasklane.backend.access;

public enum AccessDecision {
  ALLOW,
  DENY;

  public boolean isAllowed() {
    return this == ALLOW;
  }
}
