package io.tasklane.backend.security;

public class CallerContextNotBoundException extends RuntimeException {

  public CallerContextNotBoundException() {
    super("Caller context not available: no verified identity bound by filter chain");
  }
}
