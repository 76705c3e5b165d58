package io.tasklane.backend.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasklane.backend.api.ApiResponse;
import io.tasklane.backend.api.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Writes the 401 envelope for every unauthenticated request: missing credentials (raised by the
 * authorization filter) and rejected tokens (handed over by {@link BearerTokenAuthFilter}).
 *
 * <p>Failures are logged at WARN with the client-safe reason only. The request never reaches a
 * controller, so no task data is touched.
 */
@Component
public class EnvelopeAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeAuthenticationEntryPoint.class);

  private final ObjectMapper objectMapper;

  public EnvelopeAuthenticationEntryPoint(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    String message =
        authException instanceof TokenVerificationException
            ? authException.getMessage()
            : ErrorCode.AUTHENTICATION_REQUIRED.defaultMessage();

    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        message,
        request.getRemoteAddr());

    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(
        response.getOutputStream(), ApiResponse.fail(ErrorCode.AUTHENTICATION_REQUIRED, message));
  }
}
