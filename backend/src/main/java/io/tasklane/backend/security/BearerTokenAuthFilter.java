package io.tasklane.backend.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the {@code Authorization: Bearer <token>} header via {@link AccessTokenService} and binds
 * the resulting {@link CallerIdentity} into the security context.
 *
 * <p>A request without the header continues anonymously and is rejected by the authorization rules
 * of {@link SecurityConfig}. A request with a header that fails verification is answered with 401
 * here and goes no further.
 */
@Component
public class BearerTokenAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final AccessTokenService accessTokenService;
  private final AuthenticationEntryPoint authenticationEntryPoint;

  public BearerTokenAuthFilter(
      AccessTokenService accessTokenService,
      EnvelopeAuthenticationEntryPoint authenticationEntryPoint) {
    this.accessTokenService = accessTokenService;
    this.authenticationEntryPoint = authenticationEntryPoint;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authHeader == null || authHeader.isBlank()) {
      filterChain.doFilter(request, response);
      return;
    }

    if (!authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      authenticationEntryPoint.commence(request, response, new InvalidTokenException());
      return;
    }

    String token = authHeader.substring(BEARER_PREFIX.length()).trim();
    CallerIdentity caller;
    try {
      caller = accessTokenService.verifyToken(token);
    } catch (TokenVerificationException e) {
      log.debug("Bearer authentication failed: {}", e.getMessage());
      SecurityContextHolder.clearContext();
      authenticationEntryPoint.commence(request, response, e);
      return;
    }

    var context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(new CallerAuthenticationToken(caller));
    SecurityContextHolder.setContext(context);
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.equals("/")
        || path.equals("/api/health")
        || path.startsWith("/api/auth/")
        || path.startsWith("/actuator/");
  }
}
