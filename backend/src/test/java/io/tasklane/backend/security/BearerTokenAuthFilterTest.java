package io.tasklane.backend.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import io.tasklane.backend.config.AuthProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

class BearerTokenAuthFilterTest {

  private static final UUID USER_ID = UUID.randomUUID();

  private AccessTokenService accessTokenService;
  private BearerTokenAuthFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private boolean filterChainCalled;
  private CallerIdentity callerSeenByChain;

  private final FilterChain filterChain =
      (req, res) -> {
        filterChainCalled = true;
        callerSeenByChain = CallerContext.getCallerOrNull();
      };

  @BeforeEach
  void setUp() {
    accessTokenService =
        new AccessTokenService(new AuthProperties(TestTokens.SECRET, Duration.ofHours(1)));
    filter =
        new BearerTokenAuthFilter(
            accessTokenService, new EnvelopeAuthenticationEntryPoint(new ObjectMapper()));
    request = new MockHttpServletRequest("GET", "/api/" + USER_ID + "/tasks");
    response = new MockHttpServletResponse();
    filterChainCalled = false;
    callerSeenByChain = null;
    SecurityContextHolder.clearContext();
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validToken_bindsCallerAndContinuesChain() throws ServletException, IOException {
    String token = accessTokenService.issueToken(USER_ID, "user@test.com", "User");
    request.addHeader("Authorization", "Bearer " + token);

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isTrue();
    assertThat(callerSeenByChain).isNotNull();
    assertThat(callerSeenByChain.userId()).isEqualTo(USER_ID);
    assertThat(response.getStatus()).isEqualTo(200);
  }

  @Test
  void missingHeader_continuesAnonymously() throws ServletException, IOException {
    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isTrue();
    assertThat(callerSeenByChain).isNull();
  }

  @Test
  void expiredToken_returns401WithoutReachingChain() throws ServletException, IOException {
    request.addHeader("Authorization", "Bearer " + TestTokens.expiredToken(USER_ID));

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getHeader("WWW-Authenticate")).isEqualTo("Bearer");
    String body = response.getContentAsString();
    assertThat(JsonPath.<Boolean>read(body, "$.success")).isFalse();
    assertThat(JsonPath.<String>read(body, "$.error.code")).isEqualTo("AUTHENTICATION_REQUIRED");
    assertThat(JsonPath.<String>read(body, "$.error.message")).isEqualTo("Token has expired");
  }

  @Test
  void malformedToken_returns401() throws ServletException, IOException {
    request.addHeader("Authorization", "Bearer abc.def.ghi");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getContentAsString()).doesNotContain("abc.def.ghi");
  }

  @Test
  void nonBearerScheme_returns401() throws ServletException, IOException {
    request.addHeader("Authorization", "Basic dXNlcjpwYXNz");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void publicPaths_areNotFiltered() {
    assertThat(filter.shouldNotFilter(new MockHttpServletRequest("GET", "/api/health"))).isTrue();
    assertThat(filter.shouldNotFilter(new MockHttpServletRequest("POST", "/api/auth/signin")))
        .isTrue();
    assertThat(filter.shouldNotFilter(request)).isFalse();
  }
}
