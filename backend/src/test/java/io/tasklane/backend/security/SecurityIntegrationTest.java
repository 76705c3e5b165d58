package io.tasklane.backend.security;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.nimbusds.jose.JWSAlgorithm;
import io.tasklane.backend.TestcontainersConfiguration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SecurityIntegrationTest {

  private static final UUID USER_ID = UUID.randomUUID();
  private static final String TASKS_PATH = "/api/" + USER_ID + "/tasks";

  @Autowired private MockMvc mockMvc;
  @Autowired private AccessTokenService accessTokenService;

  @Test
  void missingToken_returns401() throws Exception {
    mockMvc
        .perform(get(TASKS_PATH))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string("WWW-Authenticate", "Bearer"))
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.data").isEmpty())
        .andExpect(jsonPath("$.error.code").value("AUTHENTICATION_REQUIRED"))
        .andExpect(jsonPath("$.error.message").value("Authentication required"));
  }

  @Test
  void expiredToken_returns401() throws Exception {
    mockMvc
        .perform(
            get(TASKS_PATH)
                .header("Authorization", "Bearer " + TestTokens.expiredToken(USER_ID)))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string("WWW-Authenticate", "Bearer"))
        .andExpect(jsonPath("$.error.code").value("AUTHENTICATION_REQUIRED"))
        .andExpect(jsonPath("$.error.message").value("Token has expired"));
  }

  @Test
  void tamperedToken_returns401() throws Exception {
    String token = accessTokenService.issueToken(USER_ID, "user@test.com", "User");
    int signatureStart = token.lastIndexOf('.') + 1;
    char first = token.charAt(signatureStart);
    String tampered =
        token.substring(0, signatureStart)
            + (first == 'A' ? 'B' : 'A')
            + token.substring(signatureStart + 1);

    mockMvc
        .perform(get(TASKS_PATH).header("Authorization", "Bearer " + tampered))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error.code").value("AUTHENTICATION_REQUIRED"))
        .andExpect(jsonPath("$.error.message").value("Invalid or malformed token"));
  }

  @Test
  void tokenSignedWithOtherSecret_returns401() throws Exception {
    String token =
        TestTokens.sign(
            JWSAlgorithm.HS256,
            "some-other-secret-0123456789abcdef-0123456789",
            TestTokens.claims(USER_ID, Instant.now().plusSeconds(600)).build());

    mockMvc
        .perform(get(TASKS_PATH).header("Authorization", "Bearer " + token))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error.code").value("AUTHENTICATION_REQUIRED"));
  }

  @Test
  void validToken_reachesController() throws Exception {
    String token = accessTokenService.issueToken(USER_ID, "user@test.com", "User");

    mockMvc
        .perform(get(TASKS_PATH).header("Authorization", "Bearer " + token))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));
  }

  @Test
  void healthEndpoints_arePublic() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.version").exists());

    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").exists());

    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }

  @Test
  void unknownProtectedPath_requiresAuthentication() throws Exception {
    mockMvc.perform(get("/api/unknown")).andExpect(status().isUnauthorized());
  }
}
