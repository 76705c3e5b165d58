package io.tasklane.backend.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/** Hand-signed tokens for exercising the verifier with claims the service itself never issues. */
public final class TestTokens {

  /** Matches {@code tasklane.auth.jwt-secret} in {@code application-test.yml}. */
  public static final String SECRET = "test-jwt-secret-0123456789abcdef-0123456789abcdef";

  public static JWTClaimsSet.Builder claims(UUID userId, Instant expiresAt) {
    return new JWTClaimsSet.Builder()
        .subject(userId.toString())
        .claim("email", "user@test.com")
        .issueTime(Date.from(expiresAt.minus(Duration.ofHours(1))))
        .expirationTime(Date.from(expiresAt));
  }

  public static String sign(JWTClaimsSet claims) {
    return sign(JWSAlgorithm.HS256, SECRET, claims);
  }

  public static String sign(JWSAlgorithm algorithm, String secret, JWTClaimsSet claims) {
    try {
      var jwt = new SignedJWT(new JWSHeader(algorithm), claims);
      jwt.sign(new MACSigner(secret.getBytes(StandardCharsets.UTF_8)));
      return jwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign test token", e);
    }
  }

  public static String expiredToken(UUID userId) {
    return sign(claims(userId, Instant.now().minus(Duration.ofMinutes(5))).build());
  }

  private TestTokens() {}
}
