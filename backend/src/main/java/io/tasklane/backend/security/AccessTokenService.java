package io.tasklane.backend.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.tasklane.backend.config.AuthProperties;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 access tokens signed with the process-wide shared secret. Verification
 * is local and synchronous: no network calls, no retries.
 */
@Service
public class AccessTokenService {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenService.class);
  private static final JWSAlgorithm ALGORITHM = JWSAlgorithm.HS256;

  private final JWSSigner signer;
  private final JWSVerifier verifier;
  private final Duration tokenTtl;

  public AccessTokenService(AuthProperties authProperties) {
    byte[] secret = authProperties.jwtSecret().getBytes(StandardCharsets.UTF_8);
    try {
      this.signer = new MACSigner(secret);
      this.verifier = new MACVerifier(secret);
    } catch (JOSEException e) {
      // KeyLengthException: HS256 needs a secret of at least 256 bits
      throw new IllegalStateException("tasklane.auth.jwt-secret must be at least 32 bytes", e);
    }
    this.tokenTtl = authProperties.tokenTtl();
  }

  /**
   * Issues an access token for a signed-in user.
   *
   * @return signed JWT string carrying {@code sub}, {@code email}, {@code name}, {@code iat} and
   *     {@code exp}
   */
  public String issueToken(UUID userId, String email, String name) {
    try {
      Instant now = Instant.now();
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(userId.toString())
              .claim("email", email)
              .claim("name", name)
              .issueTime(Date.from(now))
              .expirationTime(Date.from(now.plus(tokenTtl)))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(ALGORITHM), claims);
      signedJwt.sign(signer);

      log.debug("Issued access token for user {}", userId);
      return signedJwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign access token", e);
    }
  }

  /**
   * Verifies an access token: algorithm, signature, expiry and not-before, then subject.
   *
   * @param token the raw bearer token
   * @return the caller identity carried by the token
   * @throws InvalidTokenException if the token is malformed, not HS256, badly signed, or lacks a
   *     usable subject or expiry, or is not valid yet
   * @throws ExpiredTokenException if the signature is valid but the token has expired
   */
  public CallerIdentity verifyToken(String token) {
    JWTClaimsSet claims;
    try {
      var signedJwt = SignedJWT.parse(token);
      if (!ALGORITHM.equals(signedJwt.getHeader().getAlgorithm())) {
        log.debug("Rejected token with algorithm {}", signedJwt.getHeader().getAlgorithm());
        throw new InvalidTokenException();
      }
      if (!signedJwt.verify(verifier)) {
        log.debug("Rejected token with invalid signature");
        throw new InvalidTokenException();
      }
      claims = signedJwt.getJWTClaimsSet();
    } catch (ParseException | JOSEException e) {
      log.debug("Rejected unparseable token: {}", e.getClass().getSimpleName());
      throw new InvalidTokenException();
    }

    Date expiration = claims.getExpirationTime();
    if (expiration == null) {
      log.debug("Rejected token without expiry");
      throw new InvalidTokenException();
    }
    Instant now = Instant.now();
    if (!expiration.toInstant().isAfter(now)) {
      throw new ExpiredTokenException();
    }
    Date notBefore = claims.getNotBeforeTime();
    if (notBefore != null && notBefore.toInstant().isAfter(now)) {
      log.debug("Rejected token not valid before {}", notBefore.toInstant());
      throw new InvalidTokenException();
    }

    UUID userId = parseSubject(claims.getSubject());
    String email;
    try {
      email = claims.getStringClaim("email");
    } catch (ParseException e) {
      log.debug("Rejected token with non-string email claim");
      throw new InvalidTokenException();
    }
    Instant issuedAt = claims.getIssueTime() != null ? claims.getIssueTime().toInstant() : null;

    return new CallerIdentity(userId, email, issuedAt, expiration.toInstant());
  }

  private static UUID parseSubject(String subject) {
    if (subject == null || subject.isBlank()) {
      log.debug("Rejected token without subject");
      throw new InvalidTokenException();
    }
    try {
      return UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      log.debug("Rejected token with non-UUID subject");
      throw new InvalidTokenException();
    }
  }
}
