package io.tasklane.backend.security;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity extracted from a verified access token. Lives for one request and is never persisted.
 *
 * @param userId the token subject; the only value used for authorization
 * @param email email claim, may be null
 * @param issuedAt issue time, may be null when the token omits {@code iat}
 * @param expiresAt expiry time
 */
public record CallerIdentity(UUID userId, String email, Instant issuedAt, Instant expiresAt) {}
