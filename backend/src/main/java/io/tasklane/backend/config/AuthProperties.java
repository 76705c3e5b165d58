package io.tasklane.backend.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing configuration, bound once at startup.
 *
 * @param jwtSecret shared HS256 secret (at least 32 bytes); never logged
 * @param tokenTtl lifetime of issued access tokens
 */
@Validated
@ConfigurationProperties(prefix = "tasklane.auth")
public record AuthProperties(@NotBlank String jwtSecret, @DefaultValue("7d") Duration tokenTtl) {

  @Override
  public String toString() {
    return "AuthProperties[jwtSecret=****, tokenTtl=" + tokenTtl + "]";
  }
}
