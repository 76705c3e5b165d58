package io.tasklane.backend.health;

import io.tasklane.backend.config.AppInfoProperties;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated liveness endpoints. Database health is reported by {@code /actuator/health}. */
@RestController
public class HealthController {

  private final AppInfoProperties appInfo;

  public HealthController(AppInfoProperties appInfo) {
    this.appInfo = appInfo;
  }

  @GetMapping("/api/health")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(new HealthResponse("healthy", Instant.now(), appInfo.version()));
  }

  @GetMapping("/")
  public ResponseEntity<RootResponse> root() {
    return ResponseEntity.ok(
        new RootResponse(appInfo.name() + " is running", appInfo.version()));
  }

  public record HealthResponse(String status, Instant timestamp, String version) {}

  public record RootResponse(String message, String version) {}
}
