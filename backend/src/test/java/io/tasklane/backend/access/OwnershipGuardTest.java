package io.tasklane.backend.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tasklane.backend.exception.ForbiddenException;
import io.tasklane.backend.security.CallerIdentity;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class OwnershipGuardTest {

  private static final UUID OWNER_ID = UUID.randomUUID();

  private final OwnershipGuard guard = new OwnershipGuard();

  @Test
  void sameIdentity_isAllowed() {
    assertThat(guard.checkAccess(caller(OWNER_ID), OWNER_ID)).isEqualTo(AccessDecision.ALLOW);
    assertThatCode(() -> guard.requireOwnerAccess(caller(OWNER_ID), OWNER_ID, "Task"))
        .doesNotThrowAnyException();
  }

  @Test
  void differentIdentity_isDenied() {
    assertThat(guard.checkAccess(caller(UUID.randomUUID()), OWNER_ID))
        .isEqualTo(AccessDecision.DENY);
  }

  @Test
  void missingCallerOrOwner_isDenied() {
    assertThat(guard.checkAccess(null, OWNER_ID)).isEqualTo(AccessDecision.DENY);
    assertThat(guard.checkAccess(caller(OWNER_ID), null)).isEqualTo(AccessDecision.DENY);
  }

  @Test
  void denial_surfacesAsNotFound() {
    assertThatThrownBy(() -> guard.requireOwnerAccess(caller(UUID.randomUUID()), OWNER_ID, "Task"))
        .isInstanceOfSatisfying(
            ForbiddenException.class,
            ex -> {
              assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
              assertThat(ex.getBody().getDetail()).isEqualTo("Task not found");
              assertThat(ex.getReason()).contains(OWNER_ID.toString());
            });
  }

  private static CallerIdentity caller(UUID userId) {
    return new CallerIdentity(userId, null, Instant.now(), Instant.now().plusSeconds(3600));
  }
}
