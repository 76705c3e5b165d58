package io.tasklane.backend.access;

import io.tasklane.backend.exception.ForbiddenException;
import io.tasklane.backend.security.CallerIdentity;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * The single authorization decision point: a caller may only address data under its own owner id.
 * Services call {@link #requireOwnerAccess} before any repository access.
 */
@Component
public class OwnershipGuard {

  public AccessDecision checkAccess(CallerIdentity caller, UUID targetOwnerId) {
    if (caller == null || caller.userId() == null || targetOwnerId == null) {
      return AccessDecision.DENY;
    }
    return caller.userId().equals(targetOwnerId) ? AccessDecision.ALLOW : AccessDecision.DENY;
  }

  /**
   * Checks access and throws {@link ForbiddenException} on denial. The exception renders as "not
   * found", so callers cannot probe which owner ids exist.
   */
  public void requireOwnerAccess(CallerIdentity caller, UUID targetOwnerId, String resourceType) {
    if (!checkAccess(caller, targetOwnerId).isAllowed()) {
      throw new ForbiddenException(
          resourceType,
          "caller "
              + (caller != null ? caller.userId() : null)
              + " is not owner "
              + targetOwnerId);
    }
  }
}
