package io.tasklane.backend.security;

import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/** Authentication placed in the security context once a bearer token has been verified. */
public class CallerAuthenticationToken extends AbstractAuthenticationToken {

  private final CallerIdentity identity;

  public CallerAuthenticationToken(CallerIdentity identity) {
    super(List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_USER)));
    this.identity = identity;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    return null;
  }

  @Override
  public CallerIdentity getPrincipal() {
    return identity;
  }

  @Override
  public String getName() {
    return identity.userId().toString();
  }
}
