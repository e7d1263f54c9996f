package io.b2mash.cleaning.dispatch.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Turns the Clerk org role of a dispatch user into the authority the team, schedule and booking
 * endpoints check. Owners and admins dispatch: they manage teams and working hours. Members read
 * schedules and book. A token without an active organization gets no authority, since every
 * dispatch resource belongs to one.
 */
@Component
public class ClerkJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  // Clerk session tokens before v2 carry "org:admin" style roles
  private static final String LEGACY_ROLE_PREFIX = "org:";

  private static final Map<String, String> DISPATCH_AUTHORITIES =
      Map.of(
          Roles.ORG_OWNER, Roles.AUTHORITY_ORG_OWNER,
          Roles.ORG_ADMIN, Roles.AUTHORITY_ORG_ADMIN,
          Roles.ORG_MEMBER, Roles.AUTHORITY_ORG_MEMBER);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities =
        dispatchAuthority(jwt)
            .<Collection<GrantedAuthority>>map(a -> List.of(new SimpleGrantedAuthority(a)))
            .orElse(List.of());
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  static Optional<String> dispatchAuthority(Jwt jwt) {
    if (ClerkJwtUtils.extractOrgId(jwt) == null) {
      return Optional.empty();
    }
    String orgRole = ClerkJwtUtils.extractOrgRole(jwt);
    if (orgRole == null) {
      return Optional.empty();
    }
    if (orgRole.startsWith(LEGACY_ROLE_PREFIX)) {
      orgRole = orgRole.substring(LEGACY_ROLE_PREFIX.length());
    }
    return Optional.ofNullable(DISPATCH_AUTHORITIES.get(orgRole));
  }
}
