package io.b2mash.cleaning.dispatch.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.cleaning.dispatch.provisioning.Organization;
import io.b2mash.cleaning.dispatch.provisioning.OrganizationRepository;
import io.b2mash.cleaning.dispatch.security.ClerkJwtUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the JWT {@code o.id} claim to a provisioned organization and binds it to {@link
 * RequestScopes} for the rest of the chain.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  private final OrganizationRepository organizationRepository;
  private final Cache<String, UUID> orgCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofHours(1)).build();

  public TenantFilter(OrganizationRepository organizationRepository) {
    this.organizationRepository = organizationRepository;
  }

  /** Evicts the cached organization id for the given identity-provider org ID. */
  public void evict(String clerkOrgId) {
    orgCache.invalidate(clerkOrgId);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      Jwt jwt = jwtAuth.getToken();
      String clerkOrgId = ClerkJwtUtils.extractOrgId(jwt);

      if (clerkOrgId != null) {
        UUID orgId = resolveOrganization(clerkOrgId);
        if (orgId == null) {
          response.sendError(HttpServletResponse.SC_FORBIDDEN, "Organization not provisioned");
          return;
        }
        try (var ignored = RequestScopes.bind(orgId, clerkOrgId, jwt.getSubject())) {
          filterChain.doFilter(request, response);
        }
        return;
      }
    }

    // No JWT or no org claim: continue unbound (actuator, internal endpoints)
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }

  private UUID resolveOrganization(String clerkOrgId) {
    // Caffeine's cache.get(key, loader) throws NPE if loader returns null.
    UUID cached = orgCache.getIfPresent(clerkOrgId);
    if (cached != null) {
      return cached;
    }
    UUID orgId =
        organizationRepository
            .findByClerkOrgId(clerkOrgId)
            .map(Organization::getId)
            .orElse(null);
    if (orgId != null) {
      orgCache.put(clerkOrgId, orgId);
    }
    return orgId;
  }
}
