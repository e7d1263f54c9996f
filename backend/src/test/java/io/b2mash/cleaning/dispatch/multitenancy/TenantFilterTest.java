package io.b2mash.cleaning.dispatch.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.cleaning.dispatch.provisioning.Organization;
import io.b2mash.cleaning.dispatch.provisioning.OrganizationRepository;
import jakarta.servlet.FilterChain;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

@ExtendWith(MockitoExtension.class)
class TenantFilterTest {

  @Mock private OrganizationRepository organizationRepository;

  private TenantFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private final AtomicReference<UUID> orgIdInChain = new AtomicReference<>();
  private boolean chainCalled;

  private final FilterChain chain =
      (req, res) -> {
        chainCalled = true;
        orgIdInChain.set(RequestScopes.getOrgIdOrNull());
      };

  @BeforeEach
  void setUp() {
    filter = new TenantFilter(organizationRepository);
    request = new MockHttpServletRequest();
    request.setRequestURI("/api/bookings");
    response = new MockHttpServletResponse();
    chainCalled = false;
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
    RequestScopes.clear();
  }

  @Test
  void bindsProvisionedOrganizationForTheChain() throws Exception {
    var organization = organizationWithId("org_filter");
    authenticate("org_filter");
    when(organizationRepository.findByClerkOrgId("org_filter"))
        .thenReturn(Optional.of(organization));

    filter.doFilterInternal(request, response, chain);

    assertThat(chainCalled).isTrue();
    assertThat(orgIdInChain.get()).isEqualTo(organization.getId());
    assertThat(RequestScopes.isBound()).isFalse();
  }

  @Test
  void unprovisionedOrganizationIsForbidden() throws Exception {
    authenticate("org_missing");
    when(organizationRepository.findByClerkOrgId("org_missing")).thenReturn(Optional.empty());

    filter.doFilterInternal(request, response, chain);

    assertThat(chainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(403);
  }

  @Test
  void resolvedOrganizationIsCached() throws Exception {
    var organization = organizationWithId("org_cached");
    authenticate("org_cached");
    when(organizationRepository.findByClerkOrgId("org_cached"))
        .thenReturn(Optional.of(organization));

    filter.doFilterInternal(request, response, chain);
    filter.doFilterInternal(request, new MockHttpServletResponse(), chain);

    verify(organizationRepository, times(1)).findByClerkOrgId("org_cached");
  }

  @Test
  void requestWithoutJwtContinuesUnbound() throws Exception {
    filter.doFilterInternal(request, response, chain);

    assertThat(chainCalled).isTrue();
    assertThat(orgIdInChain.get()).isNull();
  }

  @Test
  void internalPathsAreSkipped() {
    request.setRequestURI("/internal/orgs/provision");

    assertThat(filter.shouldNotFilter(request)).isTrue();
  }

  private static void authenticate(String clerkOrgId) {
    var jwt =
        Jwt.withTokenValue("token")
            .header("alg", "none")
            .subject("user_filter")
            .claim("o", Map.of("id", clerkOrgId, "rol", "member"))
            .issuedAt(Instant.now())
            .build();
    SecurityContextHolder.getContext()
        .setAuthentication(new JwtAuthenticationToken(jwt, List.of()));
  }

  private static Organization organizationWithId(String clerkOrgId) throws Exception {
    var organization = new Organization(clerkOrgId, "Org " + clerkOrgId);
    var idField = Organization.class.getDeclaredField("id");
    idField.setAccessible(true);
    idField.set(organization, UUID.randomUUID());
    return organization;
  }
}
