package io.b2mash.cleaning.dispatch.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_ORG_ID = "orgId";
  private static final String MDC_USER_ID = "userId";
  private static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String clerkOrgId = RequestScopes.getClerkOrgIdOrNull();
      if (clerkOrgId != null) {
        MDC.put(MDC_ORG_ID, clerkOrgId);
      }

      String actor = RequestScopes.getActorOrNull();
      if (actor != null) {
        MDC.put(MDC_USER_ID, actor);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_ORG_ID);
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
