package io.b2mash.cleaning.dispatch.multitenancy;

import io.b2mash.cleaning.dispatch.exception.MissingOrganizationContextException;
import java.util.UUID;

/**
 * Request-scoped values for multitenancy and caller identity. Bound by {@link TenantFilter}, read by
 * controllers and services.
 *
 * <p>Values live in thread locals for the duration of {@link #bind} and are removed when the
 * returned {@link Binding} is closed, so a pooled servlet thread never leaks a previous request's
 * organization.
 */
public final class RequestScopes {

  private static final ThreadLocal<UUID> ORG_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> CLERK_ORG_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> ACTOR = new ThreadLocal<>();

  /** Binds the organization and acting subject to the current thread. */
  public static Binding bind(UUID orgId, String clerkOrgId, String actor) {
    ORG_ID.set(orgId);
    CLERK_ORG_ID.set(clerkOrgId);
    ACTOR.set(actor);
    return RequestScopes::clear;
  }

  /** Returns the internal organization id. Throws if not bound by the filter chain. */
  public static UUID requireOrgId() {
    UUID orgId = ORG_ID.get();
    if (orgId == null) {
      throw new MissingOrganizationContextException();
    }
    return orgId;
  }

  public static UUID getOrgIdOrNull() {
    return ORG_ID.get();
  }

  /** Returns the identity provider's organization id (e.g. "org_abc123"), or null if not bound. */
  public static String getClerkOrgIdOrNull() {
    return CLERK_ORG_ID.get();
  }

  /** Returns the JWT subject of the caller, or null for system work. */
  public static String getActorOrNull() {
    return ACTOR.get();
  }

  public static boolean isBound() {
    return ORG_ID.get() != null;
  }

  static void clear() {
    ORG_ID.remove();
    CLERK_ORG_ID.remove();
    ACTOR.remove();
  }

  /** Handle returned by {@link #bind}; closing it unbinds every value. */
  @FunctionalInterface
  public interface Binding extends AutoCloseable {
    @Override
    void close();
  }

  private RequestScopes() {}
}
