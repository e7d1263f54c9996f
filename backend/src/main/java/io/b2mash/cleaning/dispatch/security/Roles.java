package io.b2mash.cleaning.dispatch.security;

/**
 * Centralized role constants used across authentication and authorization.
 *
 * <p>Org roles come from the identity provider's JWT {@code o.rol} claim. Spring authorities are the
 * {@code ROLE_} prefixed versions used by {@code @PreAuthorize}. Dispatchers are org admins.
 */
public final class Roles {

  // Org-level roles (JWT "o.rol" values)
  public static final String ORG_OWNER = "owner";
  public static final String ORG_ADMIN = "admin";
  public static final String ORG_MEMBER = "member";

  // Spring Security granted authorities
  public static final String AUTHORITY_ORG_OWNER = "ROLE_ORG_OWNER";
  public static final String AUTHORITY_ORG_ADMIN = "ROLE_ORG_ADMIN";
  public static final String AUTHORITY_ORG_MEMBER = "ROLE_ORG_MEMBER";
  public static final String AUTHORITY_INTERNAL = "ROLE_INTERNAL_SERVICE";

  private Roles() {}
}
