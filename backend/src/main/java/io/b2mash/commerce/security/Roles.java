package io.b2mash.commerce.security;

/**
 * Role constants shared by authentication and {@code @PreAuthorize} checks.
 *
 * <p>Role names arrive in the JWT {@code roles} claim. Spring authorities are the {@code ROLE_}
 * prefixed versions.
 */
public final class Roles {

  // JWT "roles" claim values
  public static final String USER = "user";
  public static final String ADMIN = "admin";

  // Spring Security granted authorities
  public static final String AUTHORITY_USER = "ROLE_USER";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";

  private Roles() {}
}
