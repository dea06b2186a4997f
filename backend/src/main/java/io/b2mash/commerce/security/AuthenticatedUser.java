package io.b2mash.commerce.security;

import io.b2mash.commerce.exception.InvalidStateException;
import java.util.UUID;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/** The caller behind a request: user id from the JWT subject plus the {@code email} claim. */
public record AuthenticatedUser(UUID userId, String email, boolean admin) {

  public static AuthenticatedUser from(JwtAuthenticationToken authentication) {
    var jwt = authentication.getToken();
    var subject = jwt.getSubject();
    UUID userId;
    try {
      userId = UUID.fromString(subject == null ? "" : subject);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid user identity", "Token subject is not a user id: " + subject);
    }
    boolean admin =
        authentication.getAuthorities().stream()
            .anyMatch(a -> Roles.AUTHORITY_ADMIN.equals(a.getAuthority()));
    return new AuthenticatedUser(userId, jwt.getClaimAsString("email"), admin);
  }
}
