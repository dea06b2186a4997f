package io.b2mash.commerce.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.commerce.exception.InvalidStateException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class JwtRoleAuthenticationConverterTest {

  private static final String USER_ID = "5b0f1c8e-2f43-4c1e-9d7a-2a4b6c8d0e1f";

  private final JwtRoleAuthenticationConverter converter = new JwtRoleAuthenticationConverter();

  @Test
  void tokenWithoutRolesIsAPlainUser() {
    var token = converter.convert(jwt(null));

    assertThat(authorities(token)).containsExactly(Roles.AUTHORITY_USER);
    assertThat(token.getName()).isEqualTo(USER_ID);
  }

  @Test
  void adminRoleMapsToAdminAuthority() {
    var token = converter.convert(jwt(List.of("user", "ADMIN")));

    assertThat(authorities(token))
        .containsExactlyInAnyOrder(Roles.AUTHORITY_USER, Roles.AUTHORITY_ADMIN);
  }

  @Test
  void unknownRolesAreDropped() {
    var token = converter.convert(jwt(List.of("auditor")));

    assertThat(token.getAuthorities()).isEmpty();
  }

  @Test
  void authenticatedUserReadsSubjectEmailAndAdminFlag() {
    var token = (JwtAuthenticationToken) converter.convert(jwt(List.of("admin")));

    var user = AuthenticatedUser.from(token);

    assertThat(user.userId()).isEqualTo(UUID.fromString(USER_ID));
    assertThat(user.email()).isEqualTo("buyer@example.com");
    assertThat(user.admin()).isTrue();
  }

  @Test
  void nonUuidSubjectIsRejected() {
    var jwt =
        Jwt.withTokenValue("token")
            .header("alg", "RS256")
            .subject("user_123")
            .issuedAt(Instant.now())
            .build();
    var token = (JwtAuthenticationToken) converter.convert(jwt);

    assertThatThrownBy(() -> AuthenticatedUser.from(token))
        .isInstanceOf(InvalidStateException.class);
  }

  private static Jwt jwt(List<String> roles) {
    var builder =
        Jwt.withTokenValue("token")
            .header("alg", "RS256")
            .subject(USER_ID)
            .claim("email", "buyer@example.com")
            .issuedAt(Instant.now());
    if (roles != null) {
      builder.claim(JwtRoleAuthenticationConverter.ROLES_CLAIM, roles);
    }
    return builder.build();
  }

  private static List<String> authorities(AbstractAuthenticationToken token) {
    return token.getAuthorities().stream().map(GrantedAuthority::getAuthority).toList();
  }
}
