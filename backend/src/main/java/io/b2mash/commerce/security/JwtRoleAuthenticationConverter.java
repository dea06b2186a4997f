package io.b2mash.commerce.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class JwtRoleAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLES_CLAIM = "roles";

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.USER, Roles.AUTHORITY_USER,
          Roles.ADMIN, Roles.AUTHORITY_ADMIN);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    return new JwtAuthenticationToken(jwt, extractAuthorities(jwt), jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    // A signed-in customer without explicit roles is a plain user
    List<String> roles = jwt.getClaimAsStringList(ROLES_CLAIM);
    if (roles == null || roles.isEmpty()) {
      return List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_USER));
    }
    var authorities = new LinkedHashSet<GrantedAuthority>();
    for (String role : roles) {
      String springRole = ROLE_MAPPING.get(role.toLowerCase());
      if (springRole != null) {
        authorities.add(new SimpleGrantedAuthority(springRole));
      }
    }
    return List.copyOf(authorities);
  }
}
