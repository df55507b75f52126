package com.assetplatform.assetapi.config;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;

/**
 * Maps Keycloak style role claims to {@code ROLE_*} authorities. Realm roles and the roles granted
 * to the {@value #API_CLIENT_ID} client are both honoured, next to the usual scope authorities.
 */
public class RealmRoleGrantedAuthoritiesConverter
    implements Converter<Jwt, Collection<GrantedAuthority>> {
  static final String API_CLIENT_ID = "asset-api";

  private final JwtGrantedAuthoritiesConverter scopeConverter =
      new JwtGrantedAuthoritiesConverter();

  @Override
  public Collection<GrantedAuthority> convert(Jwt jwt) {
    Set<GrantedAuthority> authorities = new LinkedHashSet<>();

    Collection<GrantedAuthority> scopeAuthorities = scopeConverter.convert(jwt);
    if (scopeAuthorities != null) {
      authorities.addAll(scopeAuthorities);
    }

    addRoleAuthorities(authorities, rolesOf(jwt.getClaims().get("realm_access")));
    Object resourceAccess = jwt.getClaims().get("resource_access");
    if (resourceAccess instanceof Map<?, ?> resourceAccessMap) {
      addRoleAuthorities(authorities, rolesOf(resourceAccessMap.get(API_CLIENT_ID)));
    }
    return authorities;
  }

  private static List<String> rolesOf(Object access) {
    if (access instanceof Map<?, ?> accessMap
        && accessMap.get("roles") instanceof Collection<?> roleValues) {
      return roleValues.stream()
          .filter(String.class::isInstance)
          .map(String.class::cast)
          .toList();
    }
    return List.of();
  }

  private static void addRoleAuthorities(
      Set<GrantedAuthority> authorities, Collection<String> roleValues) {
    roleValues.stream()
        .filter(role -> !role.isBlank())
        .map(String::toUpperCase)
        .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
        .forEach(authorities::add);
  }
}
