package com.assetplatform.assetapi.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class RealmRoleGrantedAuthoritiesConverterTest {
  private final RealmRoleGrantedAuthoritiesConverter converter =
      new RealmRoleGrantedAuthoritiesConverter();

  @Test
  void shouldMapRealmRolesToRoleAuthorities() {
    Jwt jwt = token().claim("realm_access", Map.of("roles", List.of("ADMIN", "user"))).build();

    Set<String> authorities = authorityNames(jwt);
    assertTrue(authorities.contains("ROLE_ADMIN"));
    assertTrue(authorities.contains("ROLE_USER"));
  }

  @Test
  void shouldMapAssetApiClientRolesOnly() {
    Jwt jwt =
        token()
            .claim(
                "resource_access",
                Map.of(
                    "asset-api", Map.of("roles", List.of("admin")),
                    "other-client", Map.of("roles", List.of("auditor"))))
            .build();

    assertEquals(Set.of("ROLE_ADMIN"), authorityNames(jwt));
  }

  @Test
  void shouldMergeScopeRealmAndClientRolesWithoutDuplicates() {
    Jwt jwt =
        token()
            .claim("scope", "read")
            .claim("realm_access", Map.of("roles", List.of("ADMIN", "USER")))
            .claim("resource_access", Map.of("asset-api", Map.of("roles", List.of("admin", ""))))
            .build();

    assertEquals(Set.of("SCOPE_read", "ROLE_ADMIN", "ROLE_USER"), authorityNames(jwt));
  }

  @Test
  void shouldIgnoreMalformedClaims() {
    Jwt jwt =
        token()
            .claim("realm_access", "ADMIN")
            .claim("resource_access", Map.of("asset-api", "not-a-map"))
            .build();

    assertTrue(authorityNames(jwt).isEmpty());
  }

  private static Jwt.Builder token() {
    return Jwt.withTokenValue("token").header("alg", "none").subject("user-1");
  }

  private Set<String> authorityNames(Jwt jwt) {
    return converter.convert(jwt).stream()
        .map(GrantedAuthority::getAuthority)
        .collect(Collectors.toSet());
  }
}
