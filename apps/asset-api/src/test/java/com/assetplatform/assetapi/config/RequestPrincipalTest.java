package com.assetplatform.assetapi.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class RequestPrincipalTest {
  @Test
  void shouldReadTenantAndSubjectFromJwt() {
    Jwt jwt =
        Jwt.withTokenValue("token")
            .header("alg", "none")
            .subject("alice")
            .claim("tenant_id", " tenant-1 ")
            .build();
    JwtAuthenticationToken authentication = new JwtAuthenticationToken(jwt, List.of());

    assertEquals("tenant-1", RequestPrincipal.tenant(authentication));
    assertEquals("alice", RequestPrincipal.actor(authentication));
  }

  @Test
  void shouldDenyTokenWithoutTenant() {
    Jwt jwt = Jwt.withTokenValue("token").header("alg", "none").subject("alice").build();

    assertThrows(
        AccessDeniedException.class,
        () -> RequestPrincipal.tenant(new JwtAuthenticationToken(jwt, List.of())));
    assertThrows(AccessDeniedException.class, () -> RequestPrincipal.tenant(null));
  }

  @Test
  void shouldReportTenantOnlyForAuthenticatedJwtWithClaim() {
    Jwt withTenant =
        Jwt.withTokenValue("token").header("alg", "none").claim("tenant_id", "tenant-1").build();
    Jwt blankTenant =
        Jwt.withTokenValue("token").header("alg", "none").claim("tenant_id", " ").build();

    assertTrue(RequestPrincipal.hasTenant(new JwtAuthenticationToken(withTenant, List.of())));
    assertFalse(RequestPrincipal.hasTenant(new JwtAuthenticationToken(blankTenant, List.of())));
    assertFalse(RequestPrincipal.hasTenant(new TestingAuthenticationToken("bob", "pw")));
    assertFalse(RequestPrincipal.hasTenant(null));
  }

  @Test
  void shouldFallBackToAuthenticationNameForActor() {
    assertEquals("bob", RequestPrincipal.actor(new TestingAuthenticationToken("bob", "pw")));
    assertEquals("system", RequestPrincipal.actor(null));
  }
}
