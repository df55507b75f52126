package com.assetplatform.assetapi.config;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;

/** Reads the tenant and the acting user off an authenticated request. */
public final class RequestPrincipal {
  static final String TENANT_CLAIM = "tenant_id";
  private static final String DEFAULT_ACTOR = "system";

  private RequestPrincipal() {}

  public static String tenant(Authentication authentication) {
    String tenantId = tenantClaim(authentication);
    if (tenantId == null) {
      throw new AccessDeniedException("Token does not carry a tenant");
    }
    return tenantId;
  }

  public static boolean hasTenant(Authentication authentication) {
    return tenantClaim(authentication) != null;
  }

  private static String tenantClaim(Authentication authentication) {
    if (authentication != null
        && authentication.isAuthenticated()
        && authentication.getPrincipal() instanceof Jwt jwt) {
      String tenantId = jwt.getClaimAsString(TENANT_CLAIM);
      if (tenantId != null && !tenantId.isBlank()) {
        return tenantId.trim();
      }
    }
    return null;
  }

  public static String actor(Authentication authentication) {
    if (authentication == null) {
      return DEFAULT_ACTOR;
    }
    Object principal = authentication.getPrincipal();
    if (principal instanceof Jwt jwt && jwt.getSubject() != null && !jwt.getSubject().isBlank()) {
      return jwt.getSubject();
    }
    String name = authentication.getName();
    if (name == null || name.isBlank() || "anonymousUser".equals(name)) {
      return DEFAULT_ACTOR;
    }
    return name;
  }
}
