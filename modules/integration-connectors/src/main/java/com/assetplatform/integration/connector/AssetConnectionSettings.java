package com.assetplatform.integration.connector;

import java.net.URI;
import java.time.Duration;

public record AssetConnectionSettings(
    String tenantId, String connectionId, String type, URI baseUri, String apiKey, Duration timeout) {
  public AssetConnectionSettings {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    if (connectionId == null || connectionId.isBlank()) {
      throw new IllegalArgumentException("connectionId is required");
    }
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("type is required");
    }
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
