package com.assetplatform.domain.assets;

import java.time.Instant;
import java.util.Objects;

public record AssetAudit(
    String createdBy, Instant createdOn, String lastChangedBy, Instant lastChangedOn) {

  public static AssetAudit createdBy(String user, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new AssetAudit(user, now, null, null);
  }

  public AssetAudit changedBy(String user, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new AssetAudit(createdBy, createdOn, user, now);
  }
}
