package com.assetplatform.domain.assets;

import java.util.Objects;

public record Asset(
    String id,
    String name,
    String siteAreaId,
    String siteId,
    AssetType assetType,
    boolean dynamicAsset,
    String connectionId,
    String meterId,
    GeoCoordinates coordinates,
    Double staticValueWatt,
    Double fluctuationPercent,
    boolean excludeFromSmartCharging,
    AssetLiveState liveState,
    AssetAudit audit,
    long version) {
  public Asset {
    requireNonBlank(id, "id");
    requireNonBlank(name, "name");
    Objects.requireNonNull(assetType, "assetType must not be null");
    if (fluctuationPercent != null && (fluctuationPercent < 0 || fluctuationPercent > 100)) {
      throw new AssetDomainException("fluctuationPercent must be between 0 and 100");
    }
    if (version < 0) {
      throw new AssetDomainException("version must not be negative");
    }
    liveState = liveState == null ? AssetLiveState.empty() : liveState;
    Objects.requireNonNull(audit, "audit must not be null");
  }

  public boolean hasSiteArea() {
    return siteAreaId != null && !siteAreaId.isBlank();
  }

  public boolean hasConnection() {
    return connectionId != null && !connectionId.isBlank();
  }

  public Asset withLiveState(AssetLiveState nextLiveState) {
    Objects.requireNonNull(nextLiveState, "nextLiveState must not be null");
    return new Asset(
        id,
        name,
        siteAreaId,
        siteId,
        assetType,
        dynamicAsset,
        connectionId,
        meterId,
        coordinates,
        staticValueWatt,
        fluctuationPercent,
        excludeFromSmartCharging,
        nextLiveState,
        audit,
        version);
  }

  public Asset withAudit(AssetAudit nextAudit) {
    return new Asset(
        id,
        name,
        siteAreaId,
        siteId,
        assetType,
        dynamicAsset,
        connectionId,
        meterId,
        coordinates,
        staticValueWatt,
        fluctuationPercent,
        excludeFromSmartCharging,
        liveState,
        nextAudit,
        version);
  }

  public Asset withVersion(long nextVersion) {
    return new Asset(
        id,
        name,
        siteAreaId,
        siteId,
        assetType,
        dynamicAsset,
        connectionId,
        meterId,
        coordinates,
        staticValueWatt,
        fluctuationPercent,
        excludeFromSmartCharging,
        liveState,
        audit,
        nextVersion);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new AssetDomainException(fieldName + " must not be blank");
    }
  }
}
