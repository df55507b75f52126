package com.assetplatform.assetapi.assets;

public class AssetConcurrentModificationException extends RuntimeException {
  private final String assetId;
  private final long expectedVersion;

  public AssetConcurrentModificationException(String assetId, long expectedVersion) {
    super(
        "Asset ID '"
            + assetId
            + "' was modified concurrently (expected version "
            + expectedVersion
            + ")");
    this.assetId = assetId;
    this.expectedVersion = expectedVersion;
  }

  public String assetId() {
    return assetId;
  }

  public long expectedVersion() {
    return expectedVersion;
  }
}
