package com.assetplatform.assetapi.telemetry;

public class AssetConnectorNotConfiguredException extends RuntimeException {
  private final String connectionId;

  public AssetConnectorNotConfiguredException(String connectionId) {
    super("Asset service is not configured");
    this.connectionId = connectionId;
  }

  public String connectionId() {
    return connectionId;
  }
}
