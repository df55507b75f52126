package com.assetplatform.integration.connector;

public record AssetConnectionRef(String connectionId) {
  public static AssetConnectionRef of(String connectionId) {
    return new AssetConnectionRef(connectionId);
  }
}
