package com.assetplatform.assetapi.assets;

public class AssetNotFoundException extends RuntimeException {
  public AssetNotFoundException(String assetId) {
    super("Asset ID '" + assetId + "' does not exist");
  }
}
