package com.assetplatform.assetapi.assets;

public class AssetValidationException extends RuntimeException {
  public AssetValidationException(String message) {
    super(message);
  }

  public AssetValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
