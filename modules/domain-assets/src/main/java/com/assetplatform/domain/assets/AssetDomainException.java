package com.assetplatform.domain.assets;

public class AssetDomainException extends RuntimeException {
  public AssetDomainException(String message) {
    super(message);
  }
}
