package com.assetplatform.assetapi.telemetry;

public class InvalidAssetOperationException extends RuntimeException {
  public InvalidAssetOperationException(String message) {
    super(message);
  }
}
