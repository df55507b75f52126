package com.assetplatform.integration.connector;

public class AssetConnectorException extends RuntimeException {
  private final int httpStatus;

  public AssetConnectorException(String message, int httpStatus, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
  }

  public AssetConnectorException(String message, int httpStatus) {
    super(message);
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
