package com.assetplatform.integration.connector;

public record ConnectionCheckResult(boolean healthy, String errorCode, String errorMessage) {
  private static final ConnectionCheckResult HEALTHY = new ConnectionCheckResult(true, null, null);

  public static ConnectionCheckResult ok() {
    return HEALTHY;
  }

  public static ConnectionCheckResult failed(Throwable error) {
    return new ConnectionCheckResult(
        false, ConnectorErrors.errorCode(error), ConnectorErrors.sanitizeMessage(error));
  }
}
