package com.assetplatform.assetapi.api;

import com.assetplatform.integration.connector.ConnectionCheckResult;

public record ConnectionCheckResponse(
    boolean connectionIsValid, String status, String errorCode, String errorMessage) {

  public static ConnectionCheckResponse from(ConnectionCheckResult result) {
    return new ConnectionCheckResponse(
        result.healthy(), ActionResponse.SUCCESS, result.errorCode(), result.errorMessage());
  }
}
