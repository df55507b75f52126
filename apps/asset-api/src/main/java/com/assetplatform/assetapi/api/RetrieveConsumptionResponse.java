package com.assetplatform.assetapi.api;

import com.assetplatform.assetapi.telemetry.RetrievalOutcome;

public record RetrieveConsumptionResponse(String status, RetrievalOutcome outcome) {
  public static RetrieveConsumptionResponse of(RetrievalOutcome outcome) {
    return new RetrieveConsumptionResponse(ActionResponse.SUCCESS, outcome);
  }
}
