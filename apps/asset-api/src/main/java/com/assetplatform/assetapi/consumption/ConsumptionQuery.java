package com.assetplatform.assetapi.consumption;

import java.time.Instant;
import java.util.Objects;

public record ConsumptionQuery(String assetId, Instant startDate, Instant endDate) {
  public ConsumptionQuery {
    Objects.requireNonNull(assetId, "assetId must not be null");
    Objects.requireNonNull(startDate, "startDate must not be null");
    Objects.requireNonNull(endDate, "endDate must not be null");
  }
}
