package com.assetplatform.domain.assets;

import java.time.Instant;
import java.util.Objects;

public record LastConsumption(double value, Instant timestamp) {
  public LastConsumption {
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }
}
