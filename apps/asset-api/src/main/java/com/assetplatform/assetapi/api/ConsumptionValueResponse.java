package com.assetplatform.assetapi.api;

import com.assetplatform.domain.assets.ConsumptionSample;
import java.time.Instant;

public record ConsumptionValueResponse(
    Instant startedAt,
    Instant endedAt,
    Double consumptionWh,
    Double instantWatts,
    Double instantAmps,
    Double instantVolts,
    Double limitWatts,
    Double limitAmps,
    Double stateOfCharge) {

  public static ConsumptionValueResponse from(ConsumptionSample sample) {
    return new ConsumptionValueResponse(
        sample.startedAt(),
        sample.endedAt(),
        sample.consumptionWh(),
        sample.instantWatts(),
        sample.instantAmps(),
        sample.instantVolts(),
        sample.limitWatts(),
        sample.limitAmps(),
        sample.stateOfCharge());
  }
}
