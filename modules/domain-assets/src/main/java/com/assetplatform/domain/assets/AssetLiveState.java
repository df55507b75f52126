package com.assetplatform.domain.assets;

/**
 * Most recently observed telemetry of an asset. Always replaced as a whole, never field by
 * field.
 */
public record AssetLiveState(
    LastConsumption lastConsumption,
    Double currentConsumptionWh,
    Double currentInstantAmps,
    Double currentInstantAmpsL1,
    Double currentInstantAmpsL2,
    Double currentInstantAmpsL3,
    Double currentInstantVolts,
    Double currentInstantVoltsL1,
    Double currentInstantVoltsL2,
    Double currentInstantVoltsL3,
    Double currentInstantWatts,
    Double currentInstantWattsL1,
    Double currentInstantWattsL2,
    Double currentInstantWattsL3,
    Double currentStateOfCharge) {
  private static final AssetLiveState EMPTY =
      new AssetLiveState(
          null, null, null, null, null, null, null, null, null, null, null, null, null, null,
          null);

  public static AssetLiveState empty() {
    return EMPTY;
  }

  public static AssetLiveState fromSample(ConsumptionSample sample) {
    LastConsumption lastConsumption = null;
    if (sample.consumptionWh() != null && sample.endedAt() != null) {
      lastConsumption = new LastConsumption(sample.consumptionWh(), sample.endedAt());
    }
    return new AssetLiveState(
        lastConsumption,
        sample.consumptionWh(),
        sample.instantAmps(),
        sample.instantAmpsL1(),
        sample.instantAmpsL2(),
        sample.instantAmpsL3(),
        sample.instantVolts(),
        sample.instantVoltsL1(),
        sample.instantVoltsL2(),
        sample.instantVoltsL3(),
        sample.instantWatts(),
        sample.instantWattsL1(),
        sample.instantWattsL2(),
        sample.instantWattsL3(),
        sample.stateOfCharge());
  }
}
