package com.assetplatform.domain.assets;

import java.time.Instant;

/**
 * One reading produced by a connector. Measurements are nullable because connectors report
 * whatever subset their meter supports.
 */
public record ConsumptionSample(
    Instant startedAt,
    Instant endedAt,
    Double consumptionWh,
    Double instantWatts,
    Double instantWattsL1,
    Double instantWattsL2,
    Double instantWattsL3,
    Double instantAmps,
    Double instantAmpsL1,
    Double instantAmpsL2,
    Double instantAmpsL3,
    Double instantVolts,
    Double instantVoltsL1,
    Double instantVoltsL2,
    Double instantVoltsL3,
    Double limitWatts,
    Double limitAmps,
    Double stateOfCharge) {
  public ConsumptionSample {
    if (startedAt != null && endedAt != null && endedAt.isBefore(startedAt)) {
      throw new AssetDomainException("endedAt must not be before startedAt");
    }
  }

  public ConsumptionSample withStartedAt(Instant value) {
    return new ConsumptionSample(
        value,
        endedAt,
        consumptionWh,
        instantWatts,
        instantWattsL1,
        instantWattsL2,
        instantWattsL3,
        instantAmps,
        instantAmpsL1,
        instantAmpsL2,
        instantAmpsL3,
        instantVolts,
        instantVoltsL1,
        instantVoltsL2,
        instantVoltsL3,
        limitWatts,
        limitAmps,
        stateOfCharge);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private Instant startedAt;
    private Instant endedAt;
    private Double consumptionWh;
    private Double instantWatts;
    private Double instantWattsL1;
    private Double instantWattsL2;
    private Double instantWattsL3;
    private Double instantAmps;
    private Double instantAmpsL1;
    private Double instantAmpsL2;
    private Double instantAmpsL3;
    private Double instantVolts;
    private Double instantVoltsL1;
    private Double instantVoltsL2;
    private Double instantVoltsL3;
    private Double limitWatts;
    private Double limitAmps;
    private Double stateOfCharge;

    private Builder() {}

    public Builder startedAt(Instant startedAt) {
      this.startedAt = startedAt;
      return this;
    }

    public Builder endedAt(Instant endedAt) {
      this.endedAt = endedAt;
      return this;
    }

    public Builder consumptionWh(Double consumptionWh) {
      this.consumptionWh = consumptionWh;
      return this;
    }

    public Builder instantWatts(Double total, Double l1, Double l2, Double l3) {
      this.instantWatts = total;
      this.instantWattsL1 = l1;
      this.instantWattsL2 = l2;
      this.instantWattsL3 = l3;
      return this;
    }

    public Builder instantAmps(Double total, Double l1, Double l2, Double l3) {
      this.instantAmps = total;
      this.instantAmpsL1 = l1;
      this.instantAmpsL2 = l2;
      this.instantAmpsL3 = l3;
      return this;
    }

    public Builder instantVolts(Double total, Double l1, Double l2, Double l3) {
      this.instantVolts = total;
      this.instantVoltsL1 = l1;
      this.instantVoltsL2 = l2;
      this.instantVoltsL3 = l3;
      return this;
    }

    public Builder limitWatts(Double limitWatts) {
      this.limitWatts = limitWatts;
      return this;
    }

    public Builder limitAmps(Double limitAmps) {
      this.limitAmps = limitAmps;
      return this;
    }

    public Builder stateOfCharge(Double stateOfCharge) {
      this.stateOfCharge = stateOfCharge;
      return this;
    }

    public ConsumptionSample build() {
      return new ConsumptionSample(
          startedAt,
          endedAt,
          consumptionWh,
          instantWatts,
          instantWattsL1,
          instantWattsL2,
          instantWattsL3,
          instantAmps,
          instantAmpsL1,
          instantAmpsL2,
          instantAmpsL3,
          instantVolts,
          instantVoltsL1,
          instantVoltsL2,
          instantVoltsL3,
          limitWatts,
          limitAmps,
          stateOfCharge);
    }
  }
}
