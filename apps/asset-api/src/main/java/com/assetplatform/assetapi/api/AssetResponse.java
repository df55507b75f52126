package com.assetplatform.assetapi.api;

import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.AssetLiveState;
import com.assetplatform.domain.assets.LastConsumption;
import java.time.Instant;
import java.util.List;

public record AssetResponse(
    String id,
    String name,
    String siteAreaID,
    String siteID,
    String assetType,
    boolean dynamicAsset,
    String connectionID,
    String meterID,
    List<Double> coordinates,
    Double staticValueWatt,
    Double fluctuationPercent,
    boolean excludeFromSmartCharging,
    LastConsumptionResponse lastConsumption,
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
    Double currentStateOfCharge,
    String createdBy,
    Instant createdOn,
    String lastChangedBy,
    Instant lastChangedOn,
    long version) {

  public static AssetResponse from(Asset asset) {
    AssetLiveState live = asset.liveState();
    List<Double> coordinates =
        asset.coordinates() == null
            ? null
            : List.of(asset.coordinates().longitude(), asset.coordinates().latitude());
    return new AssetResponse(
        asset.id(),
        asset.name(),
        asset.siteAreaId(),
        asset.siteId(),
        asset.assetType().code(),
        asset.dynamicAsset(),
        asset.connectionId(),
        asset.meterId(),
        coordinates,
        asset.staticValueWatt(),
        asset.fluctuationPercent(),
        asset.excludeFromSmartCharging(),
        LastConsumptionResponse.from(live.lastConsumption()),
        live.currentConsumptionWh(),
        live.currentInstantAmps(),
        live.currentInstantAmpsL1(),
        live.currentInstantAmpsL2(),
        live.currentInstantAmpsL3(),
        live.currentInstantVolts(),
        live.currentInstantVoltsL1(),
        live.currentInstantVoltsL2(),
        live.currentInstantVoltsL3(),
        live.currentInstantWatts(),
        live.currentInstantWattsL1(),
        live.currentInstantWattsL2(),
        live.currentInstantWattsL3(),
        live.currentStateOfCharge(),
        asset.audit().createdBy(),
        asset.audit().createdOn(),
        asset.audit().lastChangedBy(),
        asset.audit().lastChangedOn(),
        asset.version());
  }

  public record LastConsumptionResponse(double value, Instant timestamp) {
    static LastConsumptionResponse from(LastConsumption lastConsumption) {
      if (lastConsumption == null) {
        return null;
      }
      return new LastConsumptionResponse(lastConsumption.value(), lastConsumption.timestamp());
    }
  }
}
