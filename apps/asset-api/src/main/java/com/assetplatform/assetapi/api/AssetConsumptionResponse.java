package com.assetplatform.assetapi.api;

import com.assetplatform.assetapi.consumption.AssetConsumptionHistory;
import com.assetplatform.domain.assets.AssetLiveState;
import java.util.List;

public record AssetConsumptionResponse(
    String id,
    String name,
    String siteAreaID,
    String siteID,
    Double currentConsumptionWh,
    Double currentInstantWatts,
    Double currentStateOfCharge,
    List<ConsumptionValueResponse> values) {

  public static AssetConsumptionResponse from(AssetConsumptionHistory history) {
    AssetLiveState live = history.asset().liveState();
    return new AssetConsumptionResponse(
        history.asset().id(),
        history.asset().name(),
        history.asset().siteAreaId(),
        history.asset().siteId(),
        live.currentConsumptionWh(),
        live.currentInstantWatts(),
        live.currentStateOfCharge(),
        history.values().stream().map(ConsumptionValueResponse::from).toList());
  }
}
