package com.assetplatform.assetapi.consumption;

import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.ConsumptionSample;
import java.util.List;

public record AssetConsumptionHistory(Asset asset, List<ConsumptionSample> values) {
  public AssetConsumptionHistory {
    values = List.copyOf(values);
  }
}
