package com.assetplatform.domain.assets;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class ConsumptionMerger {
  private ConsumptionMerger() {}

  public static Asset merge(Asset asset, ConsumptionSample sample) {
    Objects.requireNonNull(asset, "asset must not be null");
    Objects.requireNonNull(sample, "sample must not be null");
    return asset.withLiveState(AssetLiveState.fromSample(sample));
  }

  /** Merges the first sample, or returns empty when the connector produced none. */
  public static Optional<Asset> mergeFirst(Asset asset, List<ConsumptionSample> samples) {
    if (samples == null || samples.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(merge(asset, samples.get(0)));
  }
}
