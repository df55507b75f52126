package com.assetplatform.integration.connector;

import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.ConsumptionSample;
import java.util.List;

/**
 * Capability set of one external telemetry integration. Implementations signal transport or
 * protocol failures with {@link AssetConnectorException}.
 */
public interface AssetConnector {
  AssetConnectionSettings settings();

  void checkConnection();

  /**
   * Pulls the latest samples for {@code asset}. When {@code persist} is set the connector also
   * hands the samples to the historical consumption store.
   */
  List<ConsumptionSample> retrieveConsumptions(Asset asset, boolean persist);

  /** Writes already retrieved samples to the historical store. No-op for store-less connectors. */
  default void recordConsumptions(Asset asset, List<ConsumptionSample> samples) {}
}
