package com.assetplatform.assetapi.consumption;

import com.assetplatform.domain.assets.ConsumptionSample;
import com.assetplatform.integration.connector.ConsumptionRecorder;
import java.util.List;

public interface ConsumptionRepository extends ConsumptionRecorder {
  /**
   * Returns the samples starting within the query range, ascending by start time. Only the
   * historical projection is populated: start, end, instant watts and amps, limits and state of
   * charge.
   */
  List<ConsumptionSample> getAssetConsumptions(String tenantId, ConsumptionQuery query);
}
