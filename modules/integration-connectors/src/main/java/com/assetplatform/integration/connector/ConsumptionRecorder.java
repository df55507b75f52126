package com.assetplatform.integration.connector;

import com.assetplatform.domain.assets.ConsumptionSample;
import java.util.List;

@FunctionalInterface
public interface ConsumptionRecorder {
  void record(String tenantId, String assetId, List<ConsumptionSample> samples);
}
