package com.assetplatform.assetapi.consumption;

import com.assetplatform.assetapi.assets.AssetNotFoundException;
import com.assetplatform.assetapi.assets.AssetRepository;
import com.assetplatform.assetapi.assets.AssetValidationException;
import com.assetplatform.assetapi.assets.RequestFilters;
import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.ConsumptionSample;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AssetConsumptionQueryService {
  private final AssetRepository assetRepository;
  private final ConsumptionRepository consumptionRepository;

  public AssetConsumptionQueryService(
      AssetRepository assetRepository, ConsumptionRepository consumptionRepository) {
    this.assetRepository = assetRepository;
    this.consumptionRepository = consumptionRepository;
  }

  @Transactional(readOnly = true)
  public AssetConsumptionHistory query(
      String tenantId, String assetId, Instant startDate, Instant endDate) {
    String id = RequestFilters.requireId(assetId, "Asset ID");
    Asset asset =
        assetRepository.findById(tenantId, id).orElseThrow(() -> new AssetNotFoundException(id));
    if (startDate == null || endDate == null) {
      throw new AssetValidationException("Start date and end date must be provided");
    }
    if (startDate.isAfter(endDate)) {
      throw new AssetValidationException(
          "The requested start date '"
              + DateTimeFormatter.ISO_INSTANT.format(startDate)
              + "' is after the end date '"
              + DateTimeFormatter.ISO_INSTANT.format(endDate)
              + "'");
    }
    List<ConsumptionSample> values =
        consumptionRepository.getAssetConsumptions(
            tenantId, new ConsumptionQuery(id, startDate, endDate));
    return new AssetConsumptionHistory(asset, values);
  }
}
