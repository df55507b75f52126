package com.assetplatform.assetapi.api;

import com.assetplatform.assetapi.assets.AssetCommand;
import com.assetplatform.domain.assets.AssetType;
import com.assetplatform.domain.assets.GeoCoordinates;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record UpsertAssetRequest(
    @NotBlank(message = "name is required") String name,
    String siteAreaID,
    @NotBlank(message = "assetType is required") String assetType,
    boolean dynamicAsset,
    String connectionID,
    String meterID,
    @Size(min = 2, max = 2, message = "coordinates must be [longitude, latitude]")
        List<Double> coordinates,
    @DecimalMin(value = "0", message = "staticValueWatt must not be negative")
        Double staticValueWatt,
    @DecimalMin(value = "0", message = "fluctuationPercent must be between 0 and 100")
        @DecimalMax(value = "100", message = "fluctuationPercent must be between 0 and 100")
        Double fluctuationPercent,
    boolean excludeFromSmartCharging) {

  /** Converts to a command; an unknown asset type surfaces as a domain error. */
  public AssetCommand toCommand() {
    GeoCoordinates geoCoordinates = null;
    if (coordinates != null && coordinates.size() == 2
        && coordinates.get(0) != null && coordinates.get(1) != null) {
      geoCoordinates = new GeoCoordinates(coordinates.get(0), coordinates.get(1));
    }
    return new AssetCommand(
        name,
        siteAreaID,
        AssetType.fromCode(assetType),
        dynamicAsset,
        connectionID,
        meterID,
        geoCoordinates,
        staticValueWatt,
        fluctuationPercent,
        excludeFromSmartCharging);
  }
}
