package com.assetplatform.assetapi.assets;

import com.assetplatform.domain.assets.AssetType;
import com.assetplatform.domain.assets.GeoCoordinates;

/** Descriptive attributes of an asset as supplied on create or update. */
public record AssetCommand(
    String name,
    String siteAreaId,
    AssetType assetType,
    boolean dynamicAsset,
    String connectionId,
    String meterId,
    GeoCoordinates coordinates,
    Double staticValueWatt,
    Double fluctuationPercent,
    boolean excludeFromSmartCharging) {}
