package com.assetplatform.assetapi.assets;

import com.assetplatform.domain.assets.AssetInErrorType;
import java.util.List;

public record AssetInErrorFilter(
    List<AssetInErrorType> errorTypes,
    String search,
    List<String> siteAreaIds,
    List<String> siteIds) {
  public AssetInErrorFilter {
    if (errorTypes == null || errorTypes.isEmpty()) {
      throw new IllegalArgumentException("errorTypes must not be empty");
    }
    errorTypes = List.copyOf(errorTypes);
    siteAreaIds = siteAreaIds == null ? null : List.copyOf(siteAreaIds);
    siteIds = siteIds == null ? null : List.copyOf(siteIds);
  }
}
