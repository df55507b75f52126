package com.assetplatform.assetapi.assets;

import java.util.List;

public record AssetQuery(
    String search,
    List<String> siteAreaIds,
    List<String> siteIds,
    boolean withNoSiteArea,
    boolean dynamicOnly) {
  public AssetQuery {
    siteAreaIds = siteAreaIds == null ? null : List.copyOf(siteAreaIds);
    siteIds = siteIds == null ? null : List.copyOf(siteIds);
  }
}
