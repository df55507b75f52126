package com.assetplatform.assetapi.assets;

import java.util.List;

public record AssetPage<T>(List<T> result, long count) {
  public AssetPage {
    result = List.copyOf(result);
  }

  public static <T> AssetPage<T> countOnly(long count) {
    return new AssetPage<>(List.of(), count);
  }
}
