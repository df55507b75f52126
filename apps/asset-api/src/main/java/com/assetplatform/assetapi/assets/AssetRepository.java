package com.assetplatform.assetapi.assets;

import com.assetplatform.domain.assets.Asset;
import java.util.Optional;

public interface AssetRepository {
  Optional<Asset> findById(String tenantId, String assetId);

  void insert(String tenantId, Asset asset);

  /**
   * Updates the stored asset when its version still equals {@code asset.version()}.
   *
   * @return the saved asset carrying the incremented version
   * @throws AssetConcurrentModificationException when another write won the race
   */
  Asset save(String tenantId, Asset asset);

  boolean delete(String tenantId, String assetId);

  AssetPage<Asset> findAssets(String tenantId, AssetQuery query, AssetPaging paging);

  AssetPage<AssetInErrorView> findAssetsInError(
      String tenantId, AssetInErrorFilter filter, AssetPaging paging);
}
