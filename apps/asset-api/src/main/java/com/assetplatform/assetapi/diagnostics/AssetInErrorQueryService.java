package com.assetplatform.assetapi.diagnostics;

import com.assetplatform.assetapi.assets.AssetInErrorFilter;
import com.assetplatform.assetapi.assets.AssetInErrorView;
import com.assetplatform.assetapi.assets.AssetPage;
import com.assetplatform.assetapi.assets.AssetPaging;
import com.assetplatform.assetapi.assets.AssetRepository;
import com.assetplatform.assetapi.assets.AssetValidationException;
import com.assetplatform.assetapi.assets.RequestFilters;
import com.assetplatform.domain.assets.AssetDomainException;
import com.assetplatform.domain.assets.AssetInErrorType;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AssetInErrorQueryService {
  static final List<AssetInErrorType> DEFAULT_ERROR_TYPES =
      List.of(AssetInErrorType.MISSING_SITE_AREA);

  private final AssetRepository assetRepository;

  public AssetInErrorQueryService(AssetRepository assetRepository) {
    this.assetRepository = assetRepository;
  }

  @Transactional(readOnly = true)
  public AssetPage<AssetInErrorView> listInError(
      String tenantId, AssetInErrorRequest request, AssetPaging paging) {
    AssetInErrorFilter filter = toFilter(request);
    return assetRepository.findAssetsInError(
        tenantId, filter, paging == null ? AssetPaging.defaults() : paging);
  }

  AssetInErrorFilter toFilter(AssetInErrorRequest request) {
    AssetInErrorRequest safeRequest =
        request == null ? new AssetInErrorRequest(null, null, null, null) : request;
    return new AssetInErrorFilter(
        errorTypes(safeRequest.errorType()),
        RequestFilters.normalizeSearch(safeRequest.search()),
        RequestFilters.splitBarDelimited(safeRequest.siteAreaId()),
        RequestFilters.splitBarDelimited(safeRequest.siteId()));
  }

  private static List<AssetInErrorType> errorTypes(String errorType) {
    List<String> tags = RequestFilters.splitBarDelimited(errorType);
    if (tags == null) {
      return DEFAULT_ERROR_TYPES;
    }
    try {
      return tags.stream().map(AssetInErrorType::fromTag).distinct().toList();
    } catch (AssetDomainException ex) {
      throw new AssetValidationException(ex.getMessage(), ex);
    }
  }
}
