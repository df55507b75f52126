package com.assetplatform.assetapi.api;

import java.util.List;

public record AssetsInErrorPageResponse(long count, List<AssetInErrorResponse> result) {}
