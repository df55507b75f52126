package com.assetplatform.assetapi.api;

import java.util.List;

public record AssetsPageResponse(long count, List<AssetResponse> result) {}
