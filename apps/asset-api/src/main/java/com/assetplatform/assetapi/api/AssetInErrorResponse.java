package com.assetplatform.assetapi.api;

import com.assetplatform.assetapi.assets.AssetInErrorView;

public record AssetInErrorResponse(
    String id, String name, String errorCode, String errorCodeDetails) {
  public static AssetInErrorResponse from(AssetInErrorView view) {
    return new AssetInErrorResponse(
        view.id(), view.name(), view.errorCode(), view.errorCodeDetails());
  }
}
