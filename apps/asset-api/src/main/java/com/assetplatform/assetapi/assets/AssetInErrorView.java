package com.assetplatform.assetapi.assets;

public record AssetInErrorView(String id, String name, String errorCode, String errorCodeDetails) {}
