package com.assetplatform.assetapi.diagnostics;

/** Raw error-listing filters as received; multi-valued fields are bar-delimited. */
public record AssetInErrorRequest(String errorType, String siteAreaId, String siteId, String search) {}
