package com.assetplatform.assetapi.siteareas;

public record SiteArea(String id, String name, String siteId) {}
