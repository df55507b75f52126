package com.assetplatform.domain.assets;

import java.util.Locale;

public enum AssetInErrorType {
  MISSING_SITE_AREA("missing_site_area", "Asset is not assigned to a site area"),
  MISSING_CONNECTION("missing_connection", "Dynamic asset has no connection configured");

  private final String tag;
  private final String description;

  AssetInErrorType(String tag, String description) {
    this.tag = tag;
    this.description = description;
  }

  public String tag() {
    return tag;
  }

  public String description() {
    return description;
  }

  public static AssetInErrorType fromTag(String tag) {
    if (tag == null || tag.isBlank()) {
      throw new AssetDomainException("Asset error type must not be blank");
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    for (AssetInErrorType type : values()) {
      if (type.tag.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
        return type;
      }
    }
    throw new AssetDomainException("Unsupported asset error type: " + tag);
  }
}
