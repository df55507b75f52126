package com.assetplatform.domain.assets;

public enum AssetType {
  CONSUMPTION("CO"),
  PRODUCTION("PR"),
  CONSUMPTION_AND_PRODUCTION("CO-PR");

  private final String code;

  AssetType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static AssetType fromCode(String code) {
    for (AssetType type : values()) {
      if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
        return type;
      }
    }
    throw new AssetDomainException("Unsupported asset type: " + code);
  }
}
