package com.assetplatform.domain.assets;

public record GeoCoordinates(double longitude, double latitude) {
  public GeoCoordinates {
    if (longitude < -180 || longitude > 180) {
      throw new AssetDomainException("longitude must be between -180 and 180");
    }
    if (latitude < -90 || latitude > 90) {
      throw new AssetDomainException("latitude must be between -90 and 90");
    }
  }
}
