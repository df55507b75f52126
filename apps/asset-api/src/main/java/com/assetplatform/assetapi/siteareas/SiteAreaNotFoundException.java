package com.assetplatform.assetapi.siteareas;

public class SiteAreaNotFoundException extends RuntimeException {
  public SiteAreaNotFoundException(String siteAreaId) {
    super("Site Area ID '" + siteAreaId + "' does not exist");
  }
}
