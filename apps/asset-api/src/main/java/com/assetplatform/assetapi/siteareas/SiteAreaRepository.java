package com.assetplatform.assetapi.siteareas;

import java.util.Optional;

public interface SiteAreaRepository {
  Optional<SiteArea> findById(String tenantId, String siteAreaId);
}
