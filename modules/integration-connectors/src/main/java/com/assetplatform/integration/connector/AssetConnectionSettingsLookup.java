package com.assetplatform.integration.connector;

import java.util.Optional;

public interface AssetConnectionSettingsLookup {
  Optional<AssetConnectionSettings> find(String tenantId, String connectionId);
}
