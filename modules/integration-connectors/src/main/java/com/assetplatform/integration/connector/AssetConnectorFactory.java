package com.assetplatform.integration.connector;

public interface AssetConnectorFactory {
  String type();

  AssetConnector create(AssetConnectionSettings settings);
}
