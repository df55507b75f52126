package com.assetplatform.integration.connector;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "connector.asset")
public class AssetConnectorProperties {
  private long callTimeoutMs = 10_000L;
  private long connectTimeoutMs = 5_000L;
  private int maxConcurrentCalls = 8;

  public long getCallTimeoutMs() {
    return callTimeoutMs;
  }

  public void setCallTimeoutMs(long callTimeoutMs) {
    this.callTimeoutMs = callTimeoutMs;
  }

  public long getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public void setConnectTimeoutMs(long connectTimeoutMs) {
    this.connectTimeoutMs = connectTimeoutMs;
  }

  public int getMaxConcurrentCalls() {
    return maxConcurrentCalls;
  }

  public void setMaxConcurrentCalls(int maxConcurrentCalls) {
    this.maxConcurrentCalls = maxConcurrentCalls;
  }
}
