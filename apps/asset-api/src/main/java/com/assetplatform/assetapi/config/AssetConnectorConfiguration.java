package com.assetplatform.assetapi.config;

import com.assetplatform.integration.connector.AssetConnectionSettingsLookup;
import com.assetplatform.integration.connector.AssetConnectorFactory;
import com.assetplatform.integration.connector.AssetConnectorProperties;
import com.assetplatform.integration.connector.AssetConnectorRegistry;
import com.assetplatform.integration.connector.ConnectionHealthChecker;
import com.assetplatform.integration.connector.ConsumptionRecorder;
import com.assetplatform.integration.connector.JacksonConsumptionSampleParser;
import com.assetplatform.integration.connector.RestJsonAssetConnectorFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AssetConnectorProperties.class)
public class AssetConnectorConfiguration {

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(name = "assetConnectorExecutor")
  public ExecutorService assetConnectorExecutor(AssetConnectorProperties properties) {
    int threads = Math.max(1, properties.getMaxConcurrentCalls());
    AtomicInteger sequence = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "asset-connector-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(threads, threadFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public JacksonConsumptionSampleParser consumptionSampleParser(ObjectMapper objectMapper) {
    return new JacksonConsumptionSampleParser(objectMapper);
  }

  @Bean
  @ConditionalOnMissingBean
  public RestJsonAssetConnectorFactory restJsonAssetConnectorFactory(
      AssetConnectorProperties properties,
      JacksonConsumptionSampleParser consumptionSampleParser,
      ConsumptionRecorder consumptionRecorder) {
    return new RestJsonAssetConnectorFactory(
        properties, consumptionSampleParser, consumptionRecorder);
  }

  @Bean
  @ConditionalOnMissingBean
  public AssetConnectorRegistry assetConnectorRegistry(
      AssetConnectionSettingsLookup settingsLookup,
      List<AssetConnectorFactory> factories,
      ExecutorService assetConnectorExecutor,
      AssetConnectorProperties properties) {
    return new AssetConnectorRegistry(
        settingsLookup,
        factories,
        assetConnectorExecutor,
        Duration.ofMillis(Math.max(100L, properties.getCallTimeoutMs())));
  }

  @Bean
  @ConditionalOnMissingBean
  public ConnectionHealthChecker connectionHealthChecker(MeterRegistry meterRegistry) {
    return new ConnectionHealthChecker(meterRegistry);
  }
}
