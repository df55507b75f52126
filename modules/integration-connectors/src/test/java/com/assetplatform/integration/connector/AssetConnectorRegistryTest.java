package com.assetplatform.integration.connector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AssetConnectorRegistryTest {
  private final Map<String, AssetConnectionSettings> settingsByKey = new HashMap<>();
  private ExecutorService executor;
  private AssetConnectorRegistry registry;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
    AssetConnectionSettingsLookup lookup =
        (tenantId, connectionId) -> Optional.ofNullable(settingsByKey.get(tenantId + "/" + connectionId));
    registry =
        new AssetConnectorRegistry(
            lookup, List.of(new StubFactory("rest-json")), executor, Duration.ofSeconds(3));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldResolveConfiguredConnectionWithTimeLimit() {
    settingsByKey.put("tenant-1/meter-7", TestAssets.settings("meter-7", "REST-JSON"));

    Optional<AssetConnector> connector = registry.resolve("tenant-1", "meter-7");

    assertTrue(connector.isPresent());
    TimeLimitedAssetConnector timeLimited =
        assertInstanceOf(TimeLimitedAssetConnector.class, connector.get());
    assertEquals(Duration.ofSeconds(3), timeLimited.timeout());
    assertEquals("meter-7", timeLimited.settings().connectionId());
  }

  @Test
  void shouldResolveFilterReferenceAndBareIdentifierTheSameWay() {
    settingsByKey.put("tenant-1/meter-7", TestAssets.settings("meter-7", "rest-json"));

    AssetConnector fromRef = registry.resolve("tenant-1", AssetConnectionRef.of("meter-7")).orElseThrow();
    AssetConnector fromId = registry.resolve("tenant-1", "meter-7").orElseThrow();

    assertEquals(fromRef.settings(), fromId.settings());
  }

  @Test
  void shouldUseConnectionTimeoutOverride() {
    settingsByKey.put(
        "tenant-1/meter-8",
        new AssetConnectionSettings(
            "tenant-1",
            "meter-8",
            "rest-json",
            URI.create("https://meters.test"),
            null,
            Duration.ofMillis(750)));

    TimeLimitedAssetConnector connector =
        (TimeLimitedAssetConnector) registry.resolve("tenant-1", "meter-8").orElseThrow();

    assertEquals(Duration.ofMillis(750), connector.timeout());
  }

  @Test
  void shouldReturnEmptyWhenNothingIsConfigured() {
    settingsByKey.put("tenant-1/meter-7", TestAssets.settings("meter-7", "rest-json"));

    assertTrue(registry.resolve("tenant-1", "unknown").isEmpty());
    assertTrue(registry.resolve("tenant-2", "meter-7").isEmpty());
    assertTrue(registry.resolve("tenant-1", " ").isEmpty());
    assertTrue(registry.resolve("tenant-1", (String) null).isEmpty());
    assertTrue(registry.resolve("tenant-1", (AssetConnectionRef) null).isEmpty());
  }

  @Test
  void shouldReturnEmptyForUnsupportedConnectorType() {
    settingsByKey.put("tenant-1/meter-9", TestAssets.settings("meter-9", "modbus"));

    assertTrue(registry.resolve("tenant-1", "meter-9").isEmpty());
  }

  @Test
  void shouldRejectDuplicateFactoryTypes() {
    assertThrows(
        IllegalStateException.class,
        () ->
            new AssetConnectorRegistry(
                (tenantId, connectionId) -> Optional.empty(),
                List.of(new StubFactory("rest-json"), new StubFactory("REST-JSON")),
                executor,
                Duration.ofSeconds(1)));
  }

  @Test
  void shouldListSupportedTypes() {
    assertEquals(List.of("rest-json"), registry.supportedTypes());
  }

  @Test
  void shouldWrapFactoryConnector() {
    settingsByKey.put("tenant-1/meter-7", TestAssets.settings("meter-7", "rest-json"));

    TimeLimitedAssetConnector connector =
        (TimeLimitedAssetConnector) registry.resolve("tenant-1", "meter-7").orElseThrow();

    assertInstanceOf(StubAssetConnector.class, connector.delegate());
    assertSame(settingsByKey.get("tenant-1/meter-7"), connector.delegate().settings());
  }

  private record StubFactory(String type) implements AssetConnectorFactory {
    @Override
    public AssetConnector create(AssetConnectionSettings settings) {
      return new StubAssetConnector(settings, () -> {}, List::of);
    }
  }
}
