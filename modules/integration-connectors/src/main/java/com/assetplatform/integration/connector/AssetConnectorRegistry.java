package com.assetplatform.integration.connector;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the connector configured for a tenant connection. An unknown or unconfigured
 * connection resolves to {@link Optional#empty()}, never to an exception.
 */
public class AssetConnectorRegistry {
  private static final Logger log = LoggerFactory.getLogger(AssetConnectorRegistry.class);

  private final AssetConnectionSettingsLookup settingsLookup;
  private final Map<String, AssetConnectorFactory> factoriesByType;
  private final ExecutorService executor;
  private final Duration defaultTimeout;

  public AssetConnectorRegistry(
      AssetConnectionSettingsLookup settingsLookup,
      List<AssetConnectorFactory> factories,
      ExecutorService executor,
      Duration defaultTimeout) {
    this.settingsLookup = Objects.requireNonNull(settingsLookup, "settingsLookup must not be null");
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
    this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
    this.factoriesByType =
        factories.stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    factory -> normalizeType(factory.type()),
                    Function.identity(),
                    (left, right) -> {
                      throw new IllegalStateException(
                          "Duplicate asset connector type: " + left.type());
                    }));
  }

  public Optional<AssetConnector> resolve(String tenantId, AssetConnectionRef connectionRef) {
    if (connectionRef == null) {
      return Optional.empty();
    }
    return resolve(tenantId, connectionRef.connectionId());
  }

  public Optional<AssetConnector> resolve(String tenantId, String connectionId) {
    if (tenantId == null || tenantId.isBlank() || connectionId == null || connectionId.isBlank()) {
      return Optional.empty();
    }
    Optional<AssetConnectionSettings> settings = settingsLookup.find(tenantId, connectionId.trim());
    if (settings.isEmpty()) {
      log.debug("No asset connection settings tenant={} connection={}", tenantId, connectionId);
      return Optional.empty();
    }
    AssetConnectorFactory factory = factoriesByType.get(normalizeType(settings.get().type()));
    if (factory == null) {
      log.warn(
          "Unsupported asset connector type tenant={} connection={} type={}",
          tenantId,
          connectionId,
          settings.get().type());
      return Optional.empty();
    }
    Duration timeout =
        settings.get().timeout() != null ? settings.get().timeout() : defaultTimeout;
    return Optional.of(
        new TimeLimitedAssetConnector(factory.create(settings.get()), executor, timeout));
  }

  public List<String> supportedTypes() {
    return factoriesByType.keySet().stream().sorted().toList();
  }

  private static String normalizeType(String type) {
    return type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
  }
}
