package com.assetplatform.assetapi.telemetry;

import com.assetplatform.assetapi.assets.AssetNotFoundException;
import com.assetplatform.assetapi.assets.AssetRepository;
import com.assetplatform.assetapi.assets.RequestFilters;
import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.ConsumptionMerger;
import com.assetplatform.domain.assets.ConsumptionSample;
import com.assetplatform.integration.connector.AssetConnectionRef;
import com.assetplatform.integration.connector.AssetConnector;
import com.assetplatform.integration.connector.AssetConnectorException;
import com.assetplatform.integration.connector.AssetConnectorRegistry;
import com.assetplatform.integration.connector.ConnectionCheckResult;
import com.assetplatform.integration.connector.ConnectionHealthChecker;
import com.assetplatform.integration.connector.ConnectorErrors;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class AssetTelemetryService {
  private static final Logger log = LoggerFactory.getLogger(AssetTelemetryService.class);

  static final String RETRIEVAL_TOTAL_METRIC = "asset.telemetry.retrieval.total";
  static final String RETRIEVAL_DURATION_METRIC = "asset.telemetry.retrieval.duration";

  private final AssetRepository assetRepository;
  private final AssetConnectorRegistry connectorRegistry;
  private final ConnectionHealthChecker healthChecker;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public AssetTelemetryService(
      AssetRepository assetRepository,
      AssetConnectorRegistry connectorRegistry,
      ConnectionHealthChecker healthChecker,
      MeterRegistry meterRegistry) {
    this(assetRepository, connectorRegistry, healthChecker, meterRegistry, Clock.systemUTC());
  }

  AssetTelemetryService(
      AssetRepository assetRepository,
      AssetConnectorRegistry connectorRegistry,
      ConnectionHealthChecker healthChecker,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.assetRepository = assetRepository;
    this.connectorRegistry = connectorRegistry;
    this.healthChecker = healthChecker;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public ConnectionCheckResult checkConnection(String tenantId, AssetConnectionRef connectionRef) {
    AssetConnector connector =
        connectorRegistry
            .resolve(tenantId, connectionRef)
            .orElseThrow(
                () ->
                    new AssetConnectorNotConfiguredException(
                        connectionRef == null ? null : connectionRef.connectionId()));
    return healthChecker.check(connector);
  }

  public RetrievalOutcome retrieveAndMerge(String tenantId, String assetId, String changedBy) {
    String id = RequestFilters.requireId(assetId, "Asset ID");
    Asset asset =
        assetRepository.findById(tenantId, id).orElseThrow(() -> new AssetNotFoundException(id));
    if (!asset.dynamicAsset()) {
      throw new InvalidAssetOperationException(
          "This Asset is not dynamic, no consumption can be retrieved");
    }
    AssetConnector connector =
        connectorRegistry
            .resolve(tenantId, asset.connectionId())
            .orElseThrow(() -> new AssetConnectorNotConfiguredException(asset.connectionId()));

    Instant startedAt = clock.instant();
    try {
      List<ConsumptionSample> samples = retrieve(tenantId, asset, connector);
      Optional<Asset> merged = ConsumptionMerger.mergeFirst(asset, samples);
      if (merged.isEmpty()) {
        increment("no_sample");
        log.info(
            "No consumption sample available tenant={} asset={} connection={}",
            tenantId,
            asset.id(),
            asset.connectionId());
        return RetrievalOutcome.NO_SAMPLE_AVAILABLE;
      }
      if (Thread.currentThread().isInterrupted()) {
        throw new AssetConnectorException(
            "Consumption retrieval cancelled before save asset=" + asset.id(), 0);
      }
      Asset toSave =
          merged.get().withAudit(merged.get().audit().changedBy(changedBy, clock.instant()));
      Asset saved = assetRepository.save(tenantId, toSave);
      increment("merged");
      log.info(
          "Asset consumption merged tenant={} asset={} connection={} samples={} version={}",
          tenantId,
          asset.id(),
          asset.connectionId(),
          samples.size(),
          saved.version());
      return RetrievalOutcome.MERGED;
    } finally {
      Timer.builder(RETRIEVAL_DURATION_METRIC)
          .description("Asset consumption retrieve-and-merge latency")
          .register(meterRegistry)
          .record(Duration.between(startedAt, clock.instant()).abs());
    }
  }

  private List<ConsumptionSample> retrieve(
      String tenantId, Asset asset, AssetConnector connector) {
    try {
      List<ConsumptionSample> samples = connector.retrieveConsumptions(asset, true);
      return samples == null ? List.of() : samples;
    } catch (RuntimeException ex) {
      String errorCode = ConnectorErrors.errorCode(ex);
      increment("failure");
      log.warn(
          "Asset consumption retrieval failed tenant={} asset={} connection={} error={}",
          tenantId,
          asset.id(),
          asset.connectionId(),
          errorCode,
          ex);
      throw ex;
    }
  }

  private void increment(String outcome) {
    meterRegistry.counter(RETRIEVAL_TOTAL_METRIC, "outcome", outcome).increment();
  }
}
