package com.assetplatform.integration.connector;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Probes a resolved connector. Never throws: every probe failure becomes a failed result. */
public class ConnectionHealthChecker {
  private static final Logger log = LoggerFactory.getLogger(ConnectionHealthChecker.class);

  static final String CHECK_TOTAL_METRIC = "asset.connector.check.total";
  static final String CHECK_DURATION_METRIC = "asset.connector.check.duration";

  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public ConnectionHealthChecker(MeterRegistry meterRegistry) {
    this(meterRegistry, Clock.systemUTC());
  }

  ConnectionHealthChecker(MeterRegistry meterRegistry, Clock clock) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public ConnectionCheckResult check(AssetConnector connector) {
    Objects.requireNonNull(connector, "connector must not be null");
    AssetConnectionSettings settings = connector.settings();
    String type = settings == null ? "unknown" : settings.type();
    Instant startedAt = clock.instant();
    try {
      connector.checkConnection();
      increment(type, "success", "none");
      log.info(
          "Asset connection check succeeded tenant={} connection={} type={}",
          settings == null ? null : settings.tenantId(),
          settings == null ? null : settings.connectionId(),
          type);
      return ConnectionCheckResult.ok();
    } catch (RuntimeException ex) {
      ConnectionCheckResult result = ConnectionCheckResult.failed(ex);
      increment(type, "failure", result.errorCode());
      log.warn(
          "Asset connection check failed tenant={} connection={} type={} error={} message={}",
          settings == null ? null : settings.tenantId(),
          settings == null ? null : settings.connectionId(),
          type,
          result.errorCode(),
          result.errorMessage(),
          ex);
      return result;
    } finally {
      Timer.builder(CHECK_DURATION_METRIC)
          .description("Asset connector health probe latency")
          .tag("type", type)
          .register(meterRegistry)
          .record(Duration.between(startedAt, clock.instant()).abs());
    }
  }

  private void increment(String type, String outcome, String errorCode) {
    meterRegistry
        .counter(CHECK_TOTAL_METRIC, "type", type, "outcome", outcome, "error_code", errorCode)
        .increment();
  }
}
