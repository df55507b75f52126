package com.assetplatform.integration.connector;

import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.ConsumptionSample;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every call of the wrapped connector on a bounded executor and gives up after the
 * configured timeout. A timed out or interrupted call is cancelled before the exception is
 * raised, so callers never act on a late result.
 *
 * <p>Samples are only written to the history store once the retrieval has returned in time, and
 * the write happens on the calling thread. A cancelled retrieval therefore records nothing.
 */
public class TimeLimitedAssetConnector implements AssetConnector {
  private final AssetConnector delegate;
  private final ExecutorService executor;
  private final Duration timeout;

  public TimeLimitedAssetConnector(
      AssetConnector delegate, ExecutorService executor, Duration timeout) {
    this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    this.timeout = timeout;
  }

  @Override
  public AssetConnectionSettings settings() {
    return delegate.settings();
  }

  @Override
  public void checkConnection() {
    call(
        "checkConnection",
        () -> {
          delegate.checkConnection();
          return null;
        });
  }

  @Override
  public List<ConsumptionSample> retrieveConsumptions(Asset asset, boolean persist) {
    List<ConsumptionSample> samples =
        call("retrieveConsumptions", () -> delegate.retrieveConsumptions(asset, false));
    if (persist && samples != null && !samples.isEmpty()) {
      recordConsumptions(asset, samples);
    }
    return samples;
  }

  @Override
  public void recordConsumptions(Asset asset, List<ConsumptionSample> samples) {
    if (Thread.currentThread().isInterrupted()) {
      throw new AssetConnectorException(
          "Connector retrieveConsumptions interrupted connection=" + connectionId(), 0);
    }
    delegate.recordConsumptions(asset, samples);
  }

  public Duration timeout() {
    return timeout;
  }

  AssetConnector delegate() {
    return delegate;
  }

  private <T> T call(String operation, Callable<T> task) {
    Future<T> future;
    try {
      future = executor.submit(task);
    } catch (RejectedExecutionException ex) {
      throw new AssetConnectorException(
          "Connector " + operation + " rejected connection=" + connectionId(), 0, ex);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new AssetConnectorException(
          "Connector "
              + operation
              + " timed out after "
              + timeout.toMillis()
              + " ms connection="
              + connectionId(),
          0,
          ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new AssetConnectorException(
          "Connector " + operation + " interrupted connection=" + connectionId(), 0, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof AssetConnectorException connectorException) {
        throw connectorException;
      }
      throw new AssetConnectorException(
          "Connector " + operation + " failed: " + ConnectorErrors.sanitizeMessage(cause),
          0,
          cause);
    }
  }

  private String connectionId() {
    AssetConnectionSettings settings = delegate.settings();
    return settings == null ? "unknown" : settings.connectionId();
  }
}
