package com.assetplatform.integration.connector;

import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.ConsumptionSample;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

public class RestJsonAssetConnector implements AssetConnector {
  public static final String TYPE = "rest-json";

  private static final String HEALTH_PATH = "/health";
  private static final String LATEST_CONSUMPTIONS_PATH = "/meters/{meterId}/consumptions/latest";
  private static final String API_KEY_HEADER = "X-Api-Key";

  private final AssetConnectionSettings settings;
  private final RestClient restClient;
  private final JacksonConsumptionSampleParser parser;
  private final ConsumptionRecorder recorder;
  private final Clock clock;

  public RestJsonAssetConnector(
      AssetConnectionSettings settings,
      RestClient restClient,
      JacksonConsumptionSampleParser parser,
      ConsumptionRecorder recorder) {
    this(settings, restClient, parser, recorder, Clock.systemUTC());
  }

  RestJsonAssetConnector(
      AssetConnectionSettings settings,
      RestClient restClient,
      JacksonConsumptionSampleParser parser,
      ConsumptionRecorder recorder,
      Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.parser = Objects.requireNonNull(parser, "parser must not be null");
    this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public AssetConnectionSettings settings() {
    return settings;
  }

  @Override
  public void checkConnection() {
    try {
      restClient
          .get()
          .uri(HEALTH_PATH)
          .headers(this::applyApiKey)
          .retrieve()
          .onStatus(HttpStatusCode::isError, (request, response) -> raise("health probe", response))
          .toBodilessEntity();
    } catch (RestClientException ex) {
      throw new AssetConnectorException(
          "Connector health probe failed connection=" + settings.connectionId(), 0, ex);
    }
  }

  @Override
  public List<ConsumptionSample> retrieveConsumptions(Asset asset, boolean persist) {
    Objects.requireNonNull(asset, "asset must not be null");
    if (asset.meterId() == null || asset.meterId().isBlank()) {
      throw new AssetConnectorException("Asset " + asset.id() + " has no meter identifier", 0);
    }
    String body;
    try {
      body =
          restClient
              .get()
              .uri(LATEST_CONSUMPTIONS_PATH, asset.meterId())
              .headers(this::applyApiKey)
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError, (request, response) -> raise("consumption read", response))
              .body(String.class);
    } catch (RestClientException ex) {
      throw new AssetConnectorException(
          "Connector consumption read failed connection=" + settings.connectionId(), 0, ex);
    }
    List<ConsumptionSample> samples = parser.parse(body);
    if (persist) {
      recordConsumptions(asset, samples);
    }
    return samples;
  }

  /**
   * History rows are keyed by their start time. A sample the meter sent without one starts at
   * its end time, or at the moment it is recorded when it has neither.
   */
  @Override
  public void recordConsumptions(Asset asset, List<ConsumptionSample> samples) {
    if (samples == null || samples.isEmpty()) {
      return;
    }
    Instant recordedAt = clock.instant();
    List<ConsumptionSample> timed =
        samples.stream()
            .map(
                sample ->
                    sample.startedAt() != null
                        ? sample
                        : sample.withStartedAt(
                            sample.endedAt() != null ? sample.endedAt() : recordedAt))
            .toList();
    recorder.record(settings.tenantId(), asset.id(), timed);
  }

  private void applyApiKey(HttpHeaders headers) {
    if (settings.hasApiKey()) {
      headers.set(API_KEY_HEADER, settings.apiKey());
    }
  }

  private void raise(String operation, ClientHttpResponse response) throws IOException {
    int status = response.getStatusCode().value();
    throw new AssetConnectorException(
        "Connector "
            + operation
            + " returned HTTP "
            + status
            + " connection="
            + settings.connectionId(),
        status);
  }
}
