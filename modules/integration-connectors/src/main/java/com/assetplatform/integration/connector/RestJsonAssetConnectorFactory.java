package com.assetplatform.integration.connector;

import java.time.Duration;
import java.util.Objects;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

public class RestJsonAssetConnectorFactory implements AssetConnectorFactory {
  private final AssetConnectorProperties properties;
  private final JacksonConsumptionSampleParser parser;
  private final ConsumptionRecorder recorder;

  public RestJsonAssetConnectorFactory(
      AssetConnectorProperties properties,
      JacksonConsumptionSampleParser parser,
      ConsumptionRecorder recorder) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.parser = Objects.requireNonNull(parser, "parser must not be null");
    this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
  }

  @Override
  public String type() {
    return RestJsonAssetConnector.TYPE;
  }

  @Override
  public AssetConnector create(AssetConnectionSettings settings) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(clampMillis(properties.getConnectTimeoutMs()));
    Duration readTimeout =
        settings.timeout() != null
            ? settings.timeout()
            : Duration.ofMillis(properties.getCallTimeoutMs());
    requestFactory.setReadTimeout(clampMillis(readTimeout.toMillis()));
    RestClient restClient =
        RestClient.builder()
            .baseUrl(settings.baseUri().toString())
            .requestFactory(requestFactory)
            .build();
    return new RestJsonAssetConnector(settings, restClient, parser, recorder);
  }

  private static int clampMillis(long millis) {
    return (int) Math.min(Integer.MAX_VALUE, Math.max(100L, millis));
  }
}
