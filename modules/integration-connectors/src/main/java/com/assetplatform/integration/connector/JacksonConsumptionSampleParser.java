package com.assetplatform.integration.connector;

import com.assetplatform.domain.assets.AssetDomainException;
import com.assetplatform.domain.assets.ConsumptionSample;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the meter gateway payload {@code {"samples":[{...}]}}. A payload without a samples
 * array carries no reading and parses to an empty list.
 */
public class JacksonConsumptionSampleParser {
  private final ObjectMapper objectMapper;

  public JacksonConsumptionSampleParser(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public List<ConsumptionSample> parse(String rawPayload) {
    if (rawPayload == null || rawPayload.isBlank()) {
      return List.of();
    }
    JsonNode root = parseRoot(rawPayload);
    JsonNode samples = root.get("samples");
    if (samples == null || !samples.isArray()) {
      return List.of();
    }
    List<ConsumptionSample> result = new ArrayList<>(samples.size());
    for (JsonNode node : samples) {
      result.add(toSample(node));
    }
    return List.copyOf(result);
  }

  private ConsumptionSample toSample(JsonNode node) {
    try {
      return new ConsumptionSample(
          optionalInstant(node, "startedAt"),
          optionalInstant(node, "endedAt"),
          optionalDouble(node, "consumptionWh"),
          optionalDouble(node, "instantWatts"),
          optionalDouble(node, "instantWattsL1"),
          optionalDouble(node, "instantWattsL2"),
          optionalDouble(node, "instantWattsL3"),
          optionalDouble(node, "instantAmps"),
          optionalDouble(node, "instantAmpsL1"),
          optionalDouble(node, "instantAmpsL2"),
          optionalDouble(node, "instantAmpsL3"),
          optionalDouble(node, "instantVolts"),
          optionalDouble(node, "instantVoltsL1"),
          optionalDouble(node, "instantVoltsL2"),
          optionalDouble(node, "instantVoltsL3"),
          optionalDouble(node, "limitWatts"),
          optionalDouble(node, "limitAmps"),
          optionalDouble(node, "stateOfCharge"));
    } catch (AssetDomainException | DateTimeParseException ex) {
      throw new AssetConnectorException("Invalid consumption sample: " + ex.getMessage(), 0, ex);
    }
  }

  private JsonNode parseRoot(String rawPayload) {
    try {
      return objectMapper.readTree(rawPayload);
    } catch (IOException ex) {
      throw new AssetConnectorException("Failed to parse connector response JSON", 0, ex);
    }
  }

  private static Instant optionalInstant(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.asText().isBlank()) {
      return null;
    }
    return Instant.parse(value.asText());
  }

  private static Double optionalDouble(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isNumber()) {
      throw new AssetConnectorException("Field " + field + " must be numeric", 0);
    }
    return value.asDouble();
  }
}
