/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.projectasap.quantile.functions.ExactQuantile;
import dev.projectasap.quantile.request.QuantileRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for loading streaming configuration from YAML files. Parses aggregation
 * configurations, their quantile requests and parameters.
 */
public class ConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

  /**
   * Loads streaming configuration from a YAML file.
   *
   * @param configFilePath path to the YAML configuration file
   * @return parsed streaming configuration
   * @throws IOException if file reading or parsing fails
   * @throws IllegalArgumentException if an aggregation is incomplete or inconsistent
   */
  public static StreamingConfig loadConfig(String configFilePath) throws IOException {
    String yamlContent =
        new String(Files.readAllBytes(Paths.get(configFilePath)), StandardCharsets.UTF_8);
    StreamingConfig streamingConfig = parseConfig(yamlContent);
    LOG.info(
        "Loaded {} aggregation(s) from {}",
        streamingConfig.aggregationConfigs.size(),
        configFilePath);
    return streamingConfig;
  }

  /**
   * Parses streaming configuration from YAML text.
   *
   * @param yamlContent the YAML document
   * @return parsed streaming configuration
   * @throws IOException if the text is not valid YAML
   */
  public static StreamingConfig parseConfig(String yamlContent) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    ObjectNode rootNode = mapper.readValue(yamlContent, ObjectNode.class);

    JsonNode aggregations = rootNode.get("aggregations");
    if (aggregations == null || !aggregations.isArray()) {
      throw new IllegalArgumentException("Configuration must contain an 'aggregations' list");
    }

    List<AggregationConfig> aggregationConfigs = new ArrayList<>();
    for (JsonNode node : aggregations) {
      aggregationConfigs.add(parseAggregation(node));
    }

    StreamingConfig streamingConfig = new StreamingConfig();
    streamingConfig.aggregationConfigs = aggregationConfigs;
    return streamingConfig;
  }

  private static AggregationConfig parseAggregation(JsonNode node) {
    AggregationConfig config = new AggregationConfig();
    config.aggregationId = required(node, "aggregationId").asInt();
    config.aggregationType = required(node, "aggregationType").asText();
    config.aggregationSubType = required(node, "aggregationSubType").asText();
    config.tumblingWindowSize = required(node, "tumblingWindowSize").asInt();

    // a bare number under an array subtype becomes a one-element list
    QuantileRequest.Shape shape = ExactQuantile.parseShape(config.aggregationSubType);
    QuantileRequest declared = QuantileRequest.fromJson(required(node, "quantiles"));
    try {
      config.quantiles = QuantileRequest.parse(declared.toArray(), shape);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Aggregation " + config.aggregationId + ": " + e.getMessage(), e);
    }

    Map<String, String> parameters = new HashMap<>();
    JsonNode parametersNode = node.get("parameters");
    if (parametersNode != null && !parametersNode.isNull()) {
      parametersNode
          .fields()
          .forEachRemaining(entry -> parameters.put(entry.getKey(), entry.getValue().asText()));
    }
    config.parameters = parameters;

    config.setOriginalYaml(node.toString());
    return config;
  }

  private static JsonNode required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Aggregation is missing required field '" + field + "'");
    }
    return value;
  }
}
