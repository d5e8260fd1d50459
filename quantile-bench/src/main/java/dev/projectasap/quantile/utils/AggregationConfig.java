/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.quantile.functions.ExactQuantile;
import dev.projectasap.quantile.request.QuantileRequest;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Configuration for a single quantile aggregation. Contains the function type, the requested
 * probabilities, parameters, and window settings for the aggregation.
 */
public class AggregationConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  static final String FUNCTION_PACKAGE = "dev.projectasap.quantile.functions";

  public Integer aggregationId;
  public String aggregationType;
  public String aggregationSubType;
  public QuantileRequest quantiles;
  public Map<String, String> parameters;
  public int tumblingWindowSize;

  private String originalYaml;

  public void setOriginalYaml(String originalYaml) {
    this.originalYaml = originalYaml;
  }

  /** @return the probabilities in the form rows carry them */
  public double[] requestSpec() {
    return quantiles.toArray();
  }

  public byte[] serializeToBytes() {
    return originalYaml == null ? new byte[0] : originalYaml.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Serializes the aggregation configuration to JSON.
   *
   * @return JsonNode containing the configuration details
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("aggregationId", this.aggregationId);
    jsonNode.put("aggregationType", this.aggregationType);
    jsonNode.put("aggregationSubType", this.aggregationSubType);
    jsonNode.set("quantiles", this.quantiles == null ? null : this.quantiles.toJson());

    ObjectNode parametersNode = jsonNode.putObject("parameters");
    if (this.parameters != null) {
      this.parameters.forEach(parametersNode::put);
    }

    jsonNode.put("tumblingWindowSize", this.tumblingWindowSize);
    return jsonNode;
  }

  /**
   * Instantiates the aggregation function named by {@code aggregationType}.
   *
   * @return the instantiated aggregation function
   * @throws RuntimeException if function instantiation fails
   */
  public ExactQuantile<?> getAggregationFunction() {
    try {
      Class<?> clazz = Class.forName(FUNCTION_PACKAGE + "." + aggregationType);
      return (ExactQuantile<?>)
          clazz.getConstructor(String.class, Map.class).newInstance(aggregationSubType, parameters);
    } catch (ReflectiveOperationException | ClassCastException e) {
      throw new RuntimeException("Failed to create aggregation function " + aggregationType, e);
    }
  }
}
