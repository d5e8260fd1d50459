/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.quantile.rank.RankedResult;
import dev.projectasap.quantile.utils.AggregationConfig;
import dev.projectasap.quantile.utils.OutputStrategy;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Represents the output of one group in one window. Contains the ranked quantile values with
 * metadata about the time window and the group key.
 */
public class PrecomputedOutput implements SerializableToSink {
  @JsonProperty("start_timestamp")
  public Long startTimestamp;

  @JsonProperty("end_timestamp")
  public Long endTimestamp;

  public String key;
  public AggregationConfig config;
  public RankedResult<?> result; // null when the group saw only missing values
  private final OutputStrategy outputStrategy;

  /**
   * Constructs a PrecomputedOutput.
   *
   * @param startTimestamp the window start timestamp
   * @param endTimestamp the window end timestamp
   * @param key the group key
   * @param result the ranked values, or null if the group has none
   * @param config the aggregation configuration
   * @param outputStrategy decides which fields are written
   */
  public PrecomputedOutput(
      Long startTimestamp,
      Long endTimestamp,
      String key,
      RankedResult<?> result,
      AggregationConfig config,
      OutputStrategy outputStrategy) {
    this.startTimestamp = startTimestamp;
    this.endTimestamp = endTimestamp;
    this.key = key;
    this.result = result;
    this.config = config;
    this.outputStrategy = outputStrategy;
  }

  public boolean hasResult() {
    return result != null;
  }

  /**
   * Layout (big-endian): int config length, config YAML, long start, long end, int key length,
   * key, int result length, result bytes. A group without result has a zero result length.
   *
   * @return serialized byte array containing config, timestamps, key, and ranked values
   */
  @Override
  public byte[] serializeToBytes() {
    byte[] resultBytes = this.result == null ? new byte[0] : this.result.serializeToBytes();
    byte[] configBytes = this.config.serializeToBytes();
    byte[] keyBytes =
        this.key == null ? new byte[0] : this.key.getBytes(StandardCharsets.UTF_8);

    ByteBuffer buffer =
        ByteBuffer.allocate(
            Integer.BYTES
                + configBytes.length
                + Long.BYTES
                + Long.BYTES
                + Integer.BYTES
                + keyBytes.length
                + Integer.BYTES
                + resultBytes.length);
    buffer.putInt(configBytes.length);
    buffer.put(configBytes);
    buffer.putLong(this.startTimestamp);
    buffer.putLong(this.endTimestamp);
    buffer.putInt(keyBytes.length);
    buffer.put(keyBytes);
    buffer.putInt(resultBytes.length);
    buffer.put(resultBytes);
    return buffer.array();
  }

  /**
   * Serializes the window output to JSON.
   *
   * @return JsonNode with the metadata and the fields selected by the output mode
   */
  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.set("config", this.config.serializeToJson());
    jsonNode.put("start_timestamp", this.startTimestamp);
    jsonNode.put("end_timestamp", this.endTimestamp);
    jsonNode.put("key", this.key);
    jsonNode.put("output_mode", this.outputStrategy.getOutputMode());
    jsonNode.setAll(
        this.outputStrategy.buildOutput(this.result, this.config.quantiles, objectMapper));

    return jsonNode;
  }

  @Override
  public String toString() {
    return "PrecomputedOutput{"
        + "window=["
        + startTimestamp
        + ", "
        + endTimestamp
        + "), key='"
        + key
        + '\''
        + ", result="
        + result
        + '}';
  }
}
