/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.rank;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import dev.projectasap.quantile.datamodel.SerializableToSink;
import dev.projectasap.quantile.domain.ValueDomain;
import dev.projectasap.quantile.request.QuantileRequest;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * The quantile values of one finalized group, one per requested probability and in request order.
 * Immutable once built.
 *
 * @param <T> value type of the domain
 */
public final class RankedResult<T> implements SerializableToSink {
  private final ValueDomain<T> domain;
  private final QuantileRequest request;
  private final ArrayList<T> values;
  private final int count;
  private final long memoryBytes;

  RankedResult(
      ValueDomain<T> domain,
      QuantileRequest request,
      List<T> values,
      int count,
      long memoryBytes) {
    if (values.size() != request.size()) {
      throw new IllegalArgumentException(
          "Expected " + request.size() + " ranked values, got " + values.size());
    }
    this.domain = domain;
    this.request = request;
    this.values = new ArrayList<>(values);
    this.count = count;
    this.memoryBytes = memoryBytes;
  }

  public QuantileRequest request() {
    return request;
  }

  /**
   * @return the ranked values, aligned with {@link QuantileRequest#probability(int)}
   */
  public List<T> values() {
    return new ArrayList<>(values);
  }

  public T get(int index) {
    return values.get(index);
  }

  /**
   * Returns the single value of a scalar request.
   *
   * @return the ranked value
   * @throws IllegalStateException if the request asked for a list of quantiles
   */
  public T scalarValue() {
    if (!request.isScalar()) {
      throw new IllegalStateException("Result of an array request has no scalar value");
    }
    return values.get(0);
  }

  /** Number of observations the values were ranked over. */
  public int count() {
    return count;
  }

  /** Raw data size of the accumulated values at finalization. */
  public long memoryBytes() {
    return memoryBytes;
  }

  /**
   * Layout (little-endian): int number of values, then each value as written by the domain.
   *
   * @return serialized values
   */
  @Override
  public byte[] serializeToBytes() {
    int totalSize = Integer.BYTES;
    for (T value : values) {
      totalSize += domain.serializedSize(value);
    }

    ByteBuffer buffer = ByteBuffer.allocate(totalSize).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(values.size());
    for (T value : values) {
      domain.write(value, buffer);
    }
    return buffer.array();
  }

  /**
   * @return a single number for scalar requests, an array of numbers otherwise
   */
  @Override
  public JsonNode serializeToJson() {
    if (request.isScalar()) {
      return domain.toJson(values.get(0));
    }
    ObjectMapper objectMapper = new ObjectMapper();
    ArrayNode valuesArray = objectMapper.createArrayNode();
    for (T value : values) {
      valuesArray.add(domain.toJson(value));
    }
    return valuesArray;
  }

  @Override
  public String toString() {
    return "RankedResult{"
        + "domain="
        + domain.name()
        + ", request="
        + request
        + ", values="
        + values
        + ", count="
        + count
        + '}';
  }
}
