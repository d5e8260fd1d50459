/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.util.Comparator;

/**
 * A numeric value domain the quantile engine can be instantiated over. Supplies the strict total
 * order used for ranking, plus conversion from host values and per-value serialization.
 *
 * <p>Implementations are stateless and shipped to Flink task managers inside aggregate functions,
 * hence {@link Serializable}.
 *
 * @param <T> the Java type holding values of this domain
 */
public interface ValueDomain<T> extends Comparator<T>, Serializable {

  /**
   * @return the domain name used in logs and result rendering, e.g. {@code float8}
   */
  String name();

  /**
   * Converts a host number into a value of this domain.
   *
   * @param value the host value, never null
   * @return the converted value
   * @throws IllegalArgumentException if the value cannot be represented in this domain
   */
  T fromNumber(Number value);

  /**
   * Renders a value as a JSON node.
   *
   * @param value the value to render
   * @return a numeric JSON node
   */
  JsonNode toJson(T value);

  /**
   * Number of bytes {@link #write(Object, ByteBuffer)} produces for the given value.
   *
   * @param value the value to measure
   * @return serialized size in bytes
   */
  int serializedSize(T value);

  /**
   * Writes a value into the buffer, which is expected to be little-endian.
   *
   * @param value the value to write
   * @param buffer destination buffer with at least {@link #serializedSize(Object)} bytes left
   */
  void write(T value, ByteBuffer buffer);

  /**
   * Raw data size of one value, used for memory reporting. For fixed-width domains this is the
   * width of the primitive.
   *
   * @param value the value to measure
   * @return estimated size in bytes
   */
  long estimatedSize(T value);
}
