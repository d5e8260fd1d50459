/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;
import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable, ordered list of requested quantile probabilities. Probabilities are kept verbatim:
 * they are not clamped, sorted or de-duplicated, and results are aligned with the order given
 * here. Values outside [0, 1] are legal and map to the minimum or maximum at ranking time.
 */
public final class QuantileRequest implements Serializable {
  private static final long serialVersionUID = 1L;

  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

  /** Whether the caller asked for a single value or for a list of values. */
  public enum Shape {
    SCALAR,
    ARRAY
  }

  private final Shape shape;
  private final double[] probabilities;

  private QuantileRequest(Shape shape, double[] probabilities) {
    for (double p : probabilities) {
      if (Double.isNaN(p)) {
        throw new IllegalArgumentException("Quantile probability must not be NaN");
      }
    }
    this.shape = shape;
    this.probabilities = probabilities;
  }

  /**
   * Creates a request for a single quantile.
   *
   * @param probability the quantile probability
   * @return a scalar request
   */
  public static QuantileRequest scalar(double probability) {
    return new QuantileRequest(Shape.SCALAR, new double[] {probability});
  }

  /**
   * Creates a request for several quantiles, preserving order.
   *
   * @param probabilities the quantile probabilities, possibly empty
   * @return an array request
   */
  public static QuantileRequest of(double... probabilities) {
    return new QuantileRequest(Shape.ARRAY, probabilities.clone());
  }

  /**
   * Parses a request spec as carried on host rows.
   *
   * @param spec the probabilities supplied with the row
   * @param shape the shape the calling aggregate expects
   * @return the parsed request
   * @throws IllegalArgumentException if the spec is missing, or a scalar shape is given anything
   *     but exactly one probability
   */
  public static QuantileRequest parse(double[] spec, Shape shape) {
    if (spec == null) {
      throw new IllegalArgumentException("Quantile request spec is missing");
    }
    if (shape == Shape.SCALAR) {
      if (spec.length != 1) {
        throw new IllegalArgumentException(
            "Scalar quantile expects a single probability, got " + spec.length);
      }
      return scalar(spec[0]);
    }
    return of(spec);
  }

  /**
   * Parses a request from JSON (or YAML). A number yields a scalar request; a flat array of
   * numbers yields an array request.
   *
   * @param node a numeric node or a single-dimensional array of numeric nodes
   * @return the parsed request
   * @throws IllegalArgumentException for nested arrays, non-numeric elements or other node types
   */
  public static QuantileRequest fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      throw new IllegalArgumentException("Quantile request spec is missing");
    }
    if (node.isNumber()) {
      return scalar(node.doubleValue());
    }
    if (!node.isArray()) {
      throw new IllegalArgumentException("Quantile request must be a number or an array: " + node);
    }
    double[] probabilities = new double[node.size()];
    for (int i = 0; i < node.size(); i++) {
      JsonNode element = node.get(i);
      if (element.isArray()) {
        throw new IllegalArgumentException(
            "Quantile request expects a single-dimensional array: " + node);
      }
      if (!element.isNumber()) {
        throw new IllegalArgumentException("Quantile probability is not a number: " + element);
      }
      probabilities[i] = element.doubleValue();
    }
    return new QuantileRequest(Shape.ARRAY, probabilities);
  }

  /**
   * Parses comma-separated probabilities, e.g. {@code "0.5, 0.9, 0.99"}, as an array request.
   *
   * @param text the comma-separated list
   * @return the parsed request
   * @throws IllegalArgumentException if an element is not a number
   */
  public static QuantileRequest fromText(String text) {
    List<String> parts = COMMA.splitToList(text);
    double[] probabilities = new double[parts.size()];
    for (int i = 0; i < parts.size(); i++) {
      Double parsed = Doubles.tryParse(parts.get(i));
      if (parsed == null) {
        throw new IllegalArgumentException("Quantile probability is not a number: " + parts.get(i));
      }
      probabilities[i] = parsed;
    }
    return new QuantileRequest(Shape.ARRAY, probabilities);
  }

  public Shape shape() {
    return shape;
  }

  public boolean isScalar() {
    return shape == Shape.SCALAR;
  }

  public int size() {
    return probabilities.length;
  }

  public double probability(int index) {
    return probabilities[index];
  }

  /**
   * @return a copy of the probabilities, suitable for attaching to host rows
   */
  public double[] toArray() {
    return probabilities.clone();
  }

  public List<Double> asList() {
    return Doubles.asList(probabilities.clone());
  }

  /**
   * @return a number node for scalar requests, an array node otherwise
   */
  public JsonNode toJson() {
    if (isScalar()) {
      return JsonNodeFactory.instance.numberNode(probabilities[0]);
    }
    ArrayNode array = JsonNodeFactory.instance.arrayNode();
    for (double p : probabilities) {
      array.add(p);
    }
    return array;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QuantileRequest)) {
      return false;
    }
    QuantileRequest that = (QuantileRequest) o;
    return shape == that.shape && Arrays.equals(probabilities, that.probabilities);
  }

  @Override
  public int hashCode() {
    return 31 * shape.hashCode() + Arrays.hashCode(probabilities);
  }

  @Override
  public String toString() {
    return "QuantileRequest{"
        + "shape="
        + shape
        + ", probabilities=["
        + Doubles.join(", ", probabilities)
        + "]}";
  }
}
