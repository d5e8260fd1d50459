/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.datamodel;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Arrays;

/**
 * Represents a single observation row with timestamp, group key, value and the quantile request it
 * is aggregated under. Used as the basic unit of data in the streaming pipeline.
 *
 * <p>A null {@code value} is a missing observation: the row still belongs to its group but is not
 * accumulated.
 */
@JsonPropertyOrder({"timestamp", "key", "value", "quantiles"})
public class DataPoint {
  public Long timestamp;
  public String key;
  public Number value;
  public double[] quantiles;

  /** Default constructor initializing all fields to default values. */
  public DataPoint() {
    this.timestamp = 0L;
    this.key = "";
    this.value = null;
    this.quantiles = new double[0];
  }

  /**
   * Constructs a DataPoint with specified values.
   *
   * @param timestamp the event timestamp
   * @param key the group key
   * @param value the observed value, null if missing
   * @param quantiles the requested quantile probabilities
   */
  public DataPoint(Long timestamp, String key, Number value, double[] quantiles) {
    this.timestamp = timestamp;
    this.key = key;
    this.value = value;
    this.quantiles = quantiles;
  }

  @Override
  public String toString() {
    return "DataPoint{"
        + "timestamp="
        + timestamp
        + ", key='"
        + key
        + '\''
        + ", value="
        + value
        + ", quantiles="
        + Arrays.toString(quantiles)
        + '}';
  }
}
