/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.accumulator;

import dev.projectasap.quantile.domain.ValueDomain;
import dev.projectasap.quantile.request.QuantileRequest;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-group accumulator for exact quantile computation. Stores every observed value of one domain
 * together with the quantile request the group was created with.
 *
 * @param <T> value type of the domain
 */
public class QuantileAccumulator<T> {
  private final ValueDomain<T> domain;
  private final QuantileRequest request;
  private final GrowableBuffer<T> values;

  /**
   * Creates an empty accumulator with one slab of capacity.
   *
   * @param domain the value domain
   * @param request the request installed for the group's lifetime
   * @param slabSize initial capacity and growth increment
   */
  public QuantileAccumulator(ValueDomain<T> domain, QuantileRequest request, int slabSize) {
    this.domain = domain;
    this.request = request;
    this.values = new GrowableBuffer<>(slabSize);
  }

  /**
   * Adds one observation. Missing observations are skipped and not counted.
   *
   * @param value the observed value, or null when the row had no value
   */
  public void append(T value) {
    if (value == null) {
      return;
    }
    values.append(value);
  }

  /**
   * Merges another accumulator into a new one holding this accumulator's values followed by the
   * other's. The result keeps this accumulator's request.
   *
   * @param other the accumulator to merge with
   * @return a new merged accumulator
   */
  public QuantileAccumulator<T> merge(QuantileAccumulator<T> other) {
    QuantileAccumulator<T> merged =
        new QuantileAccumulator<>(this.domain, this.request, this.values.slabSize());
    merged.values.appendAll(this.values);
    merged.values.appendAll(other.values);
    return merged;
  }

  /** Sorts the valid entries ascending in the domain's order. The arrival order is lost. */
  public void sortInPlace() {
    values.sort(domain);
  }

  public ValueDomain<T> domain() {
    return domain;
  }

  public QuantileRequest request() {
    return request;
  }

  public T get(int index) {
    return values.get(index);
  }

  public int capacity() {
    return values.capacity();
  }

  /**
   * @return a copy of the valid entries in their current order
   */
  public List<T> values() {
    List<T> copy = new ArrayList<>(values.count());
    for (int i = 0; i < values.count(); i++) {
      copy.add(values.get(i));
    }
    return copy;
  }

  /**
   * Raw data size of the stored values, without object or array overhead.
   *
   * @return memory usage in bytes
   */
  public long get_memory() {
    long size = 0;
    for (int i = 0; i < values.count(); i++) {
      size += domain.estimatedSize(values.get(i));
    }
    return size;
  }

  /**
   * Returns the count of observations stored in this accumulator.
   *
   * @return number of non-missing values appended
   */
  public int get_count() {
    return values.count();
  }
}
