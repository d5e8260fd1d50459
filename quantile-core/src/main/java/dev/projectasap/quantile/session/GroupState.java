/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.session;

import dev.projectasap.quantile.accumulator.QuantileAccumulator;
import dev.projectasap.quantile.rank.RankedResult;
import java.util.Optional;

/**
 * Opaque per-group handle passed between append calls. Owns the group's accumulator and, once
 * finalized, its result. Instances are only mutated through {@link AggregationSession}.
 *
 * @param <T> value type of the domain
 */
public final class GroupState<T> {

  /** Lifecycle of a group. */
  public enum Phase {
    UNINITIALIZED,
    ACCUMULATING,
    FINALIZED
  }

  private Phase phase;
  private QuantileAccumulator<T> accumulator;
  private RankedResult<T> result;

  private GroupState() {
    this.phase = Phase.UNINITIALIZED;
  }

  /**
   * @return a fresh handle for a group that has not seen any row yet
   */
  public static <T> GroupState<T> uninitialized() {
    return new GroupState<>();
  }

  public Phase phase() {
    return phase;
  }

  /**
   * @return the group's accumulator, empty before the first row
   */
  Optional<QuantileAccumulator<T>> accumulator() {
    return Optional.ofNullable(accumulator);
  }

  void start(QuantileAccumulator<T> accumulator) {
    this.accumulator = accumulator;
    this.phase = Phase.ACCUMULATING;
  }

  void finish(RankedResult<T> result) {
    this.result = result;
    this.phase = Phase.FINALIZED;
  }

  RankedResult<T> result() {
    return result;
  }

  @Override
  public String toString() {
    return "GroupState{"
        + "phase="
        + phase
        + ", count="
        + (accumulator == null ? 0 : accumulator.get_count())
        + '}';
  }
}
