/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.session;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import dev.projectasap.quantile.accumulator.QuantileAccumulator;
import dev.projectasap.quantile.domain.ValueDomain;
import dev.projectasap.quantile.rank.RankEngine;
import dev.projectasap.quantile.rank.RankedResult;
import dev.projectasap.quantile.request.QuantileRequest;
import java.io.Serializable;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the per-group lifecycle of an exact quantile aggregate: the group state is created lazily
 * by the first row, every row appends one observation, and finalization sorts and ranks.
 *
 * <p>A session holds no group data itself; all state lives in the {@link GroupState} handles the
 * host passes back on every call, so one session serves any number of groups.
 *
 * @param <T> value type of the domain
 */
public class AggregationSession<T> implements Serializable {
  private static final long serialVersionUID = 1L;
  private static final Logger LOG = LoggerFactory.getLogger(AggregationSession.class);

  private final ValueDomain<T> domain;
  private final QuantileRequest.Shape shape;
  private final int slabSize;

  /**
   * @param domain the value domain of the observations
   * @param shape whether groups return one value or a list of values
   * @param slabSize initial accumulator capacity and growth increment
   */
  public AggregationSession(ValueDomain<T> domain, QuantileRequest.Shape shape, int slabSize) {
    checkArgument(slabSize > 0, "slabSize must be positive, got %s", slabSize);
    this.domain = domain;
    this.shape = shape;
    this.slabSize = slabSize;
  }

  /**
   * Appends one row to a group. The request spec is parsed only when the call creates the group's
   * accumulator; on later calls it is ignored.
   *
   * @param state the group handle, or null for the group's first row
   * @param observation the observed value, or null when the row has none
   * @param requestSpec the quantile probabilities supplied with the row
   * @return the group handle to pass to the next call
   * @throws IllegalStateException if the group was already finalized
   * @throws IllegalArgumentException if the request spec creating the group is malformed
   */
  public GroupState<T> append(GroupState<T> state, T observation, double[] requestSpec) {
    GroupState<T> group = state == null ? GroupState.uninitialized() : state;
    checkState(group.phase() != GroupState.Phase.FINALIZED, "append called on a finalized group");

    if (group.phase() == GroupState.Phase.UNINITIALIZED) {
      QuantileRequest request = QuantileRequest.parse(requestSpec, shape);
      group.start(new QuantileAccumulator<>(domain, request, slabSize));
    }
    group.accumulator().get().append(observation);
    return group;
  }

  /**
   * Finalizes a group. Groups that never saw a row, or saw only missing observations, have no
   * result. Finalizing again returns the result of the first call.
   *
   * @param state the group handle, may be null
   * @return the ranked values, or empty when the group accumulated nothing
   */
  public Optional<RankedResult<T>> finalizeGroup(GroupState<T> state) {
    if (state == null) {
      return Optional.empty();
    }
    switch (state.phase()) {
      case FINALIZED:
        return Optional.ofNullable(state.result());
      case UNINITIALIZED:
        state.finish(null);
        return Optional.empty();
      default:
        Optional<RankedResult<T>> result = RankEngine.finalizeRanks(state.accumulator().get());
        if (!result.isPresent()) {
          LOG.debug("Finalized {} group without observations", domain.name());
        }
        state.finish(result.orElse(null));
        return result;
    }
  }

  /**
   * Combines two groups that are still accumulating, e.g. when Flink merges windows. The merged
   * group keeps the request of {@code a} unless {@code a} never saw a row.
   *
   * @return a handle holding the observations of both groups
   * @throws IllegalStateException if either group was already finalized
   */
  public GroupState<T> merge(GroupState<T> a, GroupState<T> b) {
    checkState(
        a.phase() != GroupState.Phase.FINALIZED && b.phase() != GroupState.Phase.FINALIZED,
        "cannot merge a finalized group");
    if (a.phase() == GroupState.Phase.UNINITIALIZED) {
      return b;
    }
    if (b.phase() == GroupState.Phase.UNINITIALIZED) {
      return a;
    }
    GroupState<T> merged = GroupState.uninitialized();
    merged.start(a.accumulator().get().merge(b.accumulator().get()));
    return merged;
  }

  public ValueDomain<T> domain() {
    return domain;
  }

  public QuantileRequest.Shape shape() {
    return shape;
  }

  public int slabSize() {
    return slabSize;
  }
}
