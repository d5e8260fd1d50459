/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.functions;

import dev.projectasap.quantile.accumulator.GrowableBuffer;
import dev.projectasap.quantile.datamodel.DataPoint;
import dev.projectasap.quantile.domain.ValueDomain;
import dev.projectasap.quantile.rank.RankedResult;
import dev.projectasap.quantile.request.QuantileRequest;
import dev.projectasap.quantile.session.AggregationSession;
import dev.projectasap.quantile.session.GroupState;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Aggregate function computing exact nearest-rank quantiles. Stores all values of a group and
 * ranks them when the window fires. Every group of a keyed window gets its own accumulator.
 *
 * <p>The aggregation subtype selects the result shape: {@code scalar} yields one value per group,
 * {@code array} one value per requested probability. The optional {@code slabSize} parameter sets
 * the accumulator growth increment.
 *
 * @param <T> value type of the domain
 */
public abstract class ExactQuantile<T>
    implements AggregateFunction<DataPoint, GroupState<T>, Optional<RankedResult<T>>> {
  private final String aggregationSubType;
  private final AggregationSession<T> session;

  protected ExactQuantile(
      ValueDomain<T> domain, String aggregationSubType, Map<String, String> parameters) {
    this.aggregationSubType = aggregationSubType;
    this.session =
        new AggregationSession<>(domain, parseShape(aggregationSubType), slabSize(parameters));
  }

  /**
   * Maps an aggregation subtype to the request shape it produces.
   *
   * @param aggregationSubType {@code scalar} or {@code array}, case-insensitive
   * @return the request shape
   * @throws IllegalArgumentException for any other subtype
   */
  public static QuantileRequest.Shape parseShape(String aggregationSubType) {
    if (aggregationSubType == null) {
      throw new IllegalArgumentException("aggregationSubType is required: scalar or array");
    }
    switch (aggregationSubType.toLowerCase(Locale.ROOT)) {
      case "scalar":
        return QuantileRequest.Shape.SCALAR;
      case "array":
        return QuantileRequest.Shape.ARRAY;
      default:
        throw new IllegalArgumentException(
            "Unknown aggregationSubType '" + aggregationSubType + "', expected scalar or array");
    }
  }

  private static int slabSize(Map<String, String> parameters) {
    // slabSize is optional (defaults to GrowableBuffer.DEFAULT_SLAB_SIZE)
    if (parameters == null || !parameters.containsKey("slabSize")) {
      return GrowableBuffer.DEFAULT_SLAB_SIZE;
    }
    int slabSize = Integer.parseInt(parameters.get("slabSize").trim());
    if (slabSize <= 0) {
      throw new IllegalArgumentException("slabSize parameter must be positive, got " + slabSize);
    }
    return slabSize;
  }

  @Override
  public GroupState<T> createAccumulator() {
    return GroupState.uninitialized();
  }

  @Override
  public GroupState<T> add(DataPoint value, GroupState<T> acc) {
    T observation = value.value == null ? null : session.domain().fromNumber(value.value);
    return session.append(acc, observation, value.quantiles);
  }

  @Override
  public GroupState<T> merge(GroupState<T> a, GroupState<T> b) {
    return session.merge(a, b);
  }

  @Override
  public Optional<RankedResult<T>> getResult(GroupState<T> acc) {
    return session.finalizeGroup(acc);
  }

  public String getAggregationSubType() {
    return aggregationSubType;
  }

  public AggregationSession<T> getSession() {
    return session;
  }
}
