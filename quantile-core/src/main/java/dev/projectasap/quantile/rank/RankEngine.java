/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.rank;

import dev.projectasap.quantile.accumulator.QuantileAccumulator;
import dev.projectasap.quantile.request.QuantileRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes nearest-rank quantiles over a finished accumulator. The selected value is always an
 * observed one: the rank is rounded up and never interpolated.
 */
public final class RankEngine {

  private RankEngine() {}

  /**
   * Zero-based nearest-rank index for a probability over {@code count} sorted values.
   *
   * <ul>
   *   <li>{@code p <= 0}: 0 (the minimum)
   *   <li>{@code p >= 1}: {@code count - 1} (the maximum)
   *   <li>otherwise: {@code ceil(count * p) - 1}
   * </ul>
   *
   * @param count number of values, must be positive
   * @param p the quantile probability
   * @return index into the ascending-sorted values
   */
  public static int nearestRankIndex(int count, double p) {
    if (count <= 0) {
      throw new IllegalArgumentException("Nearest rank is undefined over " + count + " values");
    }
    if (p <= 0) {
      return 0;
    }
    if (p >= 1) {
      return count - 1;
    }
    return (int) Math.ceil(count * p) - 1;
  }

  /**
   * Sorts the accumulator in place and picks the value at the nearest rank of every requested
   * probability. The accumulator must not be appended to afterwards.
   *
   * @param accumulator the group's accumulator
   * @param <T> value type of the domain
   * @return the ranked values, or empty if the accumulator holds no values
   */
  public static <T> Optional<RankedResult<T>> finalizeRanks(QuantileAccumulator<T> accumulator) {
    int count = accumulator.get_count();
    if (count == 0) {
      return Optional.empty();
    }

    accumulator.sortInPlace();

    QuantileRequest request = accumulator.request();
    List<T> ranked = new ArrayList<>(request.size());
    for (int i = 0; i < request.size(); i++) {
      ranked.add(accumulator.get(nearestRankIndex(count, request.probability(i))));
    }

    return Optional.of(
        new RankedResult<>(
            accumulator.domain(), request, ranked, count, accumulator.get_memory()));
  }
}
