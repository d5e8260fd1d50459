/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.windowfunctions;

import dev.projectasap.quantile.datamodel.PrecomputedOutput;
import dev.projectasap.quantile.rank.RankedResult;
import dev.projectasap.quantile.utils.AggregationConfig;
import dev.projectasap.quantile.utils.OutputStrategy;
import java.util.Optional;
import org.apache.flink.streaming.api.functions.windowing.ProcessWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process function that adds window metadata to the finalized quantiles of a group. Attaches
 * window start/end times, the group key and configuration to create PrecomputedOutput objects.
 * Groups without observations still produce an output, with no ranked values.
 *
 * @param <T> value type of the aggregated domain
 */
public class KeyedWindowProcessor<T>
    extends ProcessWindowFunction<
        Optional<RankedResult<T>>, PrecomputedOutput, String, TimeWindow> {
  private static final Logger logger = LoggerFactory.getLogger(KeyedWindowProcessor.class);

  private final AggregationConfig config;
  private final OutputStrategy outputStrategy;

  public KeyedWindowProcessor(AggregationConfig config, OutputStrategy outputStrategy) {
    this.config = config;
    this.outputStrategy = outputStrategy;
  }

  @Override
  public void process(
      String key,
      Context context,
      Iterable<Optional<RankedResult<T>>> elements,
      Collector<PrecomputedOutput> out) {
    Optional<RankedResult<T>> result = elements.iterator().next();
    long start = context.window().getStart();
    long end = context.window().getEnd();

    if (!result.isPresent()) {
      logger.debug(
          "Aggregation {}: no observations for key {} in window [{}, {})",
          config.aggregationId,
          key,
          start,
          end);
    }

    out.collect(
        new PrecomputedOutput(start, end, key, result.orElse(null), config, outputStrategy));
  }
}
