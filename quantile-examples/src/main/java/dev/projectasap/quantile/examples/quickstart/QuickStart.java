/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.examples.quickstart;

import dev.projectasap.quantile.datamodel.DataPoint;
import dev.projectasap.quantile.datamodel.PrecomputedOutput;
import dev.projectasap.quantile.functions.Float8Quantile;
import dev.projectasap.quantile.request.QuantileRequest;
import dev.projectasap.quantile.utils.AggregationConfig;
import dev.projectasap.quantile.utils.OutputStrategy;
import dev.projectasap.quantile.windowfunctions.KeyedWindowProcessor;
import java.util.Collections;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;

/** Quick start example computing exact per-endpoint latency quartiles over 5 second windows. */
public class QuickStart {
  private static final double[] QUARTILES = {0.25, 0.5, 0.75};

  private static DataPoint latency(long timestamp, String endpoint, Double millis) {
    return new DataPoint(timestamp, endpoint, millis, QUARTILES);
  }

  public static void main(String[] args) throws Exception {
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    env.setParallelism(1);

    // null marks a request whose latency was not recorded
    DataStream<DataPoint> dataStream =
        env.fromElements(
            latency(1000L, "/search", 12.5),
            latency(1200L, "/login", 48.0),
            latency(1500L, "/search", 9.75),
            latency(2100L, "/search", null),
            latency(2300L, "/login", 51.25),
            latency(2800L, "/search", 30.0),
            latency(3100L, "/login", null),
            latency(3400L, "/search", 15.0),
            latency(4200L, "/login", 47.5),
            latency(4900L, "/search", 11.0));

    dataStream =
        dataStream.assignTimestampsAndWatermarks(
            WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                .withTimestampAssigner((event, timestamp) -> event.timestamp));

    AggregationConfig config = new AggregationConfig();
    config.aggregationId = 1;
    config.aggregationType = "Float8Quantile";
    config.aggregationSubType = "array";
    config.quantiles = QuantileRequest.of(QUARTILES);
    config.parameters = Collections.emptyMap();
    config.tumblingWindowSize = 5;

    DataStream<PrecomputedOutput> outputStream =
        dataStream
            .keyBy(point -> point.key)
            .window(TumblingEventTimeWindows.of(Time.seconds(config.tumblingWindowSize)))
            .aggregate(
                new Float8Quantile(config.aggregationSubType, config.parameters),
                new KeyedWindowProcessor<Double>(config, new OutputStrategy("query", true)));

    outputStream
        .map(
            output -> {
              if (!output.hasResult()) {
                return output.key + ": no latencies recorded";
              }
              StringBuilder sb = new StringBuilder(output.key).append(":");
              for (int i = 0; i < config.quantiles.size(); i++) {
                sb.append(
                    String.format(
                        " p%d=%s",
                        Math.round(config.quantiles.probability(i) * 100),
                        output.result.get(i)));
              }
              return sb.append(" (").append(output.result.count()).append(" samples)").toString();
            })
        .print();

    env.execute("Quick Start - Exact Latency Quartiles");
  }
}
