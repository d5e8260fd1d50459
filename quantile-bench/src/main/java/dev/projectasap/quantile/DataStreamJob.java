/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile;

import dev.projectasap.quantile.datamodel.DataPoint;
import dev.projectasap.quantile.datamodel.PrecomputedOutput;
import dev.projectasap.quantile.functions.ExactQuantile;
import dev.projectasap.quantile.request.QuantileRequest;
import dev.projectasap.quantile.sinks.SinkBuilder;
import dev.projectasap.quantile.utils.AggregationConfig;
import dev.projectasap.quantile.utils.ConfigLoader;
import dev.projectasap.quantile.utils.OutputStrategy;
import dev.projectasap.quantile.utils.StreamingConfig;
import dev.projectasap.quantile.windowfunctions.KeyedWindowProcessor;
import java.util.Random;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.connector.datagen.source.DataGeneratorSource;
import org.apache.flink.connector.datagen.source.GeneratorFunction;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.WindowedStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.functions.sink.DiscardingSink;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main Flink job computing exact quantiles per key and tumbling window. Every aggregation of the
 * configuration file becomes one keyed, windowed aggregate over a synthetic data stream.
 */
public class DataStreamJob {
  private static final Logger LOG = LoggerFactory.getLogger(DataStreamJob.class);

  /** Window size standing in for an unbounded window; start plus size must not overflow. */
  static final long UNBOUNDED_WINDOW_MILLIS = Long.MAX_VALUE / 2;

  private static Namespace parseArgs(String[] args) {
    ArgumentParser parser =
        ArgumentParsers.newFor("DataStreamJob")
            .build()
            .defaultHelp(true)
            .description("Exact quantiles over keyed tumbling windows");

    parser.addArgument("--outputFilePath").type(String.class).help("Output file path");

    parser
        .addArgument("--configFilePath")
        .type(String.class)
        .required(true)
        .help("Configuration file path");

    parser
        .addArgument("--outputFormat")
        .type(String.class)
        .choices("byte", "json")
        .help("Output format: byte or json");

    parser
        .addArgument("--logLevel")
        .type(String.class)
        .choices("TRACE", "DEBUG", "INFO", "WARN", "ERROR")
        .setDefault("INFO")
        .help("Sets the logging level (default: INFO)");

    parser
        .addArgument("--datagenKeyCardinality")
        .type(Integer.class)
        .required(true)
        .help("DataGen key cardinality, -1 for a new key per item");

    parser
        .addArgument("--datagenItemsPerWindow")
        .type(Long.class)
        .required(true)
        .help("Number of items to fit in each tumbling window");

    parser
        .addArgument("--verbose")
        .type(Boolean.class)
        .setDefault(false)
        .help("Enable verbose output to sink (default: false)");

    parser
        .addArgument("--outputMode")
        .type(String.class)
        .setDefault("query")
        .help(
            "Output mode: query, memory, request, or combinations separated by underscore"
                + " (e.g., query_memory)");

    parser
        .addArgument("--quantiles")
        .type(String.class)
        .help("Comma-separated probabilities overriding the configured quantiles (e.g., 0.5,0.99)");

    parser
        .addArgument("--parallelism")
        .type(Integer.class)
        .setDefault(1)
        .help("Parallelism for the Flink job (default: 1)");

    parser
        .addArgument("--distribution")
        .type(String.class)
        .choices("uniform", "normal")
        .setDefault("uniform")
        .help("Distribution type for generated values: uniform or normal (default: uniform)");

    parser
        .addArgument("--missingRate")
        .type(Double.class)
        .setDefault(0.0)
        .help("Fraction of generated items without a value (default: 0.0)");

    return parser.parseArgsOrFail(args);
  }

  private static void checkArgs(Namespace parsedArgs) {
    boolean verbose = parsedArgs.getBoolean("verbose");
    if (verbose && parsedArgs.getString("outputFilePath") == null) {
      throw new IllegalArgumentException(
          "Output file path is required when verbose mode is enabled");
    }
    if (verbose && parsedArgs.getString("outputFormat") == null) {
      throw new IllegalArgumentException("Output format is required when verbose mode is enabled");
    }
    double missingRate = parsedArgs.getDouble("missingRate");
    if (missingRate < 0 || missingRate > 1) {
      throw new IllegalArgumentException("missingRate must be within [0, 1], got " + missingRate);
    }
    int keyCardinality = parsedArgs.getInt("datagenKeyCardinality");
    if (keyCardinality == 0 || keyCardinality < -1) {
      throw new IllegalArgumentException(
          "datagenKeyCardinality must be positive or -1, got " + keyCardinality);
    }
    if (parsedArgs.getLong("datagenItemsPerWindow") <= 0) {
      throw new IllegalArgumentException("datagenItemsPerWindow must be positive");
    }
  }

  /**
   * Helper method to generate a DataPoint with timestamp, key, and value. The request spec is
   * attached later, per aggregation.
   *
   * @param index the index of the data point
   * @param itemsPerWindow number of items per tumbling window
   * @param baseTimestamp base timestamp in milliseconds
   * @param millisecondTumblingWindow tumbling window size in milliseconds
   * @param keyCardinality the cardinality of keys, -1 for a distinct key per item
   * @param distribution the distribution type ("normal" or "uniform")
   * @param missingRate probability that the item carries no value
   * @param randomSource the Random source for value generation
   * @return a new DataPoint
   */
  static DataPoint generateDataPoint(
      long index,
      long itemsPerWindow,
      long baseTimestamp,
      long millisecondTumblingWindow,
      int keyCardinality,
      String distribution,
      double missingRate,
      Random randomSource) {
    // N items per tumbling window
    long timestamp = baseTimestamp + (index / itemsPerWindow) * millisecondTumblingWindow;
    String key = keyCardinality == -1 ? "key" + index : "key" + ((index % keyCardinality) + 1);

    int value;
    if ("normal".equals(distribution)) {
      // mean=500,000, stddev=166,667, clamped to 1-1,000,000
      double normalValue = randomSource.nextGaussian() * 166667 + 500000;
      value = (int) Math.max(1, Math.min(1000000, normalValue));
    } else {
      value = randomSource.nextInt(1000000) + 1;
    }

    Integer observed = randomSource.nextDouble() < missingRate ? null : value;
    return new DataPoint(timestamp, key, observed, new double[0]);
  }

  private static DataStream<DataPoint> createDataGenStream(
      StreamExecutionEnvironment env,
      int keyCardinality,
      int numSources,
      long millisecondTumblingWindow,
      long itemsPerWindow,
      String distribution,
      double missingRate) {
    long recordsPerSource = Long.MAX_VALUE;
    long baseTimestamp = 1000000000000L;

    DataStream<DataPoint> inputStream = null;
    for (int i = 0; i < numSources; i++) {
      Random randomSource = new Random(40L + i);
      GeneratorFunction<Long, DataPoint> generatorFunction =
          index ->
              generateDataPoint(
                  index,
                  itemsPerWindow,
                  baseTimestamp,
                  millisecondTumblingWindow,
                  keyCardinality,
                  distribution,
                  missingRate,
                  randomSource);

      DataGeneratorSource<DataPoint> dataGenSource =
          new DataGeneratorSource<>(
              generatorFunction, recordsPerSource, TypeInformation.of(DataPoint.class));

      DataStream<DataPoint> sourceStream =
          env.fromSource(dataGenSource, WatermarkStrategy.noWatermarks(), "Generator Source " + i);
      inputStream = inputStream == null ? sourceStream : inputStream.union(sourceStream);
    }

    return inputStream;
  }

  /**
   * Window size of an aggregation; {@code -1} selects a window that only closes at end of input.
   */
  static Time windowSize(AggregationConfig config) {
    if (config.tumblingWindowSize == -1) {
      return Time.milliseconds(UNBOUNDED_WINDOW_MILLIS);
    }
    if (config.tumblingWindowSize <= 0) {
      throw new IllegalArgumentException(
          "tumblingWindowSize must be positive or -1, got " + config.tumblingWindowSize);
    }
    return Time.seconds(config.tumblingWindowSize);
  }

  /**
   * Builds the aggregation of one configuration over a stream of rows: event-time watermarks,
   * the configured request attached to every row, grouping by key, tumbling windows, and the
   * exact quantile aggregate with window metadata.
   *
   * @param input rows with event timestamps in milliseconds
   * @param config the aggregation to run
   * @param outputStrategy decides the fields of each output
   * @return one output per key and window
   */
  public static DataStream<PrecomputedOutput> buildPipeline(
      DataStream<DataPoint> input, AggregationConfig config, OutputStrategy outputStrategy) {
    double[] requestSpec = config.requestSpec();

    WindowedStream<DataPoint, String, TimeWindow> windowedStream =
        input
            .assignTimestampsAndWatermarks(
                WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                    .withTimestampAssigner((event, timestamp) -> event.timestamp))
            .map(point -> new DataPoint(point.timestamp, point.key, point.value, requestSpec))
            .returns(TypeInformation.of(DataPoint.class))
            .name("Attach request " + config.aggregationId)
            .keyBy(point -> point.key, Types.STRING)
            .window(TumblingEventTimeWindows.of(windowSize(config)));

    return aggregate(windowedStream, config.getAggregationFunction(), config, outputStrategy);
  }

  private static <T> DataStream<PrecomputedOutput> aggregate(
      WindowedStream<DataPoint, String, TimeWindow> windowedStream,
      ExactQuantile<T> function,
      AggregationConfig config,
      OutputStrategy outputStrategy) {
    return windowedStream
        .aggregate(function, new KeyedWindowProcessor<T>(config, outputStrategy))
        .name(config.aggregationType + " " + config.aggregationId);
  }

  /**
   * Replaces the request of every aggregation, keeping each aggregation's shape.
   *
   * @throws IllegalArgumentException if a scalar aggregation is given other than one probability
   */
  static void overrideQuantiles(StreamingConfig streamingConfig, QuantileRequest override) {
    for (AggregationConfig config : streamingConfig.aggregationConfigs) {
      config.quantiles =
          QuantileRequest.parse(
              override.toArray(), ExactQuantile.parseShape(config.aggregationSubType));
    }
  }

  /**
   * Main entry point for the Flink streaming job.
   *
   * @param args command-line arguments for configuration
   * @throws Exception if the job fails to execute
   */
  public static void main(String[] args) throws Exception {
    Namespace parsedArgs = parseArgs(args);

    if (parsedArgs.getString("logLevel") != null) {
      System.setProperty("log.level", parsedArgs.getString("logLevel"));
    }

    LOG.info("Starting with log level: {}", System.getProperty("log.level", "INFO"));

    checkArgs(parsedArgs);

    StreamingConfig streamingConfig =
        ConfigLoader.loadConfig(parsedArgs.getString("configFilePath"));
    if (streamingConfig.aggregationConfigs.isEmpty()) {
      throw new IllegalArgumentException("Configuration defines no aggregations");
    }
    String quantilesOverride = parsedArgs.getString("quantiles");
    if (quantilesOverride != null) {
      overrideQuantiles(streamingConfig, QuantileRequest.fromText(quantilesOverride));
    }

    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    int parallelism = parsedArgs.getInt("parallelism");
    env.setParallelism(parallelism);

    boolean verbose = parsedArgs.getBoolean("verbose");
    OutputStrategy outputStrategy =
        new OutputStrategy(parsedArgs.getString("outputMode"), verbose);

    Sink<PrecomputedOutput> sink = null;
    if (verbose) {
      sink =
          SinkBuilder.buildSink(
              parsedArgs.getString("outputFilePath"), parsedArgs.getString("outputFormat"));
    }

    // the generator spaces timestamps by the first aggregation's window
    AggregationConfig first = streamingConfig.aggregationConfigs.get(0);
    long millisecondTumblingWindow =
        first.tumblingWindowSize == -1 ? 0L : windowSize(first).toMilliseconds();

    DataStream<DataPoint> inputStream =
        createDataGenStream(
            env,
            parsedArgs.getInt("datagenKeyCardinality"),
            parallelism,
            millisecondTumblingWindow,
            parsedArgs.getLong("datagenItemsPerWindow"),
            parsedArgs.getString("distribution"),
            parsedArgs.getDouble("missingRate"));

    for (AggregationConfig config : streamingConfig.aggregationConfigs) {
      LOG.info(
          "Aggregation {}: {} ({}) over {} with window {}",
          config.aggregationId,
          config.aggregationType,
          config.aggregationSubType,
          config.quantiles,
          windowSize(config));

      DataStream<PrecomputedOutput> outputStream =
          buildPipeline(inputStream, config, outputStrategy);

      if (sink != null) {
        outputStream.sinkTo(sink);
      } else {
        outputStream.addSink(new DiscardingSink<>()).name("Discard " + config.aggregationId);
      }
    }

    env.execute("Exact Quantile Precompute");
  }
}
