/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.sinks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.projectasap.quantile.datamodel.PrecomputedOutput;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.flink.api.common.serialization.Encoder;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.configuration.MemorySize;
import org.apache.flink.connector.file.sink.FileSink;
import org.apache.flink.core.fs.Path;
import org.apache.flink.streaming.api.functions.sink.filesystem.rollingpolicies.DefaultRollingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builder for the file sink the job writes window outputs to, as JSON lines or raw bytes. */
public class SinkBuilder {
  private static final Logger logger = LoggerFactory.getLogger(SinkBuilder.class);

  /**
   * Builds a row-format file sink.
   *
   * @param outputPath directory the part files are written to
   * @param outputFormat {@code json} or {@code byte}
   * @return the configured Flink sink
   */
  public static Sink<PrecomputedOutput> buildSink(String outputPath, String outputFormat) {
    logger.info("Building sink with output format: {}", outputFormat);
    logger.info("Using file sink with path: {}", outputPath);

    return FileSink.forRowFormat(new Path(outputPath), new OutputEncoder(outputFormat))
        .withRollingPolicy(
            DefaultRollingPolicy.builder()
                .withRolloverInterval(Duration.ofMinutes(15))
                .withInactivityInterval(Duration.ofMinutes(1))
                .withMaxPartSize(MemorySize.ofMebiBytes(1024))
                .build())
        .build();
  }

  /** Writes one output per record: its byte layout, or its JSON followed by a newline. */
  static class OutputEncoder implements Encoder<PrecomputedOutput> {
    private static final long serialVersionUID = 1L;

    private final String outputFormat;

    OutputEncoder(String outputFormat) {
      if (!"byte".equals(outputFormat) && !"json".equals(outputFormat)) {
        throw new IllegalArgumentException("Invalid output format: " + outputFormat);
      }
      this.outputFormat = outputFormat;
    }

    @Override
    public void encode(PrecomputedOutput data, OutputStream stream) throws IOException {
      if (outputFormat.equals("byte")) {
        stream.write(data.serializeToBytes());
        return;
      }
      try {
        stream.write(new ObjectMapper().writeValueAsBytes(data.serializeToJson()));
        stream.write("\n".getBytes(StandardCharsets.UTF_8));
      } catch (JsonProcessingException e) {
        logger.error("Error serializing window output to JSON", e);
        throw new IOException("Error serializing to JSON", e);
      }
    }
  }
}
