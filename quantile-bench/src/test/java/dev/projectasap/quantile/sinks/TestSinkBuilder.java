/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.sinks;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.projectasap.quantile.datamodel.PrecomputedOutput;
import dev.projectasap.quantile.request.QuantileRequest;
import dev.projectasap.quantile.utils.AggregationConfig;
import dev.projectasap.quantile.utils.OutputStrategy;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import org.testng.annotations.Test;

public class TestSinkBuilder {

  private static PrecomputedOutput output() {
    AggregationConfig config = new AggregationConfig();
    config.aggregationId = 2;
    config.aggregationType = "Float8Quantile";
    config.aggregationSubType = "array";
    config.quantiles = QuantileRequest.of(0.5);
    config.parameters = Collections.emptyMap();
    config.tumblingWindowSize = 10;
    config.setOriginalYaml("{}");
    return new PrecomputedOutput(0L, 10000L, "k", null, config, new OutputStrategy("query", true));
  }

  @Test
  public void testJsonLines() throws Exception {
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    SinkBuilder.OutputEncoder encoder = new SinkBuilder.OutputEncoder("json");
    encoder.encode(output(), stream);
    encoder.encode(output(), stream);

    String[] lines = new String(stream.toByteArray(), StandardCharsets.UTF_8).split("\n");
    assertEquals(lines.length, 2);
    JsonNode json = new ObjectMapper().readTree(lines[0]);
    assertEquals(json.get("key").asText(), "k");
    assertTrue(json.get("query").isNull());
  }

  @Test
  public void testBytes() throws Exception {
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    PrecomputedOutput output = output();
    new SinkBuilder.OutputEncoder("byte").encode(output, stream);
    assertEquals(stream.toByteArray(), output.serializeToBytes());
  }

  @Test
  public void testInvalidFormat() {
    expectThrows(IllegalArgumentException.class, () -> new SinkBuilder.OutputEncoder("csv"));
    expectThrows(IllegalArgumentException.class, () -> SinkBuilder.buildSink("/tmp/out", "csv"));
  }

  @Test
  public void testBuildSink() {
    assertNotNull(SinkBuilder.buildSink("/tmp/quantile-out", "json"));
  }
}
