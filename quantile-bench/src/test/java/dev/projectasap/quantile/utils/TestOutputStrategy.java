/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.utils;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.quantile.datamodel.DataPoint;
import dev.projectasap.quantile.functions.Int32Quantile;
import dev.projectasap.quantile.rank.RankedResult;
import dev.projectasap.quantile.request.QuantileRequest;
import dev.projectasap.quantile.session.GroupState;
import java.util.Collections;
import org.testng.annotations.Test;

public class TestOutputStrategy {
  private static final QuantileRequest REQUEST = QuantileRequest.of(0.5, 1.0);

  private final ObjectMapper mapper = new ObjectMapper();

  private static RankedResult<Integer> rank(int... values) {
    Int32Quantile function = new Int32Quantile("array", Collections.emptyMap());
    GroupState<Integer> acc = function.createAccumulator();
    for (int value : values) {
      acc = function.add(new DataPoint(0L, "k", value, REQUEST.toArray()), acc);
    }
    return function.getResult(acc).get();
  }

  @Test
  public void testParseOutputMode() {
    OutputStrategy.OutputModeFlags flags =
        new OutputStrategy("memory_query", true).parseOutputMode();
    assertTrue(flags.includeQuery);
    assertTrue(flags.includeMemory);
    assertFalse(flags.includeRequest);

    flags = new OutputStrategy("request", true).parseOutputMode();
    assertFalse(flags.includeQuery);
    assertTrue(flags.includeRequest);
  }

  @Test
  public void testUnknownFlag() {
    expectThrows(IllegalArgumentException.class, () -> new OutputStrategy("query_sketch", true));
  }

  @Test
  public void testQueryAndMemory() {
    ObjectNode output =
        new OutputStrategy("query_memory_request", true)
            .buildOutput(rank(4, 8, 6), REQUEST, mapper);
    assertEquals(output.get("query").toString(), "[6,8]");
    assertEquals(output.get("memory_bytes").asLong(), 12L);
    assertEquals(output.get("count").asInt(), 3);
    assertEquals(output.get("request").toString(), "[0.5,1.0]");
  }

  @Test
  public void testMissingResult() {
    ObjectNode output = new OutputStrategy("query_memory", true).buildOutput(null, REQUEST, mapper);
    assertTrue(output.get("query").isNull());
    assertEquals(output.get("count").asInt(), 0);
    assertEquals(output.get("memory_bytes").asLong(), 0L);
  }

  @Test
  public void testQuietWhenNotVerbose() {
    ObjectNode output =
        new OutputStrategy("query_memory", false).buildOutput(rank(1), REQUEST, mapper);
    assertEquals(output.size(), 0);
  }
}
