/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.rank;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.expectThrows;

import dev.projectasap.quantile.domain.ValueDomains;
import dev.projectasap.quantile.request.QuantileRequest;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import org.testng.annotations.Test;

public class TestRankedResult {

  @Test
  public void testScalarJson() {
    RankedResult<Double> result =
        new RankedResult<>(
            ValueDomains.FLOAT8, QuantileRequest.scalar(0.5), Arrays.asList(2.5), 3, 24);
    assertEquals(result.serializeToJson().toString(), "2.5");
    assertEquals(result.serializeToString(), "2.5");
  }

  @Test
  public void testArrayJson() {
    RankedResult<Long> result =
        new RankedResult<>(
            ValueDomains.INT64, QuantileRequest.of(0.1, 0.9), Arrays.asList(1L, 9L), 10, 80);
    assertEquals(result.serializeToJson().toString(), "[1,9]");
    expectThrows(IllegalStateException.class, result::scalarValue);
  }

  @Test
  public void testBytes() {
    RankedResult<Integer> result =
        new RankedResult<>(
            ValueDomains.INT32, QuantileRequest.of(0.1, 0.9), Arrays.asList(-4, 12), 5, 20);
    ByteBuffer buffer = ByteBuffer.wrap(result.serializeToBytes()).order(ByteOrder.LITTLE_ENDIAN);
    assertEquals(buffer.getInt(), 2);
    assertEquals(buffer.getInt(), -4);
    assertEquals(buffer.getInt(), 12);
    assertEquals(buffer.remaining(), 0);
  }

  @Test
  public void testValuesMustMatchRequest() {
    expectThrows(
        IllegalArgumentException.class,
        () ->
            new RankedResult<>(
                ValueDomains.INT32, QuantileRequest.of(0.1, 0.9), Arrays.asList(1), 1, 4));
  }
}
