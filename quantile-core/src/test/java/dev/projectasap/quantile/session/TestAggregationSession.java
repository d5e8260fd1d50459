/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.session;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.expectThrows;

import dev.projectasap.quantile.domain.ValueDomains;
import dev.projectasap.quantile.rank.RankedResult;
import dev.projectasap.quantile.request.QuantileRequest;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.testng.annotations.Test;

public class TestAggregationSession {
  private static final double[] MEDIAN = {0.5};

  private final AggregationSession<Long> scalarSession =
      new AggregationSession<>(ValueDomains.INT64, QuantileRequest.Shape.SCALAR, 1024);
  private final AggregationSession<Long> arraySession =
      new AggregationSession<>(ValueDomains.INT64, QuantileRequest.Shape.ARRAY, 1024);

  private static GroupState<Long> feed(
      AggregationSession<Long> session, double[] spec, Long... values) {
    GroupState<Long> state = null;
    for (Long value : values) {
      state = session.append(state, value, spec);
    }
    return state;
  }

  @Test
  public void testLazyInitialization() {
    GroupState<Long> state = GroupState.uninitialized();
    assertEquals(state.phase(), GroupState.Phase.UNINITIALIZED);
    assertFalse(state.accumulator().isPresent());

    state = scalarSession.append(state, 5L, MEDIAN);
    assertEquals(state.phase(), GroupState.Phase.ACCUMULATING);
    assertEquals(state.accumulator().get().capacity(), 1024);
  }

  @Test
  public void testSlabSizeSetsGrowthStep() {
    AggregationSession<Long> session =
        new AggregationSession<>(ValueDomains.INT64, QuantileRequest.Shape.ARRAY, 16);
    GroupState<Long> state = null;
    for (long i = 0; i < 16; i++) {
      state = session.append(state, i, MEDIAN);
    }
    assertEquals(state.accumulator().get().capacity(), 16);

    state = session.append(state, 16L, MEDIAN);
    assertEquals(state.accumulator().get().capacity(), 32);
    assertEquals(state.accumulator().get().get_count(), 17);
  }

  @Test
  public void testNaNProbabilityInFirstRowFails() {
    expectThrows(
        IllegalArgumentException.class,
        () -> arraySession.append(null, 1L, new double[] {0.5, Double.NaN}));
  }

  @Test
  public void testMissingValuesDoNotChangeResult() {
    double[] spec = {0.0, 0.5, 1.0};
    GroupState<Long> withMissing = feed(arraySession, spec, 3L, null, 1L, null, 2L);
    GroupState<Long> withoutMissing = feed(arraySession, spec, 3L, 1L, 2L);

    RankedResult<Long> expected = arraySession.finalizeGroup(withoutMissing).get();
    RankedResult<Long> actual = arraySession.finalizeGroup(withMissing).get();
    assertEquals(actual.values(), expected.values());
    assertEquals(actual.values(), Arrays.asList(1L, 2L, 3L));
    assertEquals(actual.count(), 3);
  }

  @Test
  public void testOnlyMissingValuesHasNoResult() {
    GroupState<Long> state = feed(scalarSession, MEDIAN, null, null);
    assertEquals(state.phase(), GroupState.Phase.ACCUMULATING);
    assertFalse(scalarSession.finalizeGroup(state).isPresent());
  }

  @Test
  public void testUntouchedGroupHasNoResult() {
    assertFalse(scalarSession.finalizeGroup(null).isPresent());
    GroupState<Long> state = GroupState.uninitialized();
    assertFalse(scalarSession.finalizeGroup(state).isPresent());
    assertEquals(state.phase(), GroupState.Phase.FINALIZED);
  }

  @Test
  public void testRequestIsReadFromFirstRowOnly() {
    GroupState<Long> state = arraySession.append(null, 10L, new double[] {0.0});
    state = arraySession.append(state, 20L, new double[] {1.0});
    state = arraySession.append(state, 30L, new double[] {1.0, 0.5});
    // malformed specs on later rows are never parsed
    state = arraySession.append(state, 40L, null);

    RankedResult<Long> result = arraySession.finalizeGroup(state).get();
    assertEquals(result.request(), QuantileRequest.of(0.0));
    assertEquals(result.values(), Collections.singletonList(10L));
  }

  @Test
  public void testMalformedFirstRequestFails() {
    expectThrows(
        IllegalArgumentException.class,
        () -> scalarSession.append(null, 1L, new double[] {0.25, 0.75}));
    expectThrows(
        IllegalArgumentException.class,
        () -> arraySession.append(null, 1L, new double[] {Double.NaN}));
  }

  @Test
  public void testEmptyArrayRequest() {
    GroupState<Long> state = feed(arraySession, new double[0], 1L, 2L);
    assertEquals(arraySession.finalizeGroup(state).get().values(), Collections.emptyList());
  }

  @Test
  public void testFinalizeTwiceReturnsSameResult() {
    GroupState<Long> state = feed(scalarSession, MEDIAN, 4L, 2L, 8L);
    Optional<RankedResult<Long>> first = scalarSession.finalizeGroup(state);
    Optional<RankedResult<Long>> second = scalarSession.finalizeGroup(state);
    assertSame(second.get(), first.get());
    assertEquals(first.get().scalarValue(), Long.valueOf(4));
  }

  @Test
  public void testAppendAfterFinalizeFails() {
    GroupState<Long> state = feed(scalarSession, MEDIAN, 1L);
    scalarSession.finalizeGroup(state);
    expectThrows(IllegalStateException.class, () -> scalarSession.append(state, 2L, MEDIAN));
  }

  @Test
  public void testArrivalOrderDoesNotMatter() {
    double[] spec = {0.1, 0.33, 0.5, 0.9};
    Long[] values = new Long[500];
    for (int i = 0; i < values.length; i++) {
      values[i] = (long) (i * 7 % 131);
    }
    List<Long> expected =
        arraySession.finalizeGroup(feed(arraySession, spec, values)).get().values();

    Random random = new Random(99);
    List<Long> shuffled = Arrays.asList(values.clone());
    for (int round = 0; round < 5; round++) {
      Collections.shuffle(shuffled, random);
      GroupState<Long> state = feed(arraySession, spec, shuffled.toArray(new Long[0]));
      assertEquals(arraySession.finalizeGroup(state).get().values(), expected);
    }
  }

  @Test
  public void testMerge() {
    GroupState<Long> a = feed(arraySession, new double[] {0.0, 1.0}, 5L, 1L);
    GroupState<Long> b = feed(arraySession, new double[] {0.5}, 9L, 3L, 7L);

    GroupState<Long> merged = arraySession.merge(a, b);
    RankedResult<Long> result = arraySession.finalizeGroup(merged).get();
    assertEquals(result.values(), Arrays.asList(1L, 9L));
    assertEquals(result.count(), 5);
  }

  @Test
  public void testMergeWithUntouchedGroup() {
    GroupState<Long> a = feed(scalarSession, MEDIAN, 5L);
    GroupState<Long> empty = GroupState.uninitialized();
    assertSame(scalarSession.merge(a, empty), a);
    assertSame(scalarSession.merge(empty, a), a);
  }

  @Test
  public void testMergeFinalizedGroupFails() {
    GroupState<Long> a = feed(scalarSession, MEDIAN, 5L);
    GroupState<Long> b = feed(scalarSession, MEDIAN, 6L);
    scalarSession.finalizeGroup(b);
    expectThrows(IllegalStateException.class, () -> scalarSession.merge(a, b));
  }

  @Test
  public void testInvalidSlabSize() {
    expectThrows(
        IllegalArgumentException.class,
        () -> new AggregationSession<>(ValueDomains.INT64, QuantileRequest.Shape.SCALAR, 0));
  }
}
