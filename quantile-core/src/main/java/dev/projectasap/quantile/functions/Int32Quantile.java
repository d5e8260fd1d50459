/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.functions;

import dev.projectasap.quantile.domain.ValueDomains;
import java.util.Map;

/**
 * Exact quantile aggregate over 32-bit integer values. Rows with fractional or out-of-range values
 * fail the aggregation.
 */
public class Int32Quantile extends ExactQuantile<Integer> {

  public Int32Quantile(String aggregationSubType, Map<String, String> parameters) {
    super(ValueDomains.INT32, aggregationSubType, parameters);
  }
}
