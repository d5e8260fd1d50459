/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.functions;

import dev.projectasap.quantile.domain.ValueDomains;
import java.util.Map;

/**
 * Exact quantile aggregate over 64-bit floating point values. Ordering follows {@link
 * Double#compare}, so NaN ranks above every other value.
 */
public class Float8Quantile extends ExactQuantile<Double> {

  public Float8Quantile(String aggregationSubType, Map<String, String> parameters) {
    super(ValueDomains.FLOAT8, aggregationSubType, parameters);
  }
}
