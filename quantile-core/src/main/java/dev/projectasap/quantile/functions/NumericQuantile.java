/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.functions;

import dev.projectasap.quantile.domain.ValueDomains;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Exact quantile aggregate over arbitrary-precision decimal values. Values that differ only in
 * scale, such as {@code 1.0} and {@code 1.00}, rank as equal.
 */
public class NumericQuantile extends ExactQuantile<BigDecimal> {

  public NumericQuantile(String aggregationSubType, Map<String, String> parameters) {
    super(ValueDomains.NUMERIC, aggregationSubType, parameters);
  }
}
