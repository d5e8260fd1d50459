/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.functions;

import dev.projectasap.quantile.domain.ValueDomains;
import java.util.Map;

/** Exact quantile aggregate over 64-bit integer values. */
public class Int64Quantile extends ExactQuantile<Long> {

  public Int64Quantile(String aggregationSubType, Map<String, String> parameters) {
    super(ValueDomains.INT64, aggregationSubType, parameters);
  }
}
