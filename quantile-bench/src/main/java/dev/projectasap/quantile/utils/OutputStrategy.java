/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.quantile.rank.RankedResult;
import dev.projectasap.quantile.request.QuantileRequest;
import java.io.Serializable;

/**
 * Decides which fields a window output carries. The output mode is a combination of {@code query}
 * (the ranked values), {@code memory} (accumulated bytes and observation count) and {@code request}
 * (the probabilities asked for), joined by underscores, e.g. {@code query_memory}.
 */
public class OutputStrategy implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String outputMode;
  private final boolean verbose;

  public OutputStrategy(String outputMode, boolean verbose) {
    this.outputMode = outputMode;
    this.verbose = verbose;
    parseOutputMode();
  }

  public String getOutputMode() {
    return outputMode;
  }

  public boolean isVerbose() {
    return verbose;
  }

  /**
   * Parse output mode flags (e.g., "query_memory" -> query and memory).
   *
   * @throws IllegalArgumentException on an unknown flag
   */
  public OutputModeFlags parseOutputMode() {
    boolean includeQuery = false;
    boolean includeMemory = false;
    boolean includeRequest = false;

    for (String flag : this.outputMode.split("_")) {
      switch (flag) {
        case "query":
          includeQuery = true;
          break;
        case "memory":
          includeMemory = true;
          break;
        case "request":
          includeRequest = true;
          break;
        default:
          throw new IllegalArgumentException(
              "Unknown output mode flag '" + flag + "' in " + this.outputMode);
      }
    }

    return new OutputModeFlags(includeQuery, includeMemory, includeRequest);
  }

  /**
   * Build the JSON output based on the output strategy configuration.
   *
   * @param result the group's ranked values, null when the group had no observations
   * @param request the request the group was aggregated under
   * @param objectMapper Jackson ObjectMapper for JSON construction
   * @return ObjectNode with the appropriate output fields
   */
  public ObjectNode buildOutput(
      RankedResult<?> result, QuantileRequest request, ObjectMapper objectMapper) {
    ObjectNode outputNode = objectMapper.createObjectNode();
    if (!this.verbose) {
      return outputNode;
    }
    OutputModeFlags flags = parseOutputMode();

    if (flags.includeQuery) {
      outputNode.set("query", result == null ? null : result.serializeToJson());
    }

    if (flags.includeMemory) {
      outputNode.put("memory_bytes", result == null ? 0L : result.memoryBytes());
      outputNode.put("count", result == null ? 0 : result.count());
    }

    if (flags.includeRequest && request != null) {
      outputNode.set("request", request.toJson());
    }

    return outputNode;
  }

  /** Flags indicating which output components to include. */
  public static class OutputModeFlags {
    public final boolean includeQuery;
    public final boolean includeMemory;
    public final boolean includeRequest;

    public OutputModeFlags(boolean includeQuery, boolean includeMemory, boolean includeRequest) {
      this.includeQuery = includeQuery;
      this.includeMemory = includeMemory;
      this.includeRequest = includeRequest;
    }
  }
}
