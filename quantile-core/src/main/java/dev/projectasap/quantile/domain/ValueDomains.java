/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;

/** The value domains supported by the quantile engine. */
public final class ValueDomains {

  /** 64-bit floating point. */
  public static final ValueDomain<Double> FLOAT8 = new Float8Domain();

  /** 32-bit signed integer. */
  public static final ValueDomain<Integer> INT32 = new Int32Domain();

  /** 64-bit signed integer. */
  public static final ValueDomain<Long> INT64 = new Int64Domain();

  /** Arbitrary-precision decimal. */
  public static final ValueDomain<BigDecimal> NUMERIC = new NumericDomain();

  private ValueDomains() {}

  /** Converts any host number to an exact decimal, rejecting NaN and infinities. */
  static BigDecimal toExactDecimal(Number value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    }
    if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte) {
      return BigDecimal.valueOf(value.longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      double d = value.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Not a finite number: " + value);
      }
      return BigDecimal.valueOf(d);
    }
    return new BigDecimal(value.toString());
  }

  private static final class Float8Domain implements ValueDomain<Double> {
    private static final long serialVersionUID = 1L;

    @Override
    public String name() {
      return "float8";
    }

    @Override
    public Double fromNumber(Number value) {
      return value.doubleValue();
    }

    @Override
    public int compare(Double a, Double b) {
      return Double.compare(a, b);
    }

    @Override
    public JsonNode toJson(Double value) {
      return JsonNodeFactory.instance.numberNode(value);
    }

    @Override
    public int serializedSize(Double value) {
      return Double.BYTES;
    }

    @Override
    public void write(Double value, ByteBuffer buffer) {
      buffer.putDouble(value);
    }

    @Override
    public long estimatedSize(Double value) {
      return Double.BYTES;
    }
  }

  private static final class Int32Domain implements ValueDomain<Integer> {
    private static final long serialVersionUID = 1L;

    @Override
    public String name() {
      return "int32";
    }

    @Override
    public Integer fromNumber(Number value) {
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
        return value.intValue();
      }
      try {
        return toExactDecimal(value).intValueExact();
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("Value out of int32 domain: " + value, e);
      }
    }

    @Override
    public int compare(Integer a, Integer b) {
      return Integer.compare(a, b);
    }

    @Override
    public JsonNode toJson(Integer value) {
      return JsonNodeFactory.instance.numberNode(value);
    }

    @Override
    public int serializedSize(Integer value) {
      return Integer.BYTES;
    }

    @Override
    public void write(Integer value, ByteBuffer buffer) {
      buffer.putInt(value);
    }

    @Override
    public long estimatedSize(Integer value) {
      return Integer.BYTES;
    }
  }

  private static final class Int64Domain implements ValueDomain<Long> {
    private static final long serialVersionUID = 1L;

    @Override
    public String name() {
      return "int64";
    }

    @Override
    public Long fromNumber(Number value) {
      if (value instanceof Long
          || value instanceof Integer
          || value instanceof Short
          || value instanceof Byte) {
        return value.longValue();
      }
      try {
        return toExactDecimal(value).longValueExact();
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("Value out of int64 domain: " + value, e);
      }
    }

    @Override
    public int compare(Long a, Long b) {
      return Long.compare(a, b);
    }

    @Override
    public JsonNode toJson(Long value) {
      return JsonNodeFactory.instance.numberNode(value);
    }

    @Override
    public int serializedSize(Long value) {
      return Long.BYTES;
    }

    @Override
    public void write(Long value, ByteBuffer buffer) {
      buffer.putLong(value);
    }

    @Override
    public long estimatedSize(Long value) {
      return Long.BYTES;
    }
  }

  /** Ordered by {@link BigDecimal#compareTo}, so values differing only in scale rank equal. */
  private static final class NumericDomain implements ValueDomain<BigDecimal> {
    private static final long serialVersionUID = 1L;

    @Override
    public String name() {
      return "numeric";
    }

    @Override
    public BigDecimal fromNumber(Number value) {
      return toExactDecimal(value);
    }

    @Override
    public int compare(BigDecimal a, BigDecimal b) {
      return a.compareTo(b);
    }

    @Override
    public JsonNode toJson(BigDecimal value) {
      return JsonNodeFactory.instance.numberNode(value);
    }

    @Override
    public int serializedSize(BigDecimal value) {
      // scale + length prefix + two's-complement unscaled value
      return Integer.BYTES + Integer.BYTES + value.unscaledValue().toByteArray().length;
    }

    @Override
    public void write(BigDecimal value, ByteBuffer buffer) {
      byte[] unscaled = value.unscaledValue().toByteArray();
      buffer.putInt(value.scale());
      buffer.putInt(unscaled.length);
      buffer.put(unscaled);
    }

    @Override
    public long estimatedSize(BigDecimal value) {
      return Integer.BYTES + value.unscaledValue().bitLength() / Byte.SIZE + 1;
    }
  }
}
