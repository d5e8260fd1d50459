/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.quantile.accumulator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Append-only value buffer that grows by a fixed slab of slots whenever it fills up. Growth is
 * additive, so a buffer holding {@code n} values has been reallocated {@code n / slabSize} times.
 *
 * @param <T> element type
 */
public class GrowableBuffer<T> {
  public static final int DEFAULT_SLAB_SIZE = 1024;

  private final int slabSize;
  private Object[] elements;
  private int count;

  public GrowableBuffer() {
    this(DEFAULT_SLAB_SIZE);
  }

  /**
   * Creates a buffer with one slab of capacity.
   *
   * @param slabSize initial capacity and growth increment, must be positive
   */
  public GrowableBuffer(int slabSize) {
    checkArgument(slabSize > 0, "slabSize must be positive, got %s", slabSize);
    this.slabSize = slabSize;
    this.elements = new Object[slabSize];
    this.count = 0;
  }

  /**
   * Appends a value, first growing the backing array by one slab if it is full.
   *
   * @param value the value to store, never null
   */
  public void append(T value) {
    checkNotNull(value, "buffer does not store missing values");
    if (count == elements.length) {
      elements = Arrays.copyOf(elements, elements.length + slabSize);
    }
    elements[count++] = value;
  }

  /**
   * Appends all valid entries of another buffer, growing by as many whole slabs as needed.
   *
   * @param other the buffer to copy from
   */
  public void appendAll(GrowableBuffer<? extends T> other) {
    int required = count + other.count;
    if (required > elements.length) {
      int missing = required - elements.length;
      int slabs = (missing + slabSize - 1) / slabSize;
      elements = Arrays.copyOf(elements, elements.length + slabs * slabSize);
    }
    System.arraycopy(other.elements, 0, elements, count, other.count);
    count = required;
  }

  @SuppressWarnings("unchecked")
  public T get(int index) {
    if (index < 0 || index >= count) {
      throw new IndexOutOfBoundsException("index " + index + " outside [0, " + count + ")");
    }
    return (T) elements[index];
  }

  /** Sorts the valid entries in place. */
  @SuppressWarnings("unchecked")
  public void sort(Comparator<? super T> comparator) {
    Arrays.sort((T[]) elements, 0, count, comparator);
  }

  public int count() {
    return count;
  }

  public int capacity() {
    return elements.length;
  }

  public int slabSize() {
    return slabSize;
  }
}
