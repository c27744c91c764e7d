/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.monitor.series;

import com.linkedin.anomalywatch.common.utils.AutoCloseableLock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * A bounded, time ordered history of {@link MetricPoint}s backed by a ring buffer. Once the series is full, each append
 * evicts the oldest point.
 * <p>
 * The series is guarded by its own read-write lock. Readers always receive copies, so a reader never observes a
 * partially appended point and never holds the lock beyond the copy.
 *
 * @param <M> The type of the metadata attached to the points.
 */
public class MetricSeries<M> {
  private final MetricPoint<M>[] _points;
  private final ReentrantReadWriteLock _lock;
  // Index of the slot the next point goes to.
  private int _next;
  private int _size;
  private long _numAppended;

  @SuppressWarnings("unchecked")
  public MetricSeries(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("The capacity of a metric series must be positive, got " + capacity);
    }
    _points = (MetricPoint<M>[]) new MetricPoint[capacity];
    _lock = new ReentrantReadWriteLock();
    _next = 0;
    _size = 0;
    _numAppended = 0L;
  }

  /**
   * Append a point, evicting the oldest one if the series is at capacity.
   *
   * @param point The point to append.
   */
  public void add(MetricPoint<M> point) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      _points[_next] = point;
      _next = (_next + 1) % _points.length;
      if (_size < _points.length) {
        _size++;
      }
      _numAppended++;
    }
  }

  public int capacity() {
    return _points.length;
  }

  public int size() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _size;
    }
  }

  /**
   * @return Total number of points ever appended, including evicted ones.
   */
  public long numAppended() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _numAppended;
    }
  }

  /**
   * Get the most recent points, oldest first.
   *
   * @param n The maximum number of points to return.
   * @return An unmodifiable copy of the last {@code min(n, size)} points.
   */
  public List<MetricPoint<M>> window(int n) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      int count = Math.max(0, Math.min(n, _size));
      List<MetricPoint<M>> result = new ArrayList<>(count);
      int start = _next - count + _points.length;
      for (int i = 0; i < count; i++) {
        result.add(_points[(start + i) % _points.length]);
      }
      return Collections.unmodifiableList(result);
    }
  }

  /**
   * @return An unmodifiable copy of all retained points, oldest first.
   */
  public List<MetricPoint<M>> snapshot() {
    return window(_points.length);
  }

  /**
   * @return The most recently appended point, or {@code null} if the series is empty.
   */
  public MetricPoint<M> latest() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _size == 0 ? null : _points[(_next - 1 + _points.length) % _points.length];
    }
  }
}
