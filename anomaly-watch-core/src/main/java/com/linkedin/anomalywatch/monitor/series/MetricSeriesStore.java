/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.monitor.series;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;


/**
 * Keeps a bounded {@link MetricSeries} per (metric type, entity). Series are created lazily on first observation and
 * are retained for the lifetime of the store.
 * <p>
 * The store itself never takes a global lock: the series map is concurrent and each series guards itself, so a
 * reader scanning every series only ever blocks the writer for the duration of a single series copy.
 *
 * @param <T> The metric type.
 * @param <K> The entity key.
 * @param <M> The metadata attached to each point.
 */
public class MetricSeriesStore<T, K, M> {
  private final int _capacity;
  private final ConcurrentMap<T, ConcurrentMap<K, MetricSeries<M>>> _seriesByEntityByType;
  private final Set<K> _entities;

  /**
   * @param capacity Maximum number of points retained per series.
   */
  public MetricSeriesStore(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("The capacity of a metric series must be positive, got " + capacity);
    }
    _capacity = capacity;
    _seriesByEntityByType = new ConcurrentHashMap<>();
    _entities = ConcurrentHashMap.newKeySet();
  }

  /**
   * Append a point to the series of the given metric type and entity.
   *
   * @param type Metric type.
   * @param key Entity key.
   * @param value Observed value.
   * @param metadata Metadata of the originating event, may be null.
   * @param timestampMs Observation time.
   * @return The series the point was appended to.
   */
  public MetricSeries<M> add(T type, K key, double value, M metadata, long timestampMs) {
    MetricSeries<M> series = _seriesByEntityByType.computeIfAbsent(type, t -> new ConcurrentHashMap<>())
                                                  .computeIfAbsent(key, this::newSeries);
    series.add(new MetricPoint<>(value, timestampMs, metadata));
    return series;
  }

  private MetricSeries<M> newSeries(K key) {
    _entities.add(key);
    return new MetricSeries<>(_capacity);
  }

  /**
   * @param type Metric type.
   * @param key Entity key.
   * @return The series of the given metric type and entity, or {@code null} if nothing has been observed for it.
   */
  public MetricSeries<M> series(T type, K key) {
    ConcurrentMap<K, MetricSeries<M>> seriesByEntity = _seriesByEntityByType.get(type);
    return seriesByEntity == null ? null : seriesByEntity.get(key);
  }

  /**
   * @param type Metric type.
   * @param key Entity key.
   * @param n Maximum number of points.
   * @return The last {@code n} points of the series, oldest first, or an empty list if there is no such series.
   */
  public List<MetricPoint<M>> window(T type, K key, int n) {
    MetricSeries<M> series = series(type, key);
    return series == null ? Collections.emptyList() : series.window(n);
  }

  /**
   * @param type Metric type.
   * @param key Entity key.
   * @return All retained points of the series, oldest first, or an empty list if there is no such series.
   */
  public List<MetricPoint<M>> snapshot(T type, K key) {
    MetricSeries<M> series = series(type, key);
    return series == null ? Collections.emptyList() : series.snapshot();
  }

  /**
   * @param type Metric type.
   * @param key Entity key.
   * @return Number of retained points of the series.
   */
  public int size(T type, K key) {
    MetricSeries<M> series = series(type, key);
    return series == null ? 0 : series.size();
  }

  /**
   * @param type Metric type.
   * @return The entities that have a series of the given type.
   */
  public Set<K> keys(T type) {
    ConcurrentMap<K, MetricSeries<M>> seriesByEntity = _seriesByEntityByType.get(type);
    return seriesByEntity == null ? Collections.emptySet() : Collections.unmodifiableSet(new HashSet<>(seriesByEntity.keySet()));
  }

  /**
   * @return The number of distinct entities with at least one series, maintained as series are created.
   */
  public int numEntities() {
    return _entities.size();
  }

  /**
   * @return The total number of series across all metric types.
   */
  public int numSeries() {
    int numSeries = 0;
    for (ConcurrentMap<K, MetricSeries<M>> seriesByEntity : _seriesByEntityByType.values()) {
      numSeries += seriesByEntity.size();
    }
    return numSeries;
  }

  public int capacity() {
    return _capacity;
  }
}
