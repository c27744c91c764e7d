/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.monitor.series;

import java.util.List;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class MetricSeriesTest {

  @Test
  public void testNeverExceedsCapacity() {
    MetricSeries<String> series = new MetricSeries<>(10);
    for (int i = 0; i < 25; i++) {
      series.add(new MetricPoint<>(i, i * 1000L, null));
      assertTrue(series.size() <= 10);
    }
    assertEquals(10, series.size());
    assertEquals(25L, series.numAppended());
    List<MetricPoint<String>> snapshot = series.snapshot();
    // Oldest retained point is the 16th appended one.
    assertEquals(15.0, snapshot.get(0).value(), 0.0);
    assertEquals(24.0, snapshot.get(9).value(), 0.0);
    assertEquals(24.0, series.latest().value(), 0.0);
  }

  @Test
  public void testWindowBeforeWrapAround() {
    MetricSeries<String> series = new MetricSeries<>(100);
    assertNull(series.latest());
    assertTrue(series.window(5).isEmpty());
    for (int i = 0; i < 7; i++) {
      series.add(new MetricPoint<>(i, i, "event-" + i));
    }
    List<MetricPoint<String>> window = series.window(3);
    assertEquals(3, window.size());
    assertEquals(4.0, window.get(0).value(), 0.0);
    assertEquals("event-6", window.get(2).metadata());
    assertEquals(7, series.window(50).size());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testWindowIsReadOnly() {
    MetricSeries<String> series = new MetricSeries<>(3);
    series.add(new MetricPoint<>(1.0, 1L, null));
    series.window(3).clear();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveCapacity() {
    new MetricSeries<String>(0);
  }
}
