/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.llm.anomalywatch.detector.anomaly.ErrorRateSpike;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Detects the same error recurring for an entity. Errors are grouped by entity and by the first
 * {@value #ERROR_SIGNATURE_LENGTH} characters of their message. Occurrences are counted in event time: once the given
 * number of occurrences falls within the window, an {@link ErrorRateSpike} is reported, at most once per alert cooldown
 * for each group.
 */
public class ErrorPatternTracker {
  private static final Logger LOG = LoggerFactory.getLogger(ErrorPatternTracker.class);
  static final int ERROR_SIGNATURE_LENGTH = 100;
  private final int _minOccurrences;
  private final long _windowMs;
  private final long _alertCooldownMs;
  private final Time _time;
  private final Map<ErrorGroup, ErrorHistory> _historyByGroup;

  /**
   * @param minOccurrences Number of occurrences within the window that make an error recurring.
   * @param windowMs Window the occurrences are counted in.
   * @param alertCooldownMs Minimum event time between two reports of the same group.
   * @param maxTrackedGroups Maximum number of tracked error groups; the least recently created group is dropped first.
   * @param time Clock of detection times.
   */
  public ErrorPatternTracker(int minOccurrences, long windowMs, long alertCooldownMs, int maxTrackedGroups, Time time) {
    _minOccurrences = minOccurrences;
    _windowMs = windowMs;
    _alertCooldownMs = alertCooldownMs;
    _time = time;
    _historyByGroup = new LinkedHashMap<>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<ErrorGroup, ErrorHistory> eldest) {
        return this.size() > maxTrackedGroups;
      }
    };
  }

  /**
   * Record the given event if it is a failed call.
   *
   * @param event Current event.
   * @return An error rate spike if the error of the event is recurring and was not reported recently, {@code null}
   * otherwise.
   */
  public synchronized ErrorRateSpike record(LlmCallEvent event) {
    if (event.success()) {
      return null;
    }
    String errorSignature = errorSignature(event.error());
    ErrorGroup group = new ErrorGroup(event.entityKey(), errorSignature);
    ErrorHistory history = _historyByGroup.computeIfAbsent(group, g -> new ErrorHistory());
    long eventTimeMs = event.timestampMs();
    history._occurrences.addLast(eventTimeMs);
    while (!history._occurrences.isEmpty() && history._occurrences.peekFirst() < eventTimeMs - _windowMs) {
      history._occurrences.pollFirst();
    }
    // Only the most recent occurrences matter.
    while (history._occurrences.size() > _minOccurrences) {
      history._occurrences.pollFirst();
    }
    if (history._occurrences.size() < _minOccurrences) {
      return null;
    }
    if (history._lastAlertMs != null && eventTimeMs - history._lastAlertMs < _alertCooldownMs) {
      LOG.debug("Recurring error {} of {} was already reported at {}.", errorSignature, event.entityKey(), history._lastAlertMs);
      return null;
    }
    history._lastAlertMs = eventTimeMs;
    return new ErrorRateSpike(event.entityKey(), _time.milliseconds(), event, errorSignature, history._occurrences.size(),
                              history._occurrences.peekFirst());
  }

  static String errorSignature(String error) {
    return error.length() > ERROR_SIGNATURE_LENGTH ? error.substring(0, ERROR_SIGNATURE_LENGTH) : error;
  }

  /**
   * @return The number of tracked error groups.
   */
  public synchronized int numTrackedGroups() {
    return _historyByGroup.size();
  }

  private static final class ErrorGroup {
    private final EntityKey _entityKey;
    private final String _errorSignature;

    private ErrorGroup(EntityKey entityKey, String errorSignature) {
      _entityKey = entityKey;
      _errorSignature = errorSignature;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      ErrorGroup that = (ErrorGroup) o;
      return _entityKey.equals(that._entityKey) && _errorSignature.equals(that._errorSignature);
    }

    @Override
    public int hashCode() {
      return Objects.hash(_entityKey, _errorSignature);
    }
  }

  private static final class ErrorHistory {
    private final Deque<Long> _occurrences = new ArrayDeque<>();
    private Long _lastAlertMs = null;
  }
}
