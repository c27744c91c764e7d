/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


public class LlmAnomalyWatchThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(LlmAnomalyWatchThreadFactory.class);
  private final String _namePrefix;
  private final boolean _daemon;
  private final AtomicInteger _nextThreadId = new AtomicInteger(0);
  private final Logger _logger;

  public LlmAnomalyWatchThreadFactory(String namePrefix) {
    this(namePrefix, true, null);
  }

  /**
   * @param namePrefix Prefix of the thread names, followed by a sequence number.
   * @param daemon {@code true} to create daemon threads.
   * @param logger Logger of uncaught exceptions, or {@code null} to use the logger of this class.
   */
  public LlmAnomalyWatchThreadFactory(String namePrefix, boolean daemon, Logger logger) {
    _namePrefix = namePrefix;
    _daemon = daemon;
    _logger = logger == null ? LOG : logger;
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, _namePrefix + "-" + _nextThreadId.getAndIncrement());
    thread.setDaemon(_daemon);
    thread.setUncaughtExceptionHandler((t, e) -> _logger.error("Uncaught exception in thread {}.", t.getName(), e));
    return thread;
  }
}
