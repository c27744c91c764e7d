/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.common.utils;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.easymock.EasyMock;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AutoCloseableLockTest {

  @Test
  public void testReleaseOnlyOnce() {
    Lock lock = EasyMock.mock(Lock.class);
    lock.lock();
    lock.unlock();
    EasyMock.expectLastCall().once();
    EasyMock.replay(lock);

    AutoCloseableLock autoCloseableLock = new AutoCloseableLock(lock);
    assertFalse(autoCloseableLock.isReleased());
    autoCloseableLock.close();
    assertTrue(autoCloseableLock.isReleased());
    // A second close must not unlock again.
    autoCloseableLock.close();
    assertTrue(autoCloseableLock.isReleased());
    EasyMock.verify(lock);
  }

  @Test
  public void testWriteLockReleasedByTryWithResources() {
    ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    try (AutoCloseableLock ignored = new AutoCloseableLock(lock.writeLock())) {
      assertTrue(lock.isWriteLockedByCurrentThread());
    }
    assertFalse(lock.isWriteLocked());
  }

  @Test
  public void testHeldUntilClosed() {
    ReentrantLock lock = new ReentrantLock();
    AutoCloseableLock autoCloseableLock = new AutoCloseableLock(lock);
    assertTrue(lock.isHeldByCurrentThread());
    autoCloseableLock.close();
    assertFalse(lock.isLocked());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullLock() {
    new AutoCloseableLock(null);
  }
}
