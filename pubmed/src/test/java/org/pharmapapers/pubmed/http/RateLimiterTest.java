/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pharmapapers.pubmed.http;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RateLimiter}.
 */
@Tag("unit")
public class RateLimiterTest {

  @Test void testFirstAcquireDoesNotWait() throws InterruptedException {
    RateLimiter limiter = new RateLimiter();
    long start = System.nanoTime();
    limiter.acquire(1000);
    assertTrue(elapsedMs(start) < 500);
  }

  @Test void testAcquireWaitsForInterval() throws InterruptedException {
    RateLimiter limiter = new RateLimiter();
    limiter.recordSuccess();
    long recorded = limiter.getLastRequestNanos();
    limiter.acquire(200);
    long gap = limiter.getLastRequestNanos() - recorded;
    assertTrue(gap >= TimeUnit.MILLISECONDS.toNanos(200), "gap " + gap + " ns");
  }

  @Test void testAcquireClaimsSlot() throws InterruptedException {
    RateLimiter limiter = new RateLimiter();
    assertFalse(limiter.hasRequested());

    limiter.acquire(10);
    assertTrue(limiter.hasRequested());
    long claimed = limiter.getLastRequestNanos();

    // a second caller waits behind the claimed slot even without a success
    limiter.acquire(100);
    long gap = limiter.getLastRequestNanos() - claimed;
    assertTrue(gap >= TimeUnit.MILLISECONDS.toNanos(100), "gap " + gap + " ns");
  }

  @Test void testRecordSuccessOnlyMovesForward() throws InterruptedException {
    RateLimiter limiter = new RateLimiter();
    limiter.acquire(10);
    long claimed = limiter.getLastRequestNanos();
    limiter.recordSuccess();
    assertTrue(limiter.getLastRequestNanos() - claimed >= 0);
  }

  @Test void testNonPositiveIntervalNeverWaits() throws InterruptedException {
    RateLimiter limiter = new RateLimiter();
    limiter.recordSuccess();
    long start = System.nanoTime();
    limiter.acquire(0);
    limiter.acquire(-5);
    assertTrue(elapsedMs(start) < 100);
  }

  @Test void testInterruptedWhileWaiting() {
    RateLimiter limiter = new RateLimiter();
    limiter.recordSuccess();
    Thread.currentThread().interrupt();
    try {
      assertThrows(InterruptedException.class, () -> limiter.acquire(1000));
    } finally {
      Thread.interrupted();
    }
  }

  @Test void testConcurrentCallersAreSpaced() throws InterruptedException {
    RateLimiter limiter = new RateLimiter();
    List<Long> starts = Collections.synchronizedList(new ArrayList<>());
    List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
    CountDownLatch ready = new CountDownLatch(1);
    Runnable caller = () -> {
      try {
        ready.await();
        limiter.acquire(300);
        starts.add(System.nanoTime());
      } catch (InterruptedException e) {
        errors.add(e);
      }
    };
    Thread first = new Thread(caller);
    Thread second = new Thread(caller);
    first.start();
    second.start();
    ready.countDown();
    first.join(5000);
    second.join(5000);

    assertTrue(errors.isEmpty(), errors.toString());
    assertEquals(2, starts.size());
    long gap = Math.abs(starts.get(1) - starts.get(0));
    assertTrue(gap >= TimeUnit.MILLISECONDS.toNanos(290),
        "callers started " + TimeUnit.NANOSECONDS.toMillis(gap) + " ms apart");
  }

  @Test void testSharedInstance() {
    assertSame(RateLimiter.shared(), RateLimiter.shared());
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
