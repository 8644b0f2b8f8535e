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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Enforces a minimum interval between requests.
 *
 * <p>{@link #acquire(long)} blocks until the interval has passed since the
 * last request started, then claims the current moment as the start of the
 * caller's request. Callers are released one at a time, so requesters that
 * share a limiter are spaced by the interval even when they run on different
 * threads. {@link #recordSuccess()} moves the mark forward to the moment a
 * response arrived; it never moves it back. Failed attempts only hold the slot
 * they claimed, so they do not extend the throttle window.
 *
 * <p>NCBI counts requests per client, so by default every requester in the
 * process shares the instance returned by {@link #shared()}. All methods are
 * synchronized.
 */
public class RateLimiter {
  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);

  private static final RateLimiter SHARED = new RateLimiter();

  /** {@link System#nanoTime()} of the last claimed slot or success. */
  private long lastRequestNanos;
  private boolean requested;

  /** Returns the process-wide limiter. */
  public static RateLimiter shared() {
    return SHARED;
  }

  /**
   * Waits until at least {@code minIntervalMs} have passed since the last
   * request, then claims the slot for the caller.
   *
   * @param minIntervalMs minimum interval; zero or less disables waiting
   * @throws InterruptedException if interrupted while waiting
   */
  public synchronized void acquire(long minIntervalMs) throws InterruptedException {
    if (minIntervalMs > 0 && requested) {
      long intervalNanos = TimeUnit.MILLISECONDS.toNanos(minIntervalMs);
      long waitNanos = lastRequestNanos + intervalNanos - System.nanoTime();
      if (waitNanos > 0) {
        LOGGER.debug("Rate limiting: waiting {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
      }
      while (waitNanos > 0) {
        TimeUnit.NANOSECONDS.sleep(waitNanos);
        waitNanos = lastRequestNanos + intervalNanos - System.nanoTime();
      }
    }
    lastRequestNanos = System.nanoTime();
    requested = true;
  }

  /** Records that a request has just completed successfully. */
  public synchronized void recordSuccess() {
    long now = System.nanoTime();
    if (!requested || now - lastRequestNanos > 0) {
      lastRequestNanos = now;
    }
    requested = true;
  }

  // For testing
  synchronized boolean hasRequested() {
    return requested;
  }

  // For testing
  synchronized long getLastRequestNanos() {
    return lastRequestNanos;
  }
}
