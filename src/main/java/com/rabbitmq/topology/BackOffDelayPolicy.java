// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.topology;

import java.time.Duration;

/**
 * Contract to determine a delay between attempts of some task.
 *
 * <p>The task is typically the creation of a connection. Attempt 0 is the first attempt, its delay
 * is applied before the task runs for the first time.
 */
public interface BackOffDelayPolicy {

  Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * Returns the delay to use for a given attempt.
   *
   * <p>The policy can return the TIMEOUT constant to indicate that the task has reached a timeout.
   *
   * @param recoveryAttempt number of the recovery attempt
   * @return the delay, TIMEOUT if the task should stop being retried
   */
  Duration delay(int recoveryAttempt);

  /**
   * Policy with a fixed delay.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(delay, delay);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @return fixed-delay policy with initial delay
   */
  static BackOffDelayPolicy fixedWithInitialDelay(Duration initialDelay, Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(initialDelay, delay);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay, and a timeout.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @param timeout timeout
   * @return fixed-delay policy with initial delay and timeout
   */
  static BackOffDelayPolicy fixedWithInitialDelay(
      Duration initialDelay, Duration delay, Duration timeout) {
    return new FixedWithInitialDelayAndTimeoutBackOffPolicy(initialDelay, delay, timeout);
  }

  /**
   * Policy that runs the first attempt immediately, then retries a given number of times.
   *
   * <p>A <code>retries</code> value of 0 means retrying forever.
   *
   * @param retries number of retries after the first attempt, 0 for unbounded
   * @param interval delay between attempts
   * @return policy with a bounded (or unbounded) number of retries
   */
  static BackOffDelayPolicy retries(int retries, Duration interval) {
    return new RetriesBackOffPolicy(retries, interval);
  }

  /**
   * The default policy: unbounded retries every 1.5 second.
   *
   * @return the default policy
   */
  static BackOffDelayPolicy defaultPolicy() {
    return retries(0, Duration.ofMillis(1500));
  }

  final class FixedWithInitialDelayBackOffPolicy implements BackOffDelayPolicy {

    private final Duration initialDelay;
    private final Duration delay;

    private FixedWithInitialDelayBackOffPolicy(Duration initialDelay, Duration delay) {
      this.initialDelay = initialDelay;
      this.delay = delay;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      return recoveryAttempt == 0 ? initialDelay : delay;
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayBackOffPolicy{"
          + "initialDelay="
          + initialDelay
          + ", delay="
          + delay
          + '}';
    }
  }

  final class FixedWithInitialDelayAndTimeoutBackOffPolicy implements BackOffDelayPolicy {

    private final int attemptLimitBeforeTimeout;
    private final BackOffDelayPolicy delegate;

    private FixedWithInitialDelayAndTimeoutBackOffPolicy(
        Duration initialDelay, Duration delay, Duration timeout) {
      if (timeout.toMillis() < initialDelay.toMillis()) {
        throw new IllegalArgumentException("Timeout must be longer than initial delay");
      }
      this.delegate = fixedWithInitialDelay(initialDelay, delay);
      long timeoutWithInitialDelay = timeout.toMillis() - initialDelay.toMillis();
      this.attemptLimitBeforeTimeout = (int) (timeoutWithInitialDelay / delay.toMillis()) + 1;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      if (recoveryAttempt >= attemptLimitBeforeTimeout) {
        return TIMEOUT;
      } else {
        return delegate.delay(recoveryAttempt);
      }
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayAndTimeoutBackOffPolicy{"
          + "attemptLimitBeforeTimeout="
          + attemptLimitBeforeTimeout
          + ", delegate="
          + delegate
          + '}';
    }
  }

  final class RetriesBackOffPolicy implements BackOffDelayPolicy {

    private final int retries;
    private final Duration interval;

    private RetriesBackOffPolicy(int retries, Duration interval) {
      if (retries < 0) {
        throw new IllegalArgumentException("The number of retries cannot be negative");
      }
      if (interval == null || interval.isNegative()) {
        throw new IllegalArgumentException("The retry interval must be positive");
      }
      this.retries = retries;
      this.interval = interval;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      if (recoveryAttempt == 0) {
        return Duration.ZERO;
      } else if (this.retries == 0 || recoveryAttempt <= this.retries) {
        return this.interval;
      } else {
        return TIMEOUT;
      }
    }

    @Override
    public String toString() {
      return "RetriesBackOffPolicy{" + "retries=" + retries + ", interval=" + interval + '}';
    }
  }
}
