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
package com.rabbitmq.topology.impl;

import com.rabbitmq.topology.BackOffDelayPolicy;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a task until it succeeds, waiting between attempts according to a {@link
 * BackOffDelayPolicy}.
 *
 * <p>The first attempt runs in the calling thread if the policy has no initial delay, the other
 * attempts run in the scheduler threads. The returned future fails with the last error when the
 * policy times out or when the retry predicate rejects an error.
 */
final class AsyncRetry<V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncRetry.class);

  private final CompletableFuture<V> completableFuture;

  private AsyncRetry(
      Callable<V> task,
      String description,
      ScheduledExecutorService scheduler,
      BackOffDelayPolicy delayPolicy,
      Predicate<Exception> retry) {
    this.completableFuture = new CompletableFuture<>();
    AtomicReference<Runnable> retryableTaskReference = new AtomicReference<>();
    AtomicInteger attempts = new AtomicInteger(0);
    Runnable retryableTask =
        () -> {
          if (Thread.currentThread().isInterrupted()) {
            LOGGER.debug("Task '{}' interrupted, failing future", description);
            this.completableFuture.completeExceptionally(new CancellationException());
            return;
          }
          try {
            V result = task.call();
            LOGGER.debug("Task '{}' succeeded, completing future", description);
            this.completableFuture.complete(result);
          } catch (Exception e) {
            int attemptCount = attempts.getAndIncrement();
            if (retry.test(e)) {
              Duration nextDelay = delayPolicy.delay(attemptCount + 1);
              if (BackOffDelayPolicy.TIMEOUT.equals(nextDelay)) {
                LOGGER.debug(
                    "Retryable attempts for task '{}' timed out after {} attempt(s)",
                    description,
                    attemptCount + 1);
                this.completableFuture.completeExceptionally(e);
              } else {
                LOGGER.debug(
                    "Retryable attempt #{} for task '{}' failed ({}), next attempt in {} ms",
                    attemptCount,
                    description,
                    e.getMessage(),
                    nextDelay.toMillis());
                schedule(scheduler, retryableTaskReference.get(), nextDelay, description);
              }
            } else {
              LOGGER.debug(
                  "Non-retryable exception for task '{}', failing future: {}",
                  description,
                  e.getMessage());
              this.completableFuture.completeExceptionally(e);
            }
          }
        };
    retryableTaskReference.set(retryableTask);
    Duration initialDelay = delayPolicy.delay(attempts.get());
    if (initialDelay.isZero()) {
      retryableTask.run();
    } else {
      schedule(scheduler, retryableTask, initialDelay, description);
    }
  }

  static <V> AsyncRetryBuilder<V> asyncRetry(Callable<V> task) {
    return new AsyncRetryBuilder<>(task);
  }

  private void schedule(
      ScheduledExecutorService scheduler, Runnable task, Duration delay, String description) {
    try {
      scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Could not schedule task '{}', failing future", description);
      this.completableFuture.completeExceptionally(e);
    }
  }

  static class AsyncRetryBuilder<V> {

    private final Callable<V> task;
    private String description = "";
    private ScheduledExecutorService scheduler;
    private BackOffDelayPolicy delayPolicy = BackOffDelayPolicy.fixed(Duration.ofSeconds(1));
    private Predicate<Exception> retry = e -> true;

    AsyncRetryBuilder(Callable<V> task) {
      this.task = task;
    }

    AsyncRetryBuilder<V> scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    AsyncRetryBuilder<V> delay(Duration delay) {
      this.delayPolicy = BackOffDelayPolicy.fixed(delay);
      return this;
    }

    AsyncRetryBuilder<V> delayPolicy(BackOffDelayPolicy delayPolicy) {
      this.delayPolicy = delayPolicy;
      return this;
    }

    AsyncRetryBuilder<V> retry(Predicate<Exception> predicate) {
      this.retry = predicate;
      return this;
    }

    AsyncRetryBuilder<V> description(String description, Object... args) {
      this.description = String.format(description, args);
      return this;
    }

    CompletableFuture<V> build() {
      return new AsyncRetry<>(task, description, scheduler, delayPolicy, retry).completableFuture;
    }
  }
}
