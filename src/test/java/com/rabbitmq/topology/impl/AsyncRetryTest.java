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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

import com.rabbitmq.topology.BackOffDelayPolicy;
import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class AsyncRetryTest {

  ScheduledExecutorService scheduler;
  @Mock Callable<String> task;
  AutoCloseable mocks;

  @BeforeEach
  void init() {
    mocks = MockitoAnnotations.openMocks(this);
    this.scheduler = Executors.newSingleThreadScheduledExecutor();
  }

  @AfterEach
  void tearDown() throws Exception {
    this.scheduler.shutdownNow();
    mocks.close();
  }

  @Test
  void firstAttemptRunsInCallingThreadWithoutInitialDelay() throws Exception {
    when(task.call()).thenReturn("connected");
    CompletableFuture<String> result =
        AsyncRetry.asyncRetry(task)
            .delayPolicy(BackOffDelayPolicy.retries(3, Duration.ofMillis(10)))
            .scheduler(scheduler)
            .build();
    assertThat(result).isCompletedWithValue("connected");
    verify(task, times(1)).call();
  }

  @Test
  void retriesUntilTaskSucceeds() throws Exception {
    when(task.call())
        .thenThrow(new ConnectException())
        .thenThrow(new ConnectException())
        .thenReturn("connected");
    CompletableFuture<String> result =
        AsyncRetry.asyncRetry(task)
            .delayPolicy(BackOffDelayPolicy.retries(0, Duration.ofMillis(20)))
            .scheduler(scheduler)
            .build();
    assertThat(result.get(1, TimeUnit.SECONDS)).isEqualTo("connected");
    verify(task, times(3)).call();
  }

  @Test
  void failsWithLastErrorWhenRetriesAreExhausted() throws Exception {
    when(task.call())
        .thenThrow(new ConnectException("first"))
        .thenThrow(new ConnectException("second"))
        .thenThrow(new ConnectException("third"));
    CompletableFuture<String> result =
        AsyncRetry.asyncRetry(task)
            .delayPolicy(BackOffDelayPolicy.retries(2, Duration.ofMillis(20)))
            .scheduler(scheduler)
            .build();
    assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
        .hasCauseInstanceOf(ConnectException.class)
        .hasMessageContaining("third");
    verify(task, times(3)).call();
  }

  @Test
  void timesOutWhenExecutionFailsForTooLong() throws Exception {
    when(task.call()).thenThrow(new RuntimeException());
    CompletableFuture<String> result =
        AsyncRetry.asyncRetry(task)
            .scheduler(this.scheduler)
            .delayPolicy(
                BackOffDelayPolicy.fixedWithInitialDelay(
                    Duration.ofMillis(50), Duration.ofMillis(50), Duration.ofMillis(500)))
            .build();
    CountDownLatch latch = new CountDownLatch(1);
    AtomicBoolean acceptCalled = new AtomicBoolean(false);
    result
        .thenAccept(value -> acceptCalled.set(true))
        .exceptionally(
            e -> {
              latch.countDown();
              return null;
            });
    assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
    assertThat(acceptCalled.get()).isFalse();
    verify(task, atLeast(5)).call();
  }

  @Test
  void stopsRetryingWhenPredicateRejectsError() throws Exception {
    AtomicBoolean closed = new AtomicBoolean(false);
    when(task.call())
        .thenThrow(new ConnectException())
        .thenAnswer(
            invocation -> {
              closed.set(true);
              throw new ConnectException();
            })
        .thenReturn("connected");
    CompletableFuture<String> result =
        AsyncRetry.asyncRetry(task)
            .scheduler(scheduler)
            .retry(e -> !closed.get())
            .delay(Duration.ofMillis(20))
            .build();
    assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
        .hasCauseInstanceOf(ConnectException.class);
    verify(task, times(2)).call();
  }

  @Test
  void failsWhenSchedulerRejectsRetry() throws Exception {
    when(task.call()).thenThrow(new ConnectException());
    this.scheduler.shutdownNow();
    CompletableFuture<String> result =
        AsyncRetry.asyncRetry(task)
            .scheduler(scheduler)
            .delayPolicy(BackOffDelayPolicy.retries(0, Duration.ofMillis(20)))
            .build();
    assertThat(result).isCompletedExceptionally();
    assertThatThrownBy(result::join).hasCauseInstanceOf(RejectedExecutionException.class);
    verify(task, times(1)).call();
  }
}
