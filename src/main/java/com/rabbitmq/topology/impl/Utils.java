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

import com.rabbitmq.topology.AmqpException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

final class Utils {

  private Utils() {}

  private static class NamedThreadFactory implements ThreadFactory {

    private final ThreadFactory backingThreadFactory;

    private final String prefix;

    private final AtomicLong count = new AtomicLong(0);

    private NamedThreadFactory(String prefix) {
      this(Executors.defaultThreadFactory(), prefix);
    }

    private NamedThreadFactory(ThreadFactory backingThreadFactory, String prefix) {
      this.backingThreadFactory = backingThreadFactory;
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = this.backingThreadFactory.newThread(r);
      thread.setName(prefix + count.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }

  static ThreadFactory threadFactory(String prefix) {
    if (prefix == null) {
      return Executors.defaultThreadFactory();
    } else {
      return new NamedThreadFactory(prefix);
    }
  }

  /**
   * Single-thread executor for the blocking broker operations of a connection.
   *
   * <p>The thread goes away when idle.
   */
  static ExecutorService operationExecutor(String prefix) {
    ThreadPoolExecutor executor =
        new ThreadPoolExecutor(
            1, 1, 30, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), threadFactory(prefix));
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }

  static void maybeClose(AutoCloseable closeable, Consumer<Exception> exceptionCallback) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        exceptionCallback.accept(e);
      }
    }
  }

  /**
   * Wait for all the futures to complete, whatever their outcome.
   *
   * <p>With one failure, the returned future fails with it. With several failures, it fails with a
   * new {@link AmqpException} caused by the first failure (in iteration order), the other failures
   * are its suppressed exceptions. The failures themselves are left untouched, they can belong to
   * futures that other callers observe.
   */
  static CompletableFuture<Void> allSettled(Collection<? extends CompletableFuture<?>> futures) {
    List<CompletableFuture<?>> settled = new ArrayList<>(futures);
    CompletableFuture<?>[] handled =
        settled.stream().map(f -> f.handle((r, ex) -> null)).toArray(CompletableFuture[]::new);
    return CompletableFuture.allOf(handled)
        .thenCompose(
            ignored -> {
              List<Throwable> failures = new ArrayList<>();
              for (CompletableFuture<?> future : settled) {
                Throwable cause = failure(future);
                if (cause != null && failures.stream().noneMatch(f -> f == cause)) {
                  failures.add(cause);
                }
              }
              if (failures.isEmpty()) {
                return CompletableFuture.completedFuture(null);
              } else if (failures.size() == 1) {
                return CompletableFuture.failedFuture(failures.get(0));
              }
              return CompletableFuture.failedFuture(aggregate(failures));
            });
  }

  private static AmqpException aggregate(List<Throwable> failures) {
    Throwable first = failures.get(0);
    AmqpException aggregate =
        new AmqpException(
            failures.size() + " operations failed, first failure: " + first.getMessage(), first);
    failures.subList(1, failures.size()).forEach(aggregate::addSuppressed);
    return aggregate;
  }

  /**
   * Run asynchronous steps one after the other, a step starts when the previous one is settled.
   *
   * <p>The returned future fails like {@link #allSettled(Collection)} does.
   */
  static CompletableFuture<Void> runInSequence(List<Supplier<CompletableFuture<?>>> steps) {
    List<CompletableFuture<?>> outcomes = new CopyOnWriteArrayList<>();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (Supplier<CompletableFuture<?>> step : steps) {
      chain =
          chain.thenCompose(
              ignored -> {
                CompletableFuture<?> outcome = start(step);
                outcomes.add(outcome);
                return outcome.handle((r, ex) -> (Void) null);
              });
    }
    return chain.thenCompose(ignored -> allSettled(outcomes));
  }

  private static CompletableFuture<?> start(Supplier<CompletableFuture<?>> step) {
    try {
      return step.get();
    } catch (Exception e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static Throwable failure(CompletableFuture<?> future) {
    if (!future.isCompletedExceptionally()) {
      return null;
    }
    return future.handle((r, ex) -> ExceptionUtils.unwrap(ex)).getNow(null);
  }

  @FunctionalInterface
  interface RunnableWithException {

    void run() throws Exception;
  }

  static class StopWatch {

    private final long start = System.nanoTime();
    private Duration duration;

    Duration stop() {
      this.duration = Duration.ofNanos(System.nanoTime() - start);
      return this.duration;
    }
  }
}
