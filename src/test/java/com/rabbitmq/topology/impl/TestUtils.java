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

import static org.assertj.core.api.Assertions.fail;

import com.rabbitmq.topology.Resource;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.junit.jupiter.api.TestInfo;

public abstract class TestUtils {

  static final Duration DEFAULT_CONDITION_TIMEOUT = Duration.ofSeconds(10);
  static final Duration DEFAULT_WAIT_TIME = Duration.ofMillis(50);

  private TestUtils() {}

  @FunctionalInterface
  interface CallableBooleanSupplier {

    boolean getAsBoolean() throws Exception;
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, condition, null);
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition, Supplier<String> message) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, condition, message);
  }

  public static Duration waitAtMost(
      Duration timeout, CallableBooleanSupplier condition, Supplier<String> message) {
    long start = System.nanoTime();
    try {
      if (condition.getAsBoolean()) {
        return Duration.ZERO;
      }
      Duration waitedTime = Duration.ofNanos(System.nanoTime() - start);
      Exception exception = null;
      while (waitedTime.compareTo(timeout) <= 0) {
        Thread.sleep(DEFAULT_WAIT_TIME.toMillis());
        waitedTime = waitedTime.plus(DEFAULT_WAIT_TIME);
        start = System.nanoTime();
        try {
          if (condition.getAsBoolean()) {
            return waitedTime;
          }
          exception = null;
        } catch (Exception e) {
          exception = e;
        }
        waitedTime = waitedTime.plus(Duration.ofNanos(System.nanoTime() - start));
      }
      String msg;
      if (message == null) {
        msg = "Waited " + timeout.getSeconds() + " second(s), condition never got true";
      } else {
        msg = "Waited " + timeout.getSeconds() + " second(s), " + message.get();
      }
      if (exception == null) {
        fail(msg);
      } else {
        fail(msg, exception);
      }
      return waitedTime;
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  static String name(TestInfo info) {
    return info.getTestClass().get().getSimpleName()
        + "_"
        + info.getTestMethod().get().getName()
        + "_"
        + System.currentTimeMillis();
  }

  /** Environment builder wired to an in-memory broker, with a fixed process identity. */
  static AmqpEnvironmentBuilder environmentBuilder(FakeBroker broker) {
    return new AmqpEnvironmentBuilder()
        .brokerClient(broker)
        .processIdentity(new ProcessIdentity("test-app", "test-host", 42L))
        .shutdownHooks(new RecordingHooks());
  }

  static Sync sync() {
    return sync(1);
  }

  static Sync sync(int count) {
    return new Sync(count, null);
  }

  static Sync sync(int count, String format, Object... args) {
    return new Sync(count, format, args);
  }

  static class Sync {

    private final String description;
    private final AtomicReference<CountDownLatch> latch = new AtomicReference<>();

    private Sync(int count, String description, Object... args) {
      this.latch.set(new CountDownLatch(count));
      if (description == null) {
        this.description = "N/A";
      } else {
        this.description = String.format(description, args);
      }
    }

    void down() {
      this.latch.get().countDown();
    }

    boolean await(Duration timeout) {
      try {
        return this.latch.get().await(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw new RuntimeException(ie);
      }
    }

    void reset(int count) {
      this.latch.set(new CountDownLatch(count));
    }

    void reset() {
      this.reset(1);
    }

    boolean hasCompleted() {
      return this.latch.get().getCount() == 0;
    }

    @Override
    public String toString() {
      return this.description;
    }
  }

  /** Keeps track of the state changes of resources. */
  static class StateRecorder implements Resource.StateListener {

    private final List<Resource.Context> contexts = new CopyOnWriteArrayList<>();

    @Override
    public void handle(Resource.Context context) {
      this.contexts.add(context);
    }

    List<Resource.State> states(Resource resource) {
      return this.contexts.stream()
          .filter(c -> c.resource() == resource)
          .map(Resource.Context::currentState)
          .collect(Collectors.toList());
    }

    boolean reached(Resource resource, Resource.State state) {
      return this.states(resource).contains(state);
    }
  }

  /** Shutdown hooks that are never run, keeps track of registrations. */
  static class RecordingHooks implements ShutdownHookSupport.Hooks {

    private final List<Thread> hooks = new CopyOnWriteArrayList<>();

    @Override
    public void add(Thread hook) {
      this.hooks.add(hook);
    }

    @Override
    public boolean remove(Thread hook) {
      return this.hooks.remove(hook);
    }

    List<Thread> hooks() {
      return this.hooks;
    }
  }
}
