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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class ShutdownHookSupportTest {

  @Mock ShutdownHookSupport.Hooks hooks;
  AutoCloseable mocks;

  @BeforeEach
  void init() {
    mocks = MockitoAnnotations.openMocks(this);
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  @Test
  void registerReplacesPreviousHook() {
    ShutdownHookSupport support = new ShutdownHookSupport(hooks, "connection-1");
    AtomicInteger firstRuns = new AtomicInteger();
    AtomicInteger secondRuns = new AtomicInteger();
    support.register(firstRuns::incrementAndGet);
    support.register(secondRuns::incrementAndGet);

    ArgumentCaptor<Thread> added = ArgumentCaptor.forClass(Thread.class);
    verify(hooks, times(2)).add(added.capture());
    Thread first = added.getAllValues().get(0);
    Thread second = added.getAllValues().get(1);
    verify(hooks).remove(first);
    verify(hooks, never()).remove(second);
    assertThat(second.getName()).isEqualTo("connection-1-shutdown-hook");
    assertThat(support.registered()).isTrue();

    second.run();
    assertThat(firstRuns).hasValue(0);
    assertThat(secondRuns).hasValue(1);
  }

  @Test
  void unregisterRemovesHook() {
    ShutdownHookSupport support = new ShutdownHookSupport(hooks, "connection-1");
    support.register(() -> {});
    support.unregister();
    assertThat(support.registered()).isFalse();
    verify(hooks).remove(any(Thread.class));
    support.unregister();
    verify(hooks, times(1)).remove(any(Thread.class));
  }

  @Test
  void jvmShuttingDownIsNotAnError() {
    doThrow(new IllegalStateException("Shutdown in progress")).when(hooks).add(any(Thread.class));
    ShutdownHookSupport support = new ShutdownHookSupport(hooks, "connection-1");
    support.register(() -> {});
    assertThat(support.registered()).isFalse();
  }

  @Test
  void removalFailureDuringShutdownIsNotAnError() {
    doThrow(new IllegalStateException("Shutdown in progress"))
        .when(hooks)
        .remove(any(Thread.class));
    ShutdownHookSupport support = new ShutdownHookSupport(hooks, "connection-1");
    support.register(() -> {});
    support.unregister();
    assertThat(support.registered()).isFalse();
  }
}
