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

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps at most one JVM shutdown hook registered for an owner.
 *
 * <p>Registering a new hook replaces the previous one.
 */
final class ShutdownHookSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShutdownHookSupport.class);

  static final Hooks RUNTIME_HOOKS =
      new Hooks() {
        @Override
        public void add(Thread hook) {
          Runtime.getRuntime().addShutdownHook(hook);
        }

        @Override
        public boolean remove(Thread hook) {
          return Runtime.getRuntime().removeShutdownHook(hook);
        }
      };

  private final Hooks hooks;
  private final String name;
  private final Lock instanceLock = new ReentrantLock();
  private Thread hook;

  ShutdownHookSupport(Hooks hooks, String name) {
    this.hooks = hooks;
    this.name = name;
  }

  void register(Runnable action) {
    this.instanceLock.lock();
    try {
      this.removeCurrent();
      Thread thread = new Thread(action, this.name + "-shutdown-hook");
      try {
        this.hooks.add(thread);
        this.hook = thread;
      } catch (IllegalStateException e) {
        LOGGER.debug("Could not register shutdown hook for {}: {}", this.name, e.getMessage());
      }
    } finally {
      this.instanceLock.unlock();
    }
  }

  void unregister() {
    this.instanceLock.lock();
    try {
      this.removeCurrent();
    } finally {
      this.instanceLock.unlock();
    }
  }

  boolean registered() {
    this.instanceLock.lock();
    try {
      return this.hook != null;
    } finally {
      this.instanceLock.unlock();
    }
  }

  private void removeCurrent() {
    if (this.hook != null) {
      try {
        this.hooks.remove(this.hook);
      } catch (IllegalStateException e) {
        // the JVM is already shutting down
        LOGGER.debug("Could not remove shutdown hook for {}: {}", this.name, e.getMessage());
      }
      this.hook = null;
    }
  }

  /** Registration of JVM shutdown hooks. */
  interface Hooks {

    void add(Thread hook);

    boolean remove(Thread hook);
  }
}
