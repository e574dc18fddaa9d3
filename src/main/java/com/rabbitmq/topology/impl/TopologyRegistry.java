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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exchanges, queues, and bindings declared on a connection.
 *
 * <p>Exchanges and queues are keyed by name, bindings by their identity (see {@link
 * AmqpBinding#id(String, com.rabbitmq.topology.Binding.DestinationType, String)}). A registration
 * replaces the entry with the same key. Iteration follows registration order.
 */
final class TopologyRegistry {

  private final Lock lock = new ReentrantLock();
  private final Map<String, AmqpExchange> exchanges = new LinkedHashMap<>();
  private final Map<String, AmqpQueue> queues = new LinkedHashMap<>();
  private final Map<String, AmqpBinding> bindings = new LinkedHashMap<>();

  AmqpExchange register(AmqpExchange exchange) {
    this.lock.lock();
    try {
      return this.exchanges.put(exchange.name(), exchange);
    } finally {
      this.lock.unlock();
    }
  }

  AmqpQueue register(AmqpQueue queue) {
    this.lock.lock();
    try {
      return this.queues.put(queue.name(), queue);
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Register the queue only if no queue with the same name is registered.
   *
   * @return true if the queue got registered
   */
  boolean registerIfAbsent(AmqpQueue queue) {
    this.lock.lock();
    try {
      return this.queues.putIfAbsent(queue.name(), queue) == null;
    } finally {
      this.lock.unlock();
    }
  }

  AmqpBinding register(AmqpBinding binding) {
    this.lock.lock();
    try {
      return this.bindings.put(binding.id(), binding);
    } finally {
      this.lock.unlock();
    }
  }

  AmqpExchange exchange(String name) {
    this.lock.lock();
    try {
      return this.exchanges.get(name);
    } finally {
      this.lock.unlock();
    }
  }

  AmqpQueue queue(String name) {
    this.lock.lock();
    try {
      return this.queues.get(name);
    } finally {
      this.lock.unlock();
    }
  }

  AmqpBinding binding(String id) {
    this.lock.lock();
    try {
      return this.bindings.get(id);
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Remove the exchange with the bindings it is part of, if it is the registered instance.
   *
   * @return the removed bindings
   */
  List<AmqpBinding> unregister(AmqpExchange exchange) {
    this.lock.lock();
    try {
      if (this.exchanges.remove(exchange.name(), exchange)) {
        return this.removeBindings(exchange.name(), false);
      } else {
        return List.of();
      }
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Remove the queue and the bindings to it, if it is the registered instance.
   *
   * @return the removed bindings
   */
  List<AmqpBinding> unregister(AmqpQueue queue) {
    this.lock.lock();
    try {
      if (this.queues.remove(queue.name(), queue)) {
        return this.removeBindings(queue.name(), true);
      } else {
        return List.of();
      }
    } finally {
      this.lock.unlock();
    }
  }

  boolean unregister(AmqpBinding binding) {
    this.lock.lock();
    try {
      return this.bindings.remove(binding.id(), binding);
    } finally {
      this.lock.unlock();
    }
  }

  private List<AmqpBinding> removeBindings(String name, boolean queue) {
    List<AmqpBinding> removed = new ArrayList<>();
    Iterator<AmqpBinding> iterator = this.bindings.values().iterator();
    while (iterator.hasNext()) {
      AmqpBinding binding = iterator.next();
      boolean involved =
          queue
              ? binding.isQueueDestination() && binding.destination().equals(name)
              : binding.source().equals(name)
                  || (!binding.isQueueDestination() && binding.destination().equals(name));
      if (involved) {
        iterator.remove();
        removed.add(binding);
      }
    }
    return removed;
  }

  Snapshot snapshot() {
    this.lock.lock();
    try {
      return new Snapshot(
          new ArrayList<>(this.exchanges.values()),
          new ArrayList<>(this.queues.values()),
          new ArrayList<>(this.bindings.values()));
    } finally {
      this.lock.unlock();
    }
  }

  /** Copy of the registered objects at a given time. */
  static final class Snapshot {

    private final List<AmqpExchange> exchanges;
    private final List<AmqpQueue> queues;
    private final List<AmqpBinding> bindings;

    private Snapshot(
        List<AmqpExchange> exchanges, List<AmqpQueue> queues, List<AmqpBinding> bindings) {
      this.exchanges = exchanges;
      this.queues = queues;
      this.bindings = bindings;
    }

    /** Exchanges, then queues, then bindings. */
    void accept(Visitor visitor) {
      visitor.visitExchanges(this.exchanges);
      visitor.visitQueues(this.queues);
      visitor.visitBindings(this.bindings);
    }

    List<AmqpExchange> exchanges() {
      return this.exchanges;
    }

    List<AmqpQueue> queues() {
      return this.queues;
    }

    List<AmqpBinding> bindings() {
      return this.bindings;
    }

    List<TopologyObject> all() {
      List<TopologyObject> all =
          new ArrayList<>(this.exchanges.size() + this.queues.size() + this.bindings.size());
      all.addAll(this.exchanges);
      all.addAll(this.queues);
      all.addAll(this.bindings);
      return all;
    }

    @Override
    public String toString() {
      return this.exchanges.size()
          + " exchange(s), "
          + this.queues.size()
          + " queue(s), "
          + this.bindings.size()
          + " binding(s)";
    }
  }

  interface Visitor {

    void visitExchanges(List<AmqpExchange> exchanges);

    void visitQueues(List<AmqpQueue> queues);

    void visitBindings(List<AmqpBinding> bindings);
  }
}
