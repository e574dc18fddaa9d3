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

import static com.rabbitmq.topology.Binding.DestinationType.EXCHANGE;
import static com.rabbitmq.topology.Binding.DestinationType.QUEUE;
import static org.assertj.core.api.Assertions.assertThat;

import com.rabbitmq.topology.Binding;
import com.rabbitmq.topology.Exchange;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TopologyRegistryTest {

  TopologyRegistry registry = new TopologyRegistry();

  @Test
  void bindingIdentity() {
    assertThat(AmqpBinding.id("orders", QUEUE, "billing")).isEqualTo("[orders]toQueue[billing]");
    assertThat(AmqpBinding.id("orders", EXCHANGE, "audit")).isEqualTo("[orders]toExchange[audit]");
  }

  @Test
  void lastRegistrationWins() {
    AmqpBinding first = binding("orders", QUEUE, "billing", "order.*");
    AmqpBinding second = binding("orders", QUEUE, "billing", "order.created");
    assertThat(registry.register(first)).isNull();
    assertThat(registry.register(second)).isSameAs(first);
    assertThat(registry.binding(first.id())).isSameAs(second);
    assertThat(registry.unregister(first)).isFalse();
    assertThat(registry.binding(first.id())).isSameAs(second);

    AmqpExchange exchange = exchange("orders");
    AmqpExchange replacement = exchange("orders");
    registry.register(exchange);
    assertThat(registry.register(replacement)).isSameAs(exchange);
    assertThat(registry.exchange("orders")).isSameAs(replacement);
  }

  @Test
  void registerIfAbsentKeepsExistingQueue() {
    AmqpQueue queue = queue("orders.app.host.1");
    assertThat(registry.registerIfAbsent(queue)).isTrue();
    assertThat(registry.registerIfAbsent(queue("orders.app.host.1"))).isFalse();
    assertThat(registry.queue("orders.app.host.1")).isSameAs(queue);
  }

  @Test
  void unregisteringExchangeDropsItsBindings() {
    AmqpExchange orders = exchange("orders");
    registry.register(orders);
    registry.register(exchange("audit"));
    registry.register(queue("billing"));
    AmqpBinding toQueue = binding("orders", QUEUE, "billing", "");
    AmqpBinding toExchange = binding("audit", EXCHANGE, "orders", "");
    AmqpBinding unrelated = binding("audit", QUEUE, "billing", "");
    registry.register(toQueue);
    registry.register(toExchange);
    registry.register(unrelated);

    assertThat(registry.unregister(orders)).containsExactlyInAnyOrder(toQueue, toExchange);
    assertThat(registry.exchange("orders")).isNull();
    assertThat(registry.snapshot().bindings()).containsExactly(unrelated);
  }

  @Test
  void unregisteringQueueDropsBindingsToIt() {
    AmqpQueue billing = queue("billing");
    registry.register(billing);
    AmqpBinding toQueue = binding("orders", QUEUE, "billing", "");
    AmqpBinding toSameNamedExchange = binding("orders", EXCHANGE, "billing", "");
    registry.register(toQueue);
    registry.register(toSameNamedExchange);

    assertThat(registry.unregister(billing)).containsExactly(toQueue);
    assertThat(registry.snapshot().bindings()).containsExactly(toSameNamedExchange);
  }

  @Test
  void unregisteringReplacedInstanceKeepsEverything() {
    AmqpQueue old = queue("billing");
    AmqpQueue current = queue("billing");
    registry.register(old);
    registry.register(current);
    registry.register(binding("orders", QUEUE, "billing", ""));

    assertThat(registry.unregister(old)).isEmpty();
    assertThat(registry.queue("billing")).isSameAs(current);
    assertThat(registry.snapshot().bindings()).hasSize(1);
  }

  @Test
  void snapshotVisitsExchangesThenQueuesThenBindings() {
    registry.register(binding("orders", QUEUE, "billing", ""));
    registry.register(queue("billing"));
    registry.register(exchange("orders"));
    List<String> visited = new ArrayList<>();
    TopologyRegistry.Snapshot snapshot = registry.snapshot();
    snapshot.accept(
        new TopologyRegistry.Visitor() {
          @Override
          public void visitExchanges(List<AmqpExchange> exchanges) {
            exchanges.forEach(e -> visited.add("exchange " + e.name()));
          }

          @Override
          public void visitQueues(List<AmqpQueue> queues) {
            queues.forEach(q -> visited.add("queue " + q.name()));
          }

          @Override
          public void visitBindings(List<AmqpBinding> bindings) {
            bindings.forEach(b -> visited.add("binding " + b.id()));
          }
        });
    assertThat(visited)
        .containsExactly("exchange orders", "queue billing", "binding [orders]toQueue[billing]");
    assertThat(snapshot.all()).hasSize(3);
    assertThat(snapshot).hasToString("1 exchange(s), 1 queue(s), 1 binding(s)");

    registry.register(exchange("audit"));
    assertThat(snapshot.exchanges()).hasSize(1);
  }

  private static AmqpExchange exchange(String name) {
    return new AmqpExchange(null, name, Exchange.Type.TOPIC, null, List.of());
  }

  private static AmqpQueue queue(String name) {
    return new AmqpQueue(null, name, null, List.of());
  }

  private static AmqpBinding binding(
      String source, Binding.DestinationType type, String destination, String pattern) {
    return new AmqpBinding(null, source, type, destination, pattern, null, List.of());
  }
}
