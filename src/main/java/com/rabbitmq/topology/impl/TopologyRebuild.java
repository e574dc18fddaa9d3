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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets up registered objects again on a new connection.
 *
 * <p>Exchanges come first, then queues (with their consumer), then bindings. A binding looks up
 * its source and destination by name, so it uses the objects registered at the time of the
 * rebuild. The setups started by the rebuild are kept, so that their failures are reported even
 * if the failing objects already left the registry.
 */
final class TopologyRebuild implements TopologyRegistry.Visitor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopologyRebuild.class);

  private final String connectionName;
  private final List<CompletableFuture<?>> setups = new CopyOnWriteArrayList<>();

  TopologyRebuild(String connectionName) {
    this.connectionName = connectionName;
  }

  @Override
  public void visitExchanges(List<AmqpExchange> exchanges) {
    LOGGER.debug("Rebuilding {} exchange(s) of '{}'", exchanges.size(), this.connectionName);
    exchanges.forEach(exchange -> this.setups.add(exchange.recover()));
  }

  @Override
  public void visitQueues(List<AmqpQueue> queues) {
    LOGGER.debug("Rebuilding {} queue(s) of '{}'", queues.size(), this.connectionName);
    for (AmqpQueue queue : queues) {
      this.setups.add(queue.recover());
      CompletableFuture<?> consumer = queue.consumer();
      if (consumer != null) {
        this.setups.add(consumer);
      }
    }
  }

  @Override
  public void visitBindings(List<AmqpBinding> bindings) {
    LOGGER.debug("Rebuilding {} binding(s) of '{}'", bindings.size(), this.connectionName);
    bindings.forEach(binding -> this.setups.add(binding.recover()));
  }

  /** Readiness futures of the setups started by the rebuild. */
  List<CompletableFuture<?>> setups() {
    return this.setups;
  }

  /** Discards the current session of objects before a rebuild. */
  static final class Suspension implements TopologyRegistry.Visitor {

    @Override
    public void visitExchanges(List<AmqpExchange> exchanges) {
      exchanges.forEach(TopologyObject::suspend);
    }

    @Override
    public void visitQueues(List<AmqpQueue> queues) {
      queues.forEach(TopologyObject::suspend);
    }

    @Override
    public void visitBindings(List<AmqpBinding> bindings) {
      bindings.forEach(TopologyObject::suspend);
    }
  }
}
