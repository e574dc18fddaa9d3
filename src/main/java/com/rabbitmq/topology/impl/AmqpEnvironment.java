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

import com.rabbitmq.topology.ConnectionBuilder;
import com.rabbitmq.topology.Environment;
import com.rabbitmq.topology.metrics.MetricsCollector;
import com.rabbitmq.topology.metrics.NoOpMetricsCollector;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class AmqpEnvironment implements Environment {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpEnvironment.class);
  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final DefaultConnectionSettings<?> connectionSettings =
      DefaultConnectionSettings.instance();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final boolean internalScheduledExecutor;
  private final ScheduledExecutorService scheduledExecutorService;
  private final MetricsCollector metricsCollector;
  private final BrokerClient brokerClient;
  private final ProcessIdentity processIdentity;
  private final ShutdownHookSupport.Hooks shutdownHooks;
  private final ContentCodec codec = new ContentCodec();
  private final Set<AmqpConnection> connections = ConcurrentHashMap.newKeySet();

  AmqpEnvironment(
      ScheduledExecutorService scheduledExecutorService,
      DefaultConnectionSettings<?> connectionSettings,
      MetricsCollector metricsCollector,
      BrokerClient brokerClient,
      ProcessIdentity processIdentity,
      ShutdownHookSupport.Hooks shutdownHooks) {
    this.id = ID_SEQUENCE.getAndIncrement();
    connectionSettings.copyTo(this.connectionSettings);
    if (scheduledExecutorService == null) {
      String threadPrefix = String.format("rabbitmq-topology-environment-%d-scheduler-", this.id);
      this.scheduledExecutorService =
          Executors.newScheduledThreadPool(1, Utils.threadFactory(threadPrefix));
      this.internalScheduledExecutor = true;
    } else {
      this.scheduledExecutorService = scheduledExecutorService;
      this.internalScheduledExecutor = false;
    }
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    this.brokerClient = brokerClient == null ? new RabbitMqBrokerClient() : brokerClient;
    this.processIdentity = processIdentity == null ? ProcessIdentity.current() : processIdentity;
    this.shutdownHooks = shutdownHooks == null ? ShutdownHookSupport.RUNTIME_HOOKS : shutdownHooks;
  }

  DefaultConnectionSettings<?> connectionSettings() {
    return this.connectionSettings;
  }

  @Override
  public ConnectionBuilder connectionBuilder() {
    if (this.closed.get()) {
      throw new IllegalStateException("Environment " + this + " is closed");
    }
    return new AmqpConnectionBuilder(this);
  }

  AmqpConnection connection(AmqpConnectionBuilder builder) {
    if (this.closed.get()) {
      throw new IllegalStateException("Environment " + this + " is closed");
    }
    AmqpConnection connection = new AmqpConnection(builder);
    this.connections.add(connection);
    connection.start();
    return connection;
  }

  void removeConnection(AmqpConnection connection) {
    this.connections.remove(connection);
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing environment {}", this);
      List<AmqpConnection> toClose = new ArrayList<>(this.connections);
      for (AmqpConnection connection : toClose) {
        try {
          connection.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing {}: {}", connection, e.getMessage());
        }
      }
      if (this.internalScheduledExecutor) {
        this.scheduledExecutorService.shutdownNow();
      }
      LOGGER.debug("Environment {} has been closed", this);
    }
  }

  ScheduledExecutorService scheduledExecutorService() {
    return this.scheduledExecutorService;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  BrokerClient brokerClient() {
    return this.brokerClient;
  }

  ProcessIdentity processIdentity() {
    return this.processIdentity;
  }

  ShutdownHookSupport.Hooks shutdownHooks() {
    return this.shutdownHooks;
  }

  ContentCodec codec() {
    return this.codec;
  }

  int connectionCount() {
    return this.connections.size();
  }

  @Override
  public String toString() {
    return "rabbitmq-topology-" + this.id;
  }
}
