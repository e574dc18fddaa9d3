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
import com.rabbitmq.topology.Binding;
import com.rabbitmq.topology.ConsumerOptions;
import com.rabbitmq.topology.Exchange;
import com.rabbitmq.topology.ExchangeOptions;
import com.rabbitmq.topology.MessageHandler;
import com.rabbitmq.topology.PublishOptions;
import com.rabbitmq.topology.QueueOptions;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpExchange extends TopologyObject implements Exchange {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpExchange.class);

  private final Type type;
  private final ExchangeOptions options;

  AmqpExchange(
      AmqpConnection connection,
      String name,
      Type type,
      ExchangeOptions options,
      List<StateListener> listeners) {
    super(connection, name, listeners);
    this.type = type;
    this.options = options == null ? new ExchangeOptions() : options;
  }

  @Override
  public Type type() {
    return this.type;
  }

  @Override
  public CompletableFuture<Exchange> initialized() {
    return this.channel().thenApply(ch -> this);
  }

  @Override
  CompletableFuture<BrokerChannel> declare() {
    return this.connection
        .initialized()
        .thenApplyAsync(
            ignored -> {
              BrokerChannel ch = this.connection.createChannel();
              try {
                ch.assertExchange(this.name(), this.type.value(), this.options);
                return ch;
              } catch (Exception e) {
                this.connection.closeChannel(ch);
                throw ExceptionUtils.convertChannelOperation(
                    e, "Could not declare exchange '%s'", this.name());
              }
            },
            this.connection.operationExecutor());
  }

  @Override
  void rollback() {
    this.connection.registry().unregister(this).forEach(binding -> binding.closed(null));
  }

  @Override
  public CompletableFuture<Void> publish(Object content) {
    return this.publish(content, "", null);
  }

  @Override
  public CompletableFuture<Void> publish(Object content, String routingKey) {
    return this.publish(content, routingKey, null);
  }

  @Override
  public CompletableFuture<Void> publish(
      Object content, String routingKey, PublishOptions options) {
    this.checkOpen();
    OutboundMessage message = this.connection.codec().encode(content, options, false);
    String key = routingKey == null ? "" : routingKey;
    return this.connection.publish(
        this,
        name -> this.connection.registry().exchange(name),
        ch -> ch.publish(this.name(), key, message));
  }

  @Override
  public CompletableFuture<Binding> bind(Exchange source) {
    return this.bind(source, "", null);
  }

  @Override
  public CompletableFuture<Binding> bind(Exchange source, String pattern) {
    return this.bind(source, pattern, null);
  }

  @Override
  public CompletableFuture<Binding> bind(
      Exchange source, String pattern, Map<String, Object> arguments) {
    this.checkOpen();
    return this.connection
        .bind(source.name(), Binding.DestinationType.EXCHANGE, this.name(), pattern, arguments)
        .initialized();
  }

  @Override
  public CompletableFuture<Void> unbind(Exchange source) {
    this.checkOpen();
    return this.connection.unbind(
        AmqpBinding.id(source.name(), Binding.DestinationType.EXCHANGE, this.name()));
  }

  @Override
  public CompletableFuture<Void> startConsumer(MessageHandler handler) {
    return this.startConsumer(handler, null);
  }

  @Override
  public CompletableFuture<Void> startConsumer(MessageHandler handler, ConsumerOptions options) {
    this.checkOpen();
    String queueName = this.consumerQueueName();
    AmqpQueue queue =
        this.connection.declareQueueIfAbsent(queueName, new QueueOptions().durable(false));
    if (queue == null) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpConsumerConflictException(
              "A consumer is already registered on exchange '%s'", this.name()));
    }
    LOGGER.debug("Starting consumer of exchange '{}' on queue '{}'", this.name(), queueName);
    CompletableFuture<Binding> binding = queue.bind(this);
    CompletableFuture<String> consumer = queue.startConsumer(handler, options);
    return CompletableFuture.allOf(queue.initialized(), binding, consumer);
  }

  @Override
  public CompletableFuture<Void> stopConsumer() {
    this.checkOpen();
    String queueName = this.consumerQueueName();
    AmqpQueue queue = this.connection.registry().queue(queueName);
    if (queue == null) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpConsumerAbsentException(
              "No consumer registered on exchange '%s'", this.name()));
    }
    LOGGER.debug("Stopping consumer of exchange '{}' on queue '{}'", this.name(), queueName);
    String bindingId = AmqpBinding.id(this.name(), Binding.DestinationType.QUEUE, queueName);
    List<Supplier<CompletableFuture<?>>> steps =
        List.of(
            queue::stopConsumer,
            () -> {
              AmqpBinding binding = this.connection.registry().binding(bindingId);
              return binding == null ? CompletableFuture.completedFuture(null) : binding.delete();
            },
            queue::delete);
    return Utils.runInSequence(steps);
  }

  @Override
  public String consumerQueueName() {
    return this.connection.processIdentity().consumerQueueName(this.name());
  }

  @Override
  public CompletableFuture<Void> delete() {
    this.closing();
    LOGGER.debug("Deleting exchange '{}'", this.name());
    return this.deleted(
        this.onChannel(
            ch -> {
              ch.deleteExchange(this.name());
              return null;
            },
            "Could not delete exchange '%s'",
            this.name()));
  }

  @Override
  public String toString() {
    return "exchange '" + this.name() + "' (" + this.type.value() + ")";
  }
}
