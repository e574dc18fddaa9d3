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
import com.rabbitmq.topology.MessageHandler;
import com.rabbitmq.topology.PublishOptions;
import com.rabbitmq.topology.Queue;
import com.rabbitmq.topology.QueueOptions;
import com.rabbitmq.topology.metrics.MetricsCollector;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue with an optional consumer.
 *
 * <p>The consumer is part of the queue state: it is restarted with the same handler and options
 * after a connection rebuild.
 */
final class AmqpQueue extends TopologyObject implements Queue {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpQueue.class);

  private final QueueOptions options;
  private final Lock consumerLock = new ReentrantLock();
  // guarded by consumerLock
  private MessageHandler handler;
  private ConsumerOptions consumerOptions;
  private CompletableFuture<ActiveConsumer> consumer;

  AmqpQueue(
      AmqpConnection connection, String name, QueueOptions options, List<StateListener> listeners) {
    super(connection, name, listeners);
    this.options = options == null ? new QueueOptions() : options;
  }

  @Override
  public CompletableFuture<Queue> initialized() {
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
                ch.assertQueue(this.name(), this.options);
                return ch;
              } catch (Exception e) {
                this.connection.closeChannel(ch);
                throw ExceptionUtils.convertChannelOperation(
                    e, "Could not declare queue '%s'", this.name());
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
    return this.publish(content, null);
  }

  @Override
  public CompletableFuture<Void> publish(Object content, PublishOptions options) {
    this.checkOpen();
    OutboundMessage message = this.connection.codec().encode(content, options, true);
    return this.connection.publish(
        this,
        name -> this.connection.registry().queue(name),
        ch -> ch.sendToQueue(this.name(), message));
  }

  @Override
  public CompletableFuture<String> startConsumer(MessageHandler handler) {
    return this.startConsumer(handler, null);
  }

  @Override
  public CompletableFuture<String> startConsumer(
      MessageHandler handler, ConsumerOptions options) {
    if (handler == null) {
      throw new IllegalArgumentException("Message handler cannot be null");
    }
    this.checkOpen();
    CompletableFuture<ActiveConsumer> started = new CompletableFuture<>();
    this.consumerLock.lock();
    try {
      if (this.handler != null) {
        return CompletableFuture.failedFuture(
            new AmqpException.AmqpConsumerConflictException(
                "A consumer is already registered on queue '%s'", this.name()));
      }
      this.handler = handler;
      this.consumerOptions = options == null ? new ConsumerOptions() : options;
      this.consumer = started;
    } finally {
      this.consumerLock.unlock();
    }
    LOGGER.debug("Starting consumer on queue '{}'", this.name());
    this.consume(started);
    return started.thenApply(ActiveConsumer::tag);
  }

  private void consume(CompletableFuture<ActiveConsumer> target) {
    MessageHandler messageHandler;
    ConsumerOptions options;
    this.consumerLock.lock();
    try {
      messageHandler = this.handler;
      options = this.consumerOptions;
    } finally {
      this.consumerLock.unlock();
    }
    if (messageHandler == null) {
      target.completeExceptionally(
          new AmqpException.AmqpConsumerAbsentException(
              "Consumer on queue '%s' has been stopped", this.name()));
      return;
    }
    this.onChannel(
            ch -> {
              String tag =
                  ch.consume(
                      this.name(), options, delivery -> this.dispatch(ch, options, delivery));
              return new ActiveConsumer(ch, tag);
            },
            "Could not start consumer on queue '%s'",
            this.name())
        .whenComplete(
            (activeConsumer, ex) -> {
              if (ex == null) {
                if (target.complete(activeConsumer)) {
                  LOGGER.debug(
                      "Consumer {} started on queue '{}'", activeConsumer.tag(), this.name());
                  this.connection.metricsCollector().openConsumer();
                } else {
                  // stopped or closed in the meantime
                  this.connection.execute(
                      "consumer cancellation",
                      () -> activeConsumer.channel().cancel(activeConsumer.tag()));
                }
              } else {
                AmqpException cause = ExceptionUtils.convert(ex);
                if (!ExceptionUtils.isConnectionFailure(cause)) {
                  this.clearConsumer(target);
                }
                target.completeExceptionally(cause);
              }
            });
  }

  private void clearConsumer(CompletableFuture<ActiveConsumer> expected) {
    this.consumerLock.lock();
    try {
      if (this.consumer == expected) {
        this.handler = null;
        this.consumerOptions = null;
        this.consumer = null;
      }
    } finally {
      this.consumerLock.unlock();
    }
  }

  private void dispatch(BrokerChannel ch, ConsumerOptions options, Delivery delivery) {
    if (delivery == null) {
      LOGGER.debug("Consumer on queue '{}' has been cancelled", this.name());
      return;
    }
    MessageHandler messageHandler = this.currentHandler();
    boolean autoAck = options.isAutoAck();
    if (messageHandler == null) {
      // consumer stopped, the broker redelivers the message
      this.nack(ch, autoAck, delivery, true);
      return;
    }
    MetricsCollector metrics = this.connection.metricsCollector();
    metrics.consume();
    try {
      messageHandler.handle(new AmqpMessage(delivery, this.connection.codec()));
    } catch (Exception e) {
      LOGGER.warn("Error while handling message from queue '{}'", this.name(), e);
      this.nack(ch, autoAck, delivery, false);
      metrics.consumeDisposition(MetricsCollector.ConsumeDisposition.DISCARDED);
      return;
    }
    this.ack(ch, autoAck, delivery);
    metrics.consumeDisposition(MetricsCollector.ConsumeDisposition.ACCEPTED);
  }

  private void ack(BrokerChannel ch, boolean autoAck, Delivery delivery) {
    if (!autoAck) {
      try {
        ch.ack(delivery.deliveryTag());
      } catch (Exception e) {
        LOGGER.debug(
            "Could not acknowledge message {} on queue '{}': {}",
            delivery.deliveryTag(),
            this.name(),
            e.getMessage());
      }
    }
  }

  private void nack(BrokerChannel ch, boolean autoAck, Delivery delivery, boolean requeue) {
    if (!autoAck) {
      try {
        ch.nack(delivery.deliveryTag(), requeue);
      } catch (Exception e) {
        LOGGER.debug(
            "Could not reject message {} on queue '{}': {}",
            delivery.deliveryTag(),
            this.name(),
            e.getMessage());
      }
    }
  }

  private MessageHandler currentHandler() {
    this.consumerLock.lock();
    try {
      return this.handler;
    } finally {
      this.consumerLock.unlock();
    }
  }

  boolean hasConsumer() {
    return this.currentHandler() != null;
  }

  /** Future of the active consumer, null if there is no consumer. */
  CompletableFuture<?> consumer() {
    this.consumerLock.lock();
    try {
      return this.consumer;
    } finally {
      this.consumerLock.unlock();
    }
  }

  @Override
  public CompletableFuture<Void> stopConsumer() {
    this.checkOpen();
    CompletableFuture<ActiveConsumer> active;
    this.consumerLock.lock();
    try {
      if (this.handler == null) {
        return CompletableFuture.failedFuture(
            new AmqpException.AmqpConsumerAbsentException(
                "No consumer registered on queue '%s'", this.name()));
      }
      active = this.consumer;
      this.handler = null;
      this.consumerOptions = null;
      this.consumer = null;
    } finally {
      this.consumerLock.unlock();
    }
    LOGGER.debug("Stopping consumer on queue '{}'", this.name());
    boolean startPending =
        active.completeExceptionally(
            new AmqpException.AmqpConsumerAbsentException(
                "Consumer on queue '%s' has been stopped", this.name()));
    if (startPending || active.isCompletedExceptionally()) {
      // no broker consumer to cancel
      return CompletableFuture.completedFuture(null);
    }
    return active.thenAcceptAsync(
        activeConsumer -> {
          try {
            activeConsumer.channel().cancel(activeConsumer.tag());
          } catch (Exception e) {
            throw ExceptionUtils.convertChannelOperation(
                e, "Could not stop consumer on queue '%s'", this.name());
          }
          this.connection.metricsCollector().closeConsumer();
        },
        this.connection.operationExecutor());
  }

  @Override
  void suspend() {
    super.suspend();
    CompletableFuture<ActiveConsumer> previous;
    CompletableFuture<ActiveConsumer> fresh = new CompletableFuture<>();
    this.consumerLock.lock();
    try {
      previous = this.consumer;
      if (previous == null) {
        return;
      }
      this.consumer = fresh;
    } finally {
      this.consumerLock.unlock();
    }
    if (previous.isDone()) {
      if (!previous.isCompletedExceptionally()) {
        this.connection.metricsCollector().closeConsumer();
      }
    } else {
      fresh.whenComplete(
          (activeConsumer, ex) -> {
            if (ex == null) {
              previous.complete(activeConsumer);
            } else {
              previous.completeExceptionally(ex);
            }
          });
    }
  }

  @Override
  CompletableFuture<BrokerChannel> recover() {
    CompletableFuture<BrokerChannel> ready = super.recover();
    CompletableFuture<ActiveConsumer> target;
    this.consumerLock.lock();
    try {
      target = this.consumer;
    } finally {
      this.consumerLock.unlock();
    }
    if (target != null) {
      LOGGER.debug("Restarting consumer on queue '{}'", this.name());
      this.consume(target);
    }
    return ready;
  }

  @Override
  void closed(Throwable cause) {
    CompletableFuture<ActiveConsumer> previous;
    this.consumerLock.lock();
    try {
      previous = this.consumer;
      this.handler = null;
      this.consumerOptions = null;
      this.consumer = null;
    } finally {
      this.consumerLock.unlock();
    }
    if (previous != null) {
      if (previous.isDone() && !previous.isCompletedExceptionally()) {
        this.connection.metricsCollector().closeConsumer();
      } else {
        previous.completeExceptionally(
            new AmqpException.AmqpResourceClosedException(this + " is closed", cause));
      }
    }
    super.closed(cause);
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
        .bind(source.name(), Binding.DestinationType.QUEUE, this.name(), pattern, arguments)
        .initialized();
  }

  @Override
  public CompletableFuture<Void> unbind(Exchange source) {
    this.checkOpen();
    return this.connection.unbind(
        AmqpBinding.id(source.name(), Binding.DestinationType.QUEUE, this.name()));
  }

  @Override
  public CompletableFuture<Void> delete() {
    this.closing();
    LOGGER.debug("Deleting queue '{}'", this.name());
    return this.deleted(
        this.onChannel(
            ch -> {
              ch.deleteQueue(this.name());
              return null;
            },
            "Could not delete queue '%s'",
            this.name()));
  }

  @Override
  public String toString() {
    return "queue '" + this.name() + "'";
  }

  private static final class ActiveConsumer {

    private final BrokerChannel channel;
    private final String tag;

    private ActiveConsumer(BrokerChannel channel, String tag) {
      this.channel = channel;
      this.tag = tag;
    }

    BrokerChannel channel() {
      return this.channel;
    }

    String tag() {
      return this.tag;
    }
  }
}
