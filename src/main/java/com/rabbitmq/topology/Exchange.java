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
package com.rabbitmq.topology;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on a declared exchange.
 *
 * @see Connection#declareExchange(String, Type, ExchangeOptions)
 */
public interface Exchange extends Resource {

  String name();

  Type type();

  /**
   * Readiness of the exchange.
   *
   * <p>A new readiness is used after each connection recovery.
   *
   * @return the exchange readiness
   */
  CompletableFuture<Exchange> initialized();

  /**
   * Publish with an empty routing key.
   *
   * @param content message content
   * @return the publish completion
   * @see #publish(Object, String, PublishOptions)
   */
  CompletableFuture<Void> publish(Object content);

  /**
   * Publish a message.
   *
   * @param content message content
   * @param routingKey routing key
   * @return the publish completion
   * @see #publish(Object, String, PublishOptions)
   */
  CompletableFuture<Void> publish(Object content, String routingKey);

  /**
   * Publish a message to the exchange.
   *
   * <p>A {@link String} is sent as its UTF-8 bytes, a <code>byte[]</code> as is. Any other object
   * is sent as JSON with the <code>application/json</code> content type, unless the options set a
   * content type.
   *
   * <p>If the publish fails, the connection is rebuilt and the publish is attempted again once on
   * the exchange currently declared with the same name. The future completes exceptionally with
   * an {@link AmqpException.AmqpPublishException} if the second attempt fails.
   *
   * @param content message content
   * @param routingKey routing key
   * @param options publish options, can be null
   * @return the publish completion
   */
  CompletableFuture<Void> publish(Object content, String routingKey, PublishOptions options);

  /**
   * Bind this exchange to a source exchange with an empty pattern.
   *
   * @param source source exchange
   * @return the binding readiness
   */
  CompletableFuture<Binding> bind(Exchange source);

  CompletableFuture<Binding> bind(Exchange source, String pattern);

  /**
   * Bind this exchange (as destination) to a source exchange.
   *
   * <p>There is only one binding per source and destination: a new binding replaces the previous
   * one in the topology.
   *
   * @param source source exchange
   * @param pattern binding key
   * @param arguments binding arguments, can be null
   * @return the binding readiness
   */
  CompletableFuture<Binding> bind(Exchange source, String pattern, Map<String, Object> arguments);

  /**
   * Remove the binding between a source exchange and this exchange.
   *
   * <p>Completes exceptionally with {@link AmqpException.AmqpEntityNotFoundException} if there is
   * no such binding.
   *
   * @param source source exchange
   * @return the unbind completion
   */
  CompletableFuture<Void> unbind(Exchange source);

  /**
   * Start consuming the messages routed by this exchange.
   *
   * @param handler message handler
   * @return the consumer readiness
   * @see #startConsumer(MessageHandler, ConsumerOptions)
   */
  CompletableFuture<Void> startConsumer(MessageHandler handler);

  /**
   * Start consuming the messages routed by this exchange.
   *
   * <p>The consumer uses a private, non-durable queue named after {@link #consumerQueueName()}
   * and bound to this exchange with an empty pattern. Completes exceptionally with an {@link
   * AmqpException.AmqpConsumerConflictException} if a consumer is already started.
   *
   * @param handler message handler
   * @param options consumer options, can be null
   * @return the consumer readiness
   */
  CompletableFuture<Void> startConsumer(MessageHandler handler, ConsumerOptions options);

  /**
   * Stop the consumer, remove its binding and delete its queue.
   *
   * <p>Completes exceptionally with an {@link AmqpException.AmqpConsumerAbsentException} if no
   * consumer is started.
   *
   * @return the stop completion
   */
  CompletableFuture<Void> stopConsumer();

  /**
   * Name of the queue used by {@link #startConsumer(MessageHandler, ConsumerOptions)}.
   *
   * <p>The name is made of the exchange name, the application name, the hostname, and the process
   * ID, so it is stable for a given process.
   *
   * @return the consumer queue name
   */
  String consumerQueueName();

  /**
   * Delete the exchange on the broker.
   *
   * <p>The handle must not be used after the deletion.
   *
   * @return the deletion completion
   */
  CompletableFuture<Void> delete();

  /**
   * Exchange type.
   *
   * @see <a href="https://www.rabbitmq.com/tutorials/amqp-concepts#exchanges">AMQP 0-9-1
   *     exchanges</a>
   */
  enum Type {
    DIRECT("direct"),
    FANOUT("fanout"),
    TOPIC("topic"),
    HEADERS("headers");

    private final String value;

    Type(String value) {
      this.value = value;
    }

    /**
     * Type as known by the broker.
     *
     * @return the type value
     */
    public String value() {
      return this.value;
    }
  }
}
