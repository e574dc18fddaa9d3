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
 * Handle on a declared queue.
 *
 * @see Connection#declareQueue(String, QueueOptions)
 */
public interface Queue extends Resource {

  String name();

  /**
   * Readiness of the queue.
   *
   * <p>A new readiness is used after each connection recovery.
   *
   * @return the queue readiness
   */
  CompletableFuture<Queue> initialized();

  CompletableFuture<Void> publish(Object content);

  /**
   * Send a message directly to the queue.
   *
   * <p>Same content rules and retry policy as {@link Exchange#publish(Object, String,
   * PublishOptions)}, except that JSON content always uses the <code>application/json</code>
   * content type.
   *
   * @param content message content
   * @param options publish options, can be null
   * @return the publish completion
   */
  CompletableFuture<Void> publish(Object content, PublishOptions options);

  CompletableFuture<String> startConsumer(MessageHandler handler);

  /**
   * Start a consumer on the queue.
   *
   * <p>Each message is decoded and passed to the handler, then acknowledged (unless the options
   * ask for automatic acknowledgment). The consumer is restarted after a connection recovery.
   *
   * <p>Completes exceptionally with an {@link AmqpException.AmqpConsumerConflictException} if a
   * consumer is already started on this queue.
   *
   * @param handler message handler
   * @param options consumer options, can be null
   * @return the consumer tag
   */
  CompletableFuture<String> startConsumer(MessageHandler handler, ConsumerOptions options);

  /**
   * Cancel the consumer.
   *
   * <p>Completes exceptionally with an {@link AmqpException.AmqpConsumerAbsentException} if no
   * consumer is started.
   *
   * @return the cancel completion
   */
  CompletableFuture<Void> stopConsumer();

  CompletableFuture<Binding> bind(Exchange source);

  CompletableFuture<Binding> bind(Exchange source, String pattern);

  /**
   * Bind this queue to a source exchange.
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
   * Remove the binding between a source exchange and this queue.
   *
   * @param source source exchange
   * @return the unbind completion
   */
  CompletableFuture<Void> unbind(Exchange source);

  /**
   * Delete the queue on the broker.
   *
   * <p>The handle must not be used after the deletion.
   *
   * @return the deletion completion
   */
  CompletableFuture<Void> delete();
}
