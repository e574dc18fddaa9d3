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

import com.rabbitmq.topology.ConsumerOptions;
import com.rabbitmq.topology.ExchangeOptions;
import com.rabbitmq.topology.QueueOptions;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * A channel of a {@link BrokerConnection}.
 *
 * <p>Operations block until the broker replies, except publishing. A failure closes the channel.
 */
interface BrokerChannel extends AutoCloseable {

  void assertExchange(String name, String type, ExchangeOptions options) throws IOException;

  void assertQueue(String name, QueueOptions options) throws IOException;

  void bindQueue(String queue, String source, String pattern, Map<String, Object> arguments)
      throws IOException;

  void bindExchange(
      String destination, String source, String pattern, Map<String, Object> arguments)
      throws IOException;

  void unbindQueue(String queue, String source, String pattern, Map<String, Object> arguments)
      throws IOException;

  void unbindExchange(
      String destination, String source, String pattern, Map<String, Object> arguments)
      throws IOException;

  /** Fire-and-forget publish, throws if the channel is not usable. */
  void publish(String exchange, String routingKey, OutboundMessage message) throws IOException;

  /** Publish to a queue through the default exchange. */
  void sendToQueue(String queue, OutboundMessage message) throws IOException;

  /**
   * Start consuming from a queue.
   *
   * @return the consumer tag
   */
  String consume(String queue, ConsumerOptions options, DeliveryCallback callback)
      throws IOException;

  void cancel(String consumerTag) throws IOException;

  void ack(long deliveryTag) throws IOException;

  void nack(long deliveryTag, boolean requeue) throws IOException;

  void deleteExchange(String name) throws IOException;

  void deleteQueue(String name) throws IOException;

  boolean isOpen();

  @Override
  void close() throws IOException, TimeoutException;
}
