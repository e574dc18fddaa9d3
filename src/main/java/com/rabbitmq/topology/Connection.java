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

import java.util.concurrent.CompletableFuture;

/**
 * A connection to the broker that owns a topology of exchanges, queues, and bindings.
 *
 * <p>Declaring an entity registers it immediately and returns a handle, the broker-side setup
 * happens asynchronously. {@link #completeConfiguration()} tells when the whole topology is set
 * up.
 *
 * <p>If the underlying connection is lost, the connection reconnects and declares the whole
 * topology again, including active consumers. Handles obtained before the failure keep working.
 */
public interface Connection extends AutoCloseable, Resource {

  /**
   * Readiness of the connection.
   *
   * <p>Completes when the connection is established, completes exceptionally with an {@link
   * AmqpException.AmqpConnectionException} if the connection attempts are exhausted.
   *
   * @return the connection readiness
   */
  CompletableFuture<Void> initialized();

  /**
   * Declare a topic exchange.
   *
   * @param name exchange name
   * @return the exchange handle
   */
  Exchange declareExchange(String name);

  /**
   * Declare an exchange.
   *
   * @param name exchange name
   * @param type exchange type
   * @return the exchange handle
   */
  Exchange declareExchange(String name, Exchange.Type type);

  /**
   * Declare an exchange.
   *
   * @param name exchange name
   * @param type exchange type
   * @param options declaration options
   * @return the exchange handle
   */
  Exchange declareExchange(String name, Exchange.Type type, ExchangeOptions options);

  /**
   * Declare a queue.
   *
   * @param name queue name
   * @return the queue handle
   */
  Queue declareQueue(String name);

  /**
   * Declare a queue.
   *
   * @param name queue name
   * @param options declaration options
   * @return the queue handle
   */
  Queue declareQueue(String name, QueueOptions options);

  /**
   * Wait for the whole declared topology to be set up.
   *
   * <p>The returned future completes once every exchange, queue, binding, and active consumer
   * registered at call time is ready. It completes exceptionally if any of them fails.
   *
   * @return the configuration completion
   */
  CompletableFuture<Void> completeConfiguration();

  /**
   * Delete the whole declared topology.
   *
   * <p>Consumers are stopped first, then bindings, queues, and exchanges are deleted. All deletions
   * are attempted even if some fail. The returned future completes exceptionally with the first
   * failure if any deletion failed, other failures are added as suppressed exceptions.
   *
   * @return the deletion completion
   */
  CompletableFuture<Void> deleteConfiguration();

  /**
   * Close the connection asynchronously.
   *
   * @return the close completion
   */
  CompletableFuture<Void> closeAsync();

  /** Close the connection and wait for the close to complete. */
  @Override
  void close();
}
