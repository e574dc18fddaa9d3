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
package com.rabbitmq.topology.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a new {@link com.rabbitmq.topology.Connection} is opened. */
  void openConnection();

  /** Called when a {@link com.rabbitmq.topology.Connection} is closed. */
  void closeConnection();

  /** Called when a consumer is started on a {@link com.rabbitmq.topology.Queue}. */
  void openConsumer();

  /** Called when a consumer is stopped. */
  void closeConsumer();

  /** Called when a message is published. */
  void publish();

  /** Called when a failed publish is attempted again after a connection rebuild. */
  void publishRetry();

  /** Called when a message is dispatched to a consumer. */
  void consume();

  /**
   * Called when a consumer settles a message.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** Called when a connection starts rebuilding after a failure. */
  void rebuild();

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** The handler returned normally, the message is acknowledged. */
    ACCEPTED,
    /** The handler failed, the message is rejected. */
    DISCARDED
  }
}
