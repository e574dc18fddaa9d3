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
 * A routing rule between a source exchange and a destination queue or exchange.
 *
 * @see Queue#bind(Exchange, String, Map)
 * @see Exchange#bind(Exchange, String, Map)
 */
public interface Binding extends Resource {

  /**
   * Name of the source exchange.
   *
   * @return source name
   */
  String source();

  /**
   * Name of the destination queue or exchange.
   *
   * @return destination name
   */
  String destination();

  DestinationType destinationType();

  String pattern();

  Map<String, Object> arguments();

  CompletableFuture<Binding> initialized();

  /**
   * Remove the binding on the broker.
   *
   * @return the deletion completion
   */
  CompletableFuture<Void> delete();

  /** The kind of destination of a binding. */
  enum DestinationType {
    QUEUE,
    EXCHANGE
  }
}
