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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Options to declare a queue. */
public class QueueOptions {

  private boolean durable = true;
  private boolean exclusive = false;
  private boolean autoDelete = false;
  private final Map<String, Object> arguments = new LinkedHashMap<>();

  /**
   * Whether the queue survives a broker restart.
   *
   * <p>Default is <code>true</code>.
   *
   * @param durable durable flag
   * @return the options
   */
  public QueueOptions durable(boolean durable) {
    this.durable = durable;
    return this;
  }

  /**
   * Whether the queue is used by only one connection and deleted when that connection closes.
   *
   * @param exclusive exclusive flag
   * @return the options
   */
  public QueueOptions exclusive(boolean exclusive) {
    this.exclusive = exclusive;
    return this;
  }

  /**
   * Whether the queue is deleted when its last consumer unsubscribes.
   *
   * @param autoDelete auto-delete flag
   * @return the options
   */
  public QueueOptions autoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  /**
   * Time-to-live of messages in the queue.
   *
   * @param ttlInMs time-to-live in milliseconds
   * @return the options
   */
  public QueueOptions messageTtl(long ttlInMs) {
    return this.argument("x-message-ttl", ttlInMs);
  }

  public QueueOptions deadLetterExchange(String deadLetterExchange) {
    return this.argument("x-dead-letter-exchange", deadLetterExchange);
  }

  public QueueOptions maxLength(long maxLength) {
    return this.argument("x-max-length", maxLength);
  }

  public QueueOptions argument(String key, Object value) {
    this.arguments.put(key, value);
    return this;
  }

  public boolean isDurable() {
    return this.durable;
  }

  public boolean isExclusive() {
    return this.exclusive;
  }

  public boolean isAutoDelete() {
    return this.autoDelete;
  }

  public Map<String, Object> arguments() {
    return Collections.unmodifiableMap(this.arguments);
  }

  @Override
  public String toString() {
    return "QueueOptions{"
        + "durable="
        + durable
        + ", exclusive="
        + exclusive
        + ", autoDelete="
        + autoDelete
        + ", arguments="
        + arguments
        + '}';
  }
}
