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

/** Options to start a consumer. */
public class ConsumerOptions {

  private boolean autoAck = false;
  private boolean exclusive = false;
  private int prefetch = 0;
  private String consumerTag = "";
  private final Map<String, Object> arguments = new LinkedHashMap<>();

  /**
   * Whether the broker considers messages acknowledged as soon as they are sent.
   *
   * <p>Default is <code>false</code>: the library acknowledges each message after the handler
   * returns.
   *
   * @param autoAck automatic acknowledgment flag
   * @return the options
   */
  public ConsumerOptions autoAck(boolean autoAck) {
    this.autoAck = autoAck;
    return this;
  }

  public ConsumerOptions exclusive(boolean exclusive) {
    this.exclusive = exclusive;
    return this;
  }

  /**
   * Maximum number of unacknowledged messages for the consumer.
   *
   * <p>Default is 0 (no limit).
   *
   * @param prefetch prefetch count
   * @return the options
   */
  public ConsumerOptions prefetch(int prefetch) {
    if (prefetch < 0) {
      throw new IllegalArgumentException("Prefetch cannot be negative");
    }
    this.prefetch = prefetch;
    return this;
  }

  /**
   * Tag of the consumer.
   *
   * <p>The broker generates a tag if none is set.
   *
   * @param consumerTag consumer tag
   * @return the options
   */
  public ConsumerOptions consumerTag(String consumerTag) {
    this.consumerTag = consumerTag == null ? "" : consumerTag;
    return this;
  }

  public ConsumerOptions argument(String key, Object value) {
    this.arguments.put(key, value);
    return this;
  }

  public boolean isAutoAck() {
    return this.autoAck;
  }

  public boolean isExclusive() {
    return this.exclusive;
  }

  public int prefetch() {
    return this.prefetch;
  }

  public String consumerTag() {
    return this.consumerTag;
  }

  public Map<String, Object> arguments() {
    return Collections.unmodifiableMap(this.arguments);
  }
}
