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

/** Options to declare an exchange. */
public class ExchangeOptions {

  private boolean durable = true;
  private boolean autoDelete = false;
  private boolean internal = false;
  private String alternateExchange;
  private final Map<String, Object> arguments = new LinkedHashMap<>();

  /**
   * Whether the exchange survives a broker restart.
   *
   * <p>Default is <code>true</code>.
   *
   * @param durable durable flag
   * @return the options
   */
  public ExchangeOptions durable(boolean durable) {
    this.durable = durable;
    return this;
  }

  /**
   * Whether the exchange is deleted when its last binding is removed.
   *
   * <p>Default is <code>false</code>.
   *
   * @param autoDelete auto-delete flag
   * @return the options
   */
  public ExchangeOptions autoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  /**
   * Whether clients can publish to the exchange directly.
   *
   * @param internal internal flag
   * @return the options
   */
  public ExchangeOptions internal(boolean internal) {
    this.internal = internal;
    return this;
  }

  /**
   * Exchange to route unroutable messages to.
   *
   * @param alternateExchange alternate exchange name
   * @return the options
   */
  public ExchangeOptions alternateExchange(String alternateExchange) {
    this.alternateExchange = alternateExchange;
    return this;
  }

  public ExchangeOptions argument(String key, Object value) {
    this.arguments.put(key, value);
    return this;
  }

  public boolean isDurable() {
    return this.durable;
  }

  public boolean isAutoDelete() {
    return this.autoDelete;
  }

  public boolean isInternal() {
    return this.internal;
  }

  public String alternateExchange() {
    return this.alternateExchange;
  }

  /**
   * Declaration arguments, including the alternate exchange if set.
   *
   * @return the arguments
   */
  public Map<String, Object> arguments() {
    Map<String, Object> result = new LinkedHashMap<>(this.arguments);
    if (this.alternateExchange != null) {
      result.put("alternate-exchange", this.alternateExchange);
    }
    return Collections.unmodifiableMap(result);
  }

  @Override
  public String toString() {
    return "ExchangeOptions{"
        + "durable="
        + durable
        + ", autoDelete="
        + autoDelete
        + ", internal="
        + internal
        + ", arguments="
        + arguments()
        + '}';
  }
}
