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

import java.util.Collections;
import java.util.Map;

/** A message as delivered by the broker. */
final class Delivery {

  private final long deliveryTag;
  private final boolean redelivered;
  private final String exchange;
  private final String routingKey;
  private final String contentType;
  private final Map<String, Object> headers;
  private final byte[] body;

  Delivery(
      long deliveryTag,
      boolean redelivered,
      String exchange,
      String routingKey,
      String contentType,
      Map<String, Object> headers,
      byte[] body) {
    this.deliveryTag = deliveryTag;
    this.redelivered = redelivered;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.contentType = contentType;
    this.headers = headers == null ? Collections.emptyMap() : headers;
    this.body = body;
  }

  long deliveryTag() {
    return this.deliveryTag;
  }

  boolean redelivered() {
    return this.redelivered;
  }

  String exchange() {
    return this.exchange;
  }

  String routingKey() {
    return this.routingKey;
  }

  String contentType() {
    return this.contentType;
  }

  Map<String, Object> headers() {
    return this.headers;
  }

  byte[] body() {
    return this.body;
  }
}
