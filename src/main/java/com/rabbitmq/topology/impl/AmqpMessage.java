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

import com.rabbitmq.topology.Message;
import java.util.Map;

final class AmqpMessage implements Message {

  private final Delivery delivery;
  private final ContentCodec codec;
  private final Object payload;

  AmqpMessage(Delivery delivery, ContentCodec codec) {
    this.delivery = delivery;
    this.codec = codec;
    this.payload = codec.decode(delivery.body(), delivery.contentType());
  }

  @Override
  public Object payload() {
    return this.payload;
  }

  @Override
  public <T> T payload(Class<T> type) {
    return this.codec.decode(this.delivery.body(), type);
  }

  @Override
  public byte[] body() {
    return this.delivery.body();
  }

  @Override
  public String contentType() {
    return this.delivery.contentType();
  }

  @Override
  public String exchange() {
    return this.delivery.exchange();
  }

  @Override
  public String routingKey() {
    return this.delivery.routingKey();
  }

  @Override
  public Map<String, Object> headers() {
    return this.delivery.headers();
  }

  @Override
  public boolean redelivered() {
    return this.delivery.redelivered();
  }

  @Override
  public String toString() {
    return "AmqpMessage{"
        + "exchange='"
        + exchange()
        + "', routingKey='"
        + routingKey()
        + "', contentType="
        + contentType()
        + ", payload="
        + payload
        + '}';
  }
}
