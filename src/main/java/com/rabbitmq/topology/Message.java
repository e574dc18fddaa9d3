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

/** A consumed message. */
public interface Message {

  /**
   * The decoded payload.
   *
   * <p>A message with the <code>application/json</code> content type is parsed into maps, lists,
   * strings, numbers (as {@link Double}), and booleans. Any other message is returned as a UTF-8
   * {@link String}.
   *
   * @return the payload
   */
  Object payload();

  /**
   * Decode the JSON body into the given type.
   *
   * @param type target type
   * @return the decoded payload
   * @param <T> target type
   */
  <T> T payload(Class<T> type);

  byte[] body();

  /**
   * The content type, can be null.
   *
   * @return content type
   */
  String contentType();

  String exchange();

  String routingKey();

  Map<String, Object> headers();

  boolean redelivered();
}
