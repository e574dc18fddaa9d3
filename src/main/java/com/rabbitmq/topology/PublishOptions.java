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

/** Options to publish a message. */
public class PublishOptions {

  private String contentType;
  private boolean persistent = false;
  private String messageId;
  private String correlationId;
  private String expiration;
  private Integer priority;
  private final Map<String, Object> headers = new LinkedHashMap<>();

  /**
   * Content type of the message.
   *
   * @param contentType content type
   * @return the options
   */
  public PublishOptions contentType(String contentType) {
    this.contentType = contentType;
    return this;
  }

  /**
   * Whether the broker stores the message on disk (if the queue is durable).
   *
   * @param persistent persistent flag
   * @return the options
   */
  public PublishOptions persistent(boolean persistent) {
    this.persistent = persistent;
    return this;
  }

  public PublishOptions messageId(String messageId) {
    this.messageId = messageId;
    return this;
  }

  public PublishOptions correlationId(String correlationId) {
    this.correlationId = correlationId;
    return this;
  }

  /**
   * Per-message time-to-live.
   *
   * @param expirationInMs time-to-live in milliseconds
   * @return the options
   */
  public PublishOptions expiration(long expirationInMs) {
    this.expiration = String.valueOf(expirationInMs);
    return this;
  }

  public PublishOptions priority(int priority) {
    this.priority = priority;
    return this;
  }

  public PublishOptions header(String key, Object value) {
    this.headers.put(key, value);
    return this;
  }

  public String contentType() {
    return this.contentType;
  }

  public boolean isPersistent() {
    return this.persistent;
  }

  public String messageId() {
    return this.messageId;
  }

  public String correlationId() {
    return this.correlationId;
  }

  public String expiration() {
    return this.expiration;
  }

  public Integer priority() {
    return this.priority;
  }

  public Map<String, Object> headers() {
    return Collections.unmodifiableMap(this.headers);
  }

  /**
   * Copy of the options with a different content type.
   *
   * @param contentType content type of the copy
   * @return the copy
   */
  public PublishOptions withContentType(String contentType) {
    PublishOptions copy = new PublishOptions();
    copy.contentType = contentType;
    copy.persistent = this.persistent;
    copy.messageId = this.messageId;
    copy.correlationId = this.correlationId;
    copy.expiration = this.expiration;
    copy.priority = this.priority;
    copy.headers.putAll(this.headers);
    return copy;
  }
}
