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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.rabbitmq.topology.AmqpException;
import com.rabbitmq.topology.PublishOptions;
import java.nio.charset.StandardCharsets;

/**
 * Encodes message content and decodes message bodies.
 *
 * <p>A {@link String} travels as its UTF-8 bytes and a <code>byte[]</code> as is, both without
 * content type. Other objects travel as UTF-8 JSON with the {@link #APPLICATION_JSON} content
 * type. Bodies with this content type are parsed back on receipt.
 */
final class ContentCodec {

  static final String APPLICATION_JSON = "application/json";

  private static final PublishOptions NO_OPTIONS = new PublishOptions();

  private final Gson gson;

  ContentCodec() {
    this(
        new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create());
  }

  ContentCodec(Gson gson) {
    this.gson = gson;
  }

  /**
   * Encode content for publishing.
   *
   * @param content the content
   * @param options the publish options, can be null
   * @param overrideContentType whether JSON content replaces a content type set in the options
   * @return the message to publish
   */
  OutboundMessage encode(Object content, PublishOptions options, boolean overrideContentType) {
    if (content == null) {
      throw new IllegalArgumentException("Message content cannot be null");
    }
    PublishOptions opts = options == null ? NO_OPTIONS : options;
    if (content instanceof String) {
      return new OutboundMessage(((String) content).getBytes(StandardCharsets.UTF_8), opts);
    } else if (content instanceof byte[]) {
      return new OutboundMessage((byte[]) content, opts);
    } else {
      byte[] body = this.gson.toJson(content).getBytes(StandardCharsets.UTF_8);
      if (overrideContentType || opts.contentType() == null) {
        opts = opts.withContentType(APPLICATION_JSON);
      }
      return new OutboundMessage(body, opts);
    }
  }

  /**
   * Decode a body: parsed JSON for JSON content, a string otherwise.
   *
   * <p>JSON integers are decoded as {@link Long}, other JSON numbers as {@link Double}.
   */
  Object decode(byte[] body, String contentType) {
    String text = new String(body, StandardCharsets.UTF_8);
    if (APPLICATION_JSON.equals(contentType)) {
      try {
        return this.gson.fromJson(text, Object.class);
      } catch (JsonParseException e) {
        throw new AmqpException("Invalid JSON body: " + e.getMessage(), e);
      }
    } else {
      return text;
    }
  }

  <T> T decode(byte[] body, Class<T> type) {
    if (type == byte[].class) {
      return type.cast(body);
    } else if (type == String.class) {
      return type.cast(new String(body, StandardCharsets.UTF_8));
    }
    try {
      return this.gson.fromJson(new String(body, StandardCharsets.UTF_8), type);
    } catch (JsonParseException e) {
      throw new AmqpException(
          "Cannot decode body to " + type.getName() + ": " + e.getMessage(), e);
    }
  }
}
