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

import com.rabbitmq.topology.AmqpException;
import com.rabbitmq.topology.Binding;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Binding between a source exchange and a destination queue or exchange.
 *
 * <p>Source and destination are resolved by name in the registry each time the binding is set up.
 * The bind and unbind operations use a short-lived channel, the readiness future of a binding
 * carries the channel of its destination.
 */
final class AmqpBinding extends TopologyObject implements Binding {

  private final String source;
  private final DestinationType destinationType;
  private final String destination;
  private final String pattern;
  private final Map<String, Object> arguments;

  AmqpBinding(
      AmqpConnection connection,
      String source,
      DestinationType destinationType,
      String destination,
      String pattern,
      Map<String, Object> arguments,
      List<StateListener> listeners) {
    super(connection, id(source, destinationType, destination), listeners);
    this.source = source;
    this.destinationType = destinationType;
    this.destination = destination;
    this.pattern = pattern == null ? "" : pattern;
    this.arguments =
        arguments == null ? Collections.emptyMap() : Collections.unmodifiableMap(arguments);
  }

  /**
   * Identity of a binding, used as its key in the registry.
   *
   * <p>The pattern and arguments are not part of the identity.
   */
  static String id(String source, DestinationType destinationType, String destination) {
    return "["
        + source
        + "]to"
        + (destinationType == DestinationType.QUEUE ? "Queue" : "Exchange")
        + "["
        + destination
        + "]";
  }

  String id() {
    return this.name();
  }

  @Override
  public String source() {
    return this.source;
  }

  @Override
  public String destination() {
    return this.destination;
  }

  @Override
  public DestinationType destinationType() {
    return this.destinationType;
  }

  boolean isQueueDestination() {
    return this.destinationType == DestinationType.QUEUE;
  }

  @Override
  public String pattern() {
    return this.pattern;
  }

  @Override
  public Map<String, Object> arguments() {
    return this.arguments;
  }

  @Override
  public CompletableFuture<Binding> initialized() {
    return this.channel().thenApply(ch -> this);
  }

  @Override
  CompletableFuture<BrokerChannel> declare() {
    TopologyRegistry registry = this.connection.registry();
    TopologyObject sourceExchange = registry.exchange(this.source);
    TopologyObject destinationObject;
    switch (this.destinationType) {
      case QUEUE:
        destinationObject = registry.queue(this.destination);
        break;
      case EXCHANGE:
        destinationObject = registry.exchange(this.destination);
        break;
      default:
        throw new IllegalStateException("Unknown destination type: " + this.destinationType);
    }
    if (sourceExchange == null) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpEntityNotFoundException(
              "Source exchange '%s' of binding %s is not declared", this.source, this.id()));
    } else if (destinationObject == null) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpEntityNotFoundException(
              "Destination '%s' of binding %s is not declared", this.destination, this.id()));
    }
    return sourceExchange
        .channel()
        .thenCombine(
            destinationObject.channel(), (sourceChannel, destinationChannel) -> destinationChannel)
        .thenApplyAsync(
            destinationChannel -> {
              this.connection.onTemporaryChannel(
                  ch -> {
                    if (this.isQueueDestination()) {
                      ch.bindQueue(this.destination, this.source, this.pattern, this.arguments);
                    } else {
                      ch.bindExchange(
                          this.destination, this.source, this.pattern, this.arguments);
                    }
                    return null;
                  },
                  "Could not create binding %s",
                  this.id());
              return destinationChannel;
            },
            this.connection.operationExecutor());
  }

  @Override
  void rollback() {
    this.connection.registry().unregister(this);
  }

  @Override
  void releaseChannel(BrokerChannel channel) {
    // the channel belongs to the destination
  }

  @Override
  public CompletableFuture<Void> delete() {
    this.closing();
    CompletableFuture<Void> unbind =
        this.channel()
            .thenAcceptAsync(
                ignored ->
                    this.connection.onTemporaryChannel(
                        ch -> {
                          if (this.isQueueDestination()) {
                            ch.unbindQueue(
                                this.destination, this.source, this.pattern, this.arguments);
                          } else {
                            ch.unbindExchange(
                                this.destination, this.source, this.pattern, this.arguments);
                          }
                          return null;
                        },
                        "Could not delete binding %s",
                        this.id()),
                this.connection.operationExecutor());
    return this.deleted(unbind);
  }

  @Override
  public String toString() {
    return "binding " + this.id() + " (pattern '" + this.pattern + "')";
  }
}
