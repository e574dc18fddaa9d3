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

import static com.rabbitmq.topology.Resource.State.CLOSED;
import static com.rabbitmq.topology.Resource.State.CLOSING;
import static com.rabbitmq.topology.Resource.State.OPEN;
import static com.rabbitmq.topology.Resource.State.RECOVERING;

import com.rabbitmq.topology.AmqpException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of exchanges, queues, and bindings.
 *
 * <p>An object holds a readiness future that completes with its channel once the broker
 * acknowledged its declaration. Operations chain on this future. When the connection gets rebuilt,
 * the object is first suspended: it gets a new pending readiness future and the outcome of the
 * ongoing setup (if any) is ignored. The object is then initialized again on the new connection,
 * so application handles stay valid across rebuilds.
 */
abstract class TopologyObject extends ResourceBase {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopologyObject.class);

  final AmqpConnection connection;
  private final String name;
  private final Lock instanceLock = new ReentrantLock();
  private volatile CompletableFuture<BrokerChannel> channel = new CompletableFuture<>();
  // guarded by instanceLock
  private int generation = 0;
  private boolean closed = false;

  TopologyObject(
      AmqpConnection connection, String name, List<StateListener> listeners) {
    super(listeners);
    this.connection = connection;
    this.name = name;
  }

  public String name() {
    return this.name;
  }

  /** Broker round-trips to set up the object, the future completes with its channel. */
  abstract CompletableFuture<BrokerChannel> declare();

  /** Remove the object from the registry after a setup failure. */
  abstract void rollback();

  void releaseChannel(BrokerChannel channel) {
    this.connection.closeChannel(channel);
  }

  CompletableFuture<BrokerChannel> channel() {
    return this.channel;
  }

  /**
   * Start the setup of the object.
   *
   * @return the readiness future
   */
  CompletableFuture<BrokerChannel> initialize() {
    CompletableFuture<BrokerChannel> token;
    int initializationGeneration;
    this.instanceLock.lock();
    try {
      if (this.closed) {
        return this.channel;
      }
      if (this.channel.isDone()) {
        this.channel = new CompletableFuture<>();
      }
      token = this.channel;
      initializationGeneration = this.generation;
    } finally {
      this.instanceLock.unlock();
    }
    LOGGER.debug("Initializing {}", this);
    CompletableFuture<BrokerChannel> setup;
    try {
      setup = this.declare();
    } catch (Exception e) {
      setup = CompletableFuture.failedFuture(e);
    }
    setup.whenComplete((ch, ex) -> this.settle(token, initializationGeneration, ch, ex));
    return token;
  }

  private void settle(
      CompletableFuture<BrokerChannel> token,
      int initializationGeneration,
      BrokerChannel ch,
      Throwable failure) {
    boolean current;
    this.instanceLock.lock();
    try {
      current = !this.closed && initializationGeneration == this.generation;
    } finally {
      this.instanceLock.unlock();
    }
    if (!current) {
      LOGGER.debug("Ignoring outdated setup outcome of {}", this);
      if (ch != null) {
        this.releaseChannel(ch);
      }
    } else if (failure == null) {
      LOGGER.debug("{} is ready", this);
      this.state(OPEN);
      token.complete(ch);
    } else {
      AmqpException cause = ExceptionUtils.convert(failure);
      if (ExceptionUtils.isConnectionFailure(cause)) {
        // kept in the registry, the connection rebuild sets it up again
        LOGGER.debug("Connection failure during setup of {}: {}", this, cause.getMessage());
        token.completeExceptionally(cause);
      } else {
        LOGGER.debug("Setup of {} failed: {}", this, cause.getMessage());
        // the readiness future reports the setup failure, not the closing
        token.completeExceptionally(cause);
        this.rollback();
        this.closed(cause);
      }
    }
  }

  /** Discard the current session of the object before a connection rebuild. */
  void suspend() {
    CompletableFuture<BrokerChannel> previous;
    CompletableFuture<BrokerChannel> fresh = new CompletableFuture<>();
    this.instanceLock.lock();
    try {
      if (this.closed) {
        return;
      }
      this.generation++;
      previous = this.channel;
      this.channel = fresh;
    } finally {
      this.instanceLock.unlock();
    }
    if (!previous.isDone()) {
      fresh.whenComplete(
          (ch, ex) -> {
            if (ex == null) {
              previous.complete(ch);
            } else {
              previous.completeExceptionally(ex);
            }
          });
    }
    this.state(RECOVERING);
  }

  /** Set up the object again after a connection rebuild. */
  CompletableFuture<BrokerChannel> recover() {
    return this.initialize();
  }

  /** Move to closing, fail if the object is already closing or closed. */
  void closing() {
    this.checkOpen();
    this.state(CLOSING);
  }

  /**
   * Mark the object as closed: its readiness future fails and its channel is released.
   *
   * @param cause the reason, can be null
   */
  void closed(Throwable cause) {
    CompletableFuture<BrokerChannel> previous;
    AmqpException.AmqpResourceClosedException closedException =
        new AmqpException.AmqpResourceClosedException(this + " is closed", cause);
    this.instanceLock.lock();
    try {
      if (this.closed) {
        return;
      }
      this.closed = true;
      this.generation++;
      previous = this.channel;
      this.channel = CompletableFuture.failedFuture(closedException);
    } finally {
      this.instanceLock.unlock();
    }
    if (!previous.completeExceptionally(closedException) && !previous.isCompletedExceptionally()) {
      this.releaseChannel(previous.join());
    }
    this.state(CLOSED, cause);
  }

  /** Run a channel operation once the object is ready. */
  <T> CompletableFuture<T> onChannel(
      ChannelOperation<T> operation, String errorFormat, Object... errorArgs) {
    return this.channel()
        .thenApplyAsync(
            ch -> {
              try {
                return operation.apply(ch);
              } catch (Exception e) {
                throw ExceptionUtils.convertChannelOperation(e, errorFormat, errorArgs);
              }
            },
            this.connection.operationExecutor());
  }

  /** Settle a delete operation: the object leaves the registry and gets closed. */
  CompletableFuture<Void> deleted(CompletableFuture<?> deletion) {
    return deletion.handle(
        (r, ex) -> {
          this.rollback();
          if (ex == null) {
            LOGGER.debug("{} deleted", this);
            this.closed(null);
            return null;
          } else {
            AmqpException cause = ExceptionUtils.convert(ex);
            this.closed(cause);
            throw cause;
          }
        });
  }

  @FunctionalInterface
  interface ChannelOperation<T> {

    T apply(BrokerChannel channel) throws Exception;
  }
}
