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
import com.rabbitmq.topology.BackOffDelayPolicy;
import com.rabbitmq.topology.Binding;
import com.rabbitmq.topology.Connection;
import com.rabbitmq.topology.Exchange;
import com.rabbitmq.topology.ExchangeOptions;
import com.rabbitmq.topology.Queue;
import com.rabbitmq.topology.QueueOptions;
import com.rabbitmq.topology.metrics.MetricsCollector;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection that keeps its topology declared across broker connection failures.
 *
 * <p>The connection owns the registry of the exchanges, queues, and bindings declared with it.
 * When the broker connection goes away (detected by its shutdown listener or by a failed publish),
 * the connection is rebuilt: it reconnects, then sets up the registered exchanges, queues (with
 * their consumer), and bindings again. Only one rebuild runs at a time, concurrent triggers share
 * it.
 *
 * <p>Blocking broker operations run on a single-thread executor dedicated to the connection,
 * delays between connection attempts use the scheduler of the environment.
 */
final class AmqpConnection extends ResourceBase implements Connection {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConnection.class);
  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final String name;
  private final AmqpEnvironment environment;
  private final DefaultConnectionSettings<?> connectionSettings;
  private final boolean recoveryActivated;
  private final BackOffDelayPolicy backOffDelayPolicy;
  private final List<StateListener> topologyListeners;
  private final TopologyRegistry registry = new TopologyRegistry();
  private final ExecutorService operationExecutor;
  private final ShutdownHookSupport shutdownHook;
  private final Lock instanceLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
  private volatile CompletableFuture<Void> initialized = new CompletableFuture<>();
  private volatile BrokerConnection nativeConnection;
  // guarded by instanceLock
  private CompletableFuture<Void> rebuild;

  AmqpConnection(AmqpConnectionBuilder builder) {
    super(builder.listeners());
    this.id = ID_SEQUENCE.getAndIncrement();
    this.environment = builder.environment();
    this.name =
        builder.name() == null
            ? String.format("%s-connection-%d", this.environment, this.id)
            : builder.name();
    DefaultConnectionSettings<?> settings = DefaultConnectionSettings.instance();
    builder.connectionSettings().copyTo(settings);
    this.connectionSettings = settings.consolidate();
    AmqpConnectionBuilder.AmqpRecoveryConfiguration recovery = builder.recoveryConfiguration();
    this.recoveryActivated = recovery.activated();
    this.backOffDelayPolicy = recovery.backOffDelayPolicy();
    this.topologyListeners = builder.topologyListeners();
    this.operationExecutor = Utils.operationExecutor(this.name + "-operations-");
    this.shutdownHook = new ShutdownHookSupport(this.environment.shutdownHooks(), this.name);
  }

  /** Start connecting, the readiness future completes when the broker connection is open. */
  void start() {
    CompletableFuture<Void> token = this.initialized;
    LOGGER.debug("Connecting '{}' to {}", this.name, this.connectionSettings);
    this.connectWithRetry()
        .whenComplete(
            (nc, ex) -> {
              if (ex == null) {
                LOGGER.debug("Connection '{}' opened to {}", this.name, this.connectionSettings);
                this.state(OPEN);
                token.complete(null);
              } else {
                AmqpException e =
                    ExceptionUtils.convertConnect(
                        ex, "Could not connect '%s' to %s", this.name, this.connectionSettings);
                LOGGER.warn("{}: {}", e.getMessage(), ExceptionUtils.unwrap(ex).getMessage());
                token.completeExceptionally(e);
                this.close(e);
              }
            });
  }

  private CompletableFuture<BrokerConnection> connectWithRetry() {
    return this.supplyOnOperationExecutor(
            () ->
                AsyncRetry.asyncRetry(this::connect)
                    .description("Connection '%s' to %s", this.name, this.connectionSettings)
                    .delayPolicy(this.backOffDelayPolicy)
                    .retry(e -> !this.closed.get())
                    .scheduler(this.environment.scheduledExecutorService())
                    .build())
        .thenCompose(Function.identity());
  }

  private BrokerConnection connect() throws Exception {
    BrokerConnection nc;
    try {
      nc = this.environment.brokerClient().connect(this.connectionSettings, this.name);
    } catch (Exception e) {
      LOGGER.debug("Connection attempt of '{}' failed: {}", this.name, e.getMessage());
      throw e;
    }
    this.instanceLock.lock();
    try {
      if (this.closed.get()) {
        Utils.maybeClose(
            nc, e -> LOGGER.debug("Error while closing connection: {}", e.getMessage()));
        throw new AmqpException.AmqpResourceClosedException(this + " is closed");
      }
      this.nativeConnection = nc;
    } finally {
      this.instanceLock.unlock();
    }
    this.environment.metricsCollector().openConnection();
    nc.addShutdownListener(cause -> this.connectionLost(nc, cause));
    this.shutdownHook.register(
        () ->
            Utils.maybeClose(
                nc,
                e -> LOGGER.debug("Error while closing connection on exit: {}", e.getMessage())));
    return nc;
  }

  private void connectionLost(BrokerConnection nc, Throwable cause) {
    if (this.closed.get() || nc != this.nativeConnection) {
      LOGGER.debug("Ignoring shutdown of outdated broker connection of '{}'", this.name);
      return;
    }
    LOGGER.info("Connection '{}' lost: {}", this.name, cause.getMessage());
    if (this.recoveryActivated) {
      this.rebuild(cause)
          .exceptionally(
              ex -> {
                LOGGER.debug("Rebuild of '{}' failed: {}", this.name, ex.getMessage());
                return null;
              });
    } else {
      this.close(ExceptionUtils.convertConnect(cause, "Connection '%s' lost", this.name));
    }
  }

  /**
   * Reconnect and set up the registered topology again.
   *
   * <p>Joins the rebuild in progress, if any.
   *
   * @param cause the failure that triggered the rebuild
   * @return future completing when the topology is ready again
   */
  CompletableFuture<Void> rebuild(Throwable cause) {
    CompletableFuture<Void> result = new CompletableFuture<>();
    CompletableFuture<Void> token = new CompletableFuture<>();
    CompletableFuture<Void> previousToken;
    BrokerConnection stale;
    TopologyRegistry.Snapshot snapshot;
    this.instanceLock.lock();
    try {
      if (this.closed.get()) {
        return CompletableFuture.failedFuture(
            new AmqpException.AmqpResourceClosedException(this + " is closed", cause));
      } else if (this.rebuild != null) {
        LOGGER.debug("Rebuild of '{}' already in progress", this.name);
        return this.rebuild;
      }
      this.rebuild = result;
      previousToken = this.initialized;
      this.initialized = token;
      stale = this.nativeConnection;
      this.nativeConnection = null;
      snapshot = this.registry.snapshot();
    } finally {
      this.instanceLock.unlock();
    }
    if (!previousToken.isDone()) {
      token.whenComplete(
          (r, ex) -> {
            if (ex == null) {
              previousToken.complete(null);
            } else {
              previousToken.completeExceptionally(ex);
            }
          });
    }
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    LOGGER.info(
        "Rebuilding connection '{}' ({}), error was: {}",
        this.name,
        snapshot,
        cause == null ? "none" : cause.getMessage());
    this.state(RECOVERING, cause);
    this.environment.metricsCollector().rebuild();
    snapshot.accept(new TopologyRebuild.Suspension());
    this.supplyOnOperationExecutor(
            () -> {
              this.closeNativeConnection(stale);
              return null;
            })
        .thenCompose(ignored -> this.connectWithRetry())
        .thenCompose(
            nc -> {
              LOGGER.debug("Reconnected '{}' to {}", this.name, this.connectionSettings);
              this.state(OPEN);
              token.complete(null);
              TopologyRebuild topologyRebuild = new TopologyRebuild(this.name);
              snapshot.accept(topologyRebuild);
              return Utils.allSettled(topologyRebuild.setups());
            })
        .whenComplete(
            (r, ex) -> {
              this.instanceLock.lock();
              try {
                this.rebuild = null;
              } finally {
                this.instanceLock.unlock();
              }
              if (ex == null) {
                LOGGER.info("Connection '{}' rebuilt in {}", this.name, stopWatch.stop());
                result.complete(null);
              } else if (!token.isDone()) {
                AmqpException e =
                    ExceptionUtils.convertConnect(
                        ex, "Could not reconnect '%s' to %s", this.name, this.connectionSettings);
                LOGGER.warn("{}: {}", e.getMessage(), ExceptionUtils.unwrap(ex).getMessage());
                token.completeExceptionally(e);
                this.close(e);
                result.completeExceptionally(e);
              } else {
                AmqpException e = ExceptionUtils.convert(ex);
                LOGGER.warn(
                    "Topology rebuild of connection '{}' failed: {}", this.name, e.getMessage());
                result.completeExceptionally(e);
              }
            });
    return result;
  }

  @Override
  public CompletableFuture<Void> initialized() {
    return this.initialized.copy();
  }

  @Override
  public Exchange declareExchange(String name) {
    return this.declareExchange(name, Exchange.Type.TOPIC, null);
  }

  @Override
  public Exchange declareExchange(String name, Exchange.Type type) {
    return this.declareExchange(name, type, null);
  }

  @Override
  public Exchange declareExchange(String name, Exchange.Type type, ExchangeOptions options) {
    this.checkOpen();
    checkName(name, "exchange");
    AmqpExchange exchange =
        new AmqpExchange(
            this,
            name,
            type == null ? Exchange.Type.TOPIC : type,
            options,
            this.topologyListeners);
    if (this.registry.register(exchange) != null) {
      LOGGER.debug("Exchange '{}' declared again, replacing previous declaration", name);
    }
    exchange.initialize();
    return exchange;
  }

  @Override
  public Queue declareQueue(String name) {
    return this.declareQueue(name, null);
  }

  @Override
  public Queue declareQueue(String name, QueueOptions options) {
    this.checkOpen();
    checkName(name, "queue");
    AmqpQueue queue = new AmqpQueue(this, name, options, this.topologyListeners);
    if (this.registry.register(queue) != null) {
      LOGGER.debug("Queue '{}' declared again, replacing previous declaration", name);
    }
    queue.initialize();
    return queue;
  }

  /**
   * Declare a queue unless a queue with the same name is already declared.
   *
   * @return the new queue, null if a queue with the same name is already declared
   */
  AmqpQueue declareQueueIfAbsent(String name, QueueOptions options) {
    this.checkOpen();
    AmqpQueue queue = new AmqpQueue(this, name, options, this.topologyListeners);
    if (this.registry.registerIfAbsent(queue)) {
      queue.initialize();
      return queue;
    } else {
      return null;
    }
  }

  AmqpBinding bind(
      String source,
      Binding.DestinationType destinationType,
      String destination,
      String pattern,
      Map<String, Object> arguments) {
    this.checkOpen();
    AmqpBinding binding =
        new AmqpBinding(
            this,
            source,
            destinationType,
            destination,
            pattern,
            arguments,
            this.topologyListeners);
    if (this.registry.register(binding) != null) {
      LOGGER.debug("Binding {} declared again, replacing previous declaration", binding.id());
    }
    binding.initialize();
    return binding;
  }

  CompletableFuture<Void> unbind(String bindingId) {
    AmqpBinding binding = this.registry.binding(bindingId);
    if (binding == null) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpEntityNotFoundException("Binding %s is not declared", bindingId));
    }
    return binding.delete();
  }

  @Override
  public CompletableFuture<Void> completeConfiguration() {
    this.checkOpen();
    TopologyRegistry.Snapshot snapshot = this.registry.snapshot();
    List<CompletableFuture<?>> readiness = new ArrayList<>();
    readiness.add(this.initialized);
    snapshot.all().forEach(object -> readiness.add(object.channel()));
    for (AmqpQueue queue : snapshot.queues()) {
      CompletableFuture<?> consumer = queue.consumer();
      if (consumer != null) {
        readiness.add(consumer);
      }
    }
    return Utils.allSettled(readiness);
  }

  @Override
  public CompletableFuture<Void> deleteConfiguration() {
    this.checkOpen();
    TopologyRegistry.Snapshot snapshot = this.registry.snapshot();
    LOGGER.debug("Deleting configuration of '{}' ({})", this.name, snapshot);
    List<AmqpQueue> consuming =
        snapshot.queues().stream().filter(AmqpQueue::hasConsumer).collect(Collectors.toList());
    List<Supplier<CompletableFuture<?>>> phases =
        List.of(
            () -> forEachSettled(consuming, AmqpQueue::stopConsumer),
            () -> forEachSettled(snapshot.bindings(), AmqpBinding::delete),
            () -> forEachSettled(snapshot.queues(), AmqpQueue::delete),
            () -> forEachSettled(snapshot.exchanges(), AmqpExchange::delete));
    return Utils.runInSequence(phases);
  }

  private static <T extends TopologyObject> CompletableFuture<Void> forEachSettled(
      List<T> objects, Function<T, CompletableFuture<?>> operation) {
    List<CompletableFuture<?>> outcomes = new ArrayList<>(objects.size());
    for (T object : objects) {
      State state = object.state();
      if (state == CLOSING || state == CLOSED) {
        continue;
      }
      try {
        outcomes.add(operation.apply(object));
      } catch (Exception e) {
        outcomes.add(CompletableFuture.failedFuture(e));
      }
    }
    return Utils.allSettled(outcomes);
  }

  <T extends TopologyObject> CompletableFuture<Void> publish(
      T target, Function<String, T> resolver, PublishOperation operation) {
    CompletableFuture<Void> result = new CompletableFuture<>();
    MetricsCollector metrics = this.metricsCollector();
    publishOnce(target, operation)
        .whenComplete(
            (r, ex) -> {
              if (ex == null) {
                metrics.publish();
                result.complete(null);
                return;
              }
              Throwable cause = ExceptionUtils.unwrap(ex);
              if (!this.recoveryActivated || this.closed.get() || target.state() == CLOSED) {
                result.completeExceptionally(
                    new AmqpException.AmqpPublishException(
                        "Could not publish to " + target + ": " + cause.getMessage(), cause));
                return;
              }
              LOGGER.debug(
                  "Publishing to {} failed, rebuilding connection '{}' before retrying: {}",
                  target,
                  this.name,
                  cause.getMessage());
              metrics.publishRetry();
              this.rebuild(cause)
                  .thenCompose(
                      ignored -> {
                        T current = resolver.apply(target.name());
                        if (current == null) {
                          throw new AmqpException.AmqpEntityNotFoundException(
                              "%s is no longer declared", target);
                        }
                        return publishOnce(current, operation);
                      })
                  .whenComplete(
                      (r2, retryEx) -> {
                        if (retryEx == null) {
                          metrics.publish();
                          result.complete(null);
                        } else {
                          Throwable retryCause = ExceptionUtils.unwrap(retryEx);
                          result.completeExceptionally(
                              new AmqpException.AmqpPublishException(
                                  "Could not publish to "
                                      + target
                                      + " after connection rebuild: "
                                      + retryCause.getMessage(),
                                  retryCause));
                        }
                      });
            });
    return result;
  }

  private static CompletableFuture<Void> publishOnce(
      TopologyObject target, PublishOperation operation) {
    return target.onChannel(
        ch -> {
          operation.publish(ch);
          return null;
        },
        "Could not publish to %s",
        target);
  }

  BrokerChannel createChannel() {
    BrokerConnection nc = this.nativeConnection;
    if (nc == null) {
      throw new AmqpException.AmqpConnectionException(
          "Connection '%s' is not connected", this.name);
    }
    try {
      return nc.createChannel();
    } catch (Exception e) {
      throw ExceptionUtils.convertChannelOperation(
          e, "Could not create channel on connection '%s'", this.name);
    }
  }

  /** Run an operation on a channel opened for the occasion, must run on the operation executor. */
  <T> T onTemporaryChannel(
      TopologyObject.ChannelOperation<T> operation, String errorFormat, Object... errorArgs) {
    BrokerChannel ch = this.createChannel();
    try {
      return operation.apply(ch);
    } catch (Exception e) {
      throw ExceptionUtils.convertChannelOperation(e, errorFormat, errorArgs);
    } finally {
      Utils.maybeClose(
          ch, e -> LOGGER.debug("Error while closing temporary channel: {}", e.getMessage()));
    }
  }

  void closeChannel(BrokerChannel channel) {
    this.execute("channel closing", channel::close);
  }

  /** Run a best-effort task on the operation executor, failures are logged. */
  void execute(String description, Utils.RunnableWithException task) {
    if (this.closed.get()) {
      // channels and consumers go away with the broker connection
      return;
    }
    try {
      this.operationExecutor.execute(
          () -> {
            try {
              task.run();
            } catch (Exception e) {
              LOGGER.debug(
                  "Error during {} on connection '{}': {}", description, this.name, e.getMessage());
            }
          });
    } catch (RejectedExecutionException e) {
      LOGGER.debug(
          "Could not run {} on connection '{}': {}", description, this.name, e.getMessage());
    }
  }

  private <T> CompletableFuture<T> supplyOnOperationExecutor(Supplier<T> task) {
    try {
      return CompletableFuture.supplyAsync(task, this.operationExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpResourceClosedException(this + " is closed", e));
    }
  }

  private void closeNativeConnection(BrokerConnection nc) {
    if (nc != null) {
      Utils.maybeClose(
          nc,
          e ->
              LOGGER.debug(
                  "Error while closing broker connection of '{}': {}", this.name, e.getMessage()));
      this.environment.metricsCollector().closeConnection();
    }
  }

  @Override
  public CompletableFuture<Void> closeAsync() {
    return this.close(null);
  }

  @Override
  public void close() {
    ExceptionUtils.wrapGet(this.closeAsync());
  }

  private CompletableFuture<Void> close(Throwable cause) {
    if (!this.closed.compareAndSet(false, true)) {
      return this.closeFuture;
    }
    this.state(CLOSING, cause);
    LOGGER.debug("Closing connection '{}'", this.name);
    this.environment.removeConnection(this);
    this.shutdownHook.unregister();
    BrokerConnection nc;
    CompletableFuture<Void> token;
    this.instanceLock.lock();
    try {
      nc = this.nativeConnection;
      this.nativeConnection = null;
      token = this.initialized;
    } finally {
      this.instanceLock.unlock();
    }
    token.completeExceptionally(
        cause instanceof AmqpException
            ? cause
            : new AmqpException.AmqpResourceClosedException(this + " is closed", cause));
    this.registry.snapshot().all().forEach(object -> object.closed(cause));
    this.supplyOnOperationExecutor(
            () -> {
              this.closeNativeConnection(nc);
              return null;
            })
        .whenComplete(
            (r, ex) -> {
              this.operationExecutor.shutdown();
              this.state(CLOSED, cause);
              LOGGER.debug("Connection '{}' closed", this.name);
              this.closeFuture.complete(null);
            });
    return this.closeFuture;
  }

  TopologyRegistry registry() {
    return this.registry;
  }

  ExecutorService operationExecutor() {
    return this.operationExecutor;
  }

  ContentCodec codec() {
    return this.environment.codec();
  }

  MetricsCollector metricsCollector() {
    return this.environment.metricsCollector();
  }

  ProcessIdentity processIdentity() {
    return this.environment.processIdentity();
  }

  String name() {
    return this.name;
  }

  private static void checkName(String name, String type) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("The " + type + " name cannot be null or blank");
    }
  }

  @Override
  public String toString() {
    return "connection '" + this.name + "'";
  }

  @FunctionalInterface
  interface PublishOperation {

    void publish(BrokerChannel channel) throws Exception;
  }
}
