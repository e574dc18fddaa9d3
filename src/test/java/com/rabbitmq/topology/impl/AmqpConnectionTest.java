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
import static com.rabbitmq.topology.Resource.State.OPEN;
import static com.rabbitmq.topology.Resource.State.RECOVERING;
import static com.rabbitmq.topology.impl.Assertions.assertThat;
import static com.rabbitmq.topology.impl.TestUtils.environmentBuilder;
import static com.rabbitmq.topology.impl.TestUtils.sync;
import static com.rabbitmq.topology.impl.TestUtils.waitAtMost;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.rabbitmq.topology.AmqpException;
import com.rabbitmq.topology.BackOffDelayPolicy;
import com.rabbitmq.topology.Binding;
import com.rabbitmq.topology.Connection;
import com.rabbitmq.topology.ConnectionBuilder;
import com.rabbitmq.topology.Environment;
import com.rabbitmq.topology.Exchange;
import com.rabbitmq.topology.Message;
import com.rabbitmq.topology.PublishOptions;
import com.rabbitmq.topology.Queue;
import com.rabbitmq.topology.metrics.MetricsCollector;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AmqpConnectionTest {

  static final BackOffDelayPolicy FAST_RECOVERY =
      BackOffDelayPolicy.fixed(Duration.ofMillis(50));

  FakeBroker broker;
  TestUtils.RecordingHooks hooks;
  MetricsCollector metrics;
  Environment environment;

  @BeforeEach
  void init() {
    broker = new FakeBroker();
    hooks = new TestUtils.RecordingHooks();
    metrics = mock(MetricsCollector.class);
    environment =
        environmentBuilder(broker).shutdownHooks(hooks).metricsCollector(metrics).build();
  }

  @AfterEach
  void tearDown() {
    environment.close();
    broker.close();
  }

  ConnectionBuilder connectionBuilder() {
    return environment
        .connectionBuilder()
        .recovery()
        .backOffDelayPolicy(FAST_RECOVERY)
        .connectionBuilder();
  }

  @Test
  void completeConfigurationDeclaresTopology() throws Exception {
    Connection connection = connectionBuilder().name("orders-service").build();
    Exchange exchange = connection.declareExchange("orders", Exchange.Type.DIRECT);
    Queue queue = connection.declareQueue("billing");
    CompletableFuture<Binding> binding = queue.bind(exchange, "order.created");

    connection.completeConfiguration().get(10, SECONDS);

    assertThat(broker.exchangeType("orders")).isEqualTo("direct");
    assertThat(broker.hasQueue("billing")).isTrue();
    assertThat(broker.hasBinding("orders", "billing", "order.created")).isTrue();
    assertThat(connection).isOpen();
    assertThat(exchange).isOpen();
    assertThat(queue).isOpen();
    Binding b = binding.get(10, SECONDS);
    assertThat(b.source()).isEqualTo("orders");
    assertThat(b.destination()).isEqualTo("billing");
    assertThat(b.destinationType()).isEqualTo(Binding.DestinationType.QUEUE);
    assertThat(b.pattern()).isEqualTo("order.created");
    verify(metrics, times(1)).openConnection();
  }

  @Test
  void exchangeTypeDefaultsToTopic() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("events");
    assertThat(exchange.type()).isEqualTo(Exchange.Type.TOPIC);
    exchange.initialized().get(10, SECONDS);
    assertThat(broker.exchangeType("events")).isEqualTo("topic");
  }

  @Test
  void blankNamesAreRejected() {
    Connection connection = connectionBuilder().build();
    assertThatThrownBy(() -> connection.declareExchange(" "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> connection.declareQueue(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectedDeclarationIsRolledBack() throws Exception {
    broker.rejectDeclaration("billing");
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders");
    Queue queue = connection.declareQueue("billing");
    CompletableFuture<Binding> binding = queue.bind(exchange);

    assertThatThrownBy(() -> queue.initialized().get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpChannelException.class);
    assertThatThrownBy(() -> binding.get(10, SECONDS)).hasCauseInstanceOf(AmqpException.class);
    assertThat(queue).reaches(CLOSED);
    AmqpConnection amqpConnection = (AmqpConnection) connection;
    assertThat(amqpConnection.registry().queue("billing")).isNull();
    assertThat(amqpConnection.registry().snapshot().bindings()).isEmpty();
    assertThatThrownBy(() -> queue.publish("too late")).isInstanceOf(AmqpException.class);

    exchange.initialized().get(10, SECONDS);
    connection.completeConfiguration().get(10, SECONDS);
    assertThat(connection).isOpen();
  }

  @Test
  void queuePublishAndConsume() throws Exception {
    Connection connection = connectionBuilder().build();
    Queue queue = connection.declareQueue("billing");
    List<Message> messages = new CopyOnWriteArrayList<>();
    TestUtils.Sync sync = sync(3);
    queue
        .startConsumer(
            message -> {
              messages.add(message);
              sync.down();
            })
        .get(10, SECONDS);

    queue.publish("hello").get(10, SECONDS);
    Map<String, Object> order =
        Map.of(
            "id", "o-1",
            "quantity", 2,
            "price", 9.99,
            "lines", List.of(Map.of("sku", "a-1", "count", 1), List.of(1, 2)));
    queue.publish(order).get(10, SECONDS);
    queue.publish(new byte[] {1, 2, 3}, new PublishOptions().header("tenant", "acme"));

    assertThat(sync).completes();
    assertThat(messages.get(0).payload()).isEqualTo("hello");
    assertThat(messages.get(0).contentType()).isNull();
    assertThat(messages.get(0).routingKey()).isEqualTo("billing");
    assertThat(messages.get(1).payload())
        .isEqualTo(
            Map.of(
                "id", "o-1",
                "quantity", 2L,
                "price", 9.99,
                "lines", List.of(Map.of("sku", "a-1", "count", 1L), List.of(1L, 2L))));
    assertThat(messages.get(1).contentType()).isEqualTo("application/json");
    assertThat(messages.get(2).body()).containsExactly(1, 2, 3);
    assertThat(messages.get(2).headers()).containsEntry("tenant", "acme");
    waitAtMost(() -> broker.acks() == 3);
    verify(metrics, timeout(5000).times(3))
        .consumeDisposition(MetricsCollector.ConsumeDisposition.ACCEPTED);
  }

  @Test
  void exchangePublishRoutesToBoundQueues() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders");
    Queue created = connection.declareQueue("created");
    Queue all = connection.declareQueue("all");
    created.bind(exchange, "order.created");
    all.bind(exchange, "order.#");
    connection.completeConfiguration().get(10, SECONDS);

    exchange.publish("o-1", "order.created").get(10, SECONDS);
    exchange.publish("o-2", "order.cancelled.late").get(10, SECONDS);

    assertThat(broker.messageCount("created")).isEqualTo(1);
    assertThat(broker.messageCount("all")).isEqualTo(2);
  }

  @Test
  void headersExchangeRoutesOnBindingArguments() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders", Exchange.Type.HEADERS);
    Queue queue = connection.declareQueue("eu-orders");
    queue.bind(exchange, "", Map.of("x-match", "all", "region", "eu"));
    connection.completeConfiguration().get(10, SECONDS);

    exchange.publish("o-1", "", new PublishOptions().header("region", "eu")).get(10, SECONDS);
    exchange.publish("o-2", "", new PublishOptions().header("region", "us")).get(10, SECONDS);

    assertThat(broker.exchangeType("orders")).isEqualTo("headers");
    assertThat(broker.messageCount("eu-orders")).isEqualTo(1);
  }

  @Test
  void exchangeToExchangeBinding() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange orders = connection.declareExchange("orders", Exchange.Type.FANOUT);
    Exchange audit = connection.declareExchange("audit", Exchange.Type.FANOUT);
    Queue log = connection.declareQueue("audit-log");
    log.bind(audit);
    audit.bind(orders).get(10, SECONDS);
    connection.completeConfiguration().get(10, SECONDS);

    orders.publish("o-1").get(10, SECONDS);

    assertThat(broker.messageCount("audit-log")).isEqualTo(1);
    audit.unbind(orders).get(10, SECONDS);
    assertThat(broker.hasBinding("orders", "audit", "")).isFalse();
  }

  @Test
  void consumerConflictsAndAbsence() throws Exception {
    Connection connection = connectionBuilder().build();
    Queue queue = connection.declareQueue("billing");
    assertThatThrownBy(() -> queue.stopConsumer().get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpConsumerAbsentException.class);

    String tag = queue.startConsumer(message -> {}).get(10, SECONDS);
    assertThat(tag).startsWith("amq.ctag-");
    assertThatThrownBy(() -> queue.startConsumer(message -> {}).get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpConsumerConflictException.class);
    assertThat(broker.consumerCount("billing")).isEqualTo(1);

    queue.stopConsumer().get(10, SECONDS);
    assertThat(broker.consumerCount("billing")).isZero();
    verify(metrics).closeConsumer();

    queue.startConsumer(message -> {}).get(10, SECONDS);
    assertThat(broker.consumerCount("billing")).isEqualTo(1);
    assertThatThrownBy(() -> queue.startConsumer(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void exchangeConsumerUsesPrivateQueue() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("events");
    String queueName = exchange.consumerQueueName();
    assertThat(queueName).isEqualTo("events.test-app.test-host.42");

    AtomicReference<Object> received = new AtomicReference<>();
    TestUtils.Sync sync = sync();
    exchange
        .startConsumer(
            message -> {
              received.set(message.payload());
              sync.down();
            })
        .get(10, SECONDS);
    assertThat(broker.hasQueue(queueName)).isTrue();
    assertThat(broker.consumerCount(queueName)).isEqualTo(1);
    assertThatThrownBy(() -> exchange.startConsumer(message -> {}).get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpConsumerConflictException.class);

    exchange.publish("Test").get(10, SECONDS);
    assertThat(sync).completes();
    assertThat(received.get()).isEqualTo("Test");

    exchange.stopConsumer().get(10, SECONDS);
    assertThat(broker.hasQueue(queueName)).isFalse();
    assertThat(((AmqpConnection) connection).registry().queue(queueName)).isNull();
    assertThatThrownBy(() -> exchange.stopConsumer().get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpConsumerAbsentException.class);

    exchange.startConsumer(message -> {}).get(10, SECONDS);
    assertThat(broker.consumerCount(queueName)).isEqualTo(1);
  }

  @Test
  void failingHandlerDiscardsMessage() throws Exception {
    Connection connection = connectionBuilder().build();
    Queue queue = connection.declareQueue("billing");
    queue
        .startConsumer(
            message -> {
              throw new IllegalStateException("cannot handle " + message.payload());
            })
        .get(10, SECONDS);

    queue.publish("poison").get(10, SECONDS);

    waitAtMost(() -> broker.rejections() == 1);
    assertThat(broker.acks()).isZero();
    verify(metrics, timeout(5000))
        .consumeDisposition(MetricsCollector.ConsumeDisposition.DISCARDED);
  }

  @Test
  void emptyMessagesAreDelivered() throws Exception {
    Connection connection = connectionBuilder().build();
    Queue queue = connection.declareQueue("billing");
    List<Message> messages = new CopyOnWriteArrayList<>();
    TestUtils.Sync sync = sync(3);
    queue
        .startConsumer(
            message -> {
              messages.add(message);
              sync.down();
            })
        .get(10, SECONDS);

    queue.publish("").get(10, SECONDS);
    queue.publish(new byte[0]).get(10, SECONDS);
    queue.publish("not empty").get(10, SECONDS);

    assertThat(sync).completes();
    assertThat(messages).extracting(Message::payload).containsExactly("", "", "not empty");
    assertThat(messages.get(1).body()).isEmpty();
    waitAtMost(() -> broker.acks() == 3);
    assertThat(broker.rejections()).isZero();
  }

  @Test
  void bindingRedeclarationReplacesPrevious() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders");
    Queue queue = connection.declareQueue("billing");
    queue.bind(exchange, "order.*").get(10, SECONDS);
    queue.bind(exchange, "order.created").get(10, SECONDS);

    TopologyRegistry registry = ((AmqpConnection) connection).registry();
    assertThat(registry.snapshot().bindings()).hasSize(1);
    assertThat(registry.binding("[orders]toQueue[billing]").pattern()).isEqualTo("order.created");

    queue.unbind(exchange).get(10, SECONDS);
    assertThat(broker.hasBinding("orders", "billing", "order.created")).isFalse();
    assertThat(registry.snapshot().bindings()).isEmpty();
    assertThatThrownBy(() -> queue.unbind(exchange).get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpEntityNotFoundException.class);
  }

  @Test
  void deletingExchangeDropsItsBindings() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders");
    Queue queue = connection.declareQueue("billing");
    Binding binding = queue.bind(exchange).get(10, SECONDS);

    exchange.delete().get(10, SECONDS);

    assertThat(broker.hasExchange("orders")).isFalse();
    assertThat(exchange).isClosed();
    assertThat(binding).reaches(CLOSED);
    TopologyRegistry registry = ((AmqpConnection) connection).registry();
    assertThat(registry.exchange("orders")).isNull();
    assertThat(registry.snapshot().bindings()).isEmpty();
    assertThat(registry.queue("billing")).isSameAs(queue);
    assertThatThrownBy(() -> exchange.publish("x")).isInstanceOf(AmqpException.class);
  }

  @Test
  void deleteConfigurationDeletesEverythingAndReportsFailures() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders");
    Queue billing = connection.declareQueue("billing");
    Queue shipping = connection.declareQueue("shipping");
    billing.bind(exchange);
    shipping.bind(exchange);
    billing.startConsumer(message -> {});
    connection.completeConfiguration().get(10, SECONDS);
    broker.rejectDeletion("billing");

    assertThatThrownBy(() -> connection.deleteConfiguration().get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpChannelException.class)
        .hasMessageContaining("billing");

    assertThat(broker.hasExchange("orders")).isFalse();
    assertThat(broker.hasQueue("shipping")).isFalse();
    assertThat(broker.hasQueue("billing")).isTrue();
    assertThat(broker.consumerCount("billing")).isZero();
    assertThat(broker.bindingCount()).isZero();
    assertThat(billing).isClosed();
    assertThat(((AmqpConnection) connection).registry().snapshot().all()).isEmpty();
    assertThat(connection).isOpen();
  }

  @Test
  void topologyIsRebuiltAfterConnectionLoss() throws Exception {
    TestUtils.StateRecorder recorder = new TestUtils.StateRecorder();
    Connection connection = connectionBuilder().topologyListeners(recorder).build();
    Exchange exchange = connection.declareExchange("orders");
    Queue queue = connection.declareQueue("billing");
    queue.bind(exchange, "order.*");
    List<Object> payloads = new CopyOnWriteArrayList<>();
    TestUtils.Sync sync = sync();
    queue.startConsumer(
        message -> {
          payloads.add(message.payload());
          sync.down();
        });
    connection.completeConfiguration().get(10, SECONDS);

    broker.restart();

    waitAtMost(() -> broker.consumerCount("billing") == 1);
    waitAtMost(() -> broker.hasBinding("orders", "billing", "order.*"));
    connection.completeConfiguration().get(10, SECONDS);
    assertThat(connection).isOpen();
    assertThat(recorder.states(exchange)).containsExactly(OPEN, RECOVERING, OPEN);
    assertThat(recorder.states(queue)).containsExactly(OPEN, RECOVERING, OPEN);
    verify(metrics).rebuild();
    verify(metrics, times(2)).openConnection();

    exchange.publish("after restart", "order.created").get(10, SECONDS);
    assertThat(sync).completes();
    assertThat(payloads).containsExactly("after restart");
  }

  @Test
  void connectionIsRebuiltUntilBrokerIsBack() throws Exception {
    Connection connection = connectionBuilder().build();
    Queue queue = connection.declareQueue("billing");
    queue.initialized().get(10, SECONDS);
    broker.down(true);
    int attempts = broker.connectionAttempts();

    broker.killConnections();

    waitAtMost(() -> broker.connectionAttempts() >= attempts + 3);
    assertThat(connection.state()).isEqualTo(RECOVERING);
    CompletableFuture<Void> initialized = connection.initialized();
    assertThat(initialized).isNotDone();

    broker.down(false);
    initialized.get(10, SECONDS);
    queue.initialized().get(10, SECONDS);
    assertThat(broker.hasQueue("billing")).isTrue();
  }

  @Test
  void publishIsRetriedOnceAfterRebuild() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders", Exchange.Type.FANOUT);
    Queue queue = connection.declareQueue("billing");
    queue.bind(exchange);
    connection.completeConfiguration().get(10, SECONDS);
    broker.deleteExchange("orders");

    // the broker closes the channel, the next publish fails on it
    exchange.publish("lost").get(10, SECONDS);
    exchange.publish("retried").get(10, SECONDS);

    assertThat(broker.hasExchange("orders")).isTrue();
    assertThat(broker.messageCount("billing")).isEqualTo(1);
    verify(metrics).publishRetry();
    verify(metrics).rebuild();
  }

  @Test
  void publishFailsWhenRetryAfterRebuildFails() throws Exception {
    Connection connection = connectionBuilder().build();
    Queue queue = connection.declareQueue("billing");
    queue.initialized().get(10, SECONDS);
    broker.failPublications(2);

    assertThatThrownBy(() -> queue.publish("lost").get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpPublishException.class)
        .hasMessageContaining("after connection rebuild");
    verify(metrics).publishRetry();
    verify(metrics).rebuild();
    verify(metrics, times(0)).publish();
    assertThat(connection).isOpen();

    // the failed retry left a closed channel, the next publish rebuilds again
    queue.publish("delivered").get(10, SECONDS);
    assertThat(broker.messageCount("billing")).isEqualTo(1);
    verify(metrics).publish();
    verify(metrics, times(2)).rebuild();
  }

  @Test
  void rebuildFailureIsReportedToTrigger() throws Exception {
    Connection connection = connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders", Exchange.Type.FANOUT);
    Queue queue = connection.declareQueue("billing");
    connection.completeConfiguration().get(10, SECONDS);
    broker.rejectDeclaration("orders");
    broker.failPublications(1);

    assertThatThrownBy(() -> queue.publish("lost").get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpPublishException.class)
        .satisfies(
            e ->
                assertThat(e.getCause().getCause())
                    .isInstanceOf(AmqpException.AmqpChannelException.class)
                    .hasMessageContaining("orders"));
    verify(metrics).rebuild();
    assertThat(exchange).reaches(CLOSED);
    assertThat(((AmqpConnection) connection).registry().exchange("orders")).isNull();
    assertThat(connection).isOpen();

    // the rest of the topology has been set up again
    queue.publish("delivered").get(10, SECONDS);
    assertThat(broker.messageCount("billing")).isEqualTo(1);
    connection.completeConfiguration().get(10, SECONDS);
  }

  @Test
  void rebuildWaitsForEverySetupItStarted() throws Exception {
    Connection connection = connectionBuilder().build();
    Queue queue = connection.declareQueue("billing");
    Queue shipping = connection.declareQueue("shipping");
    connection.completeConfiguration().get(10, SECONDS);
    broker.rejectDeclaration("billing");
    broker.rejectDeclaration("shipping");

    CompletableFuture<Void> rebuild =
        ((AmqpConnection) connection).rebuild(new IllegalStateException("connection lost"));

    assertThatThrownBy(() -> rebuild.get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.class)
        .hasMessageContaining("2 operations failed")
        .satisfies(e -> assertThat(e.getCause().getSuppressed()).hasSize(1));
    assertThat(queue).reaches(CLOSED);
    assertThat(shipping).reaches(CLOSED);
    assertThat(((AmqpConnection) connection).registry().snapshot().all()).isEmpty();
    connection.completeConfiguration().get(10, SECONDS);
  }

  @Test
  void publishFailsWithoutRecovery() throws Exception {
    Connection connection =
        environment.connectionBuilder().recovery().activated(false).connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders");
    exchange.initialized().get(10, SECONDS);
    broker.deleteExchange("orders");

    exchange.publish("lost").get(10, SECONDS);
    assertThatThrownBy(() -> exchange.publish("failed").get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpPublishException.class);
    verify(metrics, times(0)).rebuild();
  }

  @Test
  void connectionLossWithoutRecoveryClosesEverything() throws Exception {
    Connection connection =
        environment.connectionBuilder().recovery().activated(false).connectionBuilder().build();
    Exchange exchange = connection.declareExchange("orders");
    Queue queue = connection.declareQueue("billing");
    connection.completeConfiguration().get(10, SECONDS);

    broker.killConnections();

    assertThat(connection).reaches(CLOSED);
    assertThat(exchange).isClosed();
    assertThat(queue).isClosed();
    assertThatThrownBy(() -> exchange.publish("x"))
        .isInstanceOf(AmqpException.AmqpConnectionException.class);
    assertThatThrownBy(() -> connection.declareQueue("other")).isInstanceOf(AmqpException.class);
    assertThat(hooks.hooks()).isEmpty();
  }

  @Test
  void connectRetriesUntilSuccess() throws Exception {
    broker.refuseConnections(2);
    Connection connection =
        environment
            .connectionBuilder()
            .recovery()
            .backOffDelayPolicy(BackOffDelayPolicy.retries(3, Duration.ofMillis(20)))
            .connectionBuilder()
            .build();
    connection.initialized().get(10, SECONDS);
    assertThat(broker.connectionAttempts()).isEqualTo(3);
    assertThat(connection).isOpen();
  }

  @Test
  void connectFailsWhenRetriesAreExhausted() {
    broker.down(true);
    Connection connection =
        environment
            .connectionBuilder()
            .recovery()
            .backOffDelayPolicy(BackOffDelayPolicy.retries(2, Duration.ofMillis(20)))
            .connectionBuilder()
            .build();
    Queue queue = connection.declareQueue("billing");
    assertThatThrownBy(() -> connection.initialized().get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.AmqpConnectionException.class);
    assertThat(broker.connectionAttempts()).isEqualTo(3);
    assertThat(connection).reaches(CLOSED);
    assertThatThrownBy(() -> queue.initialized().get(10, SECONDS))
        .hasCauseInstanceOf(AmqpException.class);
  }

  @Test
  void concurrentRebuildsShareTheSameOutcome() throws Exception {
    AmqpConnection connection = (AmqpConnection) connectionBuilder().build();
    connection.initialized().get(10, SECONDS);
    broker.refuseConnections(2);

    CompletableFuture<Void> first = connection.rebuild(new IllegalStateException("first"));
    CompletableFuture<Void> second = connection.rebuild(new IllegalStateException("second"));

    assertThat(second).isSameAs(first);
    first.get(10, SECONDS);
    verify(metrics, times(1)).rebuild();
    assertThat(broker.openConnections()).isEqualTo(1);
  }

  @Test
  void shutdownHookFollowsBrokerConnection() throws Exception {
    Connection connection = connectionBuilder().build();
    connection.initialized().get(10, SECONDS);
    assertThat(hooks.hooks()).hasSize(1);
    Thread firstHook = hooks.hooks().get(0);

    broker.killConnections();
    waitAtMost(() -> hooks.hooks().size() == 1 && hooks.hooks().get(0) != firstHook);
    connection.initialized().get(10, SECONDS);

    connection.close();
    assertThat(hooks.hooks()).isEmpty();
  }

  @Test
  void closedConnectionRejectsOperations() throws Exception {
    TestUtils.StateRecorder recorder = new TestUtils.StateRecorder();
    Connection connection = connectionBuilder().listeners(recorder).build();
    Queue queue = connection.declareQueue("billing");
    queue.startConsumer(message -> {});
    connection.completeConfiguration().get(10, SECONDS);

    connection.close();

    assertThat(connection).isClosed();
    assertThat(queue).isClosed();
    assertThat(broker.openConnections()).isZero();
    assertThat(recorder.states(connection)).endsWith(CLOSED);
    assertThatThrownBy(() -> connection.declareQueue("other"))
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThatThrownBy(connection::completeConfiguration)
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThatThrownBy(() -> queue.publish("x"))
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    verify(metrics, atLeastOnce()).closeConnection();
    connection.closeAsync().get(10, SECONDS);
  }

  @Test
  void closingEnvironmentClosesConnections() {
    Connection connection = connectionBuilder().build();
    environment.close();
    assertThat(connection).reaches(CLOSED);
    assertThatThrownBy(() -> environment.connectionBuilder())
        .isInstanceOf(IllegalStateException.class);
  }
}
