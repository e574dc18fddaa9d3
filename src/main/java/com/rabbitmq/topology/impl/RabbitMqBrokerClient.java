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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import com.rabbitmq.topology.ConsumerOptions;
import com.rabbitmq.topology.ExchangeOptions;
import com.rabbitmq.topology.PublishOptions;
import com.rabbitmq.topology.QueueOptions;
import java.io.IOException;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerClient} on top of the RabbitMQ Java client (AMQP 0-9-1).
 *
 * <p>The automatic recovery of the Java client is disabled, the topology connection takes care of
 * recovery.
 */
final class RabbitMqBrokerClient implements BrokerClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitMqBrokerClient.class);

  @Override
  public BrokerConnection connect(DefaultConnectionSettings<?> settings, String connectionName)
      throws IOException, TimeoutException {
    ConnectionFactory factory = connectionFactory(settings);
    LOGGER.debug("Opening connection '{}' to {}", connectionName, settings);
    return new RabbitMqConnection(factory.newConnection(connectionName));
  }

  static ConnectionFactory connectionFactory(DefaultConnectionSettings<?> settings) {
    ConnectionFactory factory = new ConnectionFactory();
    factory.setHost(settings.host());
    factory.setPort(settings.port());
    factory.setUsername(settings.username());
    factory.setPassword(settings.password());
    factory.setVirtualHost(settings.virtualHost());
    factory.setConnectionTimeout((int) settings.connectionTimeout().toMillis());
    factory.setRequestedHeartbeat((int) settings.requestedHeartbeat().toSeconds());
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    Map<String, Object> clientProperties = new LinkedHashMap<>(factory.getClientProperties());
    clientProperties.putAll(ClientProperties.DEFAULT_CLIENT_PROPERTIES);
    factory.setClientProperties(clientProperties);
    if (settings.tlsEnabled()) {
      DefaultConnectionSettings.DefaultTlsSettings<?> tls = settings.tlsSettings();
      SSLContext sslContext = tls.sslContext();
      if (sslContext == null) {
        try {
          sslContext = SSLContext.getDefault();
        } catch (NoSuchAlgorithmException e) {
          throw new IllegalStateException("No default TLS context available", e);
        }
      }
      factory.useSslProtocol(sslContext);
      if (tls.isHostnameVerification()) {
        factory.enableHostnameVerification();
      }
    }
    return factory;
  }

  private static final class RabbitMqConnection implements BrokerConnection {

    private final com.rabbitmq.client.Connection delegate;

    private RabbitMqConnection(com.rabbitmq.client.Connection delegate) {
      this.delegate = delegate;
    }

    @Override
    public BrokerChannel createChannel() throws IOException {
      Channel channel = this.delegate.createChannel();
      if (channel == null) {
        throw new IOException("No channel available on connection " + this.delegate);
      }
      return new RabbitMqChannel(channel);
    }

    @Override
    public void addShutdownListener(Consumer<Throwable> listener) {
      this.delegate.addShutdownListener(
          cause -> {
            if (cause.isInitiatedByApplication()) {
              LOGGER.debug("Connection {} closed by the application", this.delegate);
            } else {
              listener.accept(cause);
            }
          });
    }

    @Override
    public boolean isOpen() {
      return this.delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
      if (this.delegate.isOpen()) {
        this.delegate.close();
      }
    }

    @Override
    public String toString() {
      return this.delegate.toString();
    }
  }

  private static final class RabbitMqChannel implements BrokerChannel {

    private final Channel delegate;

    private RabbitMqChannel(Channel delegate) {
      this.delegate = delegate;
    }

    @Override
    public void assertExchange(String name, String type, ExchangeOptions options)
        throws IOException {
      this.delegate.exchangeDeclare(
          name,
          type,
          options.isDurable(),
          options.isAutoDelete(),
          options.isInternal(),
          options.arguments());
    }

    @Override
    public void assertQueue(String name, QueueOptions options) throws IOException {
      this.delegate.queueDeclare(
          name,
          options.isDurable(),
          options.isExclusive(),
          options.isAutoDelete(),
          options.arguments());
    }

    @Override
    public void bindQueue(
        String queue, String source, String pattern, Map<String, Object> arguments)
        throws IOException {
      this.delegate.queueBind(queue, source, pattern, arguments);
    }

    @Override
    public void bindExchange(
        String destination, String source, String pattern, Map<String, Object> arguments)
        throws IOException {
      this.delegate.exchangeBind(destination, source, pattern, arguments);
    }

    @Override
    public void unbindQueue(
        String queue, String source, String pattern, Map<String, Object> arguments)
        throws IOException {
      this.delegate.queueUnbind(queue, source, pattern, arguments);
    }

    @Override
    public void unbindExchange(
        String destination, String source, String pattern, Map<String, Object> arguments)
        throws IOException {
      this.delegate.exchangeUnbind(destination, source, pattern, arguments);
    }

    @Override
    public void publish(String exchange, String routingKey, OutboundMessage message)
        throws IOException {
      this.delegate.basicPublish(
          exchange, routingKey, properties(message.options()), message.body());
    }

    @Override
    public void sendToQueue(String queue, OutboundMessage message) throws IOException {
      this.publish("", queue, message);
    }

    @Override
    public String consume(String queue, ConsumerOptions options, DeliveryCallback callback)
        throws IOException {
      if (options.prefetch() > 0) {
        this.delegate.basicQos(options.prefetch());
      }
      return this.delegate.basicConsume(
          queue,
          options.isAutoAck(),
          options.consumerTag(),
          false,
          options.isExclusive(),
          options.arguments(),
          (consumerTag, message) -> callback.handle(delivery(message)),
          consumerTag -> {
            LOGGER.debug("Consumer {} on queue '{}' cancelled by the broker", consumerTag, queue);
            callback.handle(null);
          },
          (consumerTag, signal) -> {
            LOGGER.debug(
                "Consumer {} on queue '{}' shut down: {}", consumerTag, queue, signal.getMessage());
            callback.handle(null);
          });
    }

    @Override
    public void cancel(String consumerTag) throws IOException {
      this.delegate.basicCancel(consumerTag);
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
      this.delegate.basicAck(deliveryTag, false);
    }

    @Override
    public void nack(long deliveryTag, boolean requeue) throws IOException {
      this.delegate.basicNack(deliveryTag, false, requeue);
    }

    @Override
    public void deleteExchange(String name) throws IOException {
      this.delegate.exchangeDelete(name);
    }

    @Override
    public void deleteQueue(String name) throws IOException {
      this.delegate.queueDelete(name);
    }

    @Override
    public boolean isOpen() {
      return this.delegate.isOpen();
    }

    @Override
    public void close() throws IOException, TimeoutException {
      if (this.delegate.isOpen()) {
        this.delegate.close();
      }
    }

    @Override
    public String toString() {
      return this.delegate.toString();
    }
  }

  static AMQP.BasicProperties properties(PublishOptions options) {
    AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder();
    builder.contentType(options.contentType());
    if (!options.headers().isEmpty()) {
      builder.headers(new LinkedHashMap<>(options.headers()));
    }
    if (options.isPersistent()) {
      builder.deliveryMode(2);
    }
    builder.messageId(options.messageId());
    builder.correlationId(options.correlationId());
    builder.expiration(options.expiration());
    builder.priority(options.priority());
    return builder.build();
  }

  private static Delivery delivery(com.rabbitmq.client.Delivery message) {
    Envelope envelope = message.getEnvelope();
    AMQP.BasicProperties properties = message.getProperties();
    Map<String, Object> headers = null;
    if (properties.getHeaders() != null) {
      headers = new LinkedHashMap<>(properties.getHeaders().size());
      for (Map.Entry<String, Object> header : properties.getHeaders().entrySet()) {
        Object value = header.getValue();
        headers.put(header.getKey(), value instanceof LongString ? value.toString() : value);
      }
    }
    return new Delivery(
        envelope.getDeliveryTag(),
        envelope.isRedeliver(),
        envelope.getExchange(),
        envelope.getRoutingKey(),
        properties.getContentType(),
        headers,
        message.getBody());
  }
}
