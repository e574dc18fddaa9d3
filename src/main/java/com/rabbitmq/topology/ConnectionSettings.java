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

import java.time.Duration;
import javax.net.ssl.SSLContext;

/**
 * Settings for a connection.
 *
 * @param <T> the type of object returned by methods, usually the object itself
 */
public interface ConnectionSettings<T> {

  /**
   * The URI of the broker.
   *
   * <p>Default is <code>amqp://localhost</code>. The <code>amqps</code> scheme enables TLS.
   *
   * <p>URI elements (host, port, user, password, virtual host) take precedence over the
   * individual settings.
   *
   * @param uri broker URI
   * @return type-parameter object
   * @see <a href="https://www.rabbitmq.com/docs/uri-spec">RabbitMQ URI Specification</a>
   */
  T uri(String uri);

  /**
   * The username to use.
   *
   * <p>Default is <code>guest</code>.
   *
   * @param username username
   * @return type-parameter object
   */
  T username(String username);

  /**
   * The password to use.
   *
   * <p>Default is <code>guest</code>.
   *
   * @param password password
   * @return type-parameter object
   */
  T password(String password);

  /**
   * The host to connect to.
   *
   * <p>Default is <code>localhost</code>.
   *
   * @param host hostname
   * @return type-parameter object
   */
  T host(String host);

  /**
   * The port to use to connect.
   *
   * <p>Default is 5672, 5671 with TLS.
   *
   * @param port port
   * @return type-parameter object
   */
  T port(int port);

  /**
   * The virtual host to connect to.
   *
   * <p>Default is <code>/</code>.
   *
   * @param virtualHost virtual host
   * @return type-parameter object
   */
  T virtualHost(String virtualHost);

  /**
   * Timeout for the TCP connection and the protocol handshake.
   *
   * <p>Default is 60 seconds.
   *
   * @param connectionTimeout connection timeout
   * @return type-parameter object
   */
  T connectionTimeout(Duration connectionTimeout);

  /**
   * Requested heartbeat timeout.
   *
   * <p>Default is 60 seconds. Use {@link Duration#ZERO} to deactivate heartbeats.
   *
   * @param heartbeat heartbeat timeout
   * @return type-parameter object
   */
  T requestedHeartbeat(Duration heartbeat);

  /**
   * TLS settings.
   *
   * @return TLS settings
   */
  TlsSettings<? extends T> tls();

  /**
   * TLS settings.
   *
   * @param <T>
   */
  interface TlsSettings<T> {

    /**
     * Activate hostname verification.
     *
     * <p>Activated by default.
     *
     * @param hostnameVerification activation flag
     * @return TLS settings
     */
    TlsSettings<T> hostnameVerification(boolean hostnameVerification);

    /**
     * {@link SSLContext} to use.
     *
     * <p>Default is the JVM default context.
     *
     * @param sslContext the SSL context to use
     * @return TLS settings
     */
    TlsSettings<T> sslContext(SSLContext sslContext);

    /**
     * The connection builder.
     *
     * @return connection builder
     */
    T connection();
  }
}
