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

import com.rabbitmq.topology.ConnectionSettings;
import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.time.Duration;
import javax.net.ssl.SSLContext;

abstract class DefaultConnectionSettings<T> implements ConnectionSettings<T> {

  static final String DEFAULT_HOST = "localhost";
  static final int DEFAULT_PORT = 5672;
  static final int DEFAULT_TLS_PORT = 5671;
  static final String DEFAULT_VIRTUAL_HOST = "/";
  static final String DEFAULT_USERNAME = "guest";
  static final String DEFAULT_PASSWORD = "guest";
  static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(60);
  static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(60);

  private String host = DEFAULT_HOST;
  private int port = -1;
  private String username = DEFAULT_USERNAME;
  private String password = DEFAULT_PASSWORD;
  private String virtualHost = DEFAULT_VIRTUAL_HOST;
  private URI uri;
  private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
  private Duration requestedHeartbeat = DEFAULT_HEARTBEAT;
  private final DefaultTlsSettings<T> tlsSettings = new DefaultTlsSettings<>(this);

  @Override
  public T uri(String uriString) {
    if (uriString == null) {
      throw new IllegalArgumentException("URI parameter cannot be null");
    }
    this.uri = toUri(uriString);
    if (this.uri.getScheme().equalsIgnoreCase("amqps")) {
      this.tlsSettings.enable();
    }
    return toReturn();
  }

  @Override
  public T username(String username) {
    this.username = username;
    return toReturn();
  }

  @Override
  public T password(String password) {
    this.password = password;
    return toReturn();
  }

  @Override
  public T host(String host) {
    this.host = host;
    return toReturn();
  }

  @Override
  public T port(int port) {
    this.port = port;
    return toReturn();
  }

  @Override
  public T virtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
    return toReturn();
  }

  @Override
  public T connectionTimeout(Duration connectionTimeout) {
    if (connectionTimeout.isNegative()) {
      throw new IllegalArgumentException("Connection timeout cannot be negative");
    }
    this.connectionTimeout = connectionTimeout;
    return toReturn();
  }

  @Override
  public T requestedHeartbeat(Duration heartbeat) {
    if (heartbeat.isNegative()) {
      throw new IllegalArgumentException("Heartbeat cannot be negative");
    }
    this.requestedHeartbeat = heartbeat;
    return toReturn();
  }

  @Override
  public TlsSettings<T> tls() {
    this.tlsSettings.enable();
    return this.tlsSettings;
  }

  abstract T toReturn();

  String host() {
    return this.host;
  }

  int port() {
    if (this.port == -1) {
      return this.tlsEnabled() ? DEFAULT_TLS_PORT : DEFAULT_PORT;
    } else {
      return this.port;
    }
  }

  String username() {
    return this.username;
  }

  String password() {
    return this.password;
  }

  String virtualHost() {
    return this.virtualHost;
  }

  Duration connectionTimeout() {
    return this.connectionTimeout;
  }

  Duration requestedHeartbeat() {
    return this.requestedHeartbeat;
  }

  boolean tlsEnabled() {
    return this.tlsSettings.enabled();
  }

  DefaultTlsSettings<?> tlsSettings() {
    return this.tlsSettings;
  }

  void copyTo(DefaultConnectionSettings<?> copy) {
    copy.host(this.host);
    copy.port(this.port);
    copy.username(this.username);
    copy.password(this.password);
    copy.virtualHost(this.virtualHost);
    copy.connectionTimeout(this.connectionTimeout);
    copy.requestedHeartbeat(this.requestedHeartbeat);
    copy.uri = this.uri;
    if (this.tlsSettings.enabled()) {
      this.tlsSettings.copyTo((DefaultTlsSettings<?>) copy.tls());
    }
  }

  /** Apply the URI elements to the individual settings. */
  DefaultConnectionSettings<?> consolidate() {
    if (this.uri != null) {
      String host = uri.getHost();
      if (host != null) {
        this.host(host);
      }

      int port = uri.getPort();
      if (port != -1) {
        this.port(port);
      }

      String userInfo = uri.getRawUserInfo();
      if (userInfo != null) {
        String[] userPassword = userInfo.split(":");
        if (userPassword.length > 2) {
          throw new IllegalArgumentException("Bad user info in URI " + userInfo);
        }

        this.username(uriDecode(userPassword[0]));
        if (userPassword.length == 2) {
          this.password(uriDecode(userPassword[1]));
        }
      }

      String path = uri.getRawPath();
      if (path != null && !path.isEmpty()) {
        if (path.indexOf('/', 1) != -1) {
          throw new IllegalArgumentException("Multiple segments in path of URI: " + path);
        }
        this.virtualHost(uriDecode(path.substring(1)));
      }
    }
    return this;
  }

  static DefaultConnectionSettings<?> instance() {
    return new DefaultConnectionSettings<>() {
      @Override
      Object toReturn() {
        return null;
      }
    };
  }

  @Override
  public String toString() {
    return (this.tlsEnabled() ? "amqps" : "amqp")
        + "://"
        + this.host
        + ":"
        + this.port()
        + "/"
        + ("/".equals(this.virtualHost) ? "" : this.virtualHost);
  }

  private static URI toUri(String uriString) {
    try {
      URI uri = new URI(uriString);
      if (!"amqp".equalsIgnoreCase(uri.getScheme()) && !"amqps".equalsIgnoreCase(uri.getScheme())) {
        throw new IllegalArgumentException(
            "Wrong scheme in AMQP URI: " + uri.getScheme() + ". Should be amqp or amqps");
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URI: " + uriString, e);
    }
  }

  private static String uriDecode(String s) {
    try {
      // URLDecode decodes '+' to a space, as for
      // form encoding. So protect plus signs.
      return URLDecoder.decode(s.replace("+", "%2B"), "US-ASCII");
    } catch (UnsupportedEncodingException e) {
      throw new IllegalArgumentException(e);
    }
  }

  static class DefaultTlsSettings<T> implements TlsSettings<T> {

    private final DefaultConnectionSettings<T> connectionSettings;

    private boolean enabled = false;
    private boolean hostnameVerification = true;
    private SSLContext sslContext;

    private DefaultTlsSettings(DefaultConnectionSettings<T> connectionSettings) {
      this.connectionSettings = connectionSettings;
    }

    @Override
    public TlsSettings<T> hostnameVerification(boolean hostnameVerification) {
      this.hostnameVerification = hostnameVerification;
      return this;
    }

    @Override
    public TlsSettings<T> sslContext(SSLContext sslContext) {
      this.sslContext = sslContext;
      return this;
    }

    @Override
    public T connection() {
      return this.connectionSettings.toReturn();
    }

    void copyTo(DefaultTlsSettings<?> copy) {
      copy.enabled = this.enabled;
      copy.sslContext(this.sslContext);
      copy.hostnameVerification(this.hostnameVerification);
    }

    void enable() {
      this.enabled = true;
    }

    boolean enabled() {
      return this.enabled;
    }

    SSLContext sslContext() {
      return this.sslContext;
    }

    boolean isHostnameVerification() {
      return this.hostnameVerification;
    }
  }
}
