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

import com.rabbitmq.topology.BackOffDelayPolicy;
import com.rabbitmq.topology.Connection;
import com.rabbitmq.topology.ConnectionBuilder;
import com.rabbitmq.topology.Resource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class AmqpConnectionBuilder implements ConnectionBuilder {

  private final AmqpEnvironment environment;
  private final AmqpRecoveryConfiguration recoveryConfiguration =
      new AmqpRecoveryConfiguration(this);
  private final DefaultConnectionSettings<ConnectionBuilder> connectionSettings =
      new AmqpConnectionBuilderConnectionSettings(this);
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private final List<Resource.StateListener> topologyListeners = new ArrayList<>();
  private String name;

  AmqpConnectionBuilder(AmqpEnvironment environment) {
    this.environment = environment;
    this.environment.connectionSettings().copyTo(this.connectionSettings);
  }

  @Override
  public ConnectionBuilder uri(String uri) {
    return this.connectionSettings.uri(uri);
  }

  @Override
  public ConnectionBuilder username(String username) {
    return this.connectionSettings.username(username);
  }

  @Override
  public ConnectionBuilder password(String password) {
    return this.connectionSettings.password(password);
  }

  @Override
  public ConnectionBuilder host(String host) {
    return this.connectionSettings.host(host);
  }

  @Override
  public ConnectionBuilder port(int port) {
    return this.connectionSettings.port(port);
  }

  @Override
  public ConnectionBuilder virtualHost(String virtualHost) {
    return this.connectionSettings.virtualHost(virtualHost);
  }

  @Override
  public ConnectionBuilder connectionTimeout(Duration connectionTimeout) {
    return this.connectionSettings.connectionTimeout(connectionTimeout);
  }

  @Override
  public ConnectionBuilder requestedHeartbeat(Duration heartbeat) {
    return this.connectionSettings.requestedHeartbeat(heartbeat);
  }

  @Override
  public TlsSettings<? extends ConnectionBuilder> tls() {
    return this.connectionSettings.tls();
  }

  @Override
  public ConnectionBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public ConnectionBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public ConnectionBuilder topologyListeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.topologyListeners.clear();
    } else {
      this.topologyListeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public RecoveryConfiguration recovery() {
    return this.recoveryConfiguration;
  }

  @Override
  public Connection build() {
    return this.environment.connection(this);
  }

  AmqpEnvironment environment() {
    return this.environment;
  }

  DefaultConnectionSettings<?> connectionSettings() {
    return this.connectionSettings;
  }

  AmqpRecoveryConfiguration recoveryConfiguration() {
    return this.recoveryConfiguration;
  }

  String name() {
    return this.name;
  }

  List<Resource.StateListener> listeners() {
    return List.copyOf(this.listeners);
  }

  List<Resource.StateListener> topologyListeners() {
    return List.copyOf(this.topologyListeners);
  }

  static class AmqpRecoveryConfiguration implements RecoveryConfiguration {

    private final AmqpConnectionBuilder connectionBuilder;
    private boolean activated = true;
    private BackOffDelayPolicy backOffDelayPolicy = BackOffDelayPolicy.defaultPolicy();

    AmqpRecoveryConfiguration(AmqpConnectionBuilder connectionBuilder) {
      this.connectionBuilder = connectionBuilder;
    }

    @Override
    public AmqpRecoveryConfiguration activated(boolean activated) {
      this.activated = activated;
      return this;
    }

    @Override
    public AmqpRecoveryConfiguration backOffDelayPolicy(BackOffDelayPolicy backOffDelayPolicy) {
      if (backOffDelayPolicy == null) {
        throw new IllegalArgumentException("Back-off delay policy cannot be null");
      }
      this.backOffDelayPolicy = backOffDelayPolicy;
      return this;
    }

    @Override
    public ConnectionBuilder connectionBuilder() {
      return this.connectionBuilder;
    }

    boolean activated() {
      return this.activated;
    }

    BackOffDelayPolicy backOffDelayPolicy() {
      return this.backOffDelayPolicy;
    }
  }

  static class AmqpConnectionBuilderConnectionSettings
      extends DefaultConnectionSettings<ConnectionBuilder> {

    private final AmqpConnectionBuilder builder;

    private AmqpConnectionBuilderConnectionSettings(AmqpConnectionBuilder builder) {
      this.builder = builder;
    }

    @Override
    ConnectionBuilder toReturn() {
      return this.builder;
    }
  }
}
