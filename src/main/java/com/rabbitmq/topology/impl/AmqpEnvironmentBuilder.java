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
import com.rabbitmq.topology.Environment;
import com.rabbitmq.topology.metrics.MetricsCollector;
import com.rabbitmq.topology.metrics.NoOpMetricsCollector;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builder for {@link Environment} instances.
 *
 * <p>Connection settings set here are the defaults of the connections of the environment.
 */
public class AmqpEnvironmentBuilder {

  private final DefaultEnvironmentConnectionSettings connectionSettings =
      new DefaultEnvironmentConnectionSettings(this);
  private ScheduledExecutorService scheduledExecutorService;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private BrokerClient brokerClient;
  private ProcessIdentity processIdentity;
  private ShutdownHookSupport.Hooks shutdownHooks;

  public AmqpEnvironmentBuilder() {}

  /**
   * Scheduler to wait between connection attempts.
   *
   * <p>The environment creates its own scheduler by default, it does not shut down a scheduler set
   * with this method.
   *
   * @param scheduledExecutorService the scheduler
   * @return this builder instance
   */
  public AmqpEnvironmentBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * <p>Default is no-op.
   *
   * @param metricsCollector metrics collector
   * @return this builder instance
   * @see com.rabbitmq.topology.metrics.MicrometerMetricsCollector
   */
  public AmqpEnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  /**
   * Returns connection settings shared by the connection builders of the environment.
   *
   * @return the connection settings
   */
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public EnvironmentConnectionSettings connectionSettings() {
    return this.connectionSettings;
  }

  AmqpEnvironmentBuilder brokerClient(BrokerClient brokerClient) {
    this.brokerClient = brokerClient;
    return this;
  }

  AmqpEnvironmentBuilder processIdentity(ProcessIdentity processIdentity) {
    this.processIdentity = processIdentity;
    return this;
  }

  AmqpEnvironmentBuilder shutdownHooks(ShutdownHookSupport.Hooks shutdownHooks) {
    this.shutdownHooks = shutdownHooks;
    return this;
  }

  /**
   * Create the environment instance.
   *
   * @return the configured environment
   */
  public Environment build() {
    return new AmqpEnvironment(
        this.scheduledExecutorService,
        this.connectionSettings,
        this.metricsCollector,
        this.brokerClient,
        this.processIdentity,
        this.shutdownHooks);
  }

  /** Common settings for connections of an environment. */
  public interface EnvironmentConnectionSettings
      extends ConnectionSettings<EnvironmentConnectionSettings> {

    /**
     * The owning environment builder.
     *
     * @return environment builder
     */
    AmqpEnvironmentBuilder environmentBuilder();
  }

  static class DefaultEnvironmentConnectionSettings
      extends DefaultConnectionSettings<EnvironmentConnectionSettings>
      implements EnvironmentConnectionSettings {

    private final AmqpEnvironmentBuilder builder;

    DefaultEnvironmentConnectionSettings(AmqpEnvironmentBuilder builder) {
      this.builder = builder;
    }

    @Override
    EnvironmentConnectionSettings toReturn() {
      return this;
    }

    @Override
    public AmqpEnvironmentBuilder environmentBuilder() {
      return this.builder;
    }
  }
}
