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

/** Builder for {@link Connection} instances. */
public interface ConnectionBuilder extends ConnectionSettings<ConnectionBuilder> {

  /**
   * Name of the connection, visible in the management UI.
   *
   * @param name connection name
   * @return this builder instance
   */
  ConnectionBuilder name(String name);

  /**
   * Configuration for connection attempts and recovery.
   *
   * @return recovery configuration
   */
  RecoveryConfiguration recovery();

  /**
   * Add {@link Resource.StateListener}s to the connection.
   *
   * @param listeners connection listeners
   * @return this builder instance
   */
  ConnectionBuilder listeners(Resource.StateListener... listeners);

  /**
   * Add {@link Resource.StateListener}s to every {@link Exchange}, {@link Queue}, and {@link
   * Binding} of the connection.
   *
   * @param listeners topology listeners
   * @return this builder instance
   */
  ConnectionBuilder topologyListeners(Resource.StateListener... listeners);

  /**
   * Create the connection instance.
   *
   * <p>The connection starts connecting immediately, {@link Connection#initialized()} completes
   * when it is connected.
   *
   * @return the configured connection
   */
  Connection build();

  /** Configuration for recovery. */
  interface RecoveryConfiguration {

    /**
     * Whether to rebuild the connection and its topology after a connection failure.
     *
     * <p>Activated by default. When deactivated, the connection closes on failure.
     *
     * @param activated activation flag
     * @return the configuration instance
     */
    RecoveryConfiguration activated(boolean activated);

    /**
     * Delay policy for connection attempts, for the first connection and during recovery.
     *
     * <p>Default is {@link BackOffDelayPolicy#defaultPolicy()}.
     *
     * @param backOffDelayPolicy back-off delay policy
     * @return the configuration instance
     * @see BackOffDelayPolicy#retries(int, java.time.Duration)
     */
    RecoveryConfiguration backOffDelayPolicy(BackOffDelayPolicy backOffDelayPolicy);

    /**
     * The connection builder.
     *
     * @return connection builder
     */
    ConnectionBuilder connectionBuilder();
  }
}
