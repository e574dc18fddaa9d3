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

import java.io.IOException;
import java.util.function.Consumer;

/** A physical connection to the broker. */
interface BrokerConnection extends AutoCloseable {

  BrokerChannel createChannel() throws IOException;

  /**
   * Register a callback for unexpected shutdowns of the connection.
   *
   * <p>The callback is not called when the application closes the connection.
   *
   * @param listener shutdown callback, receives the shutdown cause
   */
  void addShutdownListener(Consumer<Throwable> listener);

  boolean isOpen();

  @Override
  void close() throws IOException;
}
