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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Paths;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Application name, hostname, and process ID of the running process. */
final class ProcessIdentity {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessIdentity.class);

  static final String APPLICATION_NAME_PROPERTY = "rabbitmq.topology.application.name";
  static final String APPLICATION_NAME_ENVIRONMENT_VARIABLE = "RABBITMQ_TOPOLOGY_APPLICATION_NAME";
  static final String DEFAULT_APPLICATION_NAME = "application";

  private final String applicationName;
  private final String hostname;
  private final long pid;

  ProcessIdentity(String applicationName, String hostname, long pid) {
    this.applicationName = applicationName;
    this.hostname = hostname;
    this.pid = pid;
  }

  static ProcessIdentity current() {
    return new ProcessIdentity(
        applicationName(System::getProperty, System::getenv),
        resolveHostname(),
        ProcessHandle.current().pid());
  }

  /**
   * Name of the queue that consumes the messages of an exchange for this process.
   *
   * @param exchange exchange name
   * @return the queue name
   */
  String consumerQueueName(String exchange) {
    return exchange + "." + this.applicationName + "." + this.hostname + "." + this.pid;
  }

  String applicationName() {
    return this.applicationName;
  }

  String hostname() {
    return this.hostname;
  }

  long pid() {
    return this.pid;
  }

  static String applicationName(
      Function<String, String> systemProperties, Function<String, String> environment) {
    String name = systemProperties.apply(APPLICATION_NAME_PROPERTY);
    if (isBlank(name)) {
      name = environment.apply(APPLICATION_NAME_ENVIRONMENT_VARIABLE);
    }
    if (isBlank(name)) {
      name = fromCommand(systemProperties.apply("sun.java.command"));
    }
    return isBlank(name) ? DEFAULT_APPLICATION_NAME : name.trim();
  }

  /** Main class simple name or JAR file name (without extension) of a java command line. */
  static String fromCommand(String command) {
    if (isBlank(command)) {
      return null;
    }
    String main = command.trim().split("\\s+")[0];
    if (main.endsWith(".jar")) {
      String fileName = Paths.get(main).getFileName().toString();
      return fileName.substring(0, fileName.length() - ".jar".length());
    } else {
      int lastDot = main.lastIndexOf('.');
      return lastDot == -1 ? main : main.substring(lastDot + 1);
    }
  }

  private static String resolveHostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      LOGGER.debug("Could not resolve local hostname: {}", e.getMessage());
      String hostname = System.getenv("HOSTNAME");
      return isBlank(hostname) ? "localhost" : hostname;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @Override
  public String toString() {
    return this.applicationName + "@" + this.hostname + "[" + this.pid + "]";
  }
}
