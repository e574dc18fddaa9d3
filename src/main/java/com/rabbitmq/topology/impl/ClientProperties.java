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

import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ClientProperties {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClientProperties.class);

  private static final String PROPERTY_FILE = "rabbitmq-topology-client.properties";
  private static final String VERSION_PROPERTY = "com.rabbitmq.topology.version";

  public static final String VERSION = getVersion();

  /** Entries merged into the client properties sent to the broker on connection. */
  public static final Map<String, Object> DEFAULT_CLIENT_PROPERTIES =
      Map.of(
          "product", "RabbitMQ Topology Client",
          "version", ClientProperties.VERSION,
          "platform", "Java",
          "copyright", "Copyright (c) 2024 Broadcom Inc. and/or its subsidiaries.",
          "information",
              "Licensed under the Apache License version 2. See https://www.rabbitmq.com/.");

  private static String getVersion() {
    String version;
    try {
      version = getVersionFromPropertyFile();
    } catch (Exception e1) {
      LOGGER.warn("Couldn't get version from property file", e1);
      try {
        version = getVersionFromPackage();
      } catch (Exception e2) {
        LOGGER.warn("Couldn't get version with Package#getImplementationVersion", e2);
        version = getDefaultVersion();
      }
    }
    return version;
  }

  private static String getVersionFromPropertyFile() throws Exception {
    Properties version = new Properties();
    try (InputStream inputStream =
        ClientProperties.class.getClassLoader().getResourceAsStream(PROPERTY_FILE)) {
      if (inputStream == null) {
        throw new IllegalStateException("Couldn't find property file " + PROPERTY_FILE);
      }
      version.load(inputStream);
    }
    String versionProperty = version.getProperty(VERSION_PROPERTY);
    if (versionProperty == null || versionProperty.startsWith("${")) {
      throw new IllegalStateException("Couldn't find version property in property file");
    }
    return versionProperty;
  }

  private static String getVersionFromPackage() {
    if (ClientProperties.class.getPackage().getImplementationVersion() == null) {
      throw new IllegalStateException("Couldn't get version with Package#getImplementationVersion");
    }
    return ClientProperties.class.getPackage().getImplementationVersion();
  }

  private static String getDefaultVersion() {
    return "0.0.0";
  }

  private ClientProperties() {}
}
