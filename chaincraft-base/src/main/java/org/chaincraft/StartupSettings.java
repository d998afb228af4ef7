/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.chaincraft;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.net.URI;

/**
 * What a node needs to boot, read from a JSON file:
 * <pre>
 * {
 *   "id": "node-1",
 *   "address": "tcp://127.0.0.1:7001",
 *   "settings": { "port": 7001, "maxPeers": 8, "bootstrapAddresses": ["tcp://127.0.0.1:7000"] }
 * }
 * </pre>
 */
public class StartupSettings {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private String id;
  private URI address;
  private NodeSettings settings = new NodeSettings();

  public static StartupSettings fromJsonFile(File file) throws IOException {
    StartupSettings startup = MAPPER.readValue(file, StartupSettings.class);
    if (startup.getSettings() == null) {
      startup.setSettings(new NodeSettings());
    }
    startup.getSettings().validate();
    return startup;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public URI getAddress() {
    return address;
  }

  public void setAddress(URI address) {
    this.address = address;
  }

  public NodeSettings getSettings() {
    return settings;
  }

  public void setSettings(NodeSettings settings) {
    this.settings = settings;
  }
}
