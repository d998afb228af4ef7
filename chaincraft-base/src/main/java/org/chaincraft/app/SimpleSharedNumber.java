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
package org.chaincraft.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.chaincraft.model.Digest;
import org.chaincraft.model.SharedObject;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/** A shared counter: every accepted payload that is a bare JSON integer is added to it. */
public class SimpleSharedNumber implements ApplicationObject {

  public static final String TYPE_NAME = "SimpleSharedNumber";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Set<Digest> applied = new HashSet<>();
  private long number;

  @Override
  public String getTypeName() {
    return TYPE_NAME;
  }

  @Override
  public boolean isValid(SharedObject object) {
    return value(object.getPayload()) != null;
  }

  @Override
  public synchronized void apply(SharedObject object, long orderIndex) {
    Long value = value(object.getPayload());
    if (value == null || !applied.add(object.getDigest())) {
      return;
    }
    number += value;
  }

  public synchronized long getNumber() {
    return number;
  }

  @Override
  public synchronized JsonNode getState() {
    ObjectNode state = MAPPER.createObjectNode();
    state.put("number", number);
    state.put("messageCount", applied.size());
    return state;
  }

  @Override
  public synchronized void reset() {
    number = 0;
    applied.clear();
  }

  private static Long value(byte[] payload) {
    JsonNode node;
    try {
      node = MAPPER.readTree(payload);
    } catch (IOException ex) {
      return null;
    }
    if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
      return null;
    }
    return node.asLong();
  }
}
