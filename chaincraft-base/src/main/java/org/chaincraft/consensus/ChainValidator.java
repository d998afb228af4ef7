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
package org.chaincraft.consensus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.chaincraft.model.Digest;
import org.chaincraft.model.ObjectKind;
import org.chaincraft.model.SharedObject;

import java.io.IOException;

/**
 * Dependency aware strategy for JSON payloads.
 * <ul>
 *   <li>{@code "depends": ["<hex digest>", ...]} on any kind: every listed object must be committed
 *   first, the candidate is deferred on the first one that is not.</li>
 *   <li>{@code "parent": "<hex digest>"} on a {@link ObjectKind#BLOCK}: the block must extend the
 *   most recently committed block. A block without a parent is a genesis block and is only valid
 *   while no block is committed.</li>
 * </ul>
 * Non-JSON payloads are accepted for every kind but blocks.
 */
public class ChainValidator implements Validator {

  public static final String PARENT = "parent";
  public static final String DEPENDS = "depends";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Validator base;

  public ChainValidator() {
    this(new AppendOnlyValidator());
  }

  public ChainValidator(Validator base) {
    this.base = base;
  }

  @Override
  public ConsensusDecision validate(SharedObject candidate, StateView view) {
    ConsensusDecision baseDecision = base.validate(candidate, view);
    if (!baseDecision.isAccepted()) {
      return baseDecision;
    }
    JsonNode document = parse(candidate.getPayload());
    if (document == null || !document.isObject()) {
      return candidate.getKind() == ObjectKind.BLOCK
          ? ConsensusDecision.reject("block payload is not a JSON object")
          : baseDecision;
    }
    if (candidate.getKind() == ObjectKind.BLOCK) {
      ConsensusDecision parentDecision = checkParent(document.get(PARENT), view);
      if (parentDecision != null) {
        return parentDecision;
      }
    }
    JsonNode depends = document.get(DEPENDS);
    if (depends != null && !depends.isNull()) {
      if (!depends.isArray()) {
        return ConsensusDecision.reject("depends must be an array of digests");
      }
      for (JsonNode dependency : depends) {
        Digest digest = toDigest(dependency);
        if (digest == null) {
          return ConsensusDecision.reject("malformed dependency " + dependency);
        }
        if (!view.isCommitted(digest)) {
          return ConsensusDecision.defer(digest);
        }
      }
    }
    return baseDecision;
  }

  private ConsensusDecision checkParent(JsonNode parentNode, StateView view) {
    Digest tip = view.latest(ObjectKind.BLOCK);
    if (parentNode == null || parentNode.isNull()) {
      return tip == null ? null : ConsensusDecision.reject("genesis block already committed");
    }
    Digest parent = toDigest(parentNode);
    if (parent == null) {
      return ConsensusDecision.reject("malformed parent " + parentNode);
    }
    if (!view.isCommitted(parent)) {
      return ConsensusDecision.defer(parent);
    }
    if (view.kindOf(parent) != ObjectKind.BLOCK) {
      return ConsensusDecision.reject("parent " + parent + " is not a block");
    }
    if (!parent.equals(tip)) {
      return ConsensusDecision.reject("block does not extend the tip " + tip);
    }
    return null;
  }

  private static Digest toDigest(JsonNode node) {
    if (!node.isTextual()) {
      return null;
    }
    try {
      return Digest.fromHex(node.asText());
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }

  private static JsonNode parse(byte[] payload) {
    try {
      return MAPPER.readTree(payload);
    } catch (IOException ex) {
      return null;
    }
  }
}
