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
package org.chaincraft.manager;

public interface NodeCoreConstants {
  String DEDUP_SIZE = "chaincraft.core.dedup.size";
  String PENDING_SIZE = "chaincraft.core.pending.size";
  String IN_FLIGHT_REQUESTS = "chaincraft.core.requests.inflight";
  String COMMITTED_SIZE = "chaincraft.consensus.committed.size";
  String CANDIDATE_QUEUE_SIZE = "chaincraft.consensus.candidates.size";
  String CONSENSUS_ROUND_SIZE = "chaincraft.consensus.round.size";
  String OBJECTS_ACCEPTED = "chaincraft.consensus.accepted";
  String OBJECTS_REJECTED = "chaincraft.consensus.rejected";
  String OBJECTS_DEFERRED = "chaincraft.consensus.deferred";
  String DEFERRED_DROPPED = "chaincraft.core.deferred.dropped";
  String INTEGRITY_FAILURES = "chaincraft.core.integrity.failures";
  String CONNECTED_PEERS = "chaincraft.peers.connected.size";
  String KNOWN_PEERS = "chaincraft.peers.known.size";
  String PEERS_EVICTED = "chaincraft.peers.evicted";
  String PEERS_BANNED = "chaincraft.peers.banned";
  String OUTBOUND_DROPPED = "chaincraft.messaging.outbound.dropped";
  String INBOUND_DROPPED = "chaincraft.messaging.inbound.dropped";
  String MESSAGE_SERDE_EXCEPTION = "chaincraft.messaging.serde.exception";
  String MESSAGE_TRANSMISSION_EXCEPTION = "chaincraft.messaging.transmission.exception";
  String MESSAGE_TRANSMISSION_SUCCESS = "chaincraft.messaging.transmission.success";
}
