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
package org.chaincraft.peer;

import org.chaincraft.PeerId;
import org.chaincraft.event.PeerState;

import java.net.URI;
import java.util.Comparator;

/**
 * What this node knows about one remote address. Records are owned by {@link PeerManager}: only
 * it changes them, everybody else reads.
 */
public class PeerRecord {

  /** lowest score first, ties go to the larger peer id so eviction is deterministic. */
  static Comparator<PeerRecord> byScore(long now) {
    return Comparator.comparingLong((PeerRecord r) -> r.score(now))
        .thenComparing(PeerRecord::getPeerId, Comparator.nullsFirst(Comparator.<PeerId>reverseOrder()));
  }

  private final URI address;
  private volatile PeerId peerId;
  private volatile PeerState state = PeerState.DISCOVERED;
  private volatile long lastSeen;
  private volatile long lastUseful;
  private volatile long stateChangedAt;
  private volatile long nextAttemptAt;
  private volatile int failureCount;
  private volatile int penalty;
  private double congestion;
  private long congestionAt;
  private volatile PeerConnection connection;

  PeerRecord(URI address, long now) {
    this.address = address;
    this.stateChangedAt = now;
    this.lastSeen = now;
    this.lastUseful = now;
  }

  public URI getAddress() {
    return address;
  }

  /** null until the first handshake with this address. */
  public PeerId getPeerId() {
    return peerId;
  }

  public PeerState getState() {
    return state;
  }

  public long getLastSeen() {
    return lastSeen;
  }

  public long getLastUseful() {
    return lastUseful;
  }

  public long getStateChangedAt() {
    return stateChangedAt;
  }

  public long getNextAttemptAt() {
    return nextAttemptAt;
  }

  public int getFailureCount() {
    return failureCount;
  }

  public int getPenalty() {
    return penalty;
  }

  /**
   * Backpressure points still weighing on the score. They drain at one point per second and never
   * lead to a ban.
   */
  public synchronized long getCongestion(long now) {
    return (long) Math.ceil(decayedCongestion(now));
  }

  private double decayedCongestion(long now) {
    double elapsed = Math.max(0, now - congestionAt) / 1000.0;
    return Math.max(0, congestion - elapsed);
  }

  public boolean isConnected() {
    return state == PeerState.CONNECTED;
  }

  /**
   * Higher is better. Loses a point per second without useful traffic, ten per connection
   * failure, one per penalty point and one per point of congestion.
   */
  public long score(long now) {
    return -((now - lastUseful) / 1000) - failureCount * 10L - penalty - getCongestion(now);
  }

  PeerConnection getConnection() {
    return connection;
  }

  synchronized boolean transition(PeerState from, PeerState to, long now) {
    if (state != from) {
      return false;
    }
    state = to;
    stateChangedAt = now;
    return true;
  }

  synchronized void connected(PeerId id, PeerConnection conn, long now) {
    peerId = id;
    connection = conn;
    state = PeerState.CONNECTED;
    stateChangedAt = now;
    failureCount = 0;
    nextAttemptAt = 0;
    lastSeen = now;
    lastUseful = now;
  }

  /** @return the connection that was open, if any */
  synchronized PeerConnection disconnected(PeerState to, long now) {
    PeerConnection old = connection;
    connection = null;
    state = to;
    stateChangedAt = now;
    return old;
  }

  /** @return the failure count after this failure */
  synchronized int failed(long retryAt, long now) {
    failureCount++;
    nextAttemptAt = retryAt;
    state = PeerState.DISCONNECTED;
    stateChangedAt = now;
    return failureCount;
  }

  synchronized int penalize(int points) {
    penalty += points;
    return penalty;
  }

  /** @return congestion after adding the points */
  synchronized long congested(int points, long now) {
    congestion = decayedCongestion(now) + points;
    congestionAt = now;
    return (long) Math.ceil(congestion);
  }

  void seen(long now) {
    lastSeen = now;
  }

  void useful(long now) {
    lastSeen = now;
    lastUseful = now;
  }

  @Override
  public String toString() {
    return "PeerRecord [address=" + address + ", peerId=" + peerId + ", state=" + state
        + ", failureCount=" + failureCount + ", penalty=" + penalty + "]";
  }
}
