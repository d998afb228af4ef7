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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import org.apache.log4j.Logger;
import org.chaincraft.NodeSettings;
import org.chaincraft.PeerId;
import org.chaincraft.event.DisconnectReason;
import org.chaincraft.event.NodeListener;
import org.chaincraft.event.PeerState;
import org.chaincraft.manager.Clock;
import org.chaincraft.manager.NodeCoreConstants;
import org.chaincraft.manager.NodeModel;
import org.chaincraft.transport.ConnectionListener;
import org.chaincraft.transport.TransportManager;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Owns the peer table: discovery, connection set up and tear down, capacity and liveness. Records
 * are keyed by address; connected records are also indexed by the id presented in the handshake.
 * Banned addresses leave the table and are remembered separately so later discovery can not bring
 * them back.
 */
public class PeerManager implements ConnectionListener {

  private static final Logger LOGGER = Logger.getLogger(PeerManager.class);

  private final NodeModel model;
  private final NodeSettings settings;
  private final Clock clock;
  private final TransportManager transport;
  private final List<DiscoverySource> discoverySources;
  private final NodeListener listener;
  private final Executor writers;
  private final Executor workers;
  private final MetricRegistry registry;
  private final ConcurrentHashMap<URI, PeerRecord> byAddress = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<PeerId, PeerRecord> byId = new ConcurrentHashMap<>();
  private final Set<URI> banned = ConcurrentHashMap.newKeySet();
  private final Object capacityLock = new Object();
  private final List<PeerSessionListener> sessionListeners = new CopyOnWriteArrayList<>();
  private final Meter evicted;
  private final Meter bannedMeter;
  private volatile boolean accepting = true;

  public PeerManager(NodeModel model, TransportManager transport, List<DiscoverySource> discoverySources,
          NodeListener listener, Executor writers, Executor workers) {
    this.model = model;
    this.settings = model.getSettings();
    this.clock = model.getClock();
    this.transport = transport;
    this.discoverySources = discoverySources;
    this.listener = listener;
    this.writers = writers;
    this.workers = workers;
    this.registry = model.getRegistry();
    evicted = registry.meter(NodeCoreConstants.PEERS_EVICTED);
    bannedMeter = registry.meter(NodeCoreConstants.PEERS_BANNED);
    registry.register(NodeCoreConstants.CONNECTED_PEERS, (Gauge<Integer>) () -> getConnectedPeers().size());
    registry.register(NodeCoreConstants.KNOWN_PEERS, (Gauge<Integer>) byAddress::size);
  }

  /**
   * Asks every discovery source for addresses and adds the new ones as {@link PeerState#DISCOVERED}.
   * @return every usable address the sources returned, new or not
   */
  public Set<URI> discover() {
    Set<URI> found = new LinkedHashSet<>();
    for (DiscoverySource source : discoverySources) {
      try {
        found.addAll(source.discover());
      } catch (RuntimeException ex) {
        LOGGER.warn("Discovery source " + source + " failed", ex);
      }
    }
    found.removeIf(address -> !usable(address));
    merge(found);
    return found;
  }

  /**
   * Adds unknown addresses to the table. Banned and own addresses are ignored.
   * @return how many records were created
   */
  public int merge(Collection<URI> addresses) {
    int added = 0;
    long now = clock.currentTimeMillis();
    for (URI address : addresses) {
      if (!usable(address)) {
        continue;
      }
      PeerRecord record = new PeerRecord(address, now);
      if (byAddress.putIfAbsent(address, record) == null) {
        added++;
        LOGGER.debug("Discovered " + address);
        listener.peerStateChanged(record, PeerState.DISCOVERED);
      }
    }
    return added;
  }

  private boolean usable(URI address) {
    return address != null && !address.equals(model.getMyAddress()) && !banned.contains(address);
  }

  /**
   * Connects to an address and registers the connection. An address that already has a live
   * connection returns its peer id without dialing again.
   */
  public PeerId connect(URI address) throws ConnectionException {
    if (!accepting) {
      throw new ConnectionException(address, "not accepting peers");
    }
    if (address.equals(model.getMyAddress())) {
      throw new ConnectionException(address, "refusing to connect to self");
    }
    if (banned.contains(address)) {
      throw new ConnectionException(address, "address is banned");
    }
    long now = clock.currentTimeMillis();
    PeerRecord record = byAddress.computeIfAbsent(address, a -> new PeerRecord(a, now));
    if (record.isConnected()) {
      return record.getPeerId();
    }
    if (now < record.getNextAttemptAt()) {
      throw new ConnectionException(address, "backing off until " + record.getNextAttemptAt());
    }
    PeerState from = record.getState();
    if (from == PeerState.CONNECTING || !record.transition(from, PeerState.CONNECTING, now)) {
      throw new ConnectionException(address, "connection attempt already in progress");
    }
    listener.peerStateChanged(record, PeerState.CONNECTING);
    PeerId id;
    try {
      id = transport.connect(address);
    } catch (IOException | RuntimeException ex) {
      connectFailed(record);
      throw new ConnectionException(address, "connect failed", ex);
    }
    if (record.isConnected() && id.equals(record.getPeerId())) {
      // the remote dialed us while we were dialing it
      return id;
    }
    if (id.equals(model.getMyself())) {
      transport.close(id);
      connectFailed(record);
      throw new ConnectionException(address, "address belongs to this node");
    }
    register(record, id);
    enforceCapacity(settings.getMaxPeers(), id);
    fireSessionStarted(id, true);
    return id;
  }

  public void addSessionListener(PeerSessionListener sessionListener) {
    sessionListeners.add(sessionListener);
  }

  private void fireSessionStarted(PeerId peer, boolean outbound) {
    for (PeerSessionListener sessionListener : sessionListeners) {
      try {
        sessionListener.sessionStarted(peer, outbound);
      } catch (RuntimeException ex) {
        LOGGER.warn("Session listener failed for " + peer, ex);
      }
    }
  }

  private void connectFailed(PeerRecord record) {
    long now = clock.currentTimeMillis();
    int failures = record.getFailureCount() + 1;
    long delay = backoff(failures);
    record.failed(now + delay, now);
    if (failures >= settings.getMaxConnectFailures()) {
      ban(record, "failed to connect " + failures + " times");
      return;
    }
    LOGGER.debug("Connect to " + record.getAddress() + " failed " + failures + " times, retry in " + delay + "ms");
    listener.peerStateChanged(record, PeerState.DISCONNECTED);
  }

  long backoff(int failures) {
    int shift = Math.min(failures - 1, 30);
    long delay = settings.getConnectBackoffBase() << shift;
    return delay < 0 ? settings.getConnectBackoffMax() : Math.min(settings.getConnectBackoffMax(), delay);
  }

  private void register(PeerRecord record, PeerId id) {
    PeerRecord previous = byId.get(id);
    if (previous != null && previous != record) {
      // same node came back under another address
      drop(previous, PeerState.DISCONNECTED, DisconnectReason.REQUESTED, false);
      byAddress.remove(previous.getAddress(), previous);
    }
    PeerConnection connection = new PeerConnection(id, transport, writers, workers,
        settings.getOutboundQueueSize(), settings.getInboundQueueSize(), registry);
    PeerId oldId = record.getPeerId();
    if (oldId != null && !oldId.equals(id)) {
      byId.remove(oldId, record);
    }
    PeerConnection old = record.getConnection();
    if (old != null) {
      old.close();
    }
    record.connected(id, connection, clock.currentTimeMillis());
    byId.put(id, record);
    LOGGER.info("Connected to " + id + " at " + record.getAddress());
    listener.peerStateChanged(record, PeerState.CONNECTED);
  }

  /** closes the connection and marks the record disconnected. Safe to call more than once. */
  public void disconnect(PeerId peer, DisconnectReason reason) {
    PeerRecord record = byId.get(peer);
    if (record == null) {
      transport.close(peer);
      return;
    }
    drop(record, PeerState.DISCONNECTED, reason, true);
  }

  private void drop(PeerRecord record, PeerState to, DisconnectReason reason, boolean closeTransport) {
    PeerId id = record.getPeerId();
    boolean wasConnected = record.isConnected();
    PeerConnection connection = record.disconnected(to, clock.currentTimeMillis());
    try {
      if (connection != null) {
        connection.close();
      }
    } finally {
      if (id != null) {
        byId.remove(id, record);
        if (closeTransport) {
          transport.close(id);
        }
      }
    }
    if (wasConnected) {
      LOGGER.info("Disconnected " + id + " at " + record.getAddress() + ": " + reason);
    }
    listener.peerStateChanged(record, to);
  }

  /**
   * Waits until every connected peer's outbound queue is empty.
   * @return false when the wait timed out
   */
  public boolean awaitFlushed(long millis) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    while (true) {
      boolean flushed = true;
      for (PeerRecord record : getConnectedPeers()) {
        PeerConnection connection = record.getConnection();
        if (connection != null && connection.outboundSize() > 0) {
          flushed = false;
          break;
        }
      }
      if (flushed) {
        return true;
      }
      if (System.nanoTime() >= deadline) {
        return false;
      }
      Thread.sleep(10);
    }
  }

  public void disconnectAll(DisconnectReason reason) {
    for (PeerRecord record : getConnectedPeers()) {
      drop(record, PeerState.DISCONNECTED, reason, true);
    }
  }

  /**
   * Evicts the lowest scoring connected peers until at most {@code maxPeers} remain, never going
   * below the configured minimum.
   * @return the evicted peers
   */
  public List<PeerId> enforceCapacity(int maxPeers) {
    return enforceCapacity(maxPeers, null);
  }

  private List<PeerId> enforceCapacity(int maxPeers, PeerId protect) {
    int target = Math.max(maxPeers, settings.getMinPeers());
    synchronized (capacityLock) {
      List<PeerRecord> connected = getConnectedPeers();
      if (connected.size() <= target) {
        return Collections.emptyList();
      }
      long now = clock.currentTimeMillis();
      List<PeerRecord> candidates = connected.stream()
          .filter(r -> !r.getPeerId().equals(protect))
          .sorted(PeerRecord.byScore(now))
          .collect(Collectors.toList());
      List<PeerId> result = new ArrayList<>();
      int excess = connected.size() - target;
      for (int i = 0; i < excess && i < candidates.size(); i++) {
        PeerRecord victim = candidates.get(i);
        result.add(victim.getPeerId());
        evicted.mark();
        drop(victim, PeerState.DISCONNECTED, DisconnectReason.EVICTED, true);
      }
      return result;
    }
  }

  /** disconnects every connected peer silent for longer than the peer timeout. */
  public List<PeerId> checkLiveness() {
    long now = clock.currentTimeMillis();
    List<PeerId> timedOut = new ArrayList<>();
    for (PeerRecord record : getConnectedPeers()) {
      if (now - record.getLastSeen() > settings.getPeerTimeout()) {
        timedOut.add(record.getPeerId());
        drop(record, PeerState.DISCONNECTED, DisconnectReason.TIMEOUT, true);
      }
    }
    return timedOut;
  }

  /** removes records that stayed disconnected for longer than the retention period. */
  public int reap() {
    long now = clock.currentTimeMillis();
    int removed = 0;
    for (PeerRecord record : byAddress.values()) {
      if (record.getState() == PeerState.DISCONNECTED
          && now - record.getStateChangedAt() > settings.getPeerRetention()
          && byAddress.remove(record.getAddress(), record)) {
        removed++;
      }
    }
    return removed;
  }

  public void penalize(PeerId peer, int points, String why) {
    PeerRecord record = byId.get(peer);
    if (record == null) {
      return;
    }
    int penalty = record.penalize(points);
    LOGGER.warn("Penalized " + peer + " by " + points + " (" + why + "), total " + penalty);
    if (penalty >= settings.getBanPenaltyThreshold()) {
      ban(record, "penalty " + penalty + " after " + why);
    }
  }

  private void ban(PeerRecord record, String why) {
    banned.add(record.getAddress());
    byAddress.remove(record.getAddress(), record);
    bannedMeter.mark();
    LOGGER.warn("Banned " + record.getAddress() + ": " + why);
    drop(record, PeerState.BANNED, DisconnectReason.BANNED, true);
  }

  /**
   * A frame for the peer was dropped because its outbound queue was full. Lowers the peer's score
   * so capacity eviction prefers it, but a slow peer is never banned for it.
   */
  public void recordBackpressure(PeerId peer, int points) {
    PeerRecord record = byId.get(peer);
    if (record == null) {
      return;
    }
    long congestion = record.congested(points, clock.currentTimeMillis());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Outbound queue of " + peer + " is full, congestion " + congestion);
    }
  }

  /** any traffic keeps a peer alive. */
  public void recordTraffic(PeerId peer) {
    PeerRecord record = byId.get(peer);
    if (record != null) {
      record.seen(clock.currentTimeMillis());
    }
  }

  /** traffic that moved the node forward, such as an object it did not have, raises the score. */
  public void recordUseful(PeerId peer) {
    PeerRecord record = byId.get(peer);
    if (record != null) {
      record.useful(clock.currentTimeMillis());
    }
  }

  @Override
  public void connectionOpened(PeerId peer, URI address) {
    if (!accepting || peer.equals(model.getMyself()) || address == null || banned.contains(address)) {
      LOGGER.debug("Refusing inbound connection from " + peer + " at " + address);
      transport.close(peer);
      return;
    }
    PeerRecord existing = byId.get(peer);
    if (existing != null && existing.isConnected()) {
      return;
    }
    PeerRecord record = byAddress.computeIfAbsent(address, a -> new PeerRecord(a, clock.currentTimeMillis()));
    register(record, peer);
    enforceCapacity(settings.getMaxPeers(), peer);
    fireSessionStarted(peer, false);
  }

  @Override
  public void connectionClosed(PeerId peer) {
    PeerRecord record = byId.get(peer);
    if (record != null && record.isConnected()) {
      drop(record, PeerState.DISCONNECTED, DisconnectReason.REMOTE_CLOSED, false);
    }
  }

  /** after this inbound connections are refused and {@link #connect(URI)} fails. */
  public void stopAccepting() {
    accepting = false;
  }

  public boolean isAccepting() {
    return accepting;
  }

  public List<PeerRecord> getConnectedPeers() {
    List<PeerRecord> result = new ArrayList<>();
    for (PeerRecord record : byAddress.values()) {
      if (record.isConnected()) {
        result.add(record);
      }
    }
    return result;
  }

  public List<PeerId> getConnectedPeerIds() {
    return getConnectedPeers().stream().map(PeerRecord::getPeerId).collect(Collectors.toList());
  }

  /** records that may be dialed now: not connected, not connecting and out of backoff. */
  public List<URI> connectCandidates() {
    long now = clock.currentTimeMillis();
    List<URI> result = new ArrayList<>();
    for (PeerRecord record : byAddress.values()) {
      PeerState state = record.getState();
      if ((state == PeerState.DISCOVERED || state == PeerState.DISCONNECTED) && now >= record.getNextAttemptAt()) {
        result.add(record.getAddress());
      }
    }
    return result;
  }

  public PeerRecord getRecord(URI address) {
    return byAddress.get(address);
  }

  public PeerRecord getRecord(PeerId peer) {
    return byId.get(peer);
  }

  public Collection<PeerRecord> getKnownPeers() {
    return Collections.unmodifiableCollection(byAddress.values());
  }

  public boolean isBanned(URI address) {
    return banned.contains(address);
  }

  /** the live connection to a peer, or null. */
  public PeerConnection connection(PeerId peer) {
    PeerRecord record = byId.get(peer);
    return record == null ? null : record.getConnection();
  }
}
