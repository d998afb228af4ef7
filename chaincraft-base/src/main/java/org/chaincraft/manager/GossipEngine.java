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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import org.apache.log4j.Logger;
import org.chaincraft.NodeSettings;
import org.chaincraft.PeerId;
import org.chaincraft.app.ApplicationObjectRegistry;
import org.chaincraft.consensus.ConsensusDecision;
import org.chaincraft.consensus.ConsensusEngine;
import org.chaincraft.consensus.ConsensusListener;
import org.chaincraft.consensus.StateView;
import org.chaincraft.crypto.CryptoProvider;
import org.chaincraft.event.NodeListener;
import org.chaincraft.model.Announce;
import org.chaincraft.model.Base;
import org.chaincraft.model.Digest;
import org.chaincraft.model.Inventory;
import org.chaincraft.model.ObjectKind;
import org.chaincraft.model.ObjectMessage;
import org.chaincraft.model.Request;
import org.chaincraft.model.SharedObject;
import org.chaincraft.model.SyncRequest;
import org.chaincraft.peer.PeerManager;
import org.chaincraft.peer.PeerSessionListener;
import org.chaincraft.store.ObjectStore;
import org.chaincraft.store.ObjectStoreException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pull based dissemination of shared objects. A node announces digests it accepted, peers that do
 * not know a digest request it and the payload comes back as an object message. Received payloads
 * are checked against their digest, deduplicated and handed to consensus; accepted ones are stored
 * and announced to everybody except the peer they came from. A node that dials a peer also asks for
 * its committed digests, so objects accepted before the connection existed still arrive.
 */
public class GossipEngine implements ConsensusListener, PeerSessionListener {

  private static final Logger LOGGER = Logger.getLogger(GossipEngine.class);

  private final NodeSettings settings;
  private final Clock clock;
  private final PeerManager peers;
  private final MessagingManager messaging;
  private final ConsensusEngine consensus;
  private final ObjectStore store;
  private final CryptoProvider crypto;
  private final DedupCache dedup;
  private final DeferredObjects deferred;
  private final NodeListener listener;
  private final ApplicationObjectRegistry applications;
  private final ConcurrentHashMap<Digest, Fetch> inFlight = new ConcurrentHashMap<>();

  private final Meter accepted;
  private final Meter rejected;
  private final Meter deferredMeter;
  private final Meter deferredDropped;
  private final Meter integrityFailures;

  public GossipEngine(NodeModel model, PeerManager peers, MessagingManager messaging, ConsensusEngine consensus,
          ObjectStore store, CryptoProvider crypto, NodeListener listener, ApplicationObjectRegistry applications) {
    this.settings = model.getSettings();
    this.clock = model.getClock();
    this.peers = peers;
    this.messaging = messaging;
    this.consensus = consensus;
    this.store = store;
    this.crypto = crypto;
    this.listener = listener;
    this.applications = applications;
    this.dedup = new DedupCache(settings.getDedupCapacity(), settings.getDedupTtl(), clock);
    this.deferred = new DeferredObjects(settings.getMaxDeferredRetries(), settings.getDeferredTtl(),
        settings.getMaxPendingObjects(), clock);
    MetricRegistry registry = model.getRegistry();
    registry.register(NodeCoreConstants.DEDUP_SIZE, (Gauge<Integer>) dedup::size);
    registry.register(NodeCoreConstants.PENDING_SIZE, (Gauge<Integer>) deferred::size);
    registry.register(NodeCoreConstants.IN_FLIGHT_REQUESTS, (Gauge<Integer>) inFlight::size);
    accepted = registry.meter(NodeCoreConstants.OBJECTS_ACCEPTED);
    rejected = registry.meter(NodeCoreConstants.OBJECTS_REJECTED);
    deferredMeter = registry.meter(NodeCoreConstants.OBJECTS_DEFERRED);
    deferredDropped = registry.meter(NodeCoreConstants.DEFERRED_DROPPED);
    integrityFailures = registry.meter(NodeCoreConstants.INTEGRITY_FAILURES);
  }

  /**
   * Entry point for gossip traffic.
   * @return false when the message is not a gossip message
   */
  public boolean onReceive(PeerId from, Base message) {
    if (message instanceof Announce) {
      onAnnounce(from, ((Announce) message).getDigest());
    } else if (message instanceof Request) {
      onRequest(from, ((Request) message).getDigest());
    } else if (message instanceof ObjectMessage) {
      onObject(from, (ObjectMessage) message);
    } else if (message instanceof SyncRequest) {
      onSyncRequest(from, (SyncRequest) message);
    } else if (message instanceof Inventory) {
      onInventory(from, (Inventory) message);
    } else {
      return false;
    }
    return true;
  }

  void onAnnounce(PeerId from, Digest digest) {
    if (digest == null) {
      return;
    }
    if (isKnown(digest)) {
      return;
    }
    request(from, digest);
  }

  void onRequest(PeerId from, Digest digest) {
    if (digest == null) {
      return;
    }
    byte[] payload;
    try {
      payload = store.get(digest);
    } catch (ObjectStoreException ex) {
      fatal(ex);
      return;
    }
    if (payload == null) {
      LOGGER.debug(from + " requested unknown " + digest);
      return;
    }
    ObjectKind kind = consensus.getStateView().kindOf(digest);
    messaging.send(new ObjectMessage(digest, kind, payload), from);
  }

  void onObject(PeerId from, ObjectMessage message) {
    Digest digest;
    try {
      digest = verify(from, message);
    } catch (WireIntegrityException ex) {
      integrityFailures.mark();
      LOGGER.warn(ex.getMessage());
      peers.penalize(from, settings.getIntegrityPenalty(), "integrity violation");
      return;
    }
    inFlight.remove(digest);
    if (!dedup.insert(digest)) {
      return;
    }
    peers.recordUseful(from);
    submit(new SharedObject(digest, message.getKind(), message.getPayload(), from, clock.currentTimeMillis()));
  }

  private Digest verify(PeerId from, ObjectMessage message) {
    Digest claimed = message.getDigest();
    if (claimed == null || message.getPayload() == null) {
      throw new WireIntegrityException(from, claimed, "missing digest or payload");
    }
    Digest actual = crypto.hash(message.getPayload());
    if (!actual.equals(claimed)) {
      throw new WireIntegrityException(from, claimed, "payload hashes to " + actual);
    }
    return claimed;
  }

  /**
   * Submits an object created on this node. It skips the announce and request round trip and is
   * announced to every peer once accepted.
   * @return the digest of the payload
   */
  public Digest submitLocal(ObjectKind kind, byte[] payload) {
    Digest digest = crypto.hash(payload);
    if (dedup.insert(digest)) {
      submit(new SharedObject(digest, kind, payload, null, clock.currentTimeMillis()));
    } else {
      LOGGER.debug("Local submission of " + digest + " is a duplicate");
    }
    return digest;
  }

  private void submit(SharedObject object) {
    if (!consensus.submit(object)) {
      deferred.forget(object.getDigest());
      LOGGER.info("Consensus is not taking candidates, dropping " + object.getDigest());
      listener.objectRejected(object, "node is stopping");
    }
  }

  @Override
  public void onConsensusResult(SharedObject object, ConsensusDecision decision) {
    switch (decision.getOutcome()) {
      case ACCEPTED:
        accept(object, decision.getOrderIndex());
        break;
      case REJECTED:
        rejected.mark();
        deferred.forget(object.getDigest());
        LOGGER.info("Rejected " + object.getDigest() + ": " + decision.getReason());
        listener.objectRejected(object, decision.getReason());
        break;
      case DEFERRED:
        defer(object, decision.getMissingDependency());
        break;
      default:
        throw new IllegalStateException("Unknown outcome " + decision.getOutcome());
    }
  }

  private void accept(SharedObject object, long orderIndex) {
    Digest digest = object.getDigest();
    try {
      store.put(digest, object.getPayload());
    } catch (ObjectStoreException ex) {
      fatal(ex);
      return;
    }
    accepted.mark();
    deferred.forget(digest);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Accepted " + digest + " at " + orderIndex);
    }
    applications.process(object, orderIndex);
    listener.objectAccepted(object, orderIndex);
    messaging.broadcast(new Announce(digest), object.getOriginPeer());
    for (SharedObject waiting : deferred.release(digest)) {
      submit(waiting);
    }
  }

  private void defer(SharedObject object, Digest missing) {
    deferredMeter.mark();
    if (!deferred.park(object, missing)) {
      deferredDropped.mark();
      LOGGER.warn("Dropping " + object.getDigest() + ", dependency " + missing + " did not arrive in time");
      listener.objectRejected(object, "missing dependency " + missing);
      return;
    }
    LOGGER.debug("Deferred " + object.getDigest() + " until " + missing + " is accepted");
    PeerId origin = object.getOriginPeer();
    if (origin != null && !isKnown(missing)) {
      request(origin, missing);
    }
  }

  /**
   * Asks {@code from} for a digest unless another peer is already being asked, in which case
   * {@code from} is remembered as the next peer to ask.
   */
  private void request(PeerId from, Digest digest) {
    Fetch fetch = inFlight.computeIfAbsent(digest, d -> new Fetch());
    synchronized (fetch) {
      if (!fetch.announcers.add(from)) {
        return;
      }
      if (fetch.asked != null) {
        fetch.waiting.add(from);
        return;
      }
      fetch.asked = from;
      fetch.expiresAt = clock.currentTimeMillis() + settings.getRequestTimeout();
    }
    if (!messaging.send(new Request(digest), from)) {
      askNext(digest, fetch);
    }
  }

  /** moves an unanswered fetch on to the next peer that announced the digest. */
  private void askNext(Digest digest, Fetch fetch) {
    while (true) {
      PeerId next;
      synchronized (fetch) {
        next = fetch.waiting.poll();
        if (next == null) {
          fetch.asked = null;
          inFlight.remove(digest, fetch);
          return;
        }
        fetch.asked = next;
        fetch.expiresAt = clock.currentTimeMillis() + settings.getRequestTimeout();
      }
      LOGGER.debug("Asking " + next + " for " + digest);
      if (messaging.send(new Request(digest), next)) {
        return;
      }
    }
  }

  @Override
  public void sessionStarted(PeerId peer, boolean outbound) {
    if (outbound) {
      messaging.send(new SyncRequest(null, settings.getSyncBatchSize(), true), peer);
    }
  }

  void onSyncRequest(PeerId from, SyncRequest message) {
    int max = Math.max(1, Math.min(message.getMax(), settings.getSyncBatchSize()));
    List<Digest> digests = consensus.getStateView().digestsSince(message.getSince(), max);
    messaging.send(new Inventory(digests, max), from);
    if (message.isOpening()) {
      messaging.send(new SyncRequest(null, settings.getSyncBatchSize(), false), from);
    }
  }

  void onInventory(PeerId from, Inventory message) {
    List<Digest> digests = message.getDigests();
    if (digests == null || digests.isEmpty()) {
      return;
    }
    for (Digest digest : digests) {
      onAnnounce(from, digest);
    }
    if (message.getMax() > 0 && digests.size() >= message.getMax()) {
      messaging.send(new SyncRequest(digests.get(digests.size() - 1), message.getMax(), false), from);
    }
  }

  /** the newest object this node committed, or null. */
  public Digest latestCommitted() {
    StateView view = consensus.getStateView();
    return view.digestAt(view.lastOrderIndex());
  }

  private boolean isKnown(Digest digest) {
    if (dedup.contains(digest)) {
      return true;
    }
    try {
      return store.contains(digest);
    } catch (ObjectStoreException ex) {
      fatal(ex);
      return true;
    }
  }

  /** expires dedup entries and deferred objects, and re-asks for objects whose request timed out. */
  public void housekeeping() {
    dedup.purgeExpired();
    for (SharedObject object : deferred.purgeExpired()) {
      deferredDropped.mark();
      LOGGER.warn("Dropping " + object.getDigest() + ", its dependency did not arrive in time");
      listener.objectRejected(object, "dependency wait expired");
    }
    long now = clock.currentTimeMillis();
    for (Map.Entry<Digest, Fetch> entry : inFlight.entrySet()) {
      Fetch fetch = entry.getValue();
      boolean expired;
      synchronized (fetch) {
        expired = fetch.asked != null && fetch.expiresAt <= now;
      }
      if (!expired) {
        continue;
      }
      if (isKnown(entry.getKey())) {
        inFlight.remove(entry.getKey(), fetch);
      } else {
        askNext(entry.getKey(), fetch);
      }
    }
  }

  private void fatal(ObjectStoreException ex) {
    LOGGER.error("Object store failure", ex);
    listener.fatalError(ex);
  }

  public DedupCache getDedupCache() {
    return dedup;
  }

  public DeferredObjects getDeferredObjects() {
    return deferred;
  }

  public int getInFlightRequests() {
    return inFlight.size();
  }

  public ApplicationObjectRegistry getApplications() {
    return applications;
  }

  /** One digest being fetched: the peer asked last and the announcers still to try. */
  private static final class Fetch {
    private final Set<PeerId> announcers = new HashSet<>();
    private final Deque<PeerId> waiting = new ArrayDeque<>();
    private PeerId asked;
    private long expiresAt;
  }
}
