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

import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;
import org.apache.log4j.Logger;
import org.chaincraft.NodeSettings;
import org.chaincraft.PeerId;
import org.chaincraft.manager.MessagingManager;
import org.chaincraft.manager.NodeModel;
import org.chaincraft.model.Goodbye;
import org.chaincraft.model.Heartbeat;
import org.chaincraft.model.PeerListRequest;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static com.codahale.metrics.MetricRegistry.name;

/**
 * The periodic side of peer management: heartbeats, discovery and reconnection while below
 * capacity, peer exchange and housekeeping. Tasks are fired by a scheduler and run on a small pool
 * that drops the oldest queued task when it falls behind.
 */
public class PeerMaintainer {

  private static final Logger LOGGER = Logger.getLogger(PeerMaintainer.class);
  private static final Random random = new Random(System.nanoTime());

  private final NodeModel model;
  private final NodeSettings settings;
  private final PeerManager peers;
  private final MessagingManager messaging;
  private final Runnable housekeeping;
  private final Histogram connectTime;

  private final ScheduledExecutorService scheduledExecutorService;
  private final BlockingQueue<Runnable> workQueue;
  private final ThreadPoolExecutor threadService;

  /**
   * @param housekeeping extra work run with every housekeeping pass, such as expiring gossip state
   */
  public PeerMaintainer(NodeModel model, PeerManager peers, MessagingManager messaging, Runnable housekeeping,
          MetricRegistry registry) {
    this.model = model;
    this.settings = model.getSettings();
    this.peers = peers;
    this.messaging = messaging;
    this.housekeeping = housekeeping;
    connectTime = registry.histogram(name(PeerMaintainer.class, "connect-time"));
    scheduledExecutorService = Executors.newScheduledThreadPool(1);
    workQueue = new ArrayBlockingQueue<Runnable>(64);
    threadService = new ThreadPoolExecutor(1, 4, 1, TimeUnit.SECONDS, workQueue,
            new ThreadPoolExecutor.DiscardOldestPolicy());
  }

  public void start() {
    schedule(this::sendHeartbeats, settings.getHeartbeatInterval());
    schedule(this::maintainConnections, settings.getDiscoveryInterval());
    schedule(this::exchangePeers, settings.getDiscoveryInterval());
    schedule(this::housekeeping, settings.getHousekeepingInterval());
  }

  public void schedule(Runnable r, long periodMillis) {
    scheduledExecutorService.scheduleAtFixedRate(() ->
        threadService.execute(() -> runGuarded(r)),
        0, periodMillis, TimeUnit.MILLISECONDS
    );
  }

  private static void runGuarded(Runnable r) {
    try {
      r.run();
    } catch (RuntimeException ex) {
      LOGGER.error("Periodic task failed", ex);
    }
  }

  void sendHeartbeats() {
    Heartbeat heartbeat = new Heartbeat(model.getMyself().getId(), model.getClock().currentTimeMillis());
    messaging.broadcast(heartbeat, null);
  }

  /** discovers addresses and dials them until the node is at capacity. */
  void maintainConnections() {
    peers.discover();
    List<URI> candidates = peers.connectCandidates();
    Collections.shuffle(candidates, random);
    for (URI address : candidates) {
      if (!peers.isAccepting() || peers.getConnectedPeers().size() >= settings.getMaxPeers()) {
        return;
      }
      long start = System.currentTimeMillis();
      try {
        PeerId id = peers.connect(address);
        connectTime.update(System.currentTimeMillis() - start);
        messaging.send(new PeerListRequest(settings.getPeerExchangeSize()), id);
      } catch (ConnectionException ex) {
        LOGGER.debug(ex.getMessage());
      }
    }
  }

  void exchangePeers() {
    PeerId partner = selectPartner(peers.getConnectedPeerIds());
    if (partner != null) {
      messaging.send(new PeerListRequest(settings.getPeerExchangeSize()), partner);
    }
  }

  void housekeeping() {
    peers.checkLiveness();
    peers.reap();
    housekeeping.run();
  }

  /** tells every connected peer this node is going away. */
  public void sayGoodbye(String reason) {
    messaging.broadcast(new Goodbye(model.getMyself().getId(), reason), null);
  }

  public void shutdown() {
    scheduledExecutorService.shutdown();
    try {
      scheduledExecutorService.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      LOGGER.debug("Issue during shutdown", e);
      Thread.currentThread().interrupt();
    }
    threadService.shutdown();
    try {
      threadService.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      LOGGER.debug("Issue during shutdown", e);
      Thread.currentThread().interrupt();
    }
  }

  /**
   * @param peerList
   *          An immutable list
   * @return The chosen peer to exchange addresses with, or null when the list is empty.
   */
  public static PeerId selectPartner(List<PeerId> peerList) {
    PeerId peer = null;
    if (peerList.size() > 0) {
      int randomNeighborIndex = random.nextInt(peerList.size());
      peer = peerList.get(randomNeighborIndex);
    }
    return peer;
  }
}
