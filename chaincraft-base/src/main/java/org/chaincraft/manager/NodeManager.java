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

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import org.apache.log4j.Logger;
import org.chaincraft.NodeSettings;
import org.chaincraft.PeerId;
import org.chaincraft.app.ApplicationObject;
import org.chaincraft.app.ApplicationObjectRegistry;
import org.chaincraft.consensus.ConsensusEngine;
import org.chaincraft.consensus.StateView;
import org.chaincraft.consensus.Validator;
import org.chaincraft.crypto.CryptoProvider;
import org.chaincraft.event.DisconnectReason;
import org.chaincraft.event.NodeListener;
import org.chaincraft.manager.handlers.MessageHandler;
import org.chaincraft.model.Base;
import org.chaincraft.model.Digest;
import org.chaincraft.model.ObjectKind;
import org.chaincraft.peer.DiscoverySource;
import org.chaincraft.peer.PeerConnection;
import org.chaincraft.peer.PeerMaintainer;
import org.chaincraft.peer.PeerManager;
import org.chaincraft.protocol.ProtocolManager;
import org.chaincraft.store.ObjectStore;
import org.chaincraft.transport.TransportManager;
import org.chaincraft.utils.ReflectionUtils;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * One node: wires the transport, peer manager, gossip engine and consensus engine together and
 * owns their threads. Every piece of node state hangs off an instance, so several nodes can live
 * in one JVM.
 */
public class NodeManager implements NodeModel {

  public static final Logger LOGGER = Logger.getLogger(NodeManager.class);

  private final PeerId me;
  private final URI address;
  private final NodeSettings settings;
  private final MetricRegistry registry;
  private final Clock clock;
  private final NodeListener listener;
  private final MessageHandler messageHandler;
  private final ObjectStore objectStore;
  private final CryptoProvider cryptoProvider;

  private final ExecutorService workers;
  private final ExecutorService writers;
  private final TransportManager transport;
  private final PeerManager peerManager;
  private final MessagingManager messaging;
  private final ConsensusEngine consensus;
  private final GossipEngine gossip;
  private final ApplicationObjectRegistry applications;
  private final PeerMaintainer maintainer;
  private final Meter inboundDropped;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean running = new AtomicBoolean();

  NodeManager(PeerId me, URI address, NodeSettings settings, Validator validator, ObjectStore objectStore,
          CryptoProvider cryptoProvider, MetricRegistry registry, Clock clock, NodeListener listener,
          MessageHandler messageHandler, Function<NodeModel, TransportManager> transportFactory,
          ProtocolManager protocolManager, List<DiscoverySource> discoverySources,
          List<ApplicationObject> applicationObjects) {
    this.me = me;
    this.address = address;
    this.settings = settings;
    this.registry = registry;
    this.clock = clock;
    this.listener = listener;
    this.messageHandler = messageHandler;
    this.objectStore = objectStore;
    this.cryptoProvider = cryptoProvider;

    // transport, protocol and validator may be named in settings.
    // construct them here via reflection when the caller did not hand them in.
    this.transport = transportFactory != null ? transportFactory.apply(this)
        : ReflectionUtils.constructWithReflection(
            settings.getTransportManagerClass(),
            new Class<?>[] { NodeModel.class },
            new Object[] { this });
    ProtocolManager protocol = protocolManager != null ? protocolManager
        : ReflectionUtils.constructWithReflection(settings.getProtocolManagerClass(), new Class<?>[0], new Object[0]);
    Validator strategy = validator != null ? validator
        : ReflectionUtils.constructWithReflection(settings.getValidatorClass(), new Class<?>[0], new Object[0]);

    workers = new ThreadPoolExecutor(settings.getWorkerThreads(), settings.getWorkerThreads(), 0L,
        TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>());
    writers = Executors.newCachedThreadPool();
    peerManager = new PeerManager(this, transport, discoverySources, listener, writers, workers);
    messaging = new MessagingManager(peerManager, protocol, settings.getBackpressurePenalty(), registry);
    consensus = new ConsensusEngine(strategy, registry);
    applications = new ApplicationObjectRegistry();
    for (ApplicationObject applicationObject : applicationObjects) {
      applications.register(applicationObject);
    }
    gossip = new GossipEngine(this, peerManager, messaging, consensus, objectStore, cryptoProvider, listener,
        applications);
    peerManager.addSessionListener(gossip);
    maintainer = new PeerMaintainer(this, peerManager, messaging, gossip::housekeeping, registry);
    inboundDropped = registry.meter(NodeCoreConstants.INBOUND_DROPPED);
  }

  /**
   * Opens the endpoint and starts consensus and the periodic peer work, which dials the bootstrap
   * addresses right away.
   */
  public void start() throws IOException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Node " + me + " was already started");
    }
    transport.addBytesListener(this::bytesReceived);
    transport.addConnectionListener(peerManager);
    transport.startEndpoint();
    consensus.start(gossip);
    running.set(true);
    maintainer.start();
    LOGGER.info("Node " + me + " started at " + address);
  }

  private void bytesReceived(PeerId from, byte[] buf) {
    PeerConnection connection = peerManager.connection(from);
    if (connection == null || !connection.execute(() -> handle(from, buf))) {
      inboundDropped.mark();
      LOGGER.debug("Dropped frame from " + from);
    }
  }

  private void handle(PeerId from, byte[] buf) {
    peerManager.recordTraffic(from);
    Base message;
    try {
      message = messaging.read(buf);
    } catch (IOException ex) {
      LOGGER.warn("Unreadable frame from " + from + ": " + ex.getMessage());
      peerManager.penalize(from, settings.getIntegrityPenalty(), "unreadable frame");
      return;
    }
    if (!messageHandler.invoke(this, from, message)) {
      LOGGER.warn("received message can not be handled: " + message);
    }
  }

  public Digest submitLocal(byte[] payload) {
    return submitLocal(ObjectKind.CUSTOM, payload);
  }

  /** @return the digest of the payload; the object is accepted asynchronously */
  public Digest submitLocal(ObjectKind kind, byte[] payload) {
    if (!running.get()) {
      throw new IllegalStateException("Node " + me + " is not running");
    }
    return gossip.submitLocal(kind, payload);
  }

  /**
   * Graceful stop: refuse new peers, decide every queued candidate, say goodbye, then close all
   * connections and release the threads.
   */
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    LOGGER.info("Stopping node " + me);
    long timeout = settings.getShutdownTimeout();
    peerManager.stopAccepting();
    maintainer.shutdown();
    try {
      consensus.shutdown(timeout);
      maintainer.sayGoodbye("shutdown");
      peerManager.awaitFlushed(timeout);
    } catch (InterruptedException e) {
      LOGGER.debug("Issue during shutdown", e);
      Thread.currentThread().interrupt();
    }
    peerManager.disconnectAll(DisconnectReason.SHUTDOWN);
    transport.shutdown();
    workers.shutdown();
    writers.shutdown();
    try {
      if (!workers.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
        workers.shutdownNow();
      }
      if (!writers.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
        writers.shutdownNow();
      }
    } catch (InterruptedException e) {
      LOGGER.debug("Issue during shutdown", e);
      Thread.currentThread().interrupt();
    }
    LOGGER.info("Node " + me + " stopped");
  }

  public boolean isRunning() {
    return running.get();
  }

  @Override
  public PeerId getMyself() {
    return me;
  }

  @Override
  public URI getMyAddress() {
    return address;
  }

  @Override
  public NodeSettings getSettings() {
    return settings;
  }

  @Override
  public MetricRegistry getRegistry() {
    return registry;
  }

  @Override
  public Clock getClock() {
    return clock;
  }

  public NodeListener getListener() {
    return listener;
  }

  public MessageHandler getMessageHandler() {
    return messageHandler;
  }

  public ObjectStore getObjectStore() {
    return objectStore;
  }

  public CryptoProvider getCryptoProvider() {
    return cryptoProvider;
  }

  public TransportManager getTransport() {
    return transport;
  }

  public PeerManager getPeerManager() {
    return peerManager;
  }

  public MessagingManager getMessagingManager() {
    return messaging;
  }

  public GossipEngine getGossipEngine() {
    return gossip;
  }

  public ConsensusEngine getConsensusEngine() {
    return consensus;
  }

  public ApplicationObjectRegistry getApplicationObjects() {
    return applications;
  }

  public StateView getStateView() {
    return consensus.getStateView();
  }

  PeerMaintainer getMaintainer() {
    return maintainer;
  }
}
