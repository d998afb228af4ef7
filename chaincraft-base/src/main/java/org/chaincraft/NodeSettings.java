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

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for a node. Every field has a usable default; times are in milliseconds.
 */
public class NodeSettings {

  private String host = "127.0.0.1";

  private int port = 7000;

  /** connection ceiling, and so the gossip fan-out. */
  private int maxPeers = 50;

  /** eviction never takes the node below this many connected peers. */
  private int minPeers = 1;

  private int dedupCapacity = 100_000;

  private long dedupTtl = 600_000;

  private long peerTimeout = 120_000;

  private long heartbeatInterval = 30_000;

  private long discoveryInterval = 60_000;

  private long housekeepingInterval = 1_000;

  private int outboundQueueSize = 1024;

  private int inboundQueueSize = 1024;

  private int maxConnectFailures = 5;

  private long connectBackoffBase = 500;

  private long connectBackoffMax = 60_000;

  private long connectTimeout = 5_000;

  private int maxDeferredRetries = 3;

  private long deferredTtl = 60_000;

  private int maxPendingObjects = 10_000;

  private long requestTimeout = 5_000;

  private long peerRetention = 600_000;

  /** most digests one catch-up inventory carries. */
  private int syncBatchSize = 256;

  private int banPenaltyThreshold = 100;

  private int integrityPenalty = 25;

  private int backpressurePenalty = 1;

  private int peerExchangeSize = 16;

  private int workerThreads = Runtime.getRuntime().availableProcessors();

  private long shutdownTimeout = 5_000;

  private int maxFrameSize = 4 * 1024 * 1024;

  private String transportManagerClass = "org.chaincraft.transport.netty.NettyTransportManager";

  private String protocolManagerClass = "org.chaincraft.protocol.JacksonProtocolManager";

  private String validatorClass = "org.chaincraft.consensus.AppendOnlyValidator";

  private List<URI> bootstrapAddresses = new ArrayList<>();

  public NodeSettings() {
  }

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    this.port = port;
  }

  public int getMaxPeers() {
    return maxPeers;
  }

  public void setMaxPeers(int maxPeers) {
    this.maxPeers = maxPeers;
  }

  public int getMinPeers() {
    return minPeers;
  }

  public void setMinPeers(int minPeers) {
    this.minPeers = minPeers;
  }

  public int getDedupCapacity() {
    return dedupCapacity;
  }

  public void setDedupCapacity(int dedupCapacity) {
    this.dedupCapacity = dedupCapacity;
  }

  public long getDedupTtl() {
    return dedupTtl;
  }

  public void setDedupTtl(long dedupTtl) {
    this.dedupTtl = dedupTtl;
  }

  public long getPeerTimeout() {
    return peerTimeout;
  }

  public void setPeerTimeout(long peerTimeout) {
    this.peerTimeout = peerTimeout;
  }

  public long getHeartbeatInterval() {
    return heartbeatInterval;
  }

  public void setHeartbeatInterval(long heartbeatInterval) {
    this.heartbeatInterval = heartbeatInterval;
  }

  public long getDiscoveryInterval() {
    return discoveryInterval;
  }

  public void setDiscoveryInterval(long discoveryInterval) {
    this.discoveryInterval = discoveryInterval;
  }

  public long getHousekeepingInterval() {
    return housekeepingInterval;
  }

  public void setHousekeepingInterval(long housekeepingInterval) {
    this.housekeepingInterval = housekeepingInterval;
  }

  public int getOutboundQueueSize() {
    return outboundQueueSize;
  }

  public void setOutboundQueueSize(int outboundQueueSize) {
    this.outboundQueueSize = outboundQueueSize;
  }

  public int getInboundQueueSize() {
    return inboundQueueSize;
  }

  public void setInboundQueueSize(int inboundQueueSize) {
    this.inboundQueueSize = inboundQueueSize;
  }

  public int getMaxConnectFailures() {
    return maxConnectFailures;
  }

  public void setMaxConnectFailures(int maxConnectFailures) {
    this.maxConnectFailures = maxConnectFailures;
  }

  public long getConnectBackoffBase() {
    return connectBackoffBase;
  }

  public void setConnectBackoffBase(long connectBackoffBase) {
    this.connectBackoffBase = connectBackoffBase;
  }

  public long getConnectBackoffMax() {
    return connectBackoffMax;
  }

  public void setConnectBackoffMax(long connectBackoffMax) {
    this.connectBackoffMax = connectBackoffMax;
  }

  public long getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(long connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public int getMaxDeferredRetries() {
    return maxDeferredRetries;
  }

  public void setMaxDeferredRetries(int maxDeferredRetries) {
    this.maxDeferredRetries = maxDeferredRetries;
  }

  public long getDeferredTtl() {
    return deferredTtl;
  }

  public void setDeferredTtl(long deferredTtl) {
    this.deferredTtl = deferredTtl;
  }

  public int getMaxPendingObjects() {
    return maxPendingObjects;
  }

  public void setMaxPendingObjects(int maxPendingObjects) {
    this.maxPendingObjects = maxPendingObjects;
  }

  public long getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(long requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  public int getSyncBatchSize() {
    return syncBatchSize;
  }

  public void setSyncBatchSize(int syncBatchSize) {
    this.syncBatchSize = syncBatchSize;
  }

  public long getPeerRetention() {
    return peerRetention;
  }

  public void setPeerRetention(long peerRetention) {
    this.peerRetention = peerRetention;
  }

  public int getBanPenaltyThreshold() {
    return banPenaltyThreshold;
  }

  public void setBanPenaltyThreshold(int banPenaltyThreshold) {
    this.banPenaltyThreshold = banPenaltyThreshold;
  }

  public int getIntegrityPenalty() {
    return integrityPenalty;
  }

  public void setIntegrityPenalty(int integrityPenalty) {
    this.integrityPenalty = integrityPenalty;
  }

  public int getBackpressurePenalty() {
    return backpressurePenalty;
  }

  public void setBackpressurePenalty(int backpressurePenalty) {
    this.backpressurePenalty = backpressurePenalty;
  }

  public int getPeerExchangeSize() {
    return peerExchangeSize;
  }

  public void setPeerExchangeSize(int peerExchangeSize) {
    this.peerExchangeSize = peerExchangeSize;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public long getShutdownTimeout() {
    return shutdownTimeout;
  }

  public void setShutdownTimeout(long shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
  }

  public int getMaxFrameSize() {
    return maxFrameSize;
  }

  public void setMaxFrameSize(int maxFrameSize) {
    this.maxFrameSize = maxFrameSize;
  }

  public String getTransportManagerClass() {
    return transportManagerClass;
  }

  public void setTransportManagerClass(String transportManagerClass) {
    this.transportManagerClass = transportManagerClass;
  }

  public String getProtocolManagerClass() {
    return protocolManagerClass;
  }

  public void setProtocolManagerClass(String protocolManagerClass) {
    this.protocolManagerClass = protocolManagerClass;
  }

  public String getValidatorClass() {
    return validatorClass;
  }

  public void setValidatorClass(String validatorClass) {
    this.validatorClass = validatorClass;
  }

  public List<URI> getBootstrapAddresses() {
    return bootstrapAddresses;
  }

  public void setBootstrapAddresses(List<URI> bootstrapAddresses) {
    this.bootstrapAddresses = bootstrapAddresses;
  }

  /** @throws IllegalArgumentException when the settings can not work together */
  public void validate() {
    if (maxPeers < 1) {
      throw new IllegalArgumentException("maxPeers must be at least 1, was " + maxPeers);
    }
    if (minPeers < 0 || minPeers > maxPeers) {
      throw new IllegalArgumentException("minPeers must be between 0 and maxPeers, was " + minPeers);
    }
    if (dedupCapacity < 1 || dedupTtl < 1) {
      throw new IllegalArgumentException("dedup cache needs a positive capacity and ttl");
    }
    if (outboundQueueSize < 1 || inboundQueueSize < 1) {
      throw new IllegalArgumentException("peer queues need a positive size");
    }
    if (workerThreads < 1) {
      throw new IllegalArgumentException("workerThreads must be at least 1, was " + workerThreads);
    }
    if (syncBatchSize < 1) {
      throw new IllegalArgumentException("syncBatchSize must be at least 1, was " + syncBatchSize);
    }
  }
}
