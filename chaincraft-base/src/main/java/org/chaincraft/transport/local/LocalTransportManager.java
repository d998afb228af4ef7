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
package org.chaincraft.transport.local;

import org.chaincraft.PeerId;
import org.chaincraft.manager.NodeModel;
import org.chaincraft.transport.AbstractTransportManager;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transport over a {@link LocalNetwork}. Frames are copied and handed to the receiver on the
 * sending thread.
 */
public class LocalTransportManager extends AbstractTransportManager {

  private final PeerId me;
  private final URI address;
  private final LocalNetwork network;
  private final ConcurrentHashMap<PeerId, LocalTransportManager> connections = new ConcurrentHashMap<>();
  private volatile boolean running;

  public LocalTransportManager(NodeModel model, LocalNetwork network) {
    this(model.getMyself(), model.getMyAddress(), network);
  }

  public LocalTransportManager(PeerId me, URI address, LocalNetwork network) {
    this.me = me;
    this.address = address;
    this.network = network;
  }

  @Override
  public void startEndpoint() throws IOException {
    try {
      network.register(address, this);
    } catch (IllegalStateException ex) {
      throw new IOException(ex.getMessage(), ex);
    }
    running = true;
  }

  @Override
  public PeerId connect(URI remoteAddress) throws IOException {
    if (!running) {
      throw new IOException("transport is not running");
    }
    LocalTransportManager remote = network.lookup(remoteAddress);
    if (remote == null) {
      throw new IOException("connection refused: " + remoteAddress);
    }
    connections.put(remote.me, remote);
    if (!remote.accept(this)) {
      connections.remove(remote.me, remote);
      throw new IOException("connection refused: " + remoteAddress);
    }
    if (connections.get(remote.me) != remote) {
      throw new IOException("connection closed by " + remoteAddress + " during handshake");
    }
    return remote.me;
  }

  private boolean accept(LocalTransportManager initiator) {
    if (!running) {
      return false;
    }
    connections.put(initiator.me, initiator);
    fireConnectionOpened(initiator.me, initiator.address);
    return true;
  }

  @Override
  public void send(PeerId peer, byte[] buf) throws IOException {
    LocalTransportManager remote = connections.get(peer);
    if (remote == null) {
      throw new IOException("not connected to " + peer);
    }
    remote.deliver(me, buf.clone());
  }

  private void deliver(PeerId from, byte[] buf) throws IOException {
    if (!running || !connections.containsKey(from)) {
      throw new IOException("connection closed by " + me);
    }
    fireBytesReceived(from, buf);
  }

  @Override
  public void close(PeerId peer) {
    LocalTransportManager remote = connections.remove(peer);
    if (remote != null) {
      remote.remoteClosed(me);
    }
  }

  private void remoteClosed(PeerId peer) {
    if (connections.remove(peer) != null) {
      fireConnectionClosed(peer);
    }
  }

  @Override
  public void shutdown() {
    running = false;
    network.unregister(address, this);
    for (PeerId peer : new ArrayList<>(connections.keySet())) {
      close(peer);
    }
  }

  public PeerId getMyself() {
    return me;
  }

  public URI getAddress() {
    return address;
  }
}
