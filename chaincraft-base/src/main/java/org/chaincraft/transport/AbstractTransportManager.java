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
package org.chaincraft.transport;

import org.apache.log4j.Logger;
import org.chaincraft.PeerId;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener bookkeeping shared by the transports. Listener failures are logged and never reach the
 * transport threads.
 */
public abstract class AbstractTransportManager implements TransportManager {

  public static final Logger LOGGER = Logger.getLogger(AbstractTransportManager.class);

  private final List<BytesListener> bytesListeners = new CopyOnWriteArrayList<>();
  private final List<ConnectionListener> connectionListeners = new CopyOnWriteArrayList<>();

  @Override
  public void addBytesListener(BytesListener listener) {
    bytesListeners.add(listener);
  }

  @Override
  public void addConnectionListener(ConnectionListener listener) {
    connectionListeners.add(listener);
  }

  protected void fireBytesReceived(PeerId from, byte[] buf) {
    for (BytesListener listener : bytesListeners) {
      try {
        listener.bytesReceived(from, buf);
      } catch (IOException | RuntimeException ex) {
        LOGGER.warn("Unable to process frame from " + from, ex);
      }
    }
  }

  protected void fireConnectionOpened(PeerId peer, URI address) {
    for (ConnectionListener listener : connectionListeners) {
      try {
        listener.connectionOpened(peer, address);
      } catch (RuntimeException ex) {
        LOGGER.warn("Connection listener failed for " + peer, ex);
      }
    }
  }

  protected void fireConnectionClosed(PeerId peer) {
    for (ConnectionListener listener : connectionListeners) {
      try {
        listener.connectionClosed(peer);
      } catch (RuntimeException ex) {
        LOGGER.warn("Connection listener failed for " + peer, ex);
      }
    }
  }
}
