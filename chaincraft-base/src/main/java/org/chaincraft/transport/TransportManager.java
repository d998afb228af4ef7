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

import org.chaincraft.PeerId;

import java.io.IOException;
import java.net.URI;

/**
 * Moves opaque frames between this node and its peers. Implementations own the identity handshake:
 * by the time a peer id is handed out, both sides know who they are talking to. Connections the
 * remote side opens are reported to {@link ConnectionListener}s; connections opened through
 * {@link #connect(URI)} are not.
 */
public interface TransportManager {

  /** starts listening for inbound connections. */
  void startEndpoint() throws IOException;

  /**
   * Opens a connection and completes the handshake.
   * @return the id the remote node presented
   */
  PeerId connect(URI address) throws IOException;

  /** hands a frame to the connection; may return before the bytes are on the wire. */
  void send(PeerId peer, byte[] buf) throws IOException;

  /** closes the connection to a peer. Does nothing when there is none. */
  void close(PeerId peer);

  void addBytesListener(BytesListener listener);

  void addConnectionListener(ConnectionListener listener);

  void shutdown();
}
