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
import org.chaincraft.PeerId;
import org.chaincraft.model.Base;
import org.chaincraft.peer.PeerConnection;
import org.chaincraft.peer.PeerManager;
import org.chaincraft.peer.PeerRecord;
import org.chaincraft.protocol.ProtocolManager;

import java.io.IOException;

/**
 * Encodes messages and puts them on peers' outbound queues. Never blocks: a full queue drops the
 * message and costs the peer some score.
 */
public class MessagingManager {

  private static final Logger LOGGER = Logger.getLogger(MessagingManager.class);

  private final PeerManager peers;
  private final ProtocolManager protocol;
  private final int backpressurePenalty;

  // metrics.
  private final Meter messageSerdeException;
  private final Meter outboundDropped;

  public MessagingManager(PeerManager peers, ProtocolManager protocol, int backpressurePenalty,
          MetricRegistry metrics) {
    this.peers = peers;
    this.protocol = protocol;
    this.backpressurePenalty = backpressurePenalty;
    messageSerdeException = metrics.meter(NodeCoreConstants.MESSAGE_SERDE_EXCEPTION);
    outboundDropped = metrics.meter(NodeCoreConstants.OUTBOUND_DROPPED);
  }

  /** @return true when the message was queued for the peer */
  public boolean send(Base message, PeerId peer) {
    byte[] frame = encode(message);
    return frame != null && enqueue(frame, peer, message);
  }

  /**
   * Sends one message to every connected peer but {@code except}.
   * @return how many peers the message was queued for
   */
  public int broadcast(Base message, PeerId except) {
    byte[] frame = encode(message);
    if (frame == null) {
      return 0;
    }
    int queued = 0;
    for (PeerRecord record : peers.getConnectedPeers()) {
      PeerId id = record.getPeerId();
      if (!id.equals(except) && enqueue(frame, id, message)) {
        queued++;
      }
    }
    return queued;
  }

  public Base read(byte[] buf) throws IOException {
    try {
      return protocol.read(buf);
    } catch (IOException ex) {
      messageSerdeException.mark();
      throw ex;
    }
  }

  private byte[] encode(Base message) {
    try {
      return protocol.write(message);
    } catch (IOException ex) {
      messageSerdeException.mark();
      LOGGER.error("Unable to encode " + message, ex);
      return null;
    }
  }

  private boolean enqueue(byte[] frame, PeerId peer, Base message) {
    PeerConnection connection = peers.connection(peer);
    if (connection == null) {
      return false;
    }
    if (connection.offer(frame)) {
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug("Queued " + message + " for " + peer);
      }
      return true;
    }
    if (!connection.isClosed()) {
      outboundDropped.mark();
      peers.recordBackpressure(peer, backpressurePenalty);
    }
    return false;
  }
}
