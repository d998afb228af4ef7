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
package org.chaincraft.manager.handlers;

import org.chaincraft.model.Announce;
import org.chaincraft.model.Goodbye;
import org.chaincraft.model.Heartbeat;
import org.chaincraft.model.Inventory;
import org.chaincraft.model.ObjectMessage;
import org.chaincraft.model.PeerList;
import org.chaincraft.model.PeerListRequest;
import org.chaincraft.model.Request;
import org.chaincraft.model.SyncRequest;

import java.util.Arrays;

public class MessageHandlerFactory {

  public static MessageHandler defaultHandler() {
    MessageHandler gossip = new GossipMessageHandler();
    return concurrentHandler(
        new TypedMessageHandler(Announce.class, gossip),
        new TypedMessageHandler(Request.class, gossip),
        new TypedMessageHandler(ObjectMessage.class, gossip),
        new TypedMessageHandler(SyncRequest.class, gossip),
        new TypedMessageHandler(Inventory.class, gossip),
        new TypedMessageHandler(Heartbeat.class, new HeartbeatHandler()),
        new TypedMessageHandler(PeerListRequest.class, new PeerListRequestHandler()),
        new TypedMessageHandler(PeerList.class, new PeerListHandler()),
        new TypedMessageHandler(Goodbye.class, new GoodbyeHandler())
    );
  }

  /**
   * Offers every message to all handlers.
   * @return a handler that reports success when at least one of the handlers did
   */
  public static MessageHandler concurrentHandler(MessageHandler... handlers) {
    if (handlers == null) {
      throw new NullPointerException("handlers cannot be null");
    }
    if (Arrays.stream(handlers).anyMatch(i -> i == null)) {
      throw new NullPointerException("found at least one null handler");
    }
    return (node, from, message) -> {
      // return true if at least one of the component handlers return true.
      return Arrays.asList(handlers).stream()
          .filter(h -> h.invoke(node, from, message)).count() > 0;
    };
  }
}
