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

import org.apache.log4j.Logger;
import org.chaincraft.PeerId;
import org.chaincraft.manager.NodeManager;
import org.chaincraft.model.Base;
import org.chaincraft.model.PeerList;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

public class PeerListHandler implements MessageHandler {

  private static final Logger LOGGER = Logger.getLogger(PeerListHandler.class);

  @Override
  public boolean invoke(NodeManager node, PeerId from, Base base) {
    PeerList list = (PeerList) base;
    if (list.getAddresses() == null) {
      return true;
    }
    int limit = node.getSettings().getPeerExchangeSize();
    List<URI> addresses = new ArrayList<>();
    for (String address : list.getAddresses()) {
      if (addresses.size() >= limit) {
        break;
      }
      try {
        addresses.add(new URI(address));
      } catch (URISyntaxException ex) {
        LOGGER.debug("Ignoring bad address " + address + " from " + from);
      }
    }
    int added = node.getPeerManager().merge(addresses);
    if (added > 0) {
      LOGGER.debug("Learned " + added + " addresses from " + from);
    }
    return true;
  }
}
