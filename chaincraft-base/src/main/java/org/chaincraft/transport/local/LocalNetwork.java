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

import java.net.URI;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An in-process network of {@link LocalTransportManager}s keyed by address. Each instance is an
 * isolated network, so independent groups of nodes can share one JVM.
 */
public class LocalNetwork {

  private final ConcurrentHashMap<URI, LocalTransportManager> endpoints = new ConcurrentHashMap<>();
  private final Set<URI> unreachable = ConcurrentHashMap.newKeySet();

  void register(URI address, LocalTransportManager endpoint) {
    LocalTransportManager previous = endpoints.putIfAbsent(address, endpoint);
    if (previous != null && previous != endpoint) {
      throw new IllegalStateException("address already in use: " + address);
    }
  }

  void unregister(URI address, LocalTransportManager endpoint) {
    endpoints.remove(address, endpoint);
  }

  LocalTransportManager lookup(URI address) {
    if (unreachable.contains(address)) {
      return null;
    }
    return endpoints.get(address);
  }

  /** makes connection attempts to an address fail, whether or not something listens there. */
  public void setUnreachable(URI address, boolean value) {
    if (value) {
      unreachable.add(address);
    } else {
      unreachable.remove(address);
    }
  }

  public boolean isListening(URI address) {
    return endpoints.containsKey(address);
  }
}
