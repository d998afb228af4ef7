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

import com.codahale.metrics.MetricRegistry;
import org.chaincraft.NodeSettings;
import org.chaincraft.PeerId;
import org.chaincraft.StartupSettings;
import org.chaincraft.app.ApplicationObject;
import org.chaincraft.consensus.Validator;
import org.chaincraft.crypto.CryptoProvider;
import org.chaincraft.crypto.Sha256CryptoProvider;
import org.chaincraft.event.NodeListener;
import org.chaincraft.manager.handlers.MessageHandler;
import org.chaincraft.manager.handlers.MessageHandlerFactory;
import org.chaincraft.peer.DiscoverySource;
import org.chaincraft.peer.StaticDiscoverySource;
import org.chaincraft.protocol.ProtocolManager;
import org.chaincraft.store.MemoryObjectStore;
import org.chaincraft.store.ObjectStore;
import org.chaincraft.transport.TransportManager;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class NodeManagerBuilder {

  public static ManagerBuilder newBuilder() {
    return new ManagerBuilder();
  }

  public static final class ManagerBuilder {
    private PeerId id;
    private URI address;
    private NodeSettings settings;
    private final List<URI> bootstrap = new ArrayList<>();
    private final List<DiscoverySource> discoverySources = new ArrayList<>();
    private Validator validator;
    private ObjectStore objectStore;
    private CryptoProvider cryptoProvider;
    private MetricRegistry registry;
    private Clock clock;
    private NodeListener listener;
    private MessageHandler messageHandler;
    private Function<NodeModel, TransportManager> transportFactory;
    private ProtocolManager protocolManager;
    private final List<ApplicationObject> applicationObjects = new ArrayList<>();

    private ManagerBuilder() {}

    private void checkArgument(boolean check, String msg) {
      if (!check) {
        throw new IllegalArgumentException(msg);
      }
    }

    public ManagerBuilder id(String id) {
      this.id = new PeerId(id);
      return this;
    }

    public ManagerBuilder id(PeerId id) {
      this.id = id;
      return this;
    }

    public ManagerBuilder address(URI address) {
      this.address = address;
      return this;
    }

    public ManagerBuilder settings(NodeSettings settings) {
      this.settings = settings;
      return this;
    }

    /** copies id, address and settings out of a startup file. */
    public ManagerBuilder startupSettings(StartupSettings startup) {
      if (startup.getId() != null) {
        this.id = new PeerId(startup.getId());
      }
      this.address = startup.getAddress();
      this.settings = startup.getSettings();
      return this;
    }

    public ManagerBuilder bootstrap(List<URI> addresses) {
      this.bootstrap.addAll(addresses);
      return this;
    }

    public ManagerBuilder discoverySource(DiscoverySource source) {
      this.discoverySources.add(source);
      return this;
    }

    public ManagerBuilder validator(Validator validator) {
      this.validator = validator;
      return this;
    }

    public ManagerBuilder objectStore(ObjectStore objectStore) {
      this.objectStore = objectStore;
      return this;
    }

    public ManagerBuilder cryptoProvider(CryptoProvider cryptoProvider) {
      this.cryptoProvider = cryptoProvider;
      return this;
    }

    public ManagerBuilder registry(MetricRegistry registry) {
      this.registry = registry;
      return this;
    }

    public ManagerBuilder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ManagerBuilder listener(NodeListener listener) {
      this.listener = listener;
      return this;
    }

    public ManagerBuilder messageHandler(MessageHandler messageHandler) {
      this.messageHandler = messageHandler;
      return this;
    }

    public ManagerBuilder transportFactory(Function<NodeModel, TransportManager> transportFactory) {
      this.transportFactory = transportFactory;
      return this;
    }

    public ManagerBuilder protocolManager(ProtocolManager protocolManager) {
      this.protocolManager = protocolManager;
      return this;
    }

    /** registers an object that sees every accepted object in commit order. */
    public ManagerBuilder applicationObject(ApplicationObject applicationObject) {
      this.applicationObjects.add(applicationObject);
      return this;
    }

    public NodeManager build() {
      checkArgument(address != null, "You must define an address");
      checkArgument(settings != null, "You must define settings");
      settings.validate();
      if (id == null) {
        id = PeerId.random();
      }
      if (objectStore == null) {
        objectStore = new MemoryObjectStore();
      }
      if (cryptoProvider == null) {
        cryptoProvider = new Sha256CryptoProvider();
      }
      if (registry == null) {
        registry = new MetricRegistry();
      }
      if (clock == null) {
        clock = new SystemClock();
      }
      if (listener == null) {
        listener = new NodeListener() {};
      }
      if (messageHandler == null) {
        messageHandler = MessageHandlerFactory.defaultHandler();
      }
      List<URI> seeds = new ArrayList<>();
      if (settings.getBootstrapAddresses() != null) {
        seeds.addAll(settings.getBootstrapAddresses());
      }
      seeds.addAll(bootstrap);
      List<DiscoverySource> sources = new ArrayList<>(discoverySources);
      if (!seeds.isEmpty()) {
        sources.add(0, new StaticDiscoverySource(seeds));
      }
      return new NodeManager(id, address, settings, validator, objectStore, cryptoProvider, registry, clock,
          listener, messageHandler, transportFactory, protocolManager, sources, applicationObjects);
    }
  }
}
