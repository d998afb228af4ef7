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
package org.chaincraft.examples;

import org.apache.log4j.Logger;
import org.chaincraft.NodeSettings;
import org.chaincraft.StartupSettings;
import org.chaincraft.event.NodeListener;
import org.chaincraft.event.PeerState;
import org.chaincraft.manager.NodeManager;
import org.chaincraft.manager.NodeManagerBuilder;
import org.chaincraft.model.SharedObject;
import org.chaincraft.peer.PeerRecord;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One node. Every line typed on stdin is submitted as an object; accepted objects and peer changes
 * are logged.
 */
public class Solo {
  private static final Object DUMP_LOCK = new Object();

  private final URI uri;
  private final Logger logger;
  private final NodeManager manager;
  private volatile boolean running = false;
  private final Thread thread;

  public Solo(int port, NodeSettings settings, List<URI> seeds) {
    this(null, makeURI(port), settings, seeds);
  }

  public Solo(String id, URI uri, NodeSettings settings, List<URI> seeds) {
    this.uri = uri;
    this.logger = Logger.getLogger(Solo.class.getName() + "-" + uri);
    NodeManagerBuilder.ManagerBuilder builder = NodeManagerBuilder.newBuilder()
        .address(uri)
        .settings(settings)
        .bootstrap(seeds)
        .listener(new LoggingListener());
    if (id != null) {
      builder.id(id);
    }
    manager = builder.build();
    thread = new Thread(uri.toString()) { public void run() {
      Solo.this.run();
    }};
  }

  public void start() throws IOException {
    manager.start();
    running = true;
    thread.start();
  }

  public void stop() {
    running = false;
    thread.interrupt();
    manager.stop();
  }

  public URI uri() {
    return uri;
  }

  public NodeManager manager() {
    return manager;
  }

  private void run() {
    String last = "";
    while (running) {
      try {
        Thread.sleep(5000);
      } catch (InterruptedException ex) {
        return;
      }
      SortedSet<String> peers = new TreeSet<>();
      for (PeerRecord record : manager.getPeerManager().getConnectedPeers()) {
        peers.add(String.format("  %s (%s)", record.getAddress(), record.getPeerId()));
      }
      String state = String.join("\n", peers) + "|" + manager.getStateView().committedCount();
      // only one node at a time dumps state.
      synchronized (DUMP_LOCK) {
        if (!state.equals(last)) {
          logger.info(String.format("%s has %d objects and is connected to:", uri,
              manager.getStateView().committedCount()));
          peers.forEach(logger::info);
        } else {
          logger.debug(String.format("%s thinks nothing changed", uri));
        }
      }
      last = state;
    }
  }

  private class LoggingListener implements NodeListener {
    @Override
    public void objectAccepted(SharedObject object, long orderIndex) {
      logger.info(String.format("#%d %s: %s", orderIndex, object.getDigest(),
          new String(object.getPayload(), StandardCharsets.UTF_8)));
    }

    @Override
    public void objectRejected(SharedObject object, String reason) {
      logger.info("rejected " + object.getDigest() + ": " + reason);
    }

    @Override
    public void peerStateChanged(PeerRecord peer, PeerState state) {
      logger.debug(peer.getAddress() + " is " + state);
    }

    @Override
    public void fatalError(Throwable cause) {
      logger.error("fatal, stopping", cause);
      running = false;
    }
  }

  static URI makeURI(int port) {
    try {
      return new URI("tcp://127.0.0.1:" + port);
    } catch (URISyntaxException ex) {
      throw new RuntimeException(ex);
    }
  }

  /** @param ports comma separated ports, or NONE */
  static List<URI> seeds(String ports) {
    List<URI> seeds = new ArrayList<>();
    if ("NONE".equals(ports)) {
      return seeds;
    }
    for (String port : ports.split(",")) {
      seeds.add(makeURI(Integer.parseInt(port.trim())));
    }
    return seeds;
  }

  // params: $LOCAL_PORT $SEED_PORTS
  // e.g.: 7003 7000,7001
  // e.g.: 7003 NONE
  // or: --config node.json
  public static void main(String[] args) throws IOException {
    final Logger logger = Logger.getLogger(Solo.class);
    Solo solo;
    if (args.length == 2 && "--config".equals(args[0])) {
      StartupSettings startup = StartupSettings.fromJsonFile(new File(args[1]));
      solo = new Solo(startup.getId(), startup.getAddress(), startup.getSettings(), new ArrayList<>());
    } else if (args.length == 2) {
      NodeSettings settings = new NodeSettings();
      int port = Integer.parseInt(args[0]);
      settings.setPort(port);
      solo = new Solo(port, settings, seeds(args[1]));
    } else {
      System.err.println("usage: Solo <port> <seed ports|NONE> | Solo --config <file>");
      System.exit(1);
      return;
    }
    Runtime.getRuntime().addShutdownHook(new Thread(solo::stop, "solo shutdown"));
    solo.start();
    BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    String line;
    while ((line = in.readLine()) != null) {
      if (!line.trim().isEmpty()) {
        logger.debug("submitted " + solo.manager().submitLocal(line.getBytes(StandardCharsets.UTF_8)));
      }
    }
  }
}
