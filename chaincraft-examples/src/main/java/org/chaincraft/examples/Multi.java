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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.log4j.Logger;
import org.chaincraft.NodeSettings;
import org.chaincraft.model.ObjectKind;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Starts N nodes on consecutive local ports, each seeded with a random handful of the others, and
 * has every node post a chat message. Usage: {@code Multi <count> [base port]}.
 */
public class Multi {
  private static final Logger logger = Logger.getLogger(Multi.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static <T> List<T> random(List<T> list, Random rand) {
    if (list.size() == 0) return new ArrayList<>(0);
    List<T> src = new ArrayList<>(list);
    int count = rand.nextInt(src.size()) + 1;
    List<T> dest = new ArrayList<>(count);
    while (count-- > 0) {
      dest.add(src.remove(rand.nextInt(src.size())));
    }
    return dest;
  }

  static byte[] chat(String from, String text, long sentAt) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("from", from);
    node.put("text", text);
    node.put("sentAt", sentAt);
    try {
      return MAPPER.writeValueAsBytes(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(ex);
    }
  }

  public static void main(String[] args) throws IOException, InterruptedException {
    Random rand = new Random(System.nanoTime());
    int count = Integer.parseInt(args[0]);
    int basePort = args.length > 1 ? Integer.parseInt(args[1]) : 7000;
    List<URI> globalUris = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      globalUris.add(Solo.makeURI(basePort + i));
    }
    Solo[] runners = new Solo[count];
    for (int i = 0; i < runners.length; i++) {
      logger.info("Creating " + i);
      NodeSettings settings = new NodeSettings();
      settings.setPort(basePort + i);
      settings.setMaxPeers(Math.max(2, Math.min(8, count - 1)));
      settings.setDiscoveryInterval(5000);
      List<URI> others = new ArrayList<>(globalUris);
      others.remove(i);
      runners[i] = new Solo(basePort + i, settings, random(others, rand));
      runners[i].start();
    }
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      for (Solo solo : runners) {
        solo.stop();
      }
    }, "multi shutdown"));
    Thread.sleep(2000);
    for (Solo solo : runners) {
      solo.manager().submitLocal(ObjectKind.TRANSACTION,
          chat(solo.uri().toString(), "hello from " + solo.uri().getPort(), System.currentTimeMillis()));
      Thread.sleep(rand.nextInt(500) + 1);
    }
  }
}
