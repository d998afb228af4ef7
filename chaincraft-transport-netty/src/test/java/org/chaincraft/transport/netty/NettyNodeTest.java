package org.chaincraft.transport.netty;

import org.chaincraft.NodeSettings;
import org.chaincraft.event.NodeListener;
import org.chaincraft.manager.NodeManager;
import org.chaincraft.manager.NodeManagerBuilder;
import org.chaincraft.model.Digest;
import org.chaincraft.model.SharedObject;
import org.junit.Assert;
import org.junit.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Two nodes over real sockets, with the transport picked from settings. */
public class NettyNodeTest {

  @Test
  public void objectsReachABootstrappedPeer() throws Exception {
    Set<Digest> acceptedByTwo = ConcurrentHashMap.newKeySet();
    URI first = URI.create("tcp://127.0.0.1:" + NettyTransportManagerTest.freePort());
    URI second = URI.create("tcp://127.0.0.1:" + NettyTransportManagerTest.freePort());
    NodeSettings settings = new NodeSettings();
    settings.setTransportManagerClass(NettyTransportManager.class.getName());
    settings.setWorkerThreads(2);
    settings.setShutdownTimeout(2000);

    NodeManager n1 = NodeManagerBuilder.newBuilder().id("n1").address(first).settings(settings).build();
    NodeManager n2 = NodeManagerBuilder.newBuilder().id("n2").address(second).settings(settings)
        .bootstrap(Collections.singletonList(first))
        .listener(new NodeListener() {
          @Override
          public void objectAccepted(SharedObject object, long orderIndex) {
            acceptedByTwo.add(object.getDigest());
          }
        })
        .build();
    Assert.assertTrue(n1.getTransport() instanceof NettyTransportManager);
    try {
      n1.start();
      n2.start();
      long deadline = System.currentTimeMillis() + 5000;
      while (n1.getPeerManager().getConnectedPeers().isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      Assert.assertEquals(1, n1.getPeerManager().getConnectedPeers().size());

      Digest digest = n1.submitLocal("over the wire".getBytes(StandardCharsets.UTF_8));
      while (!acceptedByTwo.contains(digest) && System.currentTimeMillis() < deadline + 5000) {
        Thread.sleep(10);
      }
      Assert.assertTrue(acceptedByTwo.contains(digest));
      Assert.assertArrayEquals("over the wire".getBytes(StandardCharsets.UTF_8), n2.getObjectStore().get(digest));
    } finally {
      n2.stop();
      n1.stop();
    }
  }
}
