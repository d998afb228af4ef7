package org.chaincraft.manager;

import org.chaincraft.NodeSettings;
import org.chaincraft.PeerId;
import org.chaincraft.TestUtils;
import org.chaincraft.consensus.AppendOnlyValidator;
import org.chaincraft.model.Digest;
import org.chaincraft.peer.PeerRecord;
import org.chaincraft.transport.local.LocalNetwork;
import org.chaincraft.transport.local.LocalTransportManager;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.chaincraft.TestUtils.bytes;

public class BackpressureTest {

  /** Blocks every send to one peer until released. */
  private static class StallingTransport extends LocalTransportManager {
    private final PeerId stalled;
    private final CountDownLatch release;

    StallingTransport(NodeModel model, LocalNetwork network, PeerId stalled, CountDownLatch release) {
      super(model, network);
      this.stalled = stalled;
      this.release = release;
    }

    @Override
    public void send(PeerId peer, byte[] buf) throws IOException {
      if (peer.equals(stalled)) {
        try {
          release.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IOException("interrupted", e);
        }
      }
      super.send(peer, buf);
    }
  }

  @Test
  public void aStalledPeerDoesNotHoldBackTheOthers() throws Exception {
    LocalNetwork network = new LocalNetwork();
    CountDownLatch release = new CountDownLatch(1);
    NodeSettings settings = TestNodes.settings();
    settings.setOutboundQueueSize(4);
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeManager node = TestNodes.builder(network, "n1", settings, new AppendOnlyValidator(), listener)
        .transportFactory(model -> new StallingTransport(model, network, new PeerId("slow"), release))
        .build();
    FakePeer slow = new FakePeer(network, "slow");
    FakePeer fast = new FakePeer(network, "fast");
    try {
      node.start();
      slow.connect(node.getMyAddress());
      fast.connect(node.getMyAddress());
      TestUtils.waitUntil("both peers", 5000, () -> node.getPeerManager().getConnectedPeers().size() == 2);

      List<Digest> digests = new ArrayList<>();
      for (int i = 0; i < 30; i++) {
        digests.add(node.submitLocal(bytes("object " + i)));
      }

      TestUtils.waitUntil("fast peer to hear every announce", 5000,
          () -> digests.stream().allMatch(fast::gotAnnounce));
      PeerRecord slowRecord = node.getPeerManager().getRecord(slow.getId());
      Assert.assertTrue(slowRecord.getCongestion(System.currentTimeMillis()) > 0);
      Assert.assertEquals(0, slowRecord.getPenalty());
      Assert.assertTrue(slowRecord.isConnected());
      Assert.assertTrue(node.getRegistry().meter(NodeCoreConstants.OUTBOUND_DROPPED).getCount() > 0);
      Assert.assertEquals(0, node.getPeerManager().getRecord(fast.getId()).getPenalty());
      Assert.assertEquals(30, listener.acceptedCount());
    } finally {
      release.countDown();
      node.stop();
      slow.shutdown();
      fast.shutdown();
    }
  }

  @Test
  public void aLongStallIsNeverBanned() throws Exception {
    LocalNetwork network = new LocalNetwork();
    CountDownLatch release = new CountDownLatch(1);
    NodeSettings settings = TestNodes.settings();
    settings.setOutboundQueueSize(4);
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeManager node = TestNodes.builder(network, "n1", settings, new AppendOnlyValidator(), listener)
        .transportFactory(model -> new StallingTransport(model, network, new PeerId("slow"), release))
        .build();
    FakePeer slow = new FakePeer(network, "slow");
    try {
      node.start();
      slow.connect(node.getMyAddress());
      TestUtils.waitUntil("slow peer", 5000, () -> node.getPeerManager().getConnectedPeers().size() == 1);

      // far more drops than banPenaltyThreshold
      for (int i = 0; i < 150; i++) {
        node.submitLocal(bytes("burst " + i));
      }
      TestUtils.waitUntil("every object", 5000, () -> listener.acceptedCount() == 150);
      Assert.assertTrue(node.getRegistry().meter(NodeCoreConstants.OUTBOUND_DROPPED).getCount()
          > settings.getBanPenaltyThreshold());

      PeerRecord slowRecord = node.getPeerManager().getRecord(slow.getId());
      Assert.assertFalse(node.getPeerManager().isBanned(slow.getAddress()));
      Assert.assertTrue(slowRecord.isConnected());
      Assert.assertEquals(0, slowRecord.getPenalty());
      Assert.assertTrue(slowRecord.getCongestion(System.currentTimeMillis()) > 0);

      // once the peer drains, it hears new objects again
      release.countDown();
      Digest late = node.submitLocal(bytes("after the stall"));
      TestUtils.waitUntil("announce after the stall", 5000, () -> slow.gotAnnounce(late));
    } finally {
      release.countDown();
      node.stop();
      slow.shutdown();
    }
  }
}
