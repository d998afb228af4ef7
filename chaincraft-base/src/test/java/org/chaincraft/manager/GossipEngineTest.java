package org.chaincraft.manager;

import org.chaincraft.NodeSettings;
import org.chaincraft.PeerId;
import org.chaincraft.TestUtils;
import org.chaincraft.consensus.AppendOnlyValidator;
import org.chaincraft.consensus.ChainValidator;
import org.chaincraft.crypto.Sha256CryptoProvider;
import org.chaincraft.model.Announce;
import org.chaincraft.model.Digest;
import org.chaincraft.model.ObjectKind;
import org.chaincraft.model.ObjectMessage;
import org.chaincraft.model.Request;
import org.chaincraft.peer.PeerRecord;
import org.chaincraft.transport.local.LocalNetwork;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.chaincraft.TestUtils.bytes;

public class GossipEngineTest {

  private static final long WAIT = 5000;

  private final LocalNetwork network = new LocalNetwork();
  private final Sha256CryptoProvider crypto = new Sha256CryptoProvider();
  private final List<NodeManager> nodes = new ArrayList<>();
  private final List<FakePeer> fakes = new ArrayList<>();

  @After
  public void after() {
    for (FakePeer fake : fakes) {
      fake.shutdown();
    }
    for (NodeManager node : nodes) {
      node.stop();
    }
  }

  private NodeManager start(String name, NodeSettings settings, CountingValidator validator,
          RecordingNodeListener listener) throws Exception {
    NodeManager node = TestNodes.node(network, name, settings, validator, listener);
    nodes.add(node);
    node.start();
    return node;
  }

  private NodeManager start(String name, RecordingNodeListener listener) throws Exception {
    return start(name, TestNodes.settings(), new CountingValidator(new AppendOnlyValidator()), listener);
  }

  private FakePeer fake(String name, NodeManager node) throws Exception {
    FakePeer fake = new FakePeer(network, name);
    fakes.add(fake);
    fake.connect(node.getMyAddress());
    TestUtils.waitUntil(name + " to register", WAIT,
        () -> node.getPeerManager().getConnectedPeerIds().contains(fake.getId()));
    return fake;
  }

  private ObjectMessage object(String payload) {
    byte[] bytes = bytes(payload);
    return new ObjectMessage(crypto.hash(bytes), ObjectKind.TRANSACTION, bytes);
  }

  @Test
  public void localSubmissionIsStoredAndAnnounced() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeManager node = start("n1", listener);
    FakePeer fake = fake("p1", node);

    Digest digest = node.submitLocal(bytes("hello"));
    Assert.assertEquals(crypto.hash(bytes("hello")), digest);

    TestUtils.waitUntil("acceptance", WAIT, () -> listener.isAccepted(digest));
    Assert.assertArrayEquals(bytes("hello"), node.getObjectStore().get(digest));
    Assert.assertEquals(0, listener.indexOf(digest));
    TestUtils.waitUntil("announce", WAIT, () -> fake.gotAnnounce(digest));
  }

  @Test
  public void objectsTravelAcrossALine() throws Exception {
    RecordingNodeListener l1 = new RecordingNodeListener();
    RecordingNodeListener l2 = new RecordingNodeListener();
    RecordingNodeListener l3 = new RecordingNodeListener();
    NodeManager n1 = start("n1", l1);
    NodeManager n2 = start("n2", l2);
    NodeManager n3 = start("n3", l3);
    n2.getPeerManager().connect(n1.getMyAddress());
    n3.getPeerManager().connect(n2.getMyAddress());

    Digest digest = n1.submitLocal(bytes("travel"));

    TestUtils.waitUntil("n3 to commit", WAIT, () -> l3.isAccepted(digest));
    Assert.assertTrue(l2.isAccepted(digest));
    Assert.assertArrayEquals(bytes("travel"), n3.getObjectStore().get(digest));
    Assert.assertEquals(0, n2.getGossipEngine().getInFlightRequests());
  }

  @Test
  public void theSameObjectFromTwoPeersIsValidatedOnce() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    CountingValidator validator = new CountingValidator(new AppendOnlyValidator());
    NodeManager node = start("n1", TestNodes.settings(), validator, listener);
    FakePeer a = fake("a", node);
    FakePeer b = fake("b", node);

    ObjectMessage message = object("twice");
    a.send(message);
    b.send(message);
    a.send(message);

    TestUtils.waitUntil("acceptance", WAIT, () -> listener.isAccepted(message.getDigest()));
    Thread.sleep(200);
    Assert.assertEquals(1, validator.count(message.getDigest()));
    Assert.assertEquals(1, listener.acceptedCount());
    Assert.assertTrue(listener.rejections(message.getDigest()).isEmpty());
  }

  @Test
  public void acceptedObjectsAreNotAnnouncedBackToTheSender() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeManager node = start("n1", listener);
    FakePeer sender = fake("sender", node);
    FakePeer other = fake("other", node);

    ObjectMessage message = object("no echo");
    sender.send(message);

    TestUtils.waitUntil("announce to other", WAIT, () -> other.gotAnnounce(message.getDigest()));
    Thread.sleep(200);
    Assert.assertFalse(sender.gotAnnounce(message.getDigest()));
  }

  @Test
  public void announcesOfUnknownObjectsAreRequestedOnce() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeManager node = start("n1", listener);
    FakePeer fake = fake("p1", node);
    ObjectMessage message = object("pull me");

    fake.send(new Announce(message.getDigest()));
    fake.send(new Announce(message.getDigest()));
    TestUtils.waitUntil("request", WAIT, () -> !fake.received(Request.class).isEmpty());
    Thread.sleep(200);
    Assert.assertEquals(1, fake.received(Request.class).size());
    Assert.assertEquals(message.getDigest(), fake.received(Request.class).get(0).getDigest());

    fake.send(message);
    TestUtils.waitUntil("acceptance", WAIT, () -> listener.isAccepted(message.getDigest()));
    Assert.assertEquals(0, node.getGossipEngine().getInFlightRequests());

    // known now, so a new announce is ignored
    fake.send(new Announce(message.getDigest()));
    Thread.sleep(200);
    Assert.assertEquals(1, fake.received(Request.class).size());
  }

  @Test
  public void requestsAreServedFromTheStore() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeManager node = start("n1", listener);
    FakePeer fake = fake("p1", node);
    Digest digest = node.submitLocal(ObjectKind.BLOCK, bytes("served"));
    TestUtils.waitUntil("acceptance", WAIT, () -> listener.isAccepted(digest));

    fake.send(new Request(crypto.hash(bytes("never seen"))));
    fake.send(new Request(digest));

    TestUtils.waitUntil("object", WAIT, () -> !fake.received(ObjectMessage.class).isEmpty());
    Thread.sleep(200);
    List<ObjectMessage> objects = fake.received(ObjectMessage.class);
    Assert.assertEquals(1, objects.size());
    Assert.assertEquals(digest, objects.get(0).getDigest());
    Assert.assertEquals(ObjectKind.BLOCK, objects.get(0).getKind());
    Assert.assertArrayEquals(bytes("served"), objects.get(0).getPayload());
  }

  @Test
  public void tamperedObjectsArePenalizedAndDropped() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeSettings settings = TestNodes.settings();
    CountingValidator validator = new CountingValidator(new AppendOnlyValidator());
    NodeManager node = start("n1", settings, validator, listener);
    FakePeer fake = fake("p1", node);
    Digest claimed = crypto.hash(bytes("original"));

    fake.send(new ObjectMessage(claimed, ObjectKind.TRANSACTION, bytes("forged")));

    PeerRecord record = node.getPeerManager().getRecord(fake.getId());
    TestUtils.waitUntil("penalty", WAIT, () -> record.getPenalty() == settings.getIntegrityPenalty());
    Assert.assertEquals(1, node.getRegistry().meter(NodeCoreConstants.INTEGRITY_FAILURES).getCount());
    Assert.assertEquals(0, validator.count(claimed));
    Assert.assertFalse(node.getObjectStore().contains(claimed));
    Assert.assertFalse(node.getGossipEngine().getDedupCache().contains(claimed));
  }

  @Test
  public void deferredObjectsAreResolvedOnceTheirDependencyArrives() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeManager node = start("n1", TestNodes.settings(), new CountingValidator(new ChainValidator()), listener);
    FakePeer fake = fake("p1", node);
    ObjectMessage dependency = object("{\"amount\": 5}");
    ObjectMessage dependent = object("{\"amount\": 7, \"depends\": [\"" + dependency.getDigest().toHex() + "\"]}");

    fake.send(dependent);
    TestUtils.waitUntil("request for the dependency", WAIT,
        () -> fake.received(Request.class).stream().anyMatch(r -> dependency.getDigest().equals(r.getDigest())));
    Assert.assertFalse(listener.isAccepted(dependent.getDigest()));
    Assert.assertEquals(1, node.getGossipEngine().getDeferredObjects().size());

    fake.send(dependency);
    TestUtils.waitUntil("dependent acceptance", WAIT, () -> listener.isAccepted(dependent.getDigest()));
    Assert.assertTrue(listener.indexOf(dependency.getDigest()) < listener.indexOf(dependent.getDigest()));
    Assert.assertEquals(0, node.getGossipEngine().getDeferredObjects().size());
  }

  @Test
  public void deferredObjectsExpire() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    ManualClock clock = new ManualClock();
    NodeSettings settings = TestNodes.settings();
    settings.setDeferredTtl(1000);
    NodeManager node = TestNodes.builder(network, "n1", settings, new ChainValidator(), listener)
        .clock(clock)
        .build();
    nodes.add(node);
    node.start();
    FakePeer fake = fake("p1", node);
    Digest missing = crypto.hash(bytes("never sent"));
    ObjectMessage dependent = object("{\"depends\": [\"" + missing.toHex() + "\"]}");

    fake.send(dependent);
    TestUtils.waitUntil("deferral", WAIT, () -> node.getGossipEngine().getDeferredObjects().size() == 1);

    clock.advance(2000);
    node.getGossipEngine().housekeeping();
    TestUtils.waitUntil("expiry", WAIT, () -> listener.rejections(dependent.getDigest()).contains("dependency wait expired"));
    Assert.assertEquals(0, node.getGossipEngine().getDeferredObjects().size());
    Assert.assertFalse(listener.isAccepted(dependent.getDigest()));
  }

  @Test
  public void evictedObjectsAreValidatedAgainAndRejected() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeSettings settings = TestNodes.settings();
    settings.setDedupCapacity(2);
    CountingValidator validator = new CountingValidator(new AppendOnlyValidator());
    NodeManager node = start("n1", settings, validator, listener);
    FakePeer fake = fake("p1", node);
    ObjectMessage first = object("first");

    fake.send(first);
    TestUtils.waitUntil("first", WAIT, () -> listener.isAccepted(first.getDigest()));
    for (String filler : new String[] {"second", "third"}) {
      ObjectMessage message = object(filler);
      fake.send(message);
      TestUtils.waitUntil(filler, WAIT, () -> listener.isAccepted(message.getDigest()));
    }
    Assert.assertFalse(node.getGossipEngine().getDedupCache().contains(first.getDigest()));

    fake.send(first);
    TestUtils.waitUntil("rejection", WAIT, () -> !listener.rejections(first.getDigest()).isEmpty());
    Assert.assertEquals(2, validator.count(first.getDigest()));
    Assert.assertEquals(0, listener.indexOf(first.getDigest()));
    Assert.assertEquals(3L, node.getStateView().committedCount());
  }

  @Test
  public void aSilentPeerIsReplacedByTheNextAnnouncer() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    ManualClock clock = new ManualClock();
    NodeSettings settings = TestNodes.settings();
    settings.setRequestTimeout(1000);
    NodeManager node = TestNodes.builder(network, "n1", settings, new AppendOnlyValidator(), listener)
        .clock(clock)
        .build();
    nodes.add(node);
    node.start();
    FakePeer silent = fake("silent", node);
    FakePeer helpful = fake("helpful", node);
    ObjectMessage message = object("ask around");

    silent.send(new Announce(message.getDigest()));
    TestUtils.waitUntil("request to the first announcer", WAIT, () -> !silent.received(Request.class).isEmpty());
    helpful.send(new Announce(message.getDigest()));
    Thread.sleep(200);
    Assert.assertTrue(helpful.received(Request.class).isEmpty());
    Assert.assertEquals(1, node.getGossipEngine().getInFlightRequests());

    clock.advance(1500);
    node.getGossipEngine().housekeeping();
    TestUtils.waitUntil("request to the second announcer", WAIT, () -> !helpful.received(Request.class).isEmpty());
    Assert.assertEquals(message.getDigest(), helpful.received(Request.class).get(0).getDigest());
    Assert.assertEquals(1, silent.received(Request.class).size());

    helpful.send(message);
    TestUtils.waitUntil("acceptance", WAIT, () -> listener.isAccepted(message.getDigest()));
    Assert.assertEquals(0, node.getGossipEngine().getInFlightRequests());
  }

  @Test
  public void aTimedOutRequestWithNobodyLeftToAskIsForgotten() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    ManualClock clock = new ManualClock();
    NodeSettings settings = TestNodes.settings();
    settings.setRequestTimeout(1000);
    NodeManager node = TestNodes.builder(network, "n1", settings, new AppendOnlyValidator(), listener)
        .clock(clock)
        .build();
    nodes.add(node);
    node.start();
    FakePeer fake = fake("p1", node);
    ObjectMessage message = object("gone quiet");

    fake.send(new Announce(message.getDigest()));
    TestUtils.waitUntil("request", WAIT, () -> !fake.received(Request.class).isEmpty());
    clock.advance(1500);
    node.getGossipEngine().housekeeping();
    Assert.assertEquals(0, node.getGossipEngine().getInFlightRequests());

    // a fresh announce starts over with the same peer
    fake.send(new Announce(message.getDigest()));
    TestUtils.waitUntil("second request", WAIT, () -> fake.received(Request.class).size() == 2);
  }

  @Test
  public void objectsArrivingWhileStoppingAreReportedAsRejected() throws Exception {
    RecordingNodeListener listener = new RecordingNodeListener();
    NodeManager node = start("n1", listener);
    ObjectMessage message = object("too late");
    node.stop();

    node.getGossipEngine().onObject(new PeerId("late"), message);

    Assert.assertEquals(Collections.singletonList("node is stopping"),
        listener.rejections(message.getDigest()));
    Assert.assertFalse(listener.isAccepted(message.getDigest()));
    Assert.assertEquals(0, node.getGossipEngine().getDeferredObjects().size());
  }
}
