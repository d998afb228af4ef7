package org.chaincraft.transport.local;

import org.chaincraft.PeerId;
import org.chaincraft.transport.ConnectionListener;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.chaincraft.TestUtils.bytes;

public class LocalTransportManagerTest {

  private final LocalNetwork network = new LocalNetwork();
  private final List<String> events = Collections.synchronizedList(new ArrayList<>());
  private LocalTransportManager a;
  private LocalTransportManager b;

  private LocalTransportManager endpoint(String name) throws IOException {
    LocalTransportManager transport = new LocalTransportManager(new PeerId(name), URI.create("local://" + name), network);
    transport.addConnectionListener(new ConnectionListener() {
      @Override
      public void connectionOpened(PeerId peer, URI address) {
        events.add(name + " opened " + peer + " " + address);
      }

      @Override
      public void connectionClosed(PeerId peer) {
        events.add(name + " closed " + peer);
      }
    });
    transport.addBytesListener((from, buf) -> events.add(name + " got " + new String(buf, "UTF-8") + " from " + from));
    transport.startEndpoint();
    return transport;
  }

  @Before
  public void before() throws IOException {
    a = endpoint("a");
    b = endpoint("b");
  }

  @Test
  public void connectSendAndClose() throws IOException {
    Assert.assertEquals(new PeerId("b"), a.connect(URI.create("local://b")));
    Assert.assertEquals(Collections.singletonList("b opened a local://a"), events);

    a.send(new PeerId("b"), bytes("ping"));
    b.send(new PeerId("a"), bytes("pong"));
    Assert.assertTrue(events.contains("b got ping from a"));
    Assert.assertTrue(events.contains("a got pong from b"));

    a.close(new PeerId("b"));
    Assert.assertTrue(events.contains("b closed a"));
    Assert.assertFalse(events.contains("a closed b"));
    try {
      a.send(new PeerId("b"), bytes("late"));
      Assert.fail("sent on a closed connection");
    } catch (IOException expected) {
    }
  }

  @Test
  public void framesAreCopied() throws IOException {
    List<byte[]> received = new ArrayList<>();
    b.addBytesListener((from, buf) -> received.add(buf));
    a.connect(URI.create("local://b"));
    byte[] frame = bytes("x");
    a.send(new PeerId("b"), frame);
    frame[0] = 'y';
    Assert.assertEquals('x', received.get(0)[0]);
  }

  @Test(expected = IOException.class)
  public void unknownAddressesAreRefused() throws IOException {
    a.connect(URI.create("local://nobody"));
  }

  @Test(expected = IOException.class)
  public void unreachableAddressesAreRefused() throws IOException {
    network.setUnreachable(URI.create("local://b"), true);
    a.connect(URI.create("local://b"));
  }

  @Test(expected = IOException.class)
  public void addressesAreExclusive() throws IOException {
    new LocalTransportManager(new PeerId("other"), URI.create("local://a"), network).startEndpoint();
  }

  @Test
  public void shutdownClosesEveryConnection() throws IOException {
    a.connect(URI.create("local://b"));
    LocalTransportManager c = endpoint("c");
    c.connect(URI.create("local://a"));

    a.shutdown();
    Assert.assertTrue(events.contains("b closed a"));
    Assert.assertTrue(events.contains("c closed a"));
    Assert.assertFalse(network.isListening(URI.create("local://a")));
    try {
      b.connect(URI.create("local://a"));
      Assert.fail("connected to a stopped endpoint");
    } catch (IOException expected) {
    }
  }
}
