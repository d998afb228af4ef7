package org.chaincraft.manager;

import org.chaincraft.PeerId;
import org.chaincraft.model.Announce;
import org.chaincraft.model.Base;
import org.chaincraft.model.Digest;
import org.chaincraft.protocol.JacksonProtocolManager;
import org.chaincraft.transport.BytesListener;
import org.chaincraft.transport.local.LocalNetwork;
import org.chaincraft.transport.local.LocalTransportManager;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/** A scripted remote that speaks the wire protocol and records what it receives. */
public class FakePeer implements BytesListener {

  private final LocalTransportManager transport;
  private final JacksonProtocolManager protocol = new JacksonProtocolManager();
  private final List<Base> received = new ArrayList<>();
  private PeerId node;

  public FakePeer(LocalNetwork network, String name) throws IOException {
    transport = new LocalTransportManager(new PeerId(name), URI.create("local://" + name), network);
    transport.addBytesListener(this);
    transport.startEndpoint();
  }

  public PeerId getId() {
    return transport.getMyself();
  }

  public URI getAddress() {
    return transport.getAddress();
  }

  public void connect(URI nodeAddress) throws IOException {
    node = transport.connect(nodeAddress);
  }

  public void send(Base message) throws IOException {
    transport.send(node, protocol.write(message));
  }

  public void sendRaw(byte[] frame) throws IOException {
    transport.send(node, frame);
  }

  @Override
  public void bytesReceived(PeerId from, byte[] buf) throws IOException {
    Base message = protocol.read(buf);
    synchronized (received) {
      received.add(message);
    }
  }

  public <T extends Base> List<T> received(Class<T> type) {
    List<T> out = new ArrayList<>();
    synchronized (received) {
      for (Base message : received) {
        if (type.isInstance(message)) {
          out.add(type.cast(message));
        }
      }
    }
    return out;
  }

  public boolean gotAnnounce(Digest digest) {
    return received(Announce.class).stream().anyMatch(a -> digest.equals(a.getDigest()));
  }

  public void shutdown() {
    transport.shutdown();
  }
}
