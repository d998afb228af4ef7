package org.chaincraft.transport;

import org.chaincraft.PeerId;

import java.net.URI;

public interface ConnectionListener {

  /**
   * A remote node connected to us and finished the handshake.
   * @param address the address the remote node listens on
   */
  void connectionOpened(PeerId peer, URI address);

  /** the remote side went away. Not called for connections this node closes itself. */
  void connectionClosed(PeerId peer);
}
