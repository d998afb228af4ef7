package org.chaincraft.transport;

import org.chaincraft.PeerId;

import java.io.IOException;

/** for classes that are interested in being notified of new frames. */
public interface BytesListener {

  /** a frame has arrived from a connected peer. no synchronous/asynchronous guarantees */
  void bytesReceived(PeerId from, byte[] buf) throws IOException;
}
