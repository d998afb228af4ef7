package org.chaincraft.protocol;

import org.chaincraft.model.Base;

import java.io.IOException;

/** Turns messages into frames and back. */
public interface ProtocolManager {

  byte[] write(Base message) throws IOException;

  /** @throws IOException when the frame is not a message this protocol understands */
  Base read(byte[] buf) throws IOException;
}
