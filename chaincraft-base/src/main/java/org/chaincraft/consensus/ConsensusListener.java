package org.chaincraft.consensus;

import org.chaincraft.model.SharedObject;

public interface ConsensusListener {

  /** called on the sequencer thread, once per candidate, in decision order. */
  void onConsensusResult(SharedObject object, ConsensusDecision decision);
}
