package org.chaincraft.consensus;

import org.chaincraft.crypto.Sha256CryptoProvider;
import org.chaincraft.model.Digest;
import org.chaincraft.model.ObjectKind;
import org.chaincraft.model.SharedObject;
import org.junit.Assert;
import org.junit.Test;

import static org.chaincraft.TestUtils.bytes;

public class ProofOfWorkValidatorTest {

  private final Sha256CryptoProvider crypto = new Sha256CryptoProvider();
  private final CommittedState state = new CommittedState();

  private SharedObject object(byte[] payload) {
    return new SharedObject(crypto.hash(payload), ObjectKind.BLOCK, payload, null, 0);
  }

  @Test
  public void minedPayloadPassesAndPlainOneFails() {
    int difficulty = 2;
    ProofOfWorkValidator validator = new ProofOfWorkValidator(new AppendOnlyValidator(), difficulty);
    byte[] mined = ProofOfWorkValidator.mine(crypto, nonce -> bytes("block|" + nonce), difficulty, 1_000_000);
    Assert.assertNotNull(mined);
    Digest digest = crypto.hash(mined);
    Assert.assertTrue(digest.leadingZeroNibbles() >= difficulty);
    Assert.assertTrue(validator.validate(object(mined), state).isAccepted());

    // find a payload that misses the target so the test does not depend on luck
    byte[] plain = bytes("plain");
    long nonce = 0;
    while (crypto.hash(plain).leadingZeroNibbles() >= difficulty) {
      plain = bytes("plain|" + nonce++);
    }
    ConsensusDecision decision = validator.validate(object(plain), state);
    Assert.assertTrue(decision.isRejected());
    Assert.assertTrue(decision.getReason().startsWith("insufficient proof of work"));
  }

  @Test
  public void zeroDifficultyDefersToDelegate() {
    ProofOfWorkValidator validator = new ProofOfWorkValidator(
        (candidate, view) -> ConsensusDecision.reject("delegate says no"), 0);
    Assert.assertEquals("delegate says no", validator.validate(object(bytes("x")), state).getReason());
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeDifficultyIsRefused() {
    new ProofOfWorkValidator(new AppendOnlyValidator(), -1);
  }
}
