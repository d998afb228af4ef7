package org.chaincraft.consensus;

import org.chaincraft.model.SharedObject;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

class RecordingListener implements ConsensusListener {

  static final class Result {
    final SharedObject object;
    final ConsensusDecision decision;

    Result(SharedObject object, ConsensusDecision decision) {
      this.object = object;
      this.decision = decision;
    }
  }

  private final List<Result> results = new ArrayList<>();
  private final CountDownLatch expected;

  RecordingListener(int expected) {
    this.expected = new CountDownLatch(expected);
  }

  @Override
  public synchronized void onConsensusResult(SharedObject object, ConsensusDecision decision) {
    results.add(new Result(object, decision));
    expected.countDown();
  }

  boolean await(long millis) throws InterruptedException {
    return expected.await(millis, TimeUnit.MILLISECONDS);
  }

  synchronized List<Result> results() {
    return new ArrayList<>(results);
  }
}
