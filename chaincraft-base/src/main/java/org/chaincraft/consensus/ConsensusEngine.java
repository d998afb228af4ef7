/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.chaincraft.consensus;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;
import org.apache.log4j.Logger;
import org.chaincraft.manager.NodeCoreConstants;
import org.chaincraft.model.SharedObject;
import org.chaincraft.transport.InterruptibleThread;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Runs candidates through the configured {@link Validator} and hands out order indexes.
 * <p>
 * A single sequencer thread decides candidates in rounds. A round is every candidate queued when
 * the sequencer wakes up; inside a round candidates are decided in ascending digest order, so of
 * two mutually exclusive candidates that arrive together the lower digest wins. Accepted objects
 * get strictly increasing order indexes in the order they were decided. That order is local to this
 * node; agreement across nodes is only as strong as the validator makes it.
 */
public class ConsensusEngine {

  private static final Logger LOGGER = Logger.getLogger(ConsensusEngine.class);
  private static final long POLL_MILLIS = 100;

  private final Validator validator;
  private final CommittedState state = new CommittedState();
  private final LinkedBlockingQueue<SharedObject> candidates = new LinkedBlockingQueue<>();
  private final Histogram roundSizes;
  private final InterruptibleThread sequencer;
  private volatile ConsensusListener listener;
  private volatile boolean accepting;

  public ConsensusEngine(Validator validator, MetricRegistry registry) {
    this.validator = validator;
    this.roundSizes = registry.histogram(NodeCoreConstants.CONSENSUS_ROUND_SIZE);
    registry.register(NodeCoreConstants.COMMITTED_SIZE, (Gauge<Long>) state::committedCount);
    registry.register(NodeCoreConstants.CANDIDATE_QUEUE_SIZE, (Gauge<Integer>) candidates::size);
    this.sequencer = new InterruptibleThread(this::sequence, "consensus-sequencer");
    this.sequencer.setDaemon(true);
  }

  public void start(ConsensusListener listener) {
    this.listener = listener;
    accepting = true;
    sequencer.start();
  }

  /**
   * Queues a candidate for the next round.
   * @return false when the engine is stopping and the candidate was not taken
   */
  public boolean submit(SharedObject candidate) {
    if (!accepting) {
      LOGGER.debug("Not accepting " + candidate.getDigest() + ", consensus is stopping");
      return false;
    }
    return candidates.offer(candidate);
  }

  public StateView getStateView() {
    return state;
  }

  public Validator getValidator() {
    return validator;
  }

  /**
   * Stops taking candidates, decides everything already queued and stops the sequencer.
   * @return true when the queue was drained within the timeout
   */
  public boolean shutdown(long millis) throws InterruptedException {
    accepting = false;
    if (!sequencer.isRunning()) {
      return candidates.isEmpty();
    }
    if (sequencer.awaitExit(millis)) {
      return true;
    }
    LOGGER.warn("Consensus did not drain within " + millis + "ms, " + candidates.size() + " candidates dropped");
    sequencer.shutdown(millis);
    return false;
  }

  private void sequence() {
    List<SharedObject> round = new ArrayList<>();
    while (!sequencer.isShutdownRequested()) {
      try {
        SharedObject first = candidates.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (first == null) {
          if (!accepting) {
            return;
          }
          continue;
        }
        round.add(first);
        candidates.drainTo(round);
        decideRound(round);
      } catch (InterruptedException ex) {
        if (sequencer.isShutdownRequested()) {
          return;
        }
      } finally {
        round.clear();
      }
    }
  }

  void decideRound(List<SharedObject> round) {
    round.sort(Comparator.comparing(SharedObject::getDigest));
    roundSizes.update(round.size());
    for (SharedObject candidate : round) {
      ConsensusDecision decision = decide(candidate);
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(candidate.getDigest() + " -> " + decision);
      }
      try {
        listener.onConsensusResult(candidate, decision);
      } catch (RuntimeException ex) {
        LOGGER.error("Consensus listener failed for " + candidate.getDigest(), ex);
      }
    }
  }

  private ConsensusDecision decide(SharedObject candidate) {
    ConsensusDecision decision;
    try {
      decision = validator.validate(candidate, state);
    } catch (RuntimeException ex) {
      LOGGER.warn("Validator failed on " + candidate.getDigest(), ex);
      return ConsensusDecision.reject("validator failure: " + ex.getMessage());
    }
    if (decision == null) {
      return ConsensusDecision.reject("validator returned no decision");
    }
    if (!decision.isAccepted()) {
      return decision;
    }
    long existing = state.orderIndexOf(candidate.getDigest());
    if (existing >= 0) {
      return ConsensusDecision.reject("already committed at index " + existing);
    }
    return ConsensusDecision.accepted(state.commit(candidate));
  }
}
