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

import org.chaincraft.model.Digest;

import java.util.Objects;

/**
 * Outcome of validating one candidate. Validators return {@link #accept()}; the consensus engine
 * replaces it with {@link #accepted(long)} carrying the order index it assigned.
 */
public final class ConsensusDecision {

  public enum Outcome {
    ACCEPTED, REJECTED, DEFERRED
  }

  public static final long UNASSIGNED = -1L;

  private static final ConsensusDecision ACCEPT = new ConsensusDecision(Outcome.ACCEPTED, UNASSIGNED, null, null);

  private final Outcome outcome;
  private final long orderIndex;
  private final String reason;
  private final Digest missingDependency;

  private ConsensusDecision(Outcome outcome, long orderIndex, String reason, Digest missingDependency) {
    this.outcome = outcome;
    this.orderIndex = orderIndex;
    this.reason = reason;
    this.missingDependency = missingDependency;
  }

  public static ConsensusDecision accept() {
    return ACCEPT;
  }

  public static ConsensusDecision accepted(long orderIndex) {
    if (orderIndex < 0) {
      throw new IllegalArgumentException("order index must not be negative: " + orderIndex);
    }
    return new ConsensusDecision(Outcome.ACCEPTED, orderIndex, null, null);
  }

  public static ConsensusDecision reject(String reason) {
    return new ConsensusDecision(Outcome.REJECTED, UNASSIGNED, Objects.requireNonNull(reason, "reason"), null);
  }

  public static ConsensusDecision defer(Digest missingDependency) {
    return new ConsensusDecision(Outcome.DEFERRED, UNASSIGNED, null,
        Objects.requireNonNull(missingDependency, "missingDependency"));
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isAccepted() {
    return outcome == Outcome.ACCEPTED;
  }

  public boolean isRejected() {
    return outcome == Outcome.REJECTED;
  }

  public boolean isDeferred() {
    return outcome == Outcome.DEFERRED;
  }

  /** @return the assigned order index, or {@link #UNASSIGNED} */
  public long getOrderIndex() {
    return orderIndex;
  }

  public String getReason() {
    return reason;
  }

  public Digest getMissingDependency() {
    return missingDependency;
  }

  @Override
  public String toString() {
    switch (outcome) {
      case ACCEPTED:
        return "Accepted(" + orderIndex + ")";
      case REJECTED:
        return "Rejected(" + reason + ")";
      default:
        return "Deferred(" + missingDependency + ")";
    }
  }
}
