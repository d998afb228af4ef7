package org.chaincraft.manager;

import org.chaincraft.consensus.ConsensusDecision;
import org.chaincraft.consensus.StateView;
import org.chaincraft.consensus.Validator;
import org.chaincraft.model.Digest;
import org.chaincraft.model.SharedObject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Counts how often each digest is validated, then asks the wrapped validator. */
public class CountingValidator implements Validator {

  private final Validator delegate;
  private final Map<Digest, AtomicInteger> counts = new ConcurrentHashMap<>();

  public CountingValidator(Validator delegate) {
    this.delegate = delegate;
  }

  @Override
  public ConsensusDecision validate(SharedObject candidate, StateView view) {
    counts.computeIfAbsent(candidate.getDigest(), d -> new AtomicInteger()).incrementAndGet();
    return delegate.validate(candidate, view);
  }

  public int count(Digest digest) {
    AtomicInteger count = counts.get(digest);
    return count == null ? 0 : count.get();
  }
}
