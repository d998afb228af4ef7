package org.chaincraft.manager;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/** A clock that only moves when told to. */
public class ManualClock implements Clock {

  private final AtomicLong millis;

  public ManualClock() {
    this(1_000_000L);
  }

  public ManualClock(long start) {
    millis = new AtomicLong(start);
  }

  public void advance(long delta) {
    millis.addAndGet(delta);
  }

  @Override
  public long currentTimeMillis() {
    return millis.get();
  }

  @Override
  public long nanoTime() {
    return TimeUnit.MILLISECONDS.toNanos(millis.get());
  }
}
