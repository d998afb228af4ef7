package org.chaincraft.manager;

public interface Clock {
  long currentTimeMillis();
  long nanoTime();
}
