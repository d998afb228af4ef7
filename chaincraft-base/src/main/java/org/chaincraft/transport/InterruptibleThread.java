package org.chaincraft.transport;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A thread that can be asked to finish on its own ({@link #awaitExit(long)}) or be interrupted
 * ({@link #shutdown(long)}), with any number of waiters.
 */
public class InterruptibleThread extends Thread {
  private volatile boolean isRunning = false;
  private volatile boolean requestShutdown = false;
  private final CountDownLatch awaitLatch = new CountDownLatch(1);
  
  public InterruptibleThread(Runnable runnable, String name) {
    super(runnable, name);
  }
  
  @Override
  public synchronized void start() {
    if (isRunning) {
      throw new IllegalStateException("Thread is already running");
    }
    isRunning = true;
    super.start();
  }
  
  public synchronized void requestShutdown() {
    if (!isRunning) return;
    requestShutdown = true;
    interrupt();
  }

  public boolean isShutdownRequested() {
    return requestShutdown;
  }
  
  /** interrupts the thread and waits for it to finish. */
  public boolean shutdown(long millis) throws InterruptedException {
    synchronized (this) {
      if (!requestShutdown && isRunning) {
        requestShutdown();
      }
    }
    return awaitLatch.await(millis, TimeUnit.MILLISECONDS);
  }

  /** waits for the runnable to return without interrupting it. */
  public boolean awaitExit(long millis) throws InterruptedException {
    return awaitLatch.await(millis, TimeUnit.MILLISECONDS);
  }
  
  public boolean isRunning() {
    return isRunning;
  }

  @Override
  public final void run() {
    try {
      super.run();
    } finally {
      isRunning = false;
      awaitLatch.countDown();
    }
  }
}
