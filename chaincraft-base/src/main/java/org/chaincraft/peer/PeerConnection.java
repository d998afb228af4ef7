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
package org.chaincraft.peer;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import org.apache.log4j.Logger;
import org.chaincraft.PeerId;
import org.chaincraft.manager.NodeCoreConstants;
import org.chaincraft.transport.TransportManager;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The two bounded queues of one live connection. Outbound frames are written by at most one task
 * on the writer pool at a time, inbound work runs serially on the worker pool, so a slow peer only
 * ever stalls its own queues and messages from one peer are handled in arrival order.
 */
public class PeerConnection {

  private static final Logger LOGGER = Logger.getLogger(PeerConnection.class);

  private final PeerId peer;
  private final TransportManager transport;
  private final SerialQueue<byte[]> outbound;
  private final SerialQueue<Runnable> inbound;
  private final Meter transmissionSuccess;
  private final Meter transmissionException;
  private volatile boolean closed;

  PeerConnection(PeerId peer, TransportManager transport, Executor writers, Executor workers,
          int outboundCapacity, int inboundCapacity, MetricRegistry registry) {
    this.peer = peer;
    this.transport = transport;
    this.outbound = new SerialQueue<>(outboundCapacity, writers, this::write);
    this.inbound = new SerialQueue<>(inboundCapacity, workers, this::run);
    this.transmissionSuccess = registry.meter(NodeCoreConstants.MESSAGE_TRANSMISSION_SUCCESS);
    this.transmissionException = registry.meter(NodeCoreConstants.MESSAGE_TRANSMISSION_EXCEPTION);
  }

  public PeerId getPeer() {
    return peer;
  }

  /** @return false when the connection is closed or its outbound queue is full */
  public boolean offer(byte[] frame) {
    return !closed && outbound.offer(frame);
  }

  /** @return false when the connection is closed or its inbound queue is full */
  public boolean execute(Runnable task) {
    return !closed && inbound.offer(task);
  }

  public int outboundSize() {
    return outbound.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /** drops everything still queued. Does not touch the transport. */
  void close() {
    closed = true;
    outbound.clear();
    inbound.clear();
  }

  private void write(byte[] frame) {
    try {
      transport.send(peer, frame);
      transmissionSuccess.mark();
    } catch (IOException ex) {
      transmissionException.mark();
      LOGGER.debug("Unable to send to " + peer, ex);
    }
  }

  private void run(Runnable task) {
    try {
      task.run();
    } catch (RuntimeException ex) {
      LOGGER.warn("Inbound task from " + peer + " failed", ex);
    }
  }

  private interface Sink<T> {
    void accept(T item);
  }

  /** A bounded queue drained by at most one executor task at a time. */
  private final class SerialQueue<T> {
    private final BlockingQueue<T> queue;
    private final Executor executor;
    private final Sink<T> sink;
    private final AtomicBoolean draining = new AtomicBoolean();

    SerialQueue(int capacity, Executor executor, Sink<T> sink) {
      this.queue = new ArrayBlockingQueue<>(capacity);
      this.executor = executor;
      this.sink = sink;
    }

    boolean offer(T item) {
      if (!queue.offer(item)) {
        return false;
      }
      schedule();
      return true;
    }

    int size() {
      return queue.size();
    }

    void clear() {
      queue.clear();
    }

    private void schedule() {
      if (!draining.compareAndSet(false, true)) {
        return;
      }
      try {
        executor.execute(this::drain);
      } catch (RejectedExecutionException ex) {
        draining.set(false);
        LOGGER.debug("Executor rejected work for " + peer + ", dropping " + queue.size() + " queued items");
        queue.clear();
      }
    }

    private void drain() {
      try {
        T item;
        while (!closed && (item = queue.poll()) != null) {
          sink.accept(item);
        }
      } finally {
        draining.set(false);
      }
      if (!closed && !queue.isEmpty()) {
        schedule();
      }
    }
  }
}
