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
import org.chaincraft.model.ObjectKind;
import org.chaincraft.model.SharedObject;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/** The committed prefix of one node. Written only by the consensus sequencer, read by anyone. */
public class CommittedState implements StateView {

  private static final class Commit {
    private final long orderIndex;
    private final ObjectKind kind;

    Commit(long orderIndex, ObjectKind kind) {
      this.orderIndex = orderIndex;
      this.kind = kind;
    }
  }

  private final ConcurrentHashMap<Digest, Commit> commits = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<ObjectKind, Digest> latest = new ConcurrentHashMap<>();
  private final List<Digest> log = new ArrayList<>();
  private volatile long lastOrderIndex = -1;

  /** @return the order index assigned to the object */
  long commit(SharedObject object) {
    long index = lastOrderIndex + 1;
    Commit previous = commits.putIfAbsent(object.getDigest(), new Commit(index, object.getKind()));
    if (previous != null) {
      throw new IllegalStateException(object.getDigest() + " is already committed at " + previous.orderIndex);
    }
    latest.put(object.getKind(), object.getDigest());
    synchronized (log) {
      log.add(object.getDigest());
    }
    lastOrderIndex = index;
    return index;
  }

  @Override
  public boolean isCommitted(Digest digest) {
    return commits.containsKey(digest);
  }

  @Override
  public long orderIndexOf(Digest digest) {
    Commit commit = commits.get(digest);
    return commit == null ? -1 : commit.orderIndex;
  }

  @Override
  public ObjectKind kindOf(Digest digest) {
    Commit commit = commits.get(digest);
    return commit == null ? null : commit.kind;
  }

  @Override
  public Digest latest(ObjectKind kind) {
    return latest.get(kind);
  }

  @Override
  public long lastOrderIndex() {
    return lastOrderIndex;
  }

  @Override
  public long committedCount() {
    return commits.size();
  }

  @Override
  public Digest digestAt(long orderIndex) {
    synchronized (log) {
      return orderIndex < 0 || orderIndex >= log.size() ? null : log.get((int) orderIndex);
    }
  }

  @Override
  public List<Digest> digestsSince(Digest since, int max) {
    long known = since == null ? -1 : orderIndexOf(since);
    synchronized (log) {
      int from = (int) (known + 1);
      int to = (int) Math.min(log.size(), (long) from + Math.max(0, max));
      return from >= to ? new ArrayList<>() : new ArrayList<>(log.subList(from, to));
    }
  }
}
