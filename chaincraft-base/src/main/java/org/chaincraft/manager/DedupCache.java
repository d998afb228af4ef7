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
package org.chaincraft.manager;

import org.chaincraft.model.Digest;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Bounded recency set of digests this node has already processed. Entries leave oldest first once
 * the cache holds more than {@code capacity} digests or an entry is older than {@code ttlMillis}.
 * A digest that was evicted is indistinguishable from one never seen.
 * <p>
 * Lookups and inserts go through a concurrent map; only eviction takes a lock.
 */
public class DedupCache {

  private final int capacity;
  private final long ttlMillis;
  private final Clock clock;
  private final ConcurrentHashMap<Digest, DedupEntry> entries = new ConcurrentHashMap<>();
  // first-seen order; may hold stale entries for digests that were re-inserted after expiring.
  private final ConcurrentLinkedQueue<DedupEntry> order = new ConcurrentLinkedQueue<>();
  private final Object evictionLock = new Object();

  public DedupCache(int capacity, long ttlMillis, Clock clock) {
    if (capacity < 1 || ttlMillis < 1) {
      throw new IllegalArgumentException("capacity and ttl must be positive");
    }
    this.capacity = capacity;
    this.ttlMillis = ttlMillis;
    this.clock = clock;
  }

  public boolean contains(Digest digest) {
    DedupEntry entry = entries.get(digest);
    if (entry == null) {
      return false;
    }
    if (isExpired(entry, clock.currentTimeMillis())) {
      entries.remove(digest, entry);
      return false;
    }
    return true;
  }

  /**
   * Records a digest as seen.
   * @return true when the digest was not present, false when another caller already holds it
   */
  public boolean insert(Digest digest) {
    long now = clock.currentTimeMillis();
    DedupEntry fresh = new DedupEntry(digest, now);
    DedupEntry previous = entries.putIfAbsent(digest, fresh);
    if (previous != null) {
      if (!isExpired(previous, now) || !entries.replace(digest, previous, fresh)) {
        return false;
      }
    }
    order.add(fresh);
    evict(now);
    return true;
  }

  /** drops every entry past its ttl. */
  public int purgeExpired() {
    return evict(clock.currentTimeMillis());
  }

  private int evict(long now) {
    int evicted = 0;
    synchronized (evictionLock) {
      DedupEntry head;
      while ((head = order.peek()) != null) {
        boolean stale = entries.get(head.getDigest()) != head;
        if (!stale && entries.size() <= capacity && !isExpired(head, now)) {
          break;
        }
        order.poll();
        if (!stale && entries.remove(head.getDigest(), head)) {
          evicted++;
        }
      }
    }
    return evicted;
  }

  private boolean isExpired(DedupEntry entry, long now) {
    return now - entry.getFirstSeen() >= ttlMillis;
  }

  public int size() {
    return entries.size();
  }

  public int getCapacity() {
    return capacity;
  }
}
