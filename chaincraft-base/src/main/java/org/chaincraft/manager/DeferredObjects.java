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

import org.apache.log4j.Logger;
import org.chaincraft.model.Digest;
import org.chaincraft.model.SharedObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Objects waiting for a dependency to be accepted, keyed by the digest they wait on. Bounded three
 * ways: by the number of times one object may be deferred, by how long it may wait and by the
 * total number of parked objects.
 */
public class DeferredObjects {

  private static final Logger LOGGER = Logger.getLogger(DeferredObjects.class);

  private static final class Parked {
    private final SharedObject object;
    private final long parkedAt;

    Parked(SharedObject object, long parkedAt) {
      this.object = object;
      this.parkedAt = parkedAt;
    }
  }

  private final int maxRetries;
  private final long ttlMillis;
  private final int maxPending;
  private final Clock clock;
  private final ConcurrentHashMap<Digest, List<Parked>> waiting = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Digest, Integer> deferrals = new ConcurrentHashMap<>();
  private final AtomicInteger size = new AtomicInteger();

  public DeferredObjects(int maxRetries, long ttlMillis, int maxPending, Clock clock) {
    this.maxRetries = maxRetries;
    this.ttlMillis = ttlMillis;
    this.maxPending = maxPending;
    this.clock = clock;
  }

  /**
   * Parks an object until {@code missing} is accepted.
   * @return false when the object has used up its retries or the pending set is full; the object
   *         is then forgotten
   */
  public boolean park(SharedObject object, Digest missing) {
    Digest digest = object.getDigest();
    int count = deferrals.merge(digest, 1, Integer::sum);
    if (count > maxRetries) {
      LOGGER.debug(digest + " deferred " + count + " times, giving up");
      forget(digest);
      return false;
    }
    if (size.incrementAndGet() > maxPending) {
      size.decrementAndGet();
      forget(digest);
      return false;
    }
    waiting.compute(missing, (k, list) -> {
      List<Parked> out = list == null ? new ArrayList<>(2) : list;
      out.add(new Parked(object, clock.currentTimeMillis()));
      return out;
    });
    return true;
  }

  /** removes and returns every object waiting on {@code dependency}, oldest first. */
  public List<SharedObject> release(Digest dependency) {
    List<Parked> parked = waiting.remove(dependency);
    if (parked == null) {
      return Collections.emptyList();
    }
    size.addAndGet(-parked.size());
    List<SharedObject> out = new ArrayList<>(parked.size());
    for (Parked p : parked) {
      out.add(p.object);
    }
    return out;
  }

  /** clears the retry count of an object that reached a final decision. */
  public void forget(Digest digest) {
    deferrals.remove(digest);
  }

  /**
   * Drops objects that waited longer than the ttl.
   * @return the dropped objects
   */
  public List<SharedObject> purgeExpired() {
    long now = clock.currentTimeMillis();
    List<SharedObject> expired = new ArrayList<>();
    for (Map.Entry<Digest, List<Parked>> entry : waiting.entrySet()) {
      waiting.computeIfPresent(entry.getKey(), (k, list) -> {
        Iterator<Parked> it = list.iterator();
        while (it.hasNext()) {
          Parked p = it.next();
          if (now - p.parkedAt >= ttlMillis) {
            it.remove();
            size.decrementAndGet();
            expired.add(p.object);
            deferrals.remove(p.object.getDigest());
          }
        }
        return list.isEmpty() ? null : list;
      });
    }
    return expired;
  }

  public int size() {
    return size.get();
  }

  public boolean isWaitingOn(Digest dependency) {
    return waiting.containsKey(dependency);
  }
}
