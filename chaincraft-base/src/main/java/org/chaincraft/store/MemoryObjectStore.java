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
package org.chaincraft.store;

import org.chaincraft.model.Digest;

import java.util.concurrent.ConcurrentHashMap;

public class MemoryObjectStore implements ObjectStore {

  private final ConcurrentHashMap<Digest, byte[]> objects = new ConcurrentHashMap<>();

  @Override
  public void put(Digest digest, byte[] payload) {
    objects.putIfAbsent(digest, payload.clone());
  }

  @Override
  public byte[] get(Digest digest) {
    byte[] payload = objects.get(digest);
    return payload == null ? null : payload.clone();
  }

  @Override
  public boolean contains(Digest digest) {
    return objects.containsKey(digest);
  }

  public int size() {
    return objects.size();
  }
}
