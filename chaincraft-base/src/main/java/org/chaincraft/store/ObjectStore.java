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

/**
 * Content addressed persistence for accepted objects. A {@code put} must be visible to a following
 * {@code get} or {@code contains} from the same node. Any failure is treated by the node as fatal.
 */
public interface ObjectStore {

  void put(Digest digest, byte[] payload) throws ObjectStoreException;

  /** @return the stored payload or null */
  byte[] get(Digest digest) throws ObjectStoreException;

  boolean contains(Digest digest) throws ObjectStoreException;
}
