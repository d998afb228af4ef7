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

import java.util.List;

/** Read only view of what this node has committed. */
public interface StateView {

  boolean isCommitted(Digest digest);

  /** @return the order index of a committed object, or -1 */
  long orderIndexOf(Digest digest);

  /** @return kind of a committed object, or null */
  ObjectKind kindOf(Digest digest);

  /** @return the most recently committed object of a kind, or null when there is none */
  Digest latest(ObjectKind kind);

  /** @return highest order index handed out so far, or -1 */
  long lastOrderIndex();

  long committedCount();

  /** @return the digest committed at an order index, or null */
  Digest digestAt(long orderIndex);

  /**
   * Digests committed after {@code since}, in order. An unknown or null {@code since} starts at
   * the first commit.
   */
  List<Digest> digestsSince(Digest since, int max);
}
