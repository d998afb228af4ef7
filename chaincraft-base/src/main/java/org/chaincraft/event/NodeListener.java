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
package org.chaincraft.event;

import org.chaincraft.model.SharedObject;
import org.chaincraft.peer.PeerRecord;

/**
 * Callbacks for the embedding application. Invoked on node threads; implementations must return
 * quickly.
 */
public interface NodeListener {

  default void objectAccepted(SharedObject object, long orderIndex) {
  }

  default void objectRejected(SharedObject object, String reason) {
  }

  default void peerStateChanged(PeerRecord peer, PeerState state) {
  }

  /** the node hit a condition it can not recover from, such as an unavailable object store. */
  default void fatalError(Throwable cause) {
  }
}
