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

import org.chaincraft.PeerId;
import org.chaincraft.model.Digest;

/** A peer sent an object whose payload does not hash to the digest it claimed. */
public class WireIntegrityException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final PeerId peer;
  private final Digest claimed;

  public WireIntegrityException(PeerId peer, Digest claimed, String message) {
    super("Integrity violation from " + peer + " for " + claimed + ": " + message);
    this.peer = peer;
    this.claimed = claimed;
  }

  public PeerId getPeer() {
    return peer;
  }

  public Digest getClaimed() {
    return claimed;
  }
}
