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

import org.chaincraft.model.SharedObject;

/**
 * A consensus strategy. One instance is chosen when the node is configured.
 * <p>
 * {@code validate} must be a pure function of the candidate and the committed state it is handed:
 * no hidden mutable state, no I/O, and deterministic tie-breaks, so that two nodes with the same
 * committed prefix reach the same decision class for the same object. Implementations may be
 * called from any thread but never concurrently by one engine.
 */
public interface Validator {

  /**
   * @return {@link ConsensusDecision#accept()}, {@link ConsensusDecision#reject(String)} or
   *         {@link ConsensusDecision#defer(org.chaincraft.model.Digest)}
   */
  ConsensusDecision validate(SharedObject candidate, StateView view);
}
