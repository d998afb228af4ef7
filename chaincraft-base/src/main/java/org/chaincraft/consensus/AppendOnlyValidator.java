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

/** Accepts every non-empty object it has not committed before, in arrival order. */
public class AppendOnlyValidator implements Validator {

  @Override
  public ConsensusDecision validate(SharedObject candidate, StateView view) {
    if (candidate.getPayloadSize() == 0) {
      return ConsensusDecision.reject("empty payload");
    }
    if (view.isCommitted(candidate.getDigest())) {
      return ConsensusDecision.reject("already committed");
    }
    return ConsensusDecision.accept();
  }
}
