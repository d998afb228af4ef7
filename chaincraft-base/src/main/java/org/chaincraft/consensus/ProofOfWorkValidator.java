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

import org.chaincraft.crypto.CryptoProvider;
import org.chaincraft.model.Digest;
import org.chaincraft.model.SharedObject;

import java.util.function.LongFunction;

/**
 * Requires the digest of every candidate to start with {@code difficulty} zero hex digits, then
 * defers to another validator.
 */
public class ProofOfWorkValidator implements Validator {

  public static final int DEFAULT_DIFFICULTY = 2;

  private final Validator delegate;
  private final int difficulty;

  public ProofOfWorkValidator() {
    this(new AppendOnlyValidator(), DEFAULT_DIFFICULTY);
  }

  public ProofOfWorkValidator(Validator delegate, int difficulty) {
    if (difficulty < 0) {
      throw new IllegalArgumentException("difficulty must not be negative");
    }
    this.delegate = delegate;
    this.difficulty = difficulty;
  }

  @Override
  public ConsensusDecision validate(SharedObject candidate, StateView view) {
    int work = candidate.getDigest().leadingZeroNibbles();
    if (work < difficulty) {
      return ConsensusDecision.reject("insufficient proof of work: " + work + " < " + difficulty);
    }
    return delegate.validate(candidate, view);
  }

  public int getDifficulty() {
    return difficulty;
  }

  /**
   * Searches nonces from zero until the payload built for one hashes with enough leading zeros.
   * @return the winning payload, or null if none was found below {@code maxNonce}
   */
  public static byte[] mine(CryptoProvider crypto, LongFunction<byte[]> payloadForNonce, int difficulty,
          long maxNonce) {
    for (long nonce = 0; nonce < maxNonce; nonce++) {
      byte[] payload = payloadForNonce.apply(nonce);
      Digest digest = crypto.hash(payload);
      if (digest.leadingZeroNibbles() >= difficulty) {
        return payload;
      }
    }
    return null;
  }
}
