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
package org.chaincraft.crypto;

import org.chaincraft.model.Digest;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Hashing and signature capability. The gossip layer only ever calls {@link #hash(byte[])}; the
 * signature operations are there for validators.
 */
public interface CryptoProvider {

  Digest hash(byte[] data);

  /** @return true only when the signature is well formed and matches the data and key */
  boolean verify(PublicKey key, byte[] signature, byte[] data);

  byte[] sign(PrivateKey key, byte[] data) throws GeneralSecurityException;

  KeyPair generateKeyPair() throws GeneralSecurityException;

  /** decodes a public key from its X.509 encoding. */
  PublicKey decodePublicKey(byte[] encoded) throws GeneralSecurityException;
}
