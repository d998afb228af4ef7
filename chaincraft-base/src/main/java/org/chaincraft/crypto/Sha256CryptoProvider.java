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

import org.apache.log4j.Logger;
import org.chaincraft.model.Digest;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;

/** SHA-256 digests and ECDSA over secp256r1. */
public class Sha256CryptoProvider implements CryptoProvider {

  private static final Logger LOGGER = Logger.getLogger(Sha256CryptoProvider.class);

  public static final String HASH_ALGORITHM = "SHA-256";
  public static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";
  public static final String KEY_ALGORITHM = "EC";
  public static final String CURVE = "secp256r1";

  private final SecureRandom random = new SecureRandom();

  @Override
  public Digest hash(byte[] data) {
    try {
      // MessageDigest instances are not thread safe, a fresh one is cheap.
      return new Digest(MessageDigest.getInstance(HASH_ALGORITHM).digest(data));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(HASH_ALGORITHM + " is not available", e);
    }
  }

  @Override
  public boolean verify(PublicKey key, byte[] signature, byte[] data) {
    try {
      Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
      verifier.initVerify(key);
      verifier.update(data);
      return verifier.verify(signature);
    } catch (GeneralSecurityException e) {
      LOGGER.debug("Signature could not be verified", e);
      return false;
    }
  }

  @Override
  public byte[] sign(PrivateKey key, byte[] data) throws GeneralSecurityException {
    Signature signer = Signature.getInstance(SIGNATURE_ALGORITHM);
    signer.initSign(key, random);
    signer.update(data);
    return signer.sign();
  }

  @Override
  public KeyPair generateKeyPair() throws GeneralSecurityException {
    KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
    generator.initialize(new ECGenParameterSpec(CURVE), random);
    return generator.generateKeyPair();
  }

  @Override
  public PublicKey decodePublicKey(byte[] encoded) throws GeneralSecurityException {
    return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
  }
}
