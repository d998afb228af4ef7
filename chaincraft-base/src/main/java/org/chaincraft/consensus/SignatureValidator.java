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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.chaincraft.crypto.CryptoProvider;
import org.chaincraft.crypto.Sha256CryptoProvider;
import org.chaincraft.model.SharedObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Base64;

/**
 * Only lets through objects that carry a valid signature. Payloads are JSON envelopes:
 * <pre>
 * { "publicKey": "&lt;base64 X.509&gt;", "signature": "&lt;base64&gt;", "body": "..." }
 * </pre>
 * where the signature covers the UTF-8 bytes of {@code body}. Valid envelopes go on to the
 * delegate.
 */
public class SignatureValidator implements Validator {

  public static final String PUBLIC_KEY = "publicKey";
  public static final String SIGNATURE = "signature";
  public static final String BODY = "body";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final CryptoProvider crypto;
  private final Validator delegate;

  public SignatureValidator() {
    this(new Sha256CryptoProvider(), new AppendOnlyValidator());
  }

  public SignatureValidator(CryptoProvider crypto, Validator delegate) {
    this.crypto = crypto;
    this.delegate = delegate;
  }

  @Override
  public ConsensusDecision validate(SharedObject candidate, StateView view) {
    JsonNode envelope;
    try {
      envelope = MAPPER.readTree(candidate.getPayload());
    } catch (IOException ex) {
      return ConsensusDecision.reject("payload is not a signed envelope");
    }
    if (envelope == null || !envelope.path(PUBLIC_KEY).isTextual() || !envelope.path(SIGNATURE).isTextual()
        || !envelope.path(BODY).isTextual()) {
      return ConsensusDecision.reject("payload is not a signed envelope");
    }
    PublicKey key;
    byte[] signature;
    try {
      key = crypto.decodePublicKey(Base64.getDecoder().decode(envelope.get(PUBLIC_KEY).asText()));
      signature = Base64.getDecoder().decode(envelope.get(SIGNATURE).asText());
    } catch (GeneralSecurityException | IllegalArgumentException ex) {
      return ConsensusDecision.reject("malformed key or signature");
    }
    byte[] body = envelope.get(BODY).asText().getBytes(StandardCharsets.UTF_8);
    if (!crypto.verify(key, signature, body)) {
      return ConsensusDecision.reject("bad signature");
    }
    return delegate.validate(candidate, view);
  }

  /** builds a signed envelope payload around {@code body}. */
  public static byte[] envelope(CryptoProvider crypto, KeyPair keys, String body) throws GeneralSecurityException {
    byte[] signature = crypto.sign(keys.getPrivate(), body.getBytes(StandardCharsets.UTF_8));
    ObjectNode node = MAPPER.createObjectNode();
    node.put(PUBLIC_KEY, Base64.getEncoder().encodeToString(keys.getPublic().getEncoded()));
    node.put(SIGNATURE, Base64.getEncoder().encodeToString(signature));
    node.put(BODY, body);
    try {
      return MAPPER.writeValueAsBytes(node);
    } catch (IOException ex) {
      throw new IllegalStateException("Unable to write envelope", ex);
    }
  }
}
