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
package org.chaincraft.model;

import org.chaincraft.PeerId;

import java.util.Objects;

/**
 * An immutable, content addressed unit of gossiped data. The digest is the identity: two objects
 * with the same payload are the same object no matter who sent them or when. The origin peer and
 * receive time are bookkeeping and take no part in equality.
 */
public final class SharedObject {

  private final Digest digest;
  private final ObjectKind kind;
  private final byte[] payload;
  private final PeerId originPeer;
  private final long receivedAt;

  public SharedObject(Digest digest, ObjectKind kind, byte[] payload, PeerId originPeer, long receivedAt) {
    this.digest = Objects.requireNonNull(digest, "digest");
    this.kind = kind == null ? ObjectKind.CUSTOM : kind;
    this.payload = Objects.requireNonNull(payload, "payload").clone();
    this.originPeer = originPeer;
    this.receivedAt = receivedAt;
  }

  public Digest getDigest() {
    return digest;
  }

  public ObjectKind getKind() {
    return kind;
  }

  public byte[] getPayload() {
    return payload.clone();
  }

  public int getPayloadSize() {
    return payload.length;
  }

  /** @return the peer this object arrived from, or null when unknown */
  public PeerId getOriginPeer() {
    return originPeer;
  }

  public long getReceivedAt() {
    return receivedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SharedObject)) {
      return false;
    }
    return digest.equals(((SharedObject) o).digest);
  }

  @Override
  public int hashCode() {
    return digest.hashCode();
  }

  @Override
  public String toString() {
    return "SharedObject [digest=" + digest + ", kind=" + kind + ", size=" + payload.length
        + ", origin=" + originPeer + "]";
  }
}
