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

/**
 * Carries a full shared object. The claimed digest is checked against the payload before the
 * object is looked at any further.
 */
public class ObjectMessage extends Base {

  private Digest digest;
  private ObjectKind kind;
  private byte[] payload;

  public ObjectMessage() {
  }

  public ObjectMessage(Digest digest, ObjectKind kind, byte[] payload) {
    this.digest = digest;
    this.kind = kind;
    this.payload = payload;
  }

  public Digest getDigest() {
    return digest;
  }

  public void setDigest(Digest digest) {
    this.digest = digest;
  }

  public ObjectKind getKind() {
    return kind;
  }

  public void setKind(ObjectKind kind) {
    this.kind = kind;
  }

  public byte[] getPayload() {
    return payload;
  }

  public void setPayload(byte[] payload) {
    this.payload = payload;
  }

  @Override
  public String toString() {
    return "ObjectMessage [digest=" + digest + ", kind=" + kind + ", size="
        + (payload == null ? 0 : payload.length) + "]";
  }
}
