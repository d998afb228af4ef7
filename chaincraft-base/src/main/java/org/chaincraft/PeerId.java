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
package org.chaincraft;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

/** Identity of a node on the network. Assigned at node start and exchanged during the transport handshake. */
public final class PeerId implements Comparable<PeerId> {

  private final String id;

  @JsonCreator
  public PeerId(String id) {
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("peer id must not be empty");
    }
    this.id = id;
  }

  public static PeerId random() {
    return new PeerId(UUID.randomUUID().toString());
  }

  @JsonValue
  public String getId() {
    return id;
  }

  @Override
  public int compareTo(PeerId other) {
    return id.compareTo(other.id);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PeerId)) {
      return false;
    }
    return id.equals(((PeerId) o).id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public String toString() {
    return id;
  }
}
