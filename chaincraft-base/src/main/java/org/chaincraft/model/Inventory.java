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

import java.util.ArrayList;
import java.util.List;

/** Committed digests in the sender's order, the answer to a {@link SyncRequest}. */
public class Inventory extends Base {

  private List<Digest> digests = new ArrayList<>();
  private int max;

  public Inventory() {
  }

  public Inventory(List<Digest> digests, int max) {
    this.digests = digests;
    this.max = max;
  }

  public List<Digest> getDigests() {
    return digests;
  }

  public void setDigests(List<Digest> digests) {
    this.digests = digests;
  }

  /** the page size that was asked for; a full page means there may be more. */
  public int getMax() {
    return max;
  }

  public void setMax(int max) {
    this.max = max;
  }

  @Override
  public String toString() {
    return "Inventory [digests=" + digests.size() + ", max=" + max + "]";
  }
}
