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
 * Asks a peer for the digests it committed after {@code since}. A peer that receives an opening
 * request asks back, so both sides catch up on one new connection.
 */
public class SyncRequest extends Base {

  private Digest since;
  private int max;
  private boolean opening;

  public SyncRequest() {
  }

  public SyncRequest(Digest since, int max, boolean opening) {
    this.since = since;
    this.max = max;
    this.opening = opening;
  }

  public Digest getSince() {
    return since;
  }

  public void setSince(Digest since) {
    this.since = since;
  }

  public int getMax() {
    return max;
  }

  public void setMax(int max) {
    this.max = max;
  }

  public boolean isOpening() {
    return opening;
  }

  public void setOpening(boolean opening) {
    this.opening = opening;
  }

  @Override
  public String toString() {
    return "SyncRequest [since=" + since + ", max=" + max + ", opening=" + opening + "]";
  }
}
