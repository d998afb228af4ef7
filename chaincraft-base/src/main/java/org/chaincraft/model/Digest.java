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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Content address of a shared object. Digests order by unsigned lexicographic comparison of their
 * bytes, which is also the order in which simultaneous consensus candidates are decided.
 */
public final class Digest implements Comparable<Digest> {

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private final byte[] bytes;
  private final int hashCode;

  public Digest(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new IllegalArgumentException("digest must not be empty");
    }
    this.bytes = bytes.clone();
    this.hashCode = Arrays.hashCode(this.bytes);
  }

  @JsonCreator
  public static Digest fromHex(String hex) {
    if (hex == null || hex.isEmpty() || hex.length() % 2 != 0) {
      throw new IllegalArgumentException("not a hex digest: " + hex);
    }
    byte[] out = new byte[hex.length() / 2];
    for (int i = 0; i < out.length; i++) {
      int hi = Character.digit(hex.charAt(2 * i), 16);
      int lo = Character.digit(hex.charAt(2 * i + 1), 16);
      if (hi < 0 || lo < 0) {
        throw new IllegalArgumentException("not a hex digest: " + hex);
      }
      out[i] = (byte) ((hi << 4) | lo);
    }
    return new Digest(out);
  }

  @JsonValue
  public String toHex() {
    char[] out = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      out[2 * i] = HEX[(bytes[i] >> 4) & 0xf];
      out[2 * i + 1] = HEX[bytes[i] & 0xf];
    }
    return new String(out);
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  /** number of leading zero hex digits, used as the proof of work measure. */
  public int leadingZeroNibbles() {
    int count = 0;
    for (byte b : bytes) {
      if ((b & 0xf0) != 0) {
        return count;
      }
      count++;
      if ((b & 0x0f) != 0) {
        return count;
      }
      count++;
    }
    return count;
  }

  @Override
  public int compareTo(Digest other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Digest)) {
      return false;
    }
    return Arrays.equals(bytes, ((Digest) o).bytes);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return toHex();
  }
}
