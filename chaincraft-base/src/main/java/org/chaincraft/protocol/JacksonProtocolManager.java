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
package org.chaincraft.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.chaincraft.model.Base;

import java.io.IOException;

/** JSON frames. The message class travels in a {@code type} property; byte arrays are base64. */
public class JacksonProtocolManager implements ProtocolManager {

  private final ObjectMapper objectMapper;

  public JacksonProtocolManager() {
    objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  @Override
  public byte[] write(Base message) throws IOException {
    return objectMapper.writeValueAsBytes(message);
  }

  @Override
  public Base read(byte[] buf) throws IOException {
    if (buf == null || buf.length == 0) {
      throw new IOException("empty frame");
    }
    try {
      return objectMapper.readValue(buf, Base.class);
    } catch (JsonProcessingException ex) {
      throw new IOException("Unable to decode frame: " + ex.getOriginalMessage(), ex);
    }
  }
}
