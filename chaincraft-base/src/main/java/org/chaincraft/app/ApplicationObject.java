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
package org.chaincraft.app;

import com.fasterxml.jackson.databind.JsonNode;
import org.chaincraft.model.SharedObject;

/**
 * Application state built from accepted objects. Every accepted object is offered to every
 * registered application object in order index order, on the consensus thread.
 */
public interface ApplicationObject {

  /** a name shared by all instances of one implementation. */
  String getTypeName();

  /** @return true when the object carries something this application consumes */
  boolean isValid(SharedObject object);

  void apply(SharedObject object, long orderIndex);

  /** a snapshot that is safe to hand to other threads. */
  JsonNode getState();

  void reset();
}
