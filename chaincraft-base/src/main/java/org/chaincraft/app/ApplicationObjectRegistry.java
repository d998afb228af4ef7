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

import org.apache.log4j.Logger;
import org.chaincraft.model.SharedObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** The application objects of one node, in registration order. */
public class ApplicationObjectRegistry {

  private static final Logger LOGGER = Logger.getLogger(ApplicationObjectRegistry.class);

  private final Map<String, ApplicationObject> objects = new LinkedHashMap<>();

  /** @return the id the object is registered under */
  public synchronized String register(ApplicationObject object) {
    String id = UUID.randomUUID().toString();
    objects.put(id, object);
    return id;
  }

  public synchronized ApplicationObject get(String id) {
    return objects.get(id);
  }

  public synchronized List<ApplicationObject> getByType(String typeName) {
    List<ApplicationObject> result = new ArrayList<>();
    for (ApplicationObject object : objects.values()) {
      if (object.getTypeName().equals(typeName)) {
        result.add(object);
      }
    }
    return result;
  }

  public synchronized ApplicationObject remove(String id) {
    return objects.remove(id);
  }

  public synchronized List<String> ids() {
    return new ArrayList<>(objects.keySet());
  }

  public synchronized int size() {
    return objects.size();
  }

  /**
   * Offers an accepted object to every application object.
   * @return ids of the application objects that consumed it
   */
  public List<String> process(SharedObject object, long orderIndex) {
    Map<String, ApplicationObject> snapshot;
    synchronized (this) {
      snapshot = new LinkedHashMap<>(objects);
    }
    List<String> processed = new ArrayList<>();
    for (Map.Entry<String, ApplicationObject> entry : snapshot.entrySet()) {
      ApplicationObject application = entry.getValue();
      try {
        if (application.isValid(object)) {
          application.apply(object, orderIndex);
          processed.add(entry.getKey());
        }
      } catch (RuntimeException ex) {
        LOGGER.warn(application.getTypeName() + " " + entry.getKey() + " failed on " + object.getDigest(), ex);
      }
    }
    return processed;
  }
}
