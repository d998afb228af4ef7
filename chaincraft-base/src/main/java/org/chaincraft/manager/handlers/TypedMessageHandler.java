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
package org.chaincraft.manager.handlers;

import org.chaincraft.PeerId;
import org.chaincraft.manager.NodeManager;
import org.chaincraft.model.Base;

/** Only passes messages of one class (or its subclasses) to the wrapped handler. */
public class TypedMessageHandler implements MessageHandler {
  private final Class<? extends Base> messageClass;
  private final MessageHandler messageHandler;

  public TypedMessageHandler(Class<? extends Base> messageClass, MessageHandler messageHandler) {
    if (messageClass == null || messageHandler == null) {
      throw new NullPointerException();
    }
    this.messageClass = messageClass;
    this.messageHandler = messageHandler;
  }

  @Override
  public boolean invoke(NodeManager node, PeerId from, Base message) {
    if (messageClass.isAssignableFrom(message.getClass())) {
      return messageHandler.invoke(node, from, message);
    }
    return false;
  }
}
