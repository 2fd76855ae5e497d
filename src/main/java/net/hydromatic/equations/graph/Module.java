/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.equations.graph;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSortedSet;
import net.hydromatic.equations.util.Json;

/** Module: a named group of types. */
public final class Module {
  public final String name;
  public final ImmutableSortedSet<String> typeNames;

  public Module(String name, ImmutableSortedSet<String> typeNames) {
    this.name = requireNonNull(name);
    this.typeNames = requireNonNull(typeNames);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + typeNames.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Module
            && name.equals(((Module) o).name)
            && typeNames.equals(((Module) o).typeNames);
  }

  @Override
  public String toString() {
    final ObjectNode node = Json.object();
    node.put("module", name);
    final ArrayNode array = node.putArray("types");
    typeNames.forEach(array::add);
    return Json.toString(node);
  }
}

// End Module.java
