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
import java.util.Objects;
import net.hydromatic.equations.ast.LeafKind;
import net.hydromatic.equations.ast.Naming;
import net.hydromatic.equations.util.Json;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Record of a property in a {@link PropertyGraph}: its naming and the type
 * names of the properties it is composed of.
 *
 * <p>{@link #toString()} is the serialized form consumed by renderers:
 *
 * <blockquote>
 *
 * <pre>{"naming": {"type": "Speed", "value": "speed", "plural": "speeds",
 * "docstring": "speed"}, "properties": ["Distance", "Duration"]}</pre>
 *
 * </blockquote>
 *
 * <p>The "properties" field is omitted if there are no properties.
 */
public final class PropertyNode {
  public final Naming naming;
  public final LeafKind kind;
  /** Type names of the properties, sorted. */
  public final ImmutableSortedSet<String> properties;

  public PropertyNode(
      Naming naming, LeafKind kind, ImmutableSortedSet<String> properties) {
    this.naming = requireNonNull(naming);
    this.kind = requireNonNull(kind);
    this.properties = requireNonNull(properties);
  }

  public String typeName() {
    return naming.typeName();
  }

  public String valueName() {
    return naming.valueName;
  }

  public @Nullable String moduleName() {
    return naming.moduleName;
  }

  public boolean isBuiltin() {
    return kind == LeafKind.BUILTIN;
  }

  public boolean isContainer() {
    return kind == LeafKind.RELATION;
  }

  @Override
  public int hashCode() {
    return Objects.hash(naming, kind, properties);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PropertyNode
            && naming.equals(((PropertyNode) o).naming)
            && kind == ((PropertyNode) o).kind
            && properties.equals(((PropertyNode) o).properties);
  }

  @Override
  public String toString() {
    final ObjectNode node = Json.object();
    node.set("naming", naming.toJson());
    if (!properties.isEmpty()) {
      final ArrayNode array = node.putArray("properties");
      properties.forEach(array::add);
    }
    return Json.toString(node);
  }
}

// End PropertyNode.java
