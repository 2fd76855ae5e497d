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
package net.hydromatic.equations.codegen;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import net.hydromatic.equations.ast.Naming;
import net.hydromatic.equations.graph.Prop;
import net.hydromatic.equations.graph.PropertyGraph;
import net.hydromatic.equations.graph.PropertyNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Derives {@link InterfaceSpec} instances from a property graph. */
public abstract class InterfaceSpecs {
  private InterfaceSpecs() {}

  /**
   * Returns an interface for every property in a graph except builtin types,
   * keyed and sorted by type name.
   *
   * <p>A container's interface has one repeated member, named by the plural
   * of its item; any other interface has a member for each of its
   * properties, named by the property's value name.
   */
  public static ImmutableSortedMap<String, InterfaceSpec> of(
      PropertyGraph graph) {
    final String prefix = Prop.INTERFACE_PREFIX.stringValue(graph.map);
    final ImmutableSortedMap.Builder<String, InterfaceSpec> b =
        ImmutableSortedMap.naturalOrder();
    for (PropertyNode node : graph.properties()) {
      b.put(node.typeName(), interfaceSpec(graph, node, prefix));
    }
    return b.build();
  }

  private static InterfaceSpec interfaceSpec(
      PropertyGraph graph, PropertyNode node, String prefix) {
    final Naming naming = node.naming;
    final ImmutableList.Builder<InterfaceSpec.Member> members =
        ImmutableList.builder();
    final @Nullable Naming item = naming.item;
    if (item != null) {
      members.add(
          new InterfaceSpec.Member(
              item.plural,
              item.typeName(),
              true,
              "Returns all contained "
                  + item.docstring
                  + " of the "
                  + naming.docstring
                  + " instance."));
    } else {
      for (String typeName : node.properties) {
        final PropertyNode property = graph.property(typeName);
        if (property == null) {
          throw new IllegalStateException(
              "property "
                  + typeName
                  + " of "
                  + node.typeName()
                  + " is not registered");
        }
        members.add(
            new InterfaceSpec.Member(
                property.valueName(),
                typeName,
                false,
                "The "
                    + property.naming.docstring
                    + " of the "
                    + naming.docstring
                    + " instance."));
      }
    }
    return new InterfaceSpec(
        node.typeName(),
        naming.interfaceName(prefix),
        naming.docstring,
        members.build());
  }
}

// End InterfaceSpecs.java
