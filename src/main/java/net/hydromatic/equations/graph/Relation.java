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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.equations.ast.LeafKind;
import net.hydromatic.equations.ast.Term;

/**
 * A container leaf and the leaf of its items.
 *
 * <p>Compose them as {@code container * item * O}; consumers treat the
 * item as a repeated property of the container.
 *
 * @see PropertyGraph#relationLeaf
 */
public final class Relation {
  private final Term.Leaf container;
  private final Term.Leaf item;

  Relation(Term.Leaf container, Term.Leaf item) {
    this.container = requireNonNull(container);
    this.item = requireNonNull(item);
    checkArgument(container.kind == LeafKind.RELATION);
    checkArgument(item.naming.equals(container.naming.item));
  }

  /** Returns the container leaf, for example "knife_container". */
  public Term.Leaf container() {
    return container;
  }

  /** Returns the item leaf, for example "knife". */
  public Term.Leaf item() {
    return item;
  }

  @Override
  public String toString() {
    return container + "[" + item + "]";
  }
}

// End Relation.java
