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

import net.hydromatic.equations.ast.Term;
import net.hydromatic.equations.util.EquationException;

/**
 * Thrown when a leaf is registered in a property graph that already holds a
 * different leaf with the same value name or type name.
 */
public class NamingCollisionException extends RuntimeException
    implements EquationException {
  public final Term.Leaf existing;
  public final Term.Leaf conflicting;

  public NamingCollisionException(Term.Leaf existing, Term.Leaf conflicting) {
    super(message(existing, conflicting));
    this.existing = requireNonNull(existing);
    this.conflicting = requireNonNull(conflicting);
  }

  private static String message(Term.Leaf existing, Term.Leaf conflicting) {
    final String what =
        existing.valueName().equals(conflicting.valueName())
            ? "value name '" + existing.valueName() + "'"
            : "type name '" + existing.typeName() + "'";
    return what
        + " is already registered as "
        + existing.kind
        + " "
        + existing.naming
        + "; cannot register "
        + conflicting.kind
        + " "
        + conflicting.naming;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Naming collision: ").append(getMessage());
  }
}

// End NamingCollisionException.java
