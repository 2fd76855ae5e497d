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
package net.hydromatic.equations.compile;

import net.hydromatic.equations.ast.Term;
import net.hydromatic.equations.graph.NamingCollisionException;

/** Called on various events during normalization and evaluation. */
public interface Tracer {
  /** Called when a term has been converted to canonical form. */
  void onNormalize(Term term, Term canonical);

  /** Called when a leaf is added to a property graph for the first time. */
  void onRegister(Term.Leaf leaf);

  /** Called when {@code sink} becomes a property of {@code source}. */
  void onConnect(Term.Leaf source, Term.Leaf sink);

  /** Called when evaluation fails because two leaves have the same name. */
  void onCollision(NamingCollisionException e);
}

// End Tracer.java
