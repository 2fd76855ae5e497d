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
package net.hydromatic.equations.ast;

/** Kind of {@link Term.Leaf}. */
public enum LeafKind {
  /** Leaf created from a bare name; all naming is derived. */
  PLAIN,

  /** Leaf whose plural, module or docstring may have been given explicitly. */
  NAMED,

  /**
   * Leaf that contains a collection of items of another leaf. Its type name
   * ends with "Container".
   */
  RELATION,

  /**
   * Leaf that stands for a primitive type, such as "float" or "string". It is
   * never rendered as a class of its own, and never has properties.
   */
  BUILTIN
}

// End LeafKind.java
