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

import com.google.common.collect.ImmutableList;
import java.util.Locale;

/**
 * Builds {@link Term} instances.
 *
 * <p>All methods are pure: they return new terms and never modify their
 * arguments.
 */
public enum TermBuilder {
  /**
   * The singleton instance of the term builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  term;

  /** Returns the identity term, "I". */
  public Term identity() {
    return Term.Identity.INSTANCE;
  }

  /** Returns the terminal term, "O". */
  public Term terminal() {
    return Term.Terminal.INSTANCE;
  }

  /** Creates a leaf. */
  public Term.Leaf leaf(LeafKind kind, Naming naming) {
    return new Term.Leaf(kind, naming);
  }

  /** Creates a product; a product of one term is that term. */
  public Term product(Term... terms) {
    return product(ImmutableList.copyOf(terms));
  }

  /** Creates a product; a product of one term is that term. */
  public Term product(Iterable<? extends Term> terms) {
    final ImmutableList<Term> list = operands(Op.PRODUCT, terms);
    return list.size() == 1 ? list.get(0) : new Term.Product(list);
  }

  /** Creates a sum; a sum of one term is that term. */
  public Term sum(Term... terms) {
    return sum(ImmutableList.copyOf(terms));
  }

  /** Creates a sum; a sum of one term is that term. */
  public Term sum(Iterable<? extends Term> terms) {
    final ImmutableList<Term> list = operands(Op.SUM, terms);
    return list.size() == 1 ? list.get(0) : new Term.Sum(list);
  }

  private static ImmutableList<Term> operands(
      Op op, Iterable<? extends Term> terms) {
    final ImmutableList<Term> list = ImmutableList.copyOf(terms);
    if (list.isEmpty()) {
      throw new MalformedEquationException(
          op.name().toLowerCase(Locale.ROOT)
              + " must have at least one operand");
    }
    return list;
  }
}

// End TermBuilder.java
