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

import static net.hydromatic.equations.util.Static.last;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.equations.ast.Op;
import net.hydromatic.equations.ast.Term;

/**
 * Finds closed product subterms of a term.
 *
 * <p>A closed product is a product whose last operand is the terminal, for
 * example {@code speed * (distance + duration) * O}. It groups properties that
 * no other part of the equation extends, and is therefore a candidate for an
 * intermediate composite type.
 */
public class IntermediateTermExtractor {
  private IntermediateTermExtractor() {}

  /**
   * Returns the closed product subterms of a term.
   *
   * <p>The term is first simplified, so that nested products are flattened
   * and every product has at least two operands. Matches are returned largest
   * first, ties in depth-first order; a match with the same canonical form as
   * an earlier match is skipped.
   *
   * <p>The result is recomputed each time it is iterated.
   */
  public static Iterable<Term> extract(Term term) {
    return () -> matches(term).iterator();
  }

  private static ImmutableList<Term> matches(Term t) {
    final List<Term> candidates = new ArrayList<>();
    collect(Normalizer.simplify(t), candidates);
    // stable sort, so equal sizes keep depth-first order
    candidates.sort(Comparator.comparingInt(Term::nodeCount).reversed());

    final ImmutableList.Builder<Term> matches = ImmutableList.builder();
    final Set<Term> seen = new HashSet<>();
    for (Term candidate : candidates) {
      if (seen.add(Normalizer.normalize(candidate))) {
        matches.add(candidate);
      }
    }
    return matches.build();
  }

  private static void collect(Term t, List<Term> candidates) {
    final List<Term> operands = t.operands();
    if (t.op == Op.PRODUCT
        && last(operands).op == Op.TERMINAL
        && !isTrivial(operands.subList(0, operands.size() - 1))) {
      candidates.add(t);
    }
    for (Term operand : operands) {
      collect(operand, candidates);
    }
  }

  /** Returns whether every term in a list is the identity or the terminal. */
  private static boolean isTrivial(List<Term> terms) {
    for (Term term : terms) {
      if (term.op != Op.IDENTITY && term.op != Op.TERMINAL) {
        return false;
      }
    }
    return true;
  }
}

// End IntermediateTermExtractor.java
