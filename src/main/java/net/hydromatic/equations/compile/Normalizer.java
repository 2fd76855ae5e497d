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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.equations.ast.TermBuilder.term;
import static net.hydromatic.equations.util.Static.last;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import net.hydromatic.equations.ast.Op;
import net.hydromatic.equations.ast.Term;

/**
 * Rewrites terms to canonical form.
 *
 * <p>{@link #simplify} applies the structural rules:
 *
 * <ul>
 *   <li>{@code (a * b) * c} &rarr; {@code a * b * c}, and the same for sums;
 *   <li>{@code a * I} &rarr; {@code a}, {@code I * a} &rarr; {@code a};
 *   <li>{@code a * O * O} &rarr; {@code a * O};
 *   <li>{@code a + O} &rarr; {@code a};
 *   <li>{@code a + a} &rarr; {@code a};
 *   <li>{@code b + a} &rarr; {@code a + b} (operands of a sum are ordered by
 *       printed form).
 * </ul>
 *
 * <p>{@link #normalize} then distributes products over sums and breaks each
 * product chain into atoms (see {@link Connections#toTerm()}), which gives a
 * unique canonical form for every equivalence class. Both steps terminate: the
 * structural rules only remove nodes, and distribution works on operands that
 * are already canonical, so the number of atoms is bounded by the number of
 * pairs of leaves.
 */
public class Normalizer {
  private final Tracer tracer;

  public Normalizer(Tracer tracer) {
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Returns the canonical form of a term. */
  public static Term normalize(Term term) {
    return new Normalizer(Tracers.empty()).canonical(term);
  }

  /** Returns whether two terms have the same canonical form. */
  public static boolean equivalent(Term term0, Term term1) {
    return normalize(term0).equals(normalize(term1));
  }

  /** Returns the canonical form of a term, and notifies the tracer. */
  public Term canonical(Term term) {
    final Term canonical = Connections.of(simplify(term)).toTerm();
    tracer.onNormalize(term, canonical);
    return canonical;
  }

  /**
   * Simplifies a term using the structural rules; does not distribute
   * products over sums.
   */
  public static Term simplify(Term t) {
    switch (t.op) {
      case PRODUCT:
        return simplifyProduct(t.operands());
      case SUM:
        return simplifySum(t.operands());
      default:
        return t;
    }
  }

  private static Term simplifyProduct(List<Term> operands) {
    final List<Term> list = new ArrayList<>();
    flatten(Op.PRODUCT, operands, list);
    final List<Term> list2 = new ArrayList<>();
    for (Term t : list) {
      switch (t.op) {
        case IDENTITY:
          break;
        case TERMINAL:
          if (!list2.isEmpty() && last(list2).op == Op.TERMINAL) {
            break;
          }
          // fall through
        default:
          list2.add(t);
      }
    }
    if (list2.isEmpty()) {
      return term.identity();
    }
    return term.product(list2);
  }

  private static Term simplifySum(List<Term> operands) {
    final List<Term> list = new ArrayList<>();
    flatten(Op.SUM, operands, list);
    final TreeSet<Term> set = new TreeSet<>();
    for (Term t : list) {
      if (t.op != Op.TERMINAL) {
        set.add(t);
      }
    }
    if (set.isEmpty()) {
      return term.terminal();
    }
    return term.sum(set);
  }

  /**
   * Simplifies each operand and adds it to a list; if the simplified operand
   * has the same op, adds its operands instead.
   */
  private static void flatten(Op op, List<Term> operands, List<Term> list) {
    for (Term operand : operands) {
      final Term t = simplify(operand);
      if (t.op == op) {
        list.addAll(t.operands());
      } else {
        list.add(t);
      }
    }
  }
}

// End Normalizer.java
