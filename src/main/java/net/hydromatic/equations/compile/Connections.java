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

import static net.hydromatic.equations.ast.TermBuilder.term;

import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import net.hydromatic.equations.ast.Term;

/**
 * What a term connects: its left-open leaves (sources), its right-open leaves
 * (sinks), the edges between leaves, every leaf it mentions, and whether it
 * passes through from left to right.
 *
 * <p>Product connects every sink of its left operand to every source of its
 * right operand; sum is union. The identity passes through and has nothing
 * else; the terminal has nothing at all. These rules satisfy every axiom of the
 * algebra, so two terms are equivalent if and only if they have the same
 * connections, and {@link #toTerm()} spells the connections out as the
 * canonical term.
 */
final class Connections {
  private static final Comparator<Term> ORDER = Comparator.naturalOrder();
  private static final Comparator<Term.Leaf> LEAF_ORDER =
      Comparator.naturalOrder();

  static final Connections TERMINAL =
      new Connections(
          ImmutableSortedSet.of(),
          ImmutableSortedSet.of(),
          ImmutableSetMultimap.of(),
          ImmutableSortedSet.of(),
          false);

  static final Connections IDENTITY =
      new Connections(
          ImmutableSortedSet.of(),
          ImmutableSortedSet.of(),
          ImmutableSetMultimap.of(),
          ImmutableSortedSet.of(),
          true);

  final ImmutableSortedSet<Term.Leaf> sources;
  final ImmutableSortedSet<Term.Leaf> sinks;
  final ImmutableSetMultimap<Term.Leaf, Term.Leaf> edges;
  final ImmutableSortedSet<Term.Leaf> mentions;
  final boolean passThrough;

  private Connections(
      ImmutableSortedSet<Term.Leaf> sources,
      ImmutableSortedSet<Term.Leaf> sinks,
      ImmutableSetMultimap<Term.Leaf, Term.Leaf> edges,
      ImmutableSortedSet<Term.Leaf> mentions,
      boolean passThrough) {
    this.sources = sources;
    this.sinks = sinks;
    this.edges = edges;
    this.mentions = mentions;
    this.passThrough = passThrough;
  }

  /** Computes the connections of a term. */
  static Connections of(Term t) {
    switch (t.op) {
      case IDENTITY:
        return IDENTITY;
      case TERMINAL:
        return TERMINAL;
      case LEAF:
        final Term.Leaf leaf = (Term.Leaf) t;
        final ImmutableSortedSet<Term.Leaf> set = ImmutableSortedSet.of(leaf);
        return new Connections(
            set, set, ImmutableSetMultimap.of(), set, false);
      case SUM:
        Connections sum = TERMINAL;
        for (Term operand : t.operands()) {
          sum = sum.union(of(operand));
        }
        return sum;
      case PRODUCT:
        Connections product = IDENTITY;
        for (Term operand : t.operands()) {
          product = product.then(of(operand));
        }
        return product;
      default:
        throw new AssertionError("unknown op " + t.op);
    }
  }

  /** Returns the connections of the sum of this and another. */
  Connections union(Connections c) {
    return new Connections(
        union(sources, c.sources),
        union(sinks, c.sinks),
        edges(edges, c.edges, ImmutableSortedSet.of(), ImmutableSortedSet.of()),
        union(mentions, c.mentions),
        passThrough || c.passThrough);
  }

  /** Returns the connections of the product of this followed by another. */
  Connections then(Connections c) {
    return new Connections(
        passThrough ? union(sources, c.sources) : sources,
        c.passThrough ? union(sinks, c.sinks) : c.sinks,
        edges(edges, c.edges, sinks, c.sources),
        union(mentions, c.mentions),
        passThrough && c.passThrough);
  }

  private static ImmutableSortedSet<Term.Leaf> union(
      Set<Term.Leaf> set0, Set<Term.Leaf> set1) {
    return ImmutableSortedSet.orderedBy(LEAF_ORDER)
        .addAll(set0)
        .addAll(set1)
        .build();
  }

  /**
   * Returns the union of two edge sets plus an edge from each of {@code
   * fromSet} to each of {@code toSet}.
   */
  private static ImmutableSetMultimap<Term.Leaf, Term.Leaf> edges(
      ImmutableSetMultimap<Term.Leaf, Term.Leaf> edges0,
      ImmutableSetMultimap<Term.Leaf, Term.Leaf> edges1,
      Set<Term.Leaf> fromSet,
      Set<Term.Leaf> toSet) {
    final ImmutableSetMultimap.Builder<Term.Leaf, Term.Leaf> b =
        ImmutableSetMultimap.<Term.Leaf, Term.Leaf>builder()
            .orderKeysBy(ORDER)
            .orderValuesBy(ORDER);
    b.putAll(edges0);
    b.putAll(edges1);
    for (Term.Leaf from : fromSet) {
      b.putAll(from, toSet);
    }
    return b.build();
  }

  /**
   * Converts these connections to the canonical term, a sum of the following
   * atoms, ordered by printed form:
   *
   * <ul>
   *   <li>{@code I}, if the term passes through;
   *   <li>{@code x}, for a leaf that is both source and sink;
   *   <li>{@code x * O}, for a leaf that is a source only;
   *   <li>{@code O * x}, for a leaf that is a sink only;
   *   <li>{@code O * x * (y1 + ... + yn) * O}, for a leaf with edges to
   *       {@code y1}, ..., {@code yn};
   *   <li>{@code O * x * O}, for a mentioned leaf that is in no other atom.
   * </ul>
   *
   * <p>If there are no atoms, the result is {@code O}.
   */
  Term toTerm() {
    final Term o = term.terminal();
    final List<Term> atoms = new ArrayList<>();
    if (passThrough) {
      atoms.add(term.identity());
    }
    for (Term.Leaf x : sources) {
      atoms.add(sinks.contains(x) ? x : term.product(x, o));
    }
    for (Term.Leaf x : Sets.difference(sinks, sources)) {
      atoms.add(term.product(o, x));
    }
    for (Term.Leaf x : edges.keySet()) {
      atoms.add(term.product(o, x, term.sum(edges.get(x)), o));
    }
    for (Term.Leaf x : mentions) {
      if (!sources.contains(x)
          && !sinks.contains(x)
          && !edges.containsKey(x)
          && !edges.containsValue(x)) {
        atoms.add(term.product(o, x, o));
      }
    }
    if (atoms.isEmpty()) {
      return o;
    }
    atoms.sort(ORDER);
    return term.sum(atoms);
  }
}

// End Connections.java
