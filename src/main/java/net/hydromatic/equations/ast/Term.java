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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.equations.ast.TermBuilder.term;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import net.hydromatic.equations.compile.Normalizer;

/**
 * Immutable node of a domain equation.
 *
 * <p>A term is {@link Identity}, {@link Terminal}, a {@link Leaf}, a {@link
 * Sum} ("needs one of") or a {@link Product} ("needs all of, in sequence").
 * Terms are created by {@link TermBuilder} and by the leaf constructors of a
 * property graph, and are never modified.
 *
 * <p>{@link #equals} is structural; use {@link #equivalent} to compare terms
 * under the axioms of the algebra.
 */
public abstract class Term implements Comparable<Term> {
  public final Op op;

  Term(Op op) {
    this.op = requireNonNull(op, "op");
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder(), 0, 0).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf, int left, int right);

  /** Returns the number of nodes in this term, counting itself. */
  public abstract int nodeCount();

  /** Returns the operands of this term; empty if it is not a sum or product. */
  public List<Term> operands() {
    return ImmutableList.of();
  }

  /** Returns the product of this term followed by the given terms. */
  public Term times(Term... terms) {
    return term.product(Lists.asList(this, terms));
  }

  /** Returns the sum of this term and the given terms. */
  public Term plus(Term... terms) {
    return term.sum(Lists.asList(this, terms));
  }

  /** Returns whether this term has the same canonical form as another. */
  public boolean equivalent(Term other) {
    return Normalizer.equivalent(this, other);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Orders by printed form first; terms that print the same (leaves with
   * the same value name but different metadata) are ordered by structure.
   */
  @Override
  public int compareTo(Term o) {
    int c = toString().compareTo(o.toString());
    if (c != 0) {
      return c;
    }
    c = op.compareTo(o.op);
    if (c != 0) {
      return c;
    }
    return compareSameOp(o);
  }

  abstract int compareSameOp(Term o);

  /** Multiplicative identity; passes through without adding properties. */
  public static final class Identity extends Term {
    static final Identity INSTANCE = new Identity();

    private Identity() {
      super(Op.IDENTITY);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(op.str);
    }

    @Override
    public int nodeCount() {
      return 1;
    }

    @Override
    int compareSameOp(Term o) {
      return 0;
    }
  }

  /**
   * Terminal; closes a product chain. Standing alone it denotes "no
   * properties".
   */
  public static final class Terminal extends Term {
    static final Terminal INSTANCE = new Terminal();

    private Terminal() {
      super(Op.TERMINAL);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(op.str);
    }

    @Override
    public int nodeCount() {
      return 1;
    }

    @Override
    int compareSameOp(Term o) {
      return 0;
    }
  }

  /** Named property reference. */
  public static final class Leaf extends Term {
    public final LeafKind kind;
    public final Naming naming;

    Leaf(LeafKind kind, Naming naming) {
      super(Op.LEAF);
      this.kind = requireNonNull(kind, "kind");
      this.naming = requireNonNull(naming, "naming");
    }

    public String valueName() {
      return naming.valueName;
    }

    public String typeName() {
      return naming.typeName();
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(naming.valueName);
    }

    @Override
    public int nodeCount() {
      return 1;
    }

    @Override
    int compareSameOp(Term o) {
      final Leaf leaf = (Leaf) o;
      int c = kind.compareTo(leaf.kind);
      if (c != 0) {
        return c;
      }
      c = naming.toString().compareTo(leaf.naming.toString());
      if (c != 0) {
        return c;
      }
      return String.valueOf(naming.item)
          .compareTo(String.valueOf(leaf.naming.item));
    }

    @Override
    public int hashCode() {
      return naming.hashCode() * 31 + kind.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Leaf
              && kind == ((Leaf) o).kind
              && naming.equals(((Leaf) o).naming);
    }
  }

  /** Term that has a list of operands ({@link Sum} or {@link Product}). */
  public abstract static class Compound extends Term {
    public final ImmutableList<Term> terms;

    Compound(Op op, ImmutableList<Term> terms) {
      super(op);
      this.terms = requireNonNull(terms, "terms");
    }

    @Override
    public List<Term> operands() {
      return terms;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (terms.size() == 1) {
        return terms.get(0).unparse(buf, left, right);
      }
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      for (int i = 0; i < terms.size(); i++) {
        final Term term = terms.get(i);
        if (i > 0) {
          buf.append(op.str);
        }
        term.unparse(
            buf,
            i == 0 ? left : op.right,
            i == terms.size() - 1 ? right : op.left);
      }
      return buf;
    }

    @Override
    public int nodeCount() {
      int n = 1;
      for (Term term : terms) {
        n += term.nodeCount();
      }
      return n;
    }

    @Override
    int compareSameOp(Term o) {
      final Compound compound = (Compound) o;
      int c = Integer.compare(terms.size(), compound.terms.size());
      for (int i = 0; c == 0 && i < terms.size(); i++) {
        c = terms.get(i).compareTo(compound.terms.get(i));
      }
      return c;
    }

    @Override
    public int hashCode() {
      return terms.hashCode() * 31 + op.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Compound
              && op == ((Compound) o).op
              && terms.equals(((Compound) o).terms);
    }
  }

  /**
   * Sum of terms; "needs one of". Associative and commutative, so the order
   * of operands does not affect equivalence.
   */
  public static final class Sum extends Compound {
    Sum(ImmutableList<Term> terms) {
      super(Op.SUM, terms);
    }
  }

  /**
   * Product of terms; "needs all of, in sequence". Associative but not
   * commutative.
   */
  public static final class Product extends Compound {
    Product(ImmutableList<Term> terms) {
      super(Op.PRODUCT, terms);
    }
  }
}

// End Term.java
