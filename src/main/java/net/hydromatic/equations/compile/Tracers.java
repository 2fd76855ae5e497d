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
import static net.hydromatic.equations.util.Static.str;

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.equations.ast.Term;
import net.hydromatic.equations.graph.NamingCollisionException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line for each event to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /**
   * Returns a tracer that performs the given action on each normalized term,
   * then calls the underlying tracer.
   */
  public static Tracer withOnNormalize(
      Tracer tracer, BiConsumer<Term, Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onNormalize(Term term, Term canonical) {
        consumer.accept(term, canonical);
        super.onNormalize(term, canonical);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each registered leaf,
   * then calls the underlying tracer.
   */
  public static Tracer withOnRegister(
      Tracer tracer, Consumer<Term.Leaf> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRegister(Term.Leaf leaf) {
        consumer.accept(leaf);
        super.onRegister(leaf);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each connection, then
   * calls the underlying tracer.
   */
  public static Tracer withOnConnect(
      Tracer tracer, BiConsumer<Term.Leaf, Term.Leaf> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onConnect(Term.Leaf source, Term.Leaf sink) {
        consumer.accept(source, sink);
        super.onConnect(source, sink);
      }
    };
  }

  public static Tracer withOnCollision(
      Tracer tracer, Consumer<NamingCollisionException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCollision(NamingCollisionException e) {
        consumer.accept(e);
        super.onCollision(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onNormalize(Term term, Term canonical) {}

    @Override
    public void onRegister(Term.Leaf leaf) {}

    @Override
    public void onConnect(Term.Leaf source, Term.Leaf sink) {}

    @Override
    public void onCollision(NamingCollisionException e) {}
  }

  /** Tracer that writes to a given {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush() {
      w.println(str(b));
      w.flush();
    }

    @Override
    public void onNormalize(Term term, Term canonical) {
      b.append("normalize ").append(term).append(" -> ").append(canonical);
      flush();
    }

    @Override
    public void onRegister(Term.Leaf leaf) {
      b.append("register ").append(leaf.typeName());
      flush();
    }

    @Override
    public void onConnect(Term.Leaf source, Term.Leaf sink) {
      b.append("connect ")
          .append(source.typeName())
          .append(" -> ")
          .append(sink.typeName());
      flush();
    }

    @Override
    public void onCollision(NamingCollisionException e) {
      e.describeTo(b.append("collision "));
      flush();
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  public static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onNormalize(Term term, Term canonical) {
      tracer.onNormalize(term, canonical);
    }

    @Override
    public void onRegister(Term.Leaf leaf) {
      tracer.onRegister(leaf);
    }

    @Override
    public void onConnect(Term.Leaf source, Term.Leaf sink) {
      tracer.onConnect(source, sink);
    }

    @Override
    public void onCollision(NamingCollisionException e) {
      tracer.onCollision(e);
    }
  }
}

// End Tracers.java
