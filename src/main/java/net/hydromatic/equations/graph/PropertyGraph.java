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
import static net.hydromatic.equations.ast.TermBuilder.term;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multimap;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import net.hydromatic.equations.ast.LeafKind;
import net.hydromatic.equations.ast.MalformedEquationException;
import net.hydromatic.equations.ast.Naming;
import net.hydromatic.equations.ast.Op;
import net.hydromatic.equations.ast.Term;
import net.hydromatic.equations.compile.Normalizer;
import net.hydromatic.equations.compile.Tracer;
import net.hydromatic.equations.compile.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Registry of the properties of a domain model.
 *
 * <p>To model a domain, create a graph and some leaves:
 *
 * <blockquote>
 *
 * <pre>
 * PropertyGraph g = new PropertyGraph();
 * Term speed = g.leaf("speed");
 * Term distance = g.leaf("distance");
 * Term duration = g.leaf("duration");
 * </pre>
 *
 * </blockquote>
 *
 * <p>Express "speed needs distance and duration" as a product, and evaluate
 * it:
 *
 * <blockquote>
 *
 * <pre>
 * g.evaluate(speed.times(distance.plus(duration)));
 * </pre>
 *
 * </blockquote>
 *
 * <p>Now {@link #properties()} returns records for "Distance", "Duration" and
 * "Speed", and the properties of "Speed" are "Distance" and "Duration".
 * Equivalent equations produce the same properties; if you minimize the
 * equation, you get the optimal class structure.
 *
 * <p>A graph grows each time {@link #evaluate} is called. Registration methods
 * are synchronized, so that callers on several threads are serialized; terms
 * themselves are immutable and can be built on any thread.
 */
public class PropertyGraph {
  /**
   * Configuration properties.
   *
   * <p>Access is synchronized on the map, so {@link Prop#set} may be called
   * while another thread evaluates.
   */
  public final Map<Prop, Object> map;

  private final Tracer tracer;
  private final Normalizer normalizer;

  private final Map<String, Term.Leaf> leavesByValueName = new HashMap<>();
  private final Map<String, Term.Leaf> leavesByTypeName = new HashMap<>();
  private final Map<String, SortedSet<String>> propertiesByValueName =
      new HashMap<>();

  /** Creates a property graph with default configuration. */
  public PropertyGraph() {
    this(new HashMap<>(), Tracers.empty());
  }

  /** Creates a property graph. */
  public PropertyGraph(Map<Prop, Object> map, Tracer tracer) {
    this.map = Collections.synchronizedMap(requireNonNull(map, "map"));
    this.tracer = requireNonNull(tracer, "tracer");
    this.normalizer = new Normalizer(tracer);
  }

  // Construction. Pure; nothing is registered until evaluate.

  /** Returns the identity term. */
  public Term identity() {
    return term.identity();
  }

  /** Returns the terminal term. */
  public Term terminal() {
    return term.terminal();
  }

  /** Creates a leaf whose names are all derived from its value name. */
  public Term.Leaf leaf(String name) {
    return term.leaf(LeafKind.PLAIN, Naming.of(name));
  }

  /**
   * Creates a leaf with an optional plural, module and docstring. Null
   * arguments take their default values.
   */
  public Term.Leaf namedLeaf(
      String name,
      @Nullable String plural,
      @Nullable String moduleName,
      @Nullable String docstring) {
    return term.leaf(
        LeafKind.NAMED, Naming.of(name, plural, moduleName, docstring));
  }

  /**
   * Creates an item leaf (in module {@code itemModule}) and a leaf that
   * contains a collection of those items (in module {@code
   * containerModule}).
   */
  public Relation relationLeaf(
      String name,
      @Nullable String itemModule,
      @Nullable String containerModule) {
    return relation(namedLeaf(name, null, itemModule, null), containerModule);
  }

  /** Creates a container of an existing item leaf. */
  public Relation relation(Term.Leaf item, @Nullable String containerModule) {
    if (item.kind == LeafKind.RELATION) {
      throw new MalformedEquationException(
          "cannot create container of container '" + item.valueName() + "'");
    }
    final Term.Leaf container =
        term.leaf(
            LeafKind.RELATION, Naming.container(item.naming, containerModule));
    return new Relation(container, item);
  }

  /** Creates a leaf for a primitive type, such as "float". */
  public Term.Leaf builtinLeaf(String name) {
    return term.leaf(LeafKind.BUILTIN, Naming.builtin(name));
  }

  // Evaluation

  /**
   * Registers the properties of a term.
   *
   * <p>The term is closed on both sides ({@code O * term * O}) and normalized.
   * Every leaf of the canonical form is registered, and for each subterm
   * {@code x * y} or {@code x * (y1 + ... + yn)}, the type name of {@code y}
   * (or of each {@code yi}) is added to the properties of {@code x}.
   *
   * <p>Either every leaf and property is registered, or, if there is a
   * collision, none is.
   *
   * @throws NamingCollisionException if a leaf has the same value name or type
   *     name as a different leaf in this graph
   * @throws MalformedEquationException if a builtin leaf has properties
   */
  public synchronized void evaluate(Term t) {
    final Term o = term.terminal();
    final Term canonical = normalizer.canonical(term.product(o, t, o));
    final Set<Term.Leaf> leaves = new LinkedHashSet<>();
    final Multimap<Term.Leaf, Term.Leaf> edges = LinkedHashMultimap.create();
    walk(canonical, leaves, edges);

    // Validate everything before changing anything.
    final Map<String, Term.Leaf> stagedValues = new HashMap<>();
    final Map<String, Term.Leaf> stagedTypes = new HashMap<>();
    for (Term.Leaf leaf : leaves) {
      check(leaf, leaf.valueName(), leavesByValueName, stagedValues);
      check(leaf, leaf.typeName(), leavesByTypeName, stagedTypes);
    }
    for (Term.Leaf source : edges.keySet()) {
      if (source.kind == LeafKind.BUILTIN) {
        throw new MalformedEquationException(
            "builtin type '"
                + source.valueName()
                + "' cannot have properties "
                + edges.get(source));
      }
    }

    for (Term.Leaf leaf : leaves) {
      leavesByTypeName.put(leaf.typeName(), leaf);
      if (leavesByValueName.put(leaf.valueName(), leaf) == null) {
        tracer.onRegister(leaf);
      }
    }
    edges.forEach(
        (source, sink) -> {
          propertiesByValueName
              .computeIfAbsent(source.valueName(), k -> new TreeSet<>())
              .add(sink.typeName());
          tracer.onConnect(source, sink);
        });
  }

  /** Collects leaves and edges from a canonical term. */
  private static void walk(
      Term t, Set<Term.Leaf> leaves, Multimap<Term.Leaf, Term.Leaf> edges) {
    switch (t.op) {
      case LEAF:
        leaves.add((Term.Leaf) t);
        return;
      case PRODUCT:
        final List<Term> operands = t.operands();
        for (int i = 0; i + 1 < operands.size(); i++) {
          if (operands.get(i).op != Op.LEAF) {
            continue;
          }
          final Term.Leaf source = (Term.Leaf) operands.get(i);
          final Term next = operands.get(i + 1);
          if (next.op == Op.LEAF) {
            edges.put(source, (Term.Leaf) next);
          } else if (next.op == Op.SUM) {
            for (Term sink : next.operands()) {
              if (sink.op == Op.LEAF) {
                edges.put(source, (Term.Leaf) sink);
              }
            }
          }
        }
        break;
      default:
        break;
    }
    for (Term operand : t.operands()) {
      walk(operand, leaves, edges);
    }
  }

  private void check(
      Term.Leaf leaf,
      String key,
      Map<String, Term.Leaf> registered,
      Map<String, Term.Leaf> staged) {
    Term.Leaf existing = registered.get(key);
    if (existing == null) {
      existing = staged.putIfAbsent(key, leaf);
    }
    if (existing != null && !existing.equals(leaf)) {
      final NamingCollisionException e =
          new NamingCollisionException(existing, leaf);
      tracer.onCollision(e);
      throw e;
    }
  }

  /**
   * Clears this graph, evaluates a term, and returns the resulting
   * properties.
   */
  public synchronized ImmutableList<PropertyNode> propertiesFrom(Term t) {
    clear();
    evaluate(t);
    return properties();
  }

  /** Removes all registered leaves and properties. */
  public synchronized void clear() {
    leavesByValueName.clear();
    leavesByTypeName.clear();
    propertiesByValueName.clear();
  }

  // Queries

  /**
   * Returns the registered properties, sorted by type name. Builtin types are
   * not included; see {@link #builtinTypes()}.
   */
  public synchronized ImmutableList<PropertyNode> properties() {
    final ImmutableList.Builder<PropertyNode> b = ImmutableList.builder();
    ImmutableSortedMap.copyOf(leavesByTypeName)
        .values()
        .forEach(
            leaf -> {
              if (leaf.kind != LeafKind.BUILTIN) {
                b.add(node(leaf));
              }
            });
    return b.build();
  }

  /** Returns the property with a given type name, or null. */
  public synchronized @Nullable PropertyNode property(String typeName) {
    final Term.Leaf leaf = leavesByTypeName.get(typeName);
    return leaf == null ? null : node(leaf);
  }

  private PropertyNode node(Term.Leaf leaf) {
    final SortedSet<String> properties =
        propertiesByValueName.get(leaf.valueName());
    return new PropertyNode(
        leaf.naming,
        leaf.kind,
        properties == null
            ? ImmutableSortedSet.of()
            : ImmutableSortedSet.copyOfSorted(properties));
  }

  /**
   * Returns the modules, sorted by name, each with the type names declared in
   * it. Leaves without a module are in the module named by {@link
   * Prop#DEFAULT_MODULE}.
   */
  public synchronized ImmutableList<Module> modules() {
    final String defaultModule = Prop.DEFAULT_MODULE.stringValue(map);
    final Map<String, ImmutableSortedSet.Builder<String>> builders =
        new TreeMap<>();
    for (Term.Leaf leaf : leavesByTypeName.values()) {
      if (leaf.kind == LeafKind.BUILTIN) {
        continue;
      }
      final String moduleName =
          leaf.naming.moduleName == null
              ? defaultModule
              : leaf.naming.moduleName;
      builders
          .computeIfAbsent(moduleName, k -> ImmutableSortedSet.naturalOrder())
          .add(leaf.typeName());
    }
    final ImmutableList.Builder<Module> b = ImmutableList.builder();
    builders.forEach(
        (name, builder) -> b.add(new Module(name, builder.build())));
    return b.build();
  }

  /** Returns the type names of the builtin leaves referenced, sorted. */
  public synchronized ImmutableList<String> builtinTypes() {
    final ImmutableSortedSet.Builder<String> b =
        ImmutableSortedSet.naturalOrder();
    for (Term.Leaf leaf : leavesByTypeName.values()) {
      if (leaf.kind == LeafKind.BUILTIN) {
        b.add(leaf.typeName());
      }
    }
    return b.build().asList();
  }
}

// End PropertyGraph.java
