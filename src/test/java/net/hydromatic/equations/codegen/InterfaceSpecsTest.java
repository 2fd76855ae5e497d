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
package net.hydromatic.equations.codegen;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import net.hydromatic.equations.Fixture;
import net.hydromatic.equations.graph.Prop;
import net.hydromatic.equations.graph.PropertyGraph;
import net.hydromatic.equations.graph.Relation;
import org.junit.jupiter.api.Test;

/** Tests for {@link InterfaceSpecs} and {@link InterfaceSpec}. */
public class InterfaceSpecsTest {
  @Test
  void testSpeed() {
    final Fixture f = new Fixture();
    f.g.evaluate(f.speedModel());
    final ImmutableSortedMap<String, InterfaceSpec> specs =
        InterfaceSpecs.of(f.g);
    assertThat(specs.keySet(), hasToString("[Distance, Duration, Speed]"));
    final InterfaceSpec speed = specs.get("Speed");
    assertThat(
        speed, hasToString("ISpeed[distance: Distance, duration: Duration]"));
    assertThat(speed.typeName, is("Speed"));
    assertThat(speed.docstring, is("speed"));
    assertThat(speed.requiredMembers(), hasToString("[distance, duration]"));
    assertThat(
        speed.members.get(0).docstring,
        is("The distance of the speed instance."));
    assertThat(specs.get("Distance"), hasToString("IDistance[]"));
  }

  @Test
  void testFine() {
    final Fixture f = new Fixture();
    f.g.evaluate(f.fineModel());
    final InterfaceSpec fine = InterfaceSpecs.of(f.g).get("Fine");
    assertThat(
        fine,
        hasToString(
            "IFine[monthly_income: MonthlyIncome, speed: Speed,"
                + " speed_limit: SpeedLimit]"));
    assertThat(fine.members.get(0).methodName(), is("monthlyIncome"));
    assertThat(
        fine.members.get(0).docstring,
        is("The monthly income of the fine instance."));
  }

  /** A container has one repeated member, named by its item's plural. */
  @Test
  void testContainer() {
    final PropertyGraph g = new PropertyGraph();
    final Relation relation = g.relationLeaf("knife", "accessories", null);
    g.evaluate(relation.container().times(relation.item(), g.terminal()));
    final ImmutableSortedMap<String, InterfaceSpec> specs =
        InterfaceSpecs.of(g);
    final InterfaceSpec container = specs.get("KnifeContainer");
    assertThat(
        container, hasToString("IKnifeContainer[knifes: accessories.Knife*]"));
    assertThat(container.members.get(0).repeated, is(true));
    assertThat(
        container.members.get(0).docstring,
        is("Returns all contained knife of the knife container instance."));
    assertThat(specs.get("accessories.Knife"), hasToString("IKnife[]"));
  }

  /** Builtin types get no interface, but can be members. */
  @Test
  void testBuiltin() {
    final Fixture f = new Fixture();
    f.g.evaluate(f.speed.times(f.g.builtinLeaf("float")));
    final ImmutableSortedMap<String, InterfaceSpec> specs =
        InterfaceSpecs.of(f.g);
    assertThat(specs.keySet(), hasToString("[Speed]"));
    assertThat(specs.get("Speed"), hasToString("ISpeed[float: float]"));
  }

  @Test
  void testInterfacePrefix() {
    final Fixture f = new Fixture();
    Prop.INTERFACE_PREFIX.set(f.g.map, "Has");
    f.g.evaluate(f.speedModel());
    assertThat(
        InterfaceSpecs.of(f.g).get("Speed").interfaceName, is("HasSpeed"));
  }

  @Test
  void testCheckImplemented() {
    final Fixture f = new Fixture();
    f.g.evaluate(f.speedModel());
    final InterfaceSpec speed = InterfaceSpecs.of(f.g).get("Speed");
    speed.checkImplemented(List.of("distance", "duration", "extra"));

    final UnboundReferenceException e =
        assertThrows(
            UnboundReferenceException.class,
            () -> speed.checkImplemented(List.of("distance")));
    assertThat(
        e.getMessage(),
        is("implementation of ISpeed is missing members duration"));
    assertThat(e.interfaceName, is("ISpeed"));
    assertThat(e.missingMembers, is(ImmutableList.of("duration")));

    final UnboundReferenceException e2 =
        assertThrows(
            UnboundReferenceException.class,
            () -> speed.checkImplemented(List.of()));
    assertThat(e2.missingMembers, is(ImmutableList.of("distance", "duration")));
    assertThat(
        e2.describeTo(new StringBuilder()).toString(),
        is(
            "Unbound reference: implementation of ISpeed is missing members "
                + "distance, duration"));
  }

  @Test
  void testCheckImplementedClass() {
    final Fixture f = new Fixture();
    f.g.evaluate(f.fineModel());
    final ImmutableSortedMap<String, InterfaceSpec> specs =
        InterfaceSpecs.of(f.g);
    specs.get("Speed").checkImplemented(SpeedImpl.class);
    specs.get("Fine").checkImplemented(FineImpl.class);

    final UnboundReferenceException e =
        assertThrows(
            UnboundReferenceException.class,
            () -> specs.get("Speed").checkImplemented(PartialSpeed.class));
    assertThat(e.missingMembers, is(ImmutableList.of("duration")));
  }

  /** Implements "ISpeed". */
  public static class SpeedImpl {
    public double distance() {
      return 100d;
    }

    public double duration() {
      return 3.6d;
    }
  }

  /** Implements "IFine". */
  public static class FineImpl {
    public double monthlyIncome() {
      return 3_000d;
    }

    public SpeedImpl speed() {
      return new SpeedImpl();
    }

    public double speedLimit() {
      return 80d;
    }
  }

  /** Does not implement "ISpeed", because its "duration" method is static. */
  public static class PartialSpeed {
    public double distance() {
      return 100d;
    }

    public static double duration() {
      return 3.6d;
    }
  }
}

// End InterfaceSpecsTest.java
