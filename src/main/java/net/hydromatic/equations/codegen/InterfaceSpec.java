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

import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Description of an interface that a renderer generates for a property: its
 * name and the members an implementation must supply.
 *
 * @see InterfaceSpecs#of
 */
public final class InterfaceSpec {
  /** Type name of the property, e.g. "measure.Speed". */
  public final String typeName;
  /** Name of the interface, e.g. "ISpeed". */
  public final String interfaceName;
  public final String docstring;
  public final ImmutableList<Member> members;

  InterfaceSpec(
      String typeName,
      String interfaceName,
      String docstring,
      ImmutableList<Member> members) {
    this.typeName = requireNonNull(typeName);
    this.interfaceName = requireNonNull(interfaceName);
    this.docstring = requireNonNull(docstring);
    this.members = requireNonNull(members);
  }

  /** Returns the value names of the members, in order. */
  public ImmutableSet<String> requiredMembers() {
    final ImmutableSet.Builder<String> b = ImmutableSet.builder();
    members.forEach(member -> b.add(member.valueName));
    return b.build();
  }

  /**
   * Checks that an implementation supplies every required member.
   *
   * @param supplied Value names of the members the implementation supplies
   * @throws UnboundReferenceException naming every missing member
   */
  public void checkImplemented(Collection<String> supplied) {
    final List<String> missing = new ArrayList<>();
    for (String member : requiredMembers()) {
      if (!supplied.contains(member)) {
        missing.add(member);
      }
    }
    if (!missing.isEmpty()) {
      throw new UnboundReferenceException(interfaceName, missing);
    }
  }

  /**
   * Checks that a class has a public, non-static, zero-argument method for
   * every member; member "monthly_income" needs method "monthlyIncome()".
   *
   * @throws UnboundReferenceException naming every missing member
   */
  public void checkImplemented(Class<?> implementation) {
    final Set<String> methodNames = new HashSet<>();
    for (Method method : implementation.getMethods()) {
      if (method.getParameterCount() == 0
          && !Modifier.isStatic(method.getModifiers())
          && !Modifier.isAbstract(method.getModifiers())) {
        methodNames.add(method.getName());
      }
    }
    final List<String> supplied = new ArrayList<>();
    for (Member member : members) {
      if (methodNames.contains(member.methodName())) {
        supplied.add(member.valueName);
      }
    }
    checkImplemented(supplied);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeName, interfaceName, docstring, members);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof InterfaceSpec
            && typeName.equals(((InterfaceSpec) o).typeName)
            && interfaceName.equals(((InterfaceSpec) o).interfaceName)
            && docstring.equals(((InterfaceSpec) o).docstring)
            && members.equals(((InterfaceSpec) o).members);
  }

  @Override
  public String toString() {
    return interfaceName + members;
  }

  /** Member of an interface. */
  public static final class Member {
    public final String valueName;
    public final String typeName;
    /** Whether the member is a collection of values of {@link #typeName}. */
    public final boolean repeated;
    public final String docstring;

    Member(
        String valueName, String typeName, boolean repeated, String docstring) {
      this.valueName = requireNonNull(valueName);
      this.typeName = requireNonNull(typeName);
      this.repeated = repeated;
      this.docstring = requireNonNull(docstring);
    }

    /** Returns the name of the accessor method, e.g. "monthlyIncome". */
    public String methodName() {
      return CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, valueName);
    }

    @Override
    public int hashCode() {
      return Objects.hash(valueName, typeName, repeated, docstring);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Member
              && valueName.equals(((Member) o).valueName)
              && typeName.equals(((Member) o).typeName)
              && repeated == ((Member) o).repeated
              && docstring.equals(((Member) o).docstring);
    }

    @Override
    public String toString() {
      return valueName + ": " + typeName + (repeated ? "*" : "");
    }
  }
}

// End InterfaceSpec.java
