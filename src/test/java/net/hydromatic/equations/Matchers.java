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
package net.hydromatic.equations;

import static com.google.common.collect.ImmutableList.toImmutableList;

import java.util.List;
import net.hydromatic.equations.ast.Term;
import net.hydromatic.equations.compile.Normalizer;
import net.hydromatic.equations.graph.PropertyNode;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a term that has the same canonical form as a given term. */
  public static Matcher<Term> isEquivalentTo(Term expected) {
    return new TypeSafeMatcher<Term>() {
      @Override
      protected boolean matchesSafely(Term term) {
        return Normalizer.equivalent(term, expected);
      }

      @Override
      public void describeTo(Description description) {
        description
            .appendText("term equivalent to ")
            .appendValue(expected)
            .appendText(" (canonical form ")
            .appendValue(Normalizer.normalize(expected))
            .appendText(")");
      }

      @Override
      protected void describeMismatchSafely(
          Term term, Description description) {
        description
            .appendText("was ")
            .appendValue(term)
            .appendText(" (canonical form ")
            .appendValue(Normalizer.normalize(term))
            .appendText(")");
      }
    };
  }

  /**
   * Matches a list of property nodes whose serialized forms are the given
   * lines.
   */
  public static Matcher<List<PropertyNode>> isProperties(String... lines) {
    final List<String> expected = List.of(lines);
    return new TypeSafeMatcher<List<PropertyNode>>() {
      @Override
      protected boolean matchesSafely(List<PropertyNode> nodes) {
        return serialize(nodes).equals(expected);
      }

      @Override
      public void describeTo(Description description) {
        description.appendValueList("", "\n", "", expected);
      }

      @Override
      protected void describeMismatchSafely(
          List<PropertyNode> nodes, Description description) {
        description.appendValueList("was ", "\n", "", serialize(nodes));
      }
    };
  }

  private static List<String> serialize(List<PropertyNode> nodes) {
    return nodes.stream()
        .map(PropertyNode::toString)
        .collect(toImmutableList());
  }
}

// End Matchers.java
