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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Naming}. */
public class NamingTest {
  @Test
  void testDefaults() {
    final Naming naming = Naming.of("foo_bar");
    assertThat(
        naming,
        hasToString(
            "{\"type\": \"FooBar\", \"value\": \"foo_bar\", "
                + "\"plural\": \"foo_bars\", \"docstring\": \"foo bar\"}"));
    assertThat(naming.className, is("FooBar"));
    assertThat(naming.moduleName, nullValue());
    assertThat(naming.isContainer(), is(false));
    assertThat(naming.interfaceName("I"), is("IFooBar"));
  }

  @Test
  void testModule() {
    final Naming naming = Naming.of("foo_bar", null, "module", null);
    assertThat(
        naming,
        hasToString(
            "{\"type\": \"module.FooBar\", \"value\": \"foo_bar\", "
                + "\"plural\": \"foo_bars\", \"docstring\": \"foo bar\"}"));
    assertThat(naming.typeName(), is("module.FooBar"));
    assertThat(naming.className, is("FooBar"));
    assertThat(naming.interfaceName("I"), is("IFooBar"));

    final Naming nested = Naming.of("speed", null, "domain.measure", null);
    assertThat(nested.typeName(), is("domain.measure.Speed"));
  }

  /** Explicit plural and docstring win over the derived ones. */
  @Test
  void testOverrides() {
    final Naming naming = Naming.of("knife", "knives", null, "sharp thing");
    assertThat(naming.plural, is("knives"));
    assertThat(naming.docstring, is("sharp thing"));
    assertThat(naming.typeName(), is("Knife"));
    assertThat(naming, not(is(Naming.of("knife"))));
  }

  @Test
  void testContainer() {
    final Naming container = Naming.container(Naming.of("test"), null);
    assertThat(
        container,
        hasToString(
            "{\"type\": \"TestContainer\", \"value\": \"test_container\", "
                + "\"plural\": \"test_containers\", "
                + "\"docstring\": \"test container\"}"));
    assertThat(container.isContainer(), is(true));
    assertThat(container.item, is(Naming.of("test")));

    final Naming inModule =
        Naming.container(Naming.of("knife", null, "accessories", null), "bag");
    assertThat(inModule.typeName(), is("bag.KnifeContainer"));
    assertThat(inModule.item.typeName(), is("accessories.Knife"));
  }

  @Test
  void testBuiltin() {
    final Naming naming = Naming.builtin("int32");
    assertThat(naming.typeName(), is("int32"));
    assertThat(naming.className, is("int32"));
    assertThat(naming.valueName, is("int32"));
  }

  @Test
  void testDerivationFunctions() {
    assertThat(Naming.camelCase("some_words"), is("SomeWords"));
    assertThat(Naming.camelCase("speed"), is("Speed"));
    assertThat(Naming.camelCase("int32_value"), is("Int32Value"));
    assertThat(Naming.camelCase("foo__bar"), is("FooBar"));
    assertThat(Naming.camelCase("trailing_"), is("Trailing"));
    assertThat(Naming.plural("test"), is("tests"));
    assertThat(Naming.plural("knife"), is("knifes"));
    assertThat(Naming.docstring("monthly_income"), is("monthly income"));
    assertThat(Naming.typeName("speed_limit", null), is("SpeedLimit"));
    assertThat(Naming.typeName("speed_limit", "law"), is("law.SpeedLimit"));
  }

  @Test
  void testInvalidNames() {
    for (String name : new String[] {"", "Foo", "1abc", "foo-bar", "_x"}) {
      final MalformedEquationException e =
          assertThrows(
              MalformedEquationException.class,
              () -> Naming.of(name),
              name);
      assertThat(e.getMessage(), containsString("name should be"));
    }
    assertThrows(MalformedEquationException.class, () -> Naming.of(null));
    assertThrows(
        MalformedEquationException.class,
        () -> Naming.of("knife", "Knives", null, null));
    assertThrows(
        MalformedEquationException.class,
        () -> Naming.of("knife", null, "Bad Module", null));
    assertThrows(
        MalformedEquationException.class, () -> Naming.builtin("Float"));
  }

  /** Docstrings are escaped when serialized, so the result is valid JSON. */
  @Test
  void testEscape() throws IOException {
    final Naming naming = Naming.of("quote", null, null, "say \"hi\"");
    assertThat(naming.toString(), containsString("\"say \\\"hi\\\"\""));

    final String docstring = "sharp\ttool\r\001 a\\b\n";
    final Naming knife = Naming.of("knife", null, null, docstring);
    final String json = knife.toString();
    assertThat(json, not(containsString("\t")));
    assertThat(json, not(containsString("\r")));
    assertThat(json, not(containsString("\n")));
    assertThat(json, not(containsString("\001")));
    assertThat(
        json,
        containsString("\"docstring\": \"sharp\\ttool\\r\\u0001 a\\\\b\\n\""));

    final JsonNode node = new ObjectMapper().readTree(json);
    assertThat(node.get("docstring").asText(), is(docstring));
    assertThat(node.get("type").asText(), is("Knife"));
  }
}

// End NamingTest.java
