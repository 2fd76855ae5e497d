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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.CaseFormat;
import java.util.Objects;
import java.util.regex.Pattern;
import net.hydromatic.equations.util.Json;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Names of a property: its type name, value name, plural and docstring.
 *
 * <p>Every name is derived from the value name, a lower-case identifier such
 * as "monthly_income", unless it is given explicitly. The derivation functions
 * ({@link #camelCase}, {@link #plural}, {@link #docstring}, {@link #typeName})
 * are pure and have no state.
 */
public final class Naming {
  private static final Pattern NAME_PATTERN =
      Pattern.compile("[a-z][a-z0-9_]*");
  private static final Pattern MODULE_PATTERN =
      Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)*");

  /** Suffix added to the value name of a container. */
  public static final String CONTAINER_SUFFIX = "_container";

  public final String valueName;
  /** Class name without module prefix, e.g. "MonthlyIncome". */
  public final String className;
  public final @Nullable String moduleName;
  public final String plural;
  public final String docstring;
  /** If this is the naming of a container, the naming of its items. */
  public final @Nullable Naming item;

  private Naming(
      String valueName,
      String className,
      @Nullable String moduleName,
      String plural,
      String docstring,
      @Nullable Naming item) {
    this.valueName = requireNonNull(valueName);
    this.className = requireNonNull(className);
    this.moduleName = moduleName;
    this.plural = requireNonNull(plural);
    this.docstring = requireNonNull(docstring);
    this.item = item;
  }

  /** Creates a naming whose every name is derived from the value name. */
  public static Naming of(String name) {
    return of(name, null, null, null);
  }

  /**
   * Creates a naming; the plural and docstring, if not null, override the
   * derived ones.
   */
  public static Naming of(
      String name,
      @Nullable String plural,
      @Nullable String moduleName,
      @Nullable String docstring) {
    checkName("name", name);
    if (plural != null) {
      checkName("plural", plural);
    }
    checkModuleName(moduleName);
    return new Naming(
        name,
        camelCase(name),
        moduleName,
        plural != null ? plural : plural(name),
        docstring != null ? docstring : docstring(name),
        null);
  }

  /**
   * Creates the naming of a container of items. For item "knife" the
   * container's value name is "knife_container" and its class name is
   * "KnifeContainer".
   */
  public static Naming container(Naming item, @Nullable String moduleName) {
    checkModuleName(moduleName);
    final String name = item.valueName + CONTAINER_SUFFIX;
    return new Naming(
        name, camelCase(name), moduleName, plural(name), docstring(name), item);
  }

  /** Creates the naming of a builtin type; its type name is its value name. */
  public static Naming builtin(String name) {
    checkName("builtin name", name);
    return new Naming(name, name, null, plural(name), docstring(name), null);
  }

  private static void checkName(String description, @Nullable String name) {
    if (name == null || !NAME_PATTERN.matcher(name).matches()) {
      throw new MalformedEquationException(
          description
              + " should be a non empty lowercase string matching "
              + NAME_PATTERN
              + ", but was "
              + (name == null ? "null" : "'" + name + "'"));
    }
  }

  private static void checkModuleName(@Nullable String moduleName) {
    if (moduleName != null && !MODULE_PATTERN.matcher(moduleName).matches()) {
      throw new MalformedEquationException(
          "module name should match "
              + MODULE_PATTERN
              + ", but was '"
              + moduleName
              + "'");
    }
  }

  /** Returns the type name, e.g. "MonthlyIncome" or "measure.Speed". */
  public String typeName() {
    return moduleName == null ? className : moduleName + "." + className;
  }

  /** Returns the name of the interface, e.g. "ISpeed" for prefix "I". */
  public String interfaceName(String prefix) {
    return prefix + className;
  }

  public boolean isContainer() {
    return item != null;
  }

  @Override
  public int hashCode() {
    return Objects.hash(valueName, className, moduleName, plural, docstring);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Naming
            && valueName.equals(((Naming) o).valueName)
            && className.equals(((Naming) o).className)
            && Objects.equals(moduleName, ((Naming) o).moduleName)
            && plural.equals(((Naming) o).plural)
            && docstring.equals(((Naming) o).docstring)
            && Objects.equals(item, ((Naming) o).item);
  }

  @Override
  public String toString() {
    return Json.toString(toJson());
  }

  /**
   * Returns this naming as a JSON object with fields "type", "value",
   * "plural" and "docstring".
   */
  public ObjectNode toJson() {
    final ObjectNode node = Json.object();
    node.put("type", typeName());
    node.put("value", valueName);
    node.put("plural", plural);
    node.put("docstring", docstring);
    return node;
  }

  /**
   * Converts an underscore-delimited name to a class name.
   *
   * <p>For example, {@code camelCase("some_words")} returns "SomeWords".
   */
  public static String camelCase(String word) {
    return CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, word);
  }

  /** Returns the default plural of a value name: the name plus "s". */
  public static String plural(String word) {
    return word + "s";
  }

  /** Returns the default docstring of a value name: "speed_limit" becomes
   * "speed limit". */
  public static String docstring(String word) {
    return word.replace('_', ' ');
  }

  /**
   * Returns the type name of a value name in a module, for example
   * "measure.SpeedLimit" for "speed_limit" in module "measure".
   */
  public static String typeName(String word, @Nullable String moduleName) {
    final String className = camelCase(word);
    return moduleName == null ? className : moduleName + "." + className;
  }
}

// End Naming.java
