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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.equations.util.EquationException;

/**
 * Thrown when an implementation of an interface does not supply every
 * member that the interface requires. The message names every missing member.
 */
public class UnboundReferenceException extends RuntimeException
    implements EquationException {
  public final String interfaceName;
  public final ImmutableList<String> missingMembers;

  public UnboundReferenceException(
      String interfaceName, List<String> missingMembers) {
    super(
        "implementation of "
            + interfaceName
            + " is missing members "
            + String.join(", ", missingMembers));
    this.interfaceName = requireNonNull(interfaceName);
    this.missingMembers = ImmutableList.copyOf(missingMembers);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Unbound reference: ").append(getMessage());
  }
}

// End UnboundReferenceException.java
