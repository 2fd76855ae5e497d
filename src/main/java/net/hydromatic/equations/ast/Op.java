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

/**
 * Sub-types of {@link Term}, with their left and right precedence and print
 * name.
 */
public enum Op {
  IDENTITY(0, 0, "I"),
  TERMINAL(0, 0, "O"),
  LEAF(0, 0, ""),
  SUM(1, 2, " + "),
  PRODUCT(3, 4, " * ");

  public final int left;
  public final int right;
  public final String str;

  Op(int left, int right, String str) {
    this.left = left;
    this.right = right;
    this.str = str;
  }
}

// End Op.java
