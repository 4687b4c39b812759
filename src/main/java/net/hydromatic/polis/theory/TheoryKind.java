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
package net.hydromatic.polis.theory;

/** Kind of a rule theory. */
public enum TheoryKind {
  /** Rules that may not be recursive; the usual kind of policy. */
  NONRECURSIVE("nonrecursive"),

  /**
   * Rules that describe actions, and whose heads may be update tables of
   * other theories.
   */
  ACTION("action");

  public final String lowerName;

  TheoryKind(String lowerName) {
    this.lowerName = lowerName;
  }
}

// End TheoryKind.java
