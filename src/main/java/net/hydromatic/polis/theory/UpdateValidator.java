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

import java.util.List;
import net.hydromatic.polis.compile.PolicyException;

/**
 * Decides which changesets a theory accepts.
 *
 * <p>This is the only respect in which the kinds of theory differ; they all
 * store and look up rules the same way.
 *
 * @see UpdateValidators
 */
public interface UpdateValidator {
  /**
   * Returns the errors that applying {@code events} to {@code theory} would
   * cause. Does not modify the theory.
   */
  List<PolicyException> updateWouldCauseErrors(
      RuleTheory theory, List<Event> events);
}

// End UpdateValidator.java
