/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.flc.ast;

/**
 * Properties attached to symbols by the front end.
 */
public enum Flag {
  /** Compiler-introduced temporary */
  TEMP,
  /** Holds the result of a subexpression */
  EXPR_TEMP,
  /** Holds a type, not a value */
  TYPE_VARIABLE,
  /** May be folded to a compile-time value */
  MAYBE_PARAM,
  MAYBE_REF,
  NO_COPY,
  /** Holds the iterable that a lowered loop iterates over */
  ITERABLE_TEMP,
  INDEX_VAR,
  INDEX_OF_INTEREST,
  FOLLOWER_INDEX,
  INSERT_AUTO_DESTROY,
  NO_AUTO_DESTROY,
  CONST,
  REF_VAR,
  /** Iterator that is always inlined into its caller */
  INLINE_ITERATOR,
  /** Class implementing a reduction operator */
  REDUCE_SCAN_OP,
}
