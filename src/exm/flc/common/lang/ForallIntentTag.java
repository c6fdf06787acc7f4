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

package exm.flc.common.lang;

/**
 * How a forall loop captures an outer variable, or declares a
 * task-private one.
 */
public enum ForallIntentTag {
  DEFAULT("default"),
  CONST("const"),
  IN("in"),
  CONST_IN("const in"),
  REF("ref"),
  CONST_REF("const ref"),
  REDUCE("reduce"),
  /** Reduce operator instance held by each task */
  REDUCE_OP("reduce-Op"),
  /** Accumulation state of the enclosing reduction */
  PARENT_REDUCE_AS("parent-reduce-AS"),
  /** Reduce operator of the enclosing reduction */
  PARENT_REDUCE_OP("parent-reduce-Op"),
  TASK_PRIVATE("task-private");

  private final String description;

  private ForallIntentTag(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }

  /**
   * @return true for the variants synthesized while lowering a reduction,
   *        which shadow no user variable
   */
  public boolean isReduceInternal() {
    return this == REDUCE_OP || this == PARENT_REDUCE_AS ||
           this == PARENT_REDUCE_OP;
  }

  @Override
  public String toString() {
    return description;
  }
}
