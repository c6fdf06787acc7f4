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
 * Keyword that introduces an entry in a forall "with" clause.
 */
public enum ShadowVarPrefix {
  CONST("const"),
  IN("in"),
  CONST_IN("const in"),
  REF("ref"),
  CONST_REF("const ref"),
  VAR("var");

  private final String keyword;

  private ShadowVarPrefix(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }
}
