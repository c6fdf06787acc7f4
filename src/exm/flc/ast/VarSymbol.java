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

import exm.flc.common.lang.Types.Type;

public class VarSymbol extends Symbol {
  /** Literal value, if this symbol is a constant */
  private final Object immediate;

  public VarSymbol(String name) {
    this(name, null, null);
  }

  public VarSymbol(String name, Type type) {
    this(name, type, null);
  }

  public VarSymbol(String name, Type type, Object immediate) {
    super(name, type);
    this.immediate = immediate;
  }

  public static VarSymbol newTemp(String name) {
    return newTemp(name, null);
  }

  public static VarSymbol newTemp(String name, Type type) {
    VarSymbol v = new VarSymbol(name, type);
    v.addFlag(Flag.TEMP);
    return v;
  }

  public Object getImmediate() {
    return immediate;
  }

  public boolean isImmediate() {
    return immediate != null;
  }

  @Override
  public Symbol copySymbol() {
    VarSymbol result = new VarSymbol(name, null, immediate);
    copyAttrsTo(result);
    return result;
  }
}
