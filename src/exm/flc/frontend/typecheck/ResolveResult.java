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
package exm.flc.frontend.typecheck;

import exm.flc.ast.FnSymbol;
import exm.flc.common.lang.Types.Type;

/**
 * Outcome of trying to resolve a call: the function bound and the type of
 * the call, or the reason no candidate applied.
 */
public class ResolveResult {
  private final FnSymbol fn;
  private final Type type;
  private final String reason;

  private ResolveResult(FnSymbol fn, Type type, String reason) {
    this.fn = fn;
    this.type = type;
    this.reason = reason;
  }

  /**
   * @param fn null for primitives and type constructors
   */
  public static ResolveResult success(FnSymbol fn, Type type) {
    return new ResolveResult(fn, type, null);
  }

  public static ResolveResult failure(String reason) {
    return new ResolveResult(null, null, reason);
  }

  public boolean succeeded() {
    return reason == null;
  }

  public FnSymbol getFunction() {
    return fn;
  }

  public Type getType() {
    return type;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String toString() {
    if (succeeded()) {
      return "resolved: " + (fn == null ? "<builtin>" : fn.getName()) +
             " : " + type;
    }
    return "failed: " + reason;
  }
}
