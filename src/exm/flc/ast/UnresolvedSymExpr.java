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

import java.util.Collections;
import java.util.List;

import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * A name not yet bound to a symbol: a callee before overload resolution,
 * or a variable named in a forall intent.
 */
public class UnresolvedSymExpr extends Expr {
  private final String name;

  public UnresolvedSymExpr(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public List<Expr> getChildren() {
    return Collections.emptyList();
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    throw new FlcRuntimeError("UnresolvedSymExpr has no children");
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    return samePos(new UnresolvedSymExpr(name));
  }
}
