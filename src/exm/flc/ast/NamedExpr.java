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
 * Actual argument passed by name, e.g. tag=leader.
 */
public class NamedExpr extends Expr {
  private final String name;
  private Expr actual;

  public NamedExpr(String name, Expr actual) {
    this.name = name;
    this.actual = adoptChild(actual);
  }

  public String getName() {
    return name;
  }

  public Expr getActual() {
    return actual;
  }

  @Override
  public List<Expr> getChildren() {
    if (actual == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(actual);
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    if (oldChild != actual) {
      throw new FlcRuntimeError("Not a child of NamedExpr " + name);
    }
    orphan(actual);
    actual = adoptChild(newChild);
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    return samePos(new NamedExpr(name,
                       actual == null ? null : actual.copyInner(map)));
  }
}
