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

import java.util.ArrayList;
import java.util.List;

import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * Definition of a symbol, with optional initializer and type expression.
 */
public class DefExpr extends Expr {
  private final Symbol sym;
  private Expr init;
  private Expr exprType;

  /** Intent block of a shadow variable, null otherwise */
  private BlockStmt intentBlock;

  public DefExpr(Symbol sym) {
    this(sym, null, null);
  }

  public DefExpr(Symbol sym, Expr init, Expr exprType) {
    if (sym.defPoint != null) {
      throw new FlcRuntimeError("Symbol " + sym + " is already defined");
    }
    this.sym = sym;
    sym.defPoint = this;
    this.init = adoptChild(init);
    this.exprType = adoptChild(exprType);
    if (sym instanceof ShadowVarSymbol) {
      this.intentBlock = adoptChild(((ShadowVarSymbol)sym).getIntentBlock());
    }
  }

  public Symbol getSymbol() {
    return sym;
  }

  public Expr getInit() {
    return init;
  }

  public Expr getExprType() {
    return exprType;
  }

  @Override
  public List<Expr> getChildren() {
    List<Expr> result = new ArrayList<Expr>(3);
    if (exprType != null) {
      result.add(exprType);
    }
    if (init != null) {
      result.add(init);
    }
    if (intentBlock != null) {
      result.add(intentBlock);
    }
    return result;
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    if (oldChild == init && init != null) {
      orphan(init);
      init = adoptChild(newChild);
    } else if (oldChild == exprType && exprType != null) {
      orphan(exprType);
      exprType = adoptChild(newChild);
    } else {
      throw new FlcRuntimeError("Not a replaceable child of def of " + sym);
    }
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    Symbol newSym = sym.copySymbol();
    map.put(sym, newSym);
    return samePos(new DefExpr(newSym,
          init == null ? null : init.copyInner(map),
          exprType == null ? null : exprType.copyInner(map)));
  }
}
