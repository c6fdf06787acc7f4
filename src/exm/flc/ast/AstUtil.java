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

import exm.flc.ast.CallExpr.Prim;

/**
 * Queries over the program tree.
 */
public class AstUtil {

  /**
   * @return all references to sym under root, in program order
   */
  public static List<SymExpr> symbolUses(Expr root, Symbol sym) {
    List<SymExpr> all = new ArrayList<SymExpr>();
    root.collect(SymExpr.class, all);
    List<SymExpr> result = new ArrayList<SymExpr>();
    for (SymExpr se: all) {
      if (se.symbol() == sym) {
        result.add(se);
      }
    }
    return result;
  }

  /**
   * @return references to sym in the function or block that defines it
   */
  public static List<SymExpr> symbolUses(Symbol sym) {
    Expr scope = definingScope(sym);
    if (scope == null) {
      return new ArrayList<SymExpr>();
    }
    return symbolUses(scope, sym);
  }

  private static Expr definingScope(Symbol sym) {
    DefExpr def = sym.getDefPoint();
    if (def == null) {
      return null;
    }
    Expr scope = def;
    while (scope.getParent() != null) {
      scope = scope.getParent();
    }
    return scope;
  }

  /**
   * @return the move that defines a temporary, or null
   */
  public static CallExpr getSingleDef(Symbol sym) {
    for (SymExpr se: symbolUses(sym)) {
      Expr parent = se.getParent();
      if (parent instanceof CallExpr &&
          ((CallExpr)parent).isPrimitive(Prim.MOVE) &&
          ((CallExpr)parent).actual(0) == se) {
        return (CallExpr)parent;
      }
    }
    return null;
  }

  /**
   * @return the value moved into a temporary, or null
   */
  public static Expr getDefOfTemp(Symbol sym) {
    CallExpr move = getSingleDef(sym);
    if (move == null || move.numActuals() < 2) {
      return null;
    }
    return move.actual(1);
  }

  /**
   * @return true if e denotes a type rather than a value
   */
  public static boolean isTypeExpr(Expr e) {
    return e instanceof SymExpr &&
           ((SymExpr)e).symbol().hasFlag(Flag.TYPE_VARIABLE);
  }

  /**
   * Find a variable named name that is visible at e: defined earlier in an
   * enclosing block, or a formal of the enclosing function.
   */
  public static Symbol lookupVisible(Expr e, String name) {
    Expr child = e;
    Expr parent = e.getParent();
    while (parent != null) {
      if (parent instanceof ForallStmt &&
          child == ((ForallStmt)parent).loopBody()) {
        Symbol found = lookupInHeader((ForallStmt)parent, name);
        if (found != null) {
          return found;
        }
      } else if (parent instanceof BlockStmt) {
        Expr stmt = child.getList() == ((BlockStmt)parent).getBody() ?
                    child.prev() : null;
        for (; stmt != null; stmt = stmt.prev()) {
          if (stmt instanceof DefExpr &&
              ((DefExpr)stmt).getSymbol().getName().equals(name)) {
            return ((DefExpr)stmt).getSymbol();
          }
        }
      }
      child = parent;
      parent = parent.getParent();
    }
    FnSymbol fn = e.getFunction();
    if (fn != null) {
      for (ArgSymbol formal: fn.getFormals()) {
        if (formal.getName().equals(name)) {
          return formal;
        }
      }
    }
    return null;
  }

  /**
   * Shadow and induction variables are visible in a forall's body
   */
  private static Symbol lookupInHeader(ForallStmt fs, String name) {
    for (ShadowVarSymbol svar: fs.shadowVarSymbols()) {
      if (svar.getName().equals(name)) {
        return svar;
      }
    }
    for (Expr def: fs.inductionVariables()) {
      Symbol index = ((DefExpr)def).getSymbol();
      if (index.getName().equals(name)) {
        return index;
      }
    }
    return null;
  }
}
