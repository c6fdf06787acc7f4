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
package exm.flc.frontend;

import java.util.ArrayList;
import java.util.List;

import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.CondStmt;
import exm.flc.ast.DefExpr;
import exm.flc.ast.DeferStmt;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;

/**
 * Hoists calls nested in the actuals of other calls into temporaries,
 * so that every non-primitive call is either a statement, the value of
 * a move or the initializer of a definition.
 *
 * Foralls are left alone: the pass normalizes them when it reaches them.
 */
public class CallTempNormalizer implements Normalizer {

  public static final String CALL_TMP = "call_tmp";

  @Override
  public void normalize(Expr e) {
    if (e instanceof ForallStmt) {
      return;
    } else if (e instanceof BlockStmt) {
      for (Expr stmt: ((BlockStmt)e).getBody()) {
        normalize(stmt);
      }
    } else if (e instanceof CondStmt) {
      CondStmt cond = (CondStmt)e;
      hoistNested(e, cond.condExpr(), true);
      normalize(cond.thenStmt());
      if (cond.elseStmt() != null) {
        normalize(cond.elseStmt());
      }
    } else if (e instanceof DeferStmt) {
      normalize(((DeferStmt)e).body());
    } else if (e instanceof DefExpr) {
      Expr init = ((DefExpr)e).getInit();
      if (init != null) {
        hoistNested(e, init, true);
      }
    } else if (e instanceof CallExpr) {
      hoistNested(e, e, true);
    }
  }

  /**
   * Post-order walk: inner calls are hoisted before the calls that use
   * them.
   * @param stmt statement before which temporaries go
   * @param topLevel true if e may stay a call in place
   */
  private void hoistNested(Expr stmt, Expr e, boolean topLevel) {
    if (!(e instanceof CallExpr)) {
      return;
    }
    CallExpr call = (CallExpr)e;
    List<Expr> actuals = new ArrayList<Expr>(call.actuals().toList());
    for (int i = 0; i < actuals.size(); i++) {
      boolean keep = call.isPrimitive(Prim.MOVE) && i == 1;
      hoistNested(stmt, actuals.get(i), keep);
    }
    if (topLevel || call.isPrimitive()) {
      return;
    }
    VarSymbol tmp = VarSymbol.newTemp(CALL_TMP);
    tmp.addFlag(Flag.EXPR_TEMP);
    call.replace(new SymExpr(tmp));
    stmt.insertBefore(new DefExpr(tmp));
    stmt.insertBefore(CallExpr.move(tmp, call));
  }
}
