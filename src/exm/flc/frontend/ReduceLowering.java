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

import exm.flc.ast.AstUtil;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.ForallIntentTag;
import exm.flc.frontend.LibraryEntryPoints.LibraryOp;

/**
 * Desugars <code>op reduce data</code> into a forall over the data with a
 * reduce intent, inserted before the statement that holds the reduce
 * expression.  The expression itself becomes a reference to the result.
 */
public class ReduceLowering {

  public static final String RED_RESULT = "chpl_redResult";
  public static final String RED_IDX = "chpl_redIdx";
  public static final String RED_SVAR = "chpl_redSVar";
  public static final String IITR_TEMP = "iitr_temp";

  private final LoweringContext ctx;

  public ReduceLowering(LoweringContext ctx) {
    this.ctx = ctx;
  }

  /**
   * @param call reduce(op, data, zippered[, requireSerial])
   * @return the statement to visit next: an anchor placed before
   *         everything this inserts
   */
  public Expr lowerPrimReduce(CallExpr call) throws UserException {
    if (!call.isPrimitive(Prim.REDUCE)) {
      throw new FlcRuntimeError("not a reduce: " + call);
    }
    Expr callStmt = call.getStmtExpr();
    Expr next = new CallExpr(Prim.NOOP);
    callStmt.insertBefore(next);

    SymExpr opSE = (SymExpr)call.actual(0).remove();
    SymExpr dataSE = (SymExpr)call.actual(0).remove();
    boolean zippered = ((SymExpr)call.actual(0).remove()).symbol() ==
                       Literals.TRUE;
    boolean requireSerial = call.numActuals() > 0 &&
        ((SymExpr)call.actual(0).remove()).symbol() == Literals.TRUE;

    Expr opExpr = lowerReduceOp(callStmt, opSE, dataSE, zippered);

    VarSymbol result = new VarSymbol(RED_RESULT);
    callStmt.insertBefore(new DefExpr(result));

    List<Expr> iterables = new ArrayList<Expr>();
    if (zippered) {
      for (Expr component: zipDef(dataSE).actuals()) {
        iterables.add(component.copy());
      }
    } else {
      iterables.add(dataSE);
    }
    List<VarSymbol> indices = new ArrayList<VarSymbol>();
    for (int i = 0; i < iterables.size(); i++) {
      indices.add(new VarSymbol(RED_IDX));
    }
    ShadowVarSymbol svar = new ShadowVarSymbol(ForallIntentTag.REDUCE,
                            RED_SVAR, new SymExpr(result), opExpr);

    ForallStmt fs = ForallStmt.fromReduceExpr(indices, iterables, svar,
                                    zippered, requireSerial);
    callStmt.insertBefore(fs);
    call.replace(new SymExpr(result));
    LogHelper.debug(fs, "lowered reduce expression into forall " + fs.id());
    return next;
  }

  /**
   * @return the reduce operator instantiated over the data's index type
   */
  private Expr lowerReduceOp(Expr callStmt, SymExpr opSE, SymExpr dataSE,
                             boolean zippered) throws UserException {
    CallExpr iitCall;
    if (!zippered) {
      iitCall = new CallExpr(
          ctx.entryPoints().name(LibraryOp.ITERATOR_INDEX_TYPE),
          dataSE.copy());
    } else {
      iitCall = new CallExpr(
          ctx.entryPoints().name(LibraryOp.ITERATOR_INDEX_TYPE_ZIP));
      for (Expr component: zipDef(dataSE).actuals()) {
        iitCall.insertAtTail(component.copy());
      }
    }
    callStmt.insertBefore(iitCall);
    Expr iitR = ctx.resolver.resolveExpr(iitCall);
    iitR.remove();
    if (!(iitR instanceof SymExpr)) {
      iitR = normalizeIITR(callStmt, (CallExpr)iitR);
    }
    return new CallExpr(opSE.symbol(), iitR);
  }

  /**
   * The index type has no name: compute it into a type temporary
   */
  private SymExpr normalizeIITR(Expr callStmt, CallExpr iitCall)
                                throws UserException {
    VarSymbol temp = VarSymbol.newTemp(IITR_TEMP);
    temp.addFlag(Flag.TYPE_VARIABLE);
    callStmt.insertBefore(new DefExpr(temp));
    CallExpr move = CallExpr.move(temp, iitCall);
    callStmt.insertBefore(move);
    ctx.resolver.resolveExpr(move);
    return new SymExpr(temp);
  }

  private static CallExpr zipDef(SymExpr dataSE) {
    Expr def = AstUtil.getDefOfTemp(dataSE.symbol());
    if (!(def instanceof CallExpr) ||
        !((CallExpr)def).isPrimitive(Prim.ZIP)) {
      throw new FlcRuntimeError("zippered reduce over " +
          dataSE.symbol().getName() + " which is not defined by zip");
    }
    return (CallExpr)def;
  }
}
