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

import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.DefExpr;
import exm.flc.ast.DeferStmt;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.ForLoop;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.exceptions.UserException;
import exm.flc.frontend.LibraryEntryPoints.LibraryOp;

/**
 * Pieces for running a forall as a serial loop over a stateful iterator,
 * which a later pass needs if the parallel iterator turns out to be
 * recursive.  They are built for every resolved forall and kept detached
 * on the statement until that pass commits or discards them.
 */
public class RecIterScaffold {

  public static final String ITER_PAR = "chpl__iterPAR";
  public static final String PAR_ITER = "chpl__parIter";

  private final LoweringContext ctx;

  public RecIterScaffold(LoweringContext ctx) {
    this.ctx = ctx;
  }

  public void setupRecIterFields(ForallStmt fs, CallExpr parIterCall)
                                 throws UserException {
    VarSymbol iterRec = VarSymbol.newTemp(ITER_PAR);
    iterRec.addFlag(Flag.NO_COPY);
    iterRec.addFlag(Flag.ITERABLE_TEMP);
    iterRec.addFlag(Flag.MAYBE_REF);
    iterRec.addFlag(Flag.EXPR_TEMP);
    VarSymbol parIter = VarSymbol.newTemp(PAR_ITER);
    parIter.addFlag(Flag.EXPR_TEMP);
    fs.parIdxVar().addFlag(Flag.INDEX_VAR);

    BlockStmt holder = new BlockStmt();
    fs.insertBefore(holder);
    DefExpr irDef = new DefExpr(iterRec, parIterCall.copy(), null);
    DefExpr icDef = new DefExpr(parIter);
    CallExpr getIterator = CallExpr.move(parIter, new CallExpr(
        ctx.entryPoints().name(LibraryOp.GET_ITERATOR), new SymExpr(iterRec)));
    CallExpr freeIterator = new CallExpr(
        ctx.entryPoints().name(LibraryOp.FREE_ITERATOR), new SymExpr(parIter));
    holder.insertAtTail(irDef);
    holder.insertAtTail(icDef);
    holder.insertAtTail(getIterator);
    holder.insertAtTail(freeIterator);

    ctx.resolver.resolveBlock(holder);

    irDef.remove();
    icDef.remove();
    getIterator.remove();
    freeIterator.remove();
    holder.remove();
    fs.setRecIterScaffold(irDef, icDef, getIterator, freeIterator);
  }

  /**
   * Replace the forall by a serial loop over the stateful iterator, with
   * the iterator released on leaving the loop.
   * @return the block now in place of the forall
   */
  public static BlockStmt commit(ForallStmt fs) {
    if (!fs.hasRecIterScaffold()) {
      throw new FlcRuntimeError("forall " + fs.id() + " has no scaffold");
    }
    BlockStmt serial = new BlockStmt();
    serial.insertAtTail(fs.recIterIRdef());
    serial.insertAtTail(fs.recIterICdef());
    serial.insertAtTail(fs.recIterGetIterator());
    serial.insertAtTail(new DeferStmt(fs.recIterFreeIterator()));
    for (Expr svarDef: fs.shadowVariables()) {
      serial.insertAtTail(svarDef.remove());
    }

    VarSymbol parIdx = fs.parIdxVar();
    VarSymbol parIter = (VarSymbol)fs.recIterICdef().getSymbol();
    serial.insertAtTail(fs.inductionVariables().head().remove());

    BlockStmt body = fs.loopBody();
    body.replace(new BlockStmt());
    serial.insertAtTail(new ForLoop(parIdx, parIter, body, false));

    fs.clearRecIterScaffold();
    fs.replace(serial);
    LogHelper.traceTree(serial, "committed serial loop:", serial);
    return serial;
  }

  /**
   * The parallel iterator is not recursive: drop the pieces.
   */
  public static void discard(ForallStmt fs) {
    fs.clearRecIterScaffold();
  }
}
