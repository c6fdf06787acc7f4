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
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.ExprList;
import exm.flc.ast.Flag;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForLoop;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.Types.IteratorRecordType;
import exm.flc.common.lang.Types.Type;
import exm.flc.frontend.IterCallRewriter.IterCall;

/**
 * Runs a zippered forall over serial iterators as a zippered serial loop
 * inside a forall over the trivial leader, which yields once.
 */
public class ZipperedSerial {

  public static final String TRIVIAL_IDX = "chpl_trivialIdx";

  private final LoweringContext ctx;

  public ZipperedSerial(LoweringContext ctx) {
    this.ctx = ctx;
  }

  public void handleZipperedSerial(ForallStmt fs, IterCall ic)
                                   throws UserException {
    checkParallelIterator(fs);

    CallExpr indices = new CallExpr(Prim.BUILD_TUPLE);
    for (Expr def: fs.inductionVariables()) {
      indices.insertAtTail(new SymExpr(((DefExpr)def).getSymbol()));
    }

    CallExpr zip = new CallExpr(Prim.ZIP);
    for (Expr iterable: fs.iteratedExpressions()) {
      iterable.remove();
      if (iterable == ic.call) {
        ic.restoreReused();
        zip.insertAtTail(ic.origSE);
      } else {
        zip.insertAtTail(iterable);
      }
    }

    BlockStmt origLoopBody = fs.loopBody();
    BlockStmt newLoopBody = new BlockStmt();
    origLoopBody.replace(newLoopBody);
    BlockStmt forBlock = ForLoop.buildForLoop(indices, zip, origLoopBody,
                                              true);
    newLoopBody.insertAtTail(forBlock);
    ctx.normalizer.normalize(forBlock);

    ForLoop loop = (ForLoop)forBlock.getBody().tail();
    ExprList indexDefs = fs.inductionVariables();
    for (Expr def = indexDefs.tail(); def != null; def = indexDefs.tail()) {
      loop.insertAtHead(def.remove());
    }
    origLoopBody.flattenAndRemove();
    forBlock.flattenAndRemove();

    FnSymbol trivialLeader = ctx.entryPoints().trivialLeader(ctx.resolver);
    VarSymbol trivialIdx = VarSymbol.newTemp(TRIVIAL_IDX);
    trivialIdx.addFlag(Flag.INDEX_VAR);
    trivialIdx.setType(trivialLeader.getYieldType().type());
    trivialIdx.setQual(trivialLeader.getYieldType().getQual());
    indexDefs.insertAtTail(new DefExpr(trivialIdx));

    CallExpr leaderCall = new CallExpr(trivialLeader);
    ctx.resolver.resolveCall(leaderCall);
    fs.iteratedExpressions().insertAtTail(leaderCall);
    LogHelper.traceTree(fs, "zippered serial body:", newLoopBody);
  }

  /**
   * Only serial iterators can be zippered this way.
   */
  private void checkParallelIterator(ForallStmt fs) throws UserException {
    for (Expr iterable: fs.iteratedExpressions()) {
      FnSymbol fn = underlyingFunction(iterable);
      if (fn != null && (fn.isLeaderIterator() ||
                         fn.isStandaloneIterator())) {
        throw ctx.diag.fatal(fs, "Support for this combination of " +
            "zippered iterators is not currently implemented");
      }
    }
  }

  private static FnSymbol underlyingFunction(Expr iterable) {
    if (iterable instanceof CallExpr) {
      return ((CallExpr)iterable).resolvedFunction();
    } else if (iterable instanceof SymExpr) {
      Type t = ((SymExpr)iterable).symbol().getType();
      if (t instanceof IteratorRecordType) {
        return ((IteratorRecordType)t).getIterator();
      }
      return null;
    }
    throw new FlcRuntimeError("unexpected iterable " + iterable);
  }
}
