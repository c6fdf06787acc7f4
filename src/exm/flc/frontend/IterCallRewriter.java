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

import exm.flc.ast.ArgSymbol;
import exm.flc.ast.AstUtil;
import exm.flc.ast.CallExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Symbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.UnresolvedSymExpr;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.IteratorRecordType;
import exm.flc.frontend.LibraryEntryPoints.LibraryOp;

/**
 * Turns the first iterable of a forall into a call that can be retried
 * with each iteration tag.
 */
public class IterCallRewriter {

  public static final String FORALL_EXPR_PREFIX = "chpl__forallexpr";
  public static final String LOOPEXPR_ITER_PREFIX = "chpl__loopexpr_iter";

  /**
   * The rewritten iterable of one forall
   */
  public static class IterCall {
    /** Call now in the forall's first iterable position */
    public final CallExpr call;

    /** The iterable reference that the call replaced, now detached */
    public final SymExpr origSE;

    /** Serial iterator the iterable was produced by, null if none */
    public final FnSymbol origTarget;

    /**
     * Move the call was taken out of, if the loop iterates the original
     * call as is
     */
    public final CallExpr reusedFrom;

    IterCall(CallExpr call, SymExpr origSE, FnSymbol origTarget,
             CallExpr reusedFrom) {
      this.call = call;
      this.origSE = origSE;
      this.origTarget = origTarget;
      this.reusedFrom = reusedFrom;
    }

    /**
     * @return true if no tags are to be tried
     */
    public boolean useOriginal() {
      return reusedFrom != null;
    }

    /**
     * Give a reused call back to the move it was taken from
     */
    public void restoreReused() {
      if (reusedFrom != null) {
        if (call.getParent() != null) {
          call.remove();
        }
        reusedFrom.insertAtTail(call);
      }
    }
  }

  private final LoweringContext ctx;

  public IterCallRewriter(LoweringContext ctx) {
    this.ctx = ctx;
  }

  /**
   * Build the call to iterate and put it in place of origSE.
   *
   * If the iterable is an iterator record, the call is the one that
   * produced the record, retargeted by name so that tagged overloads can
   * be found.  Otherwise it is a call to the elements-of entry point.
   */
  public IterCall buildForallParIterCall(ForallStmt fs, SymExpr origSE)
                                        throws UserException {
    Symbol origSym = origSE.symbol();
    CallExpr iterCall;
    FnSymbol origTarget = null;
    CallExpr reusedFrom = null;

    if (Types.isIteratorRecord(origSym.getType())) {
      if (origSym instanceof ArgSymbol) {
        ctx.diag.errorCont(fs, "a forall loop over a formal argument " +
            "corresponding to a for/forall/promoted expression or an " +
            "iterator call is not implemented");
        ctx.diag.note(origSym.getDeclPosition(), "the actual argument is here");
        throw ctx.diag.stop();
      }

      CallExpr defMove = AstUtil.getSingleDef(origSym);
      if (defMove == null || !(defMove.actual(1) instanceof CallExpr)) {
        throw new FlcRuntimeError("iterator record " + origSym.getName() +
                                  " has no defining call");
      }
      CallExpr origCall = (CallExpr)defMove.actual(1);
      origTarget = ((IteratorRecordType)origSym.getType()).getIterator();
      String targetName = origTarget.getName();
      String callee = origCall.getName();
      if (callee != null && callee.startsWith(FORALL_EXPR_PREFIX)) {
        String retargeted = LOOPEXPR_ITER_PREFIX +
                            callee.substring(FORALL_EXPR_PREFIX.length());
        if (!retargeted.equals(targetName)) {
          throw new FlcRuntimeError("forall expression " + callee +
              " does not wrap " + retargeted + " but " + targetName);
        }
      }

      if (fs.createdFromForLoop() || fs.requireSerialIterator()) {
        iterCall = (CallExpr)origCall.remove();
        reusedFrom = defMove;
      } else {
        iterCall = (CallExpr)origCall.copy();
        iterCall.setBaseExpr(new UnresolvedSymExpr(targetName));
        iterCall.setResolvedFunction(null);
        iterCall.setCallType(null);
      }
    } else {
      iterCall = new CallExpr(ctx.entryPoints().name(LibraryOp.ELEMENTS_OF),
                              origSE.copy());
    }

    origSE.replace(iterCall);
    LogHelper.trace(fs, "iterable call: " + iterCall.getName() +
                    (reusedFrom != null ? " (original)" : ""));
    return new IterCall(iterCall, origSE, origTarget, reusedFrom);
  }

  /**
   * The temporary that held the original iterator record is deleted
   * with its defining move once a single iterator call replaced it,
   * unless it still feeds a reduce expression's index type query.
   */
  public void removeOrigIterCall(SymExpr origSE) {
    Symbol origSym = origSE.symbol();
    if (!origSym.hasFlag(Flag.TEMP)) {
      return;
    }
    CallExpr defMove = AstUtil.getSingleDef(origSym);
    boolean keep = false;
    for (SymExpr use: AstUtil.symbolUses(origSym)) {
      if (defMove != null && use == defMove.actual(0)) {
        continue;
      }
      Expr parent = use.getParent();
      if (parent instanceof CallExpr && (
          ((CallExpr)parent).isNamed(
              ctx.entryPoints().name(LibraryOp.ITERATOR_INDEX_TYPE)) ||
          ((CallExpr)parent).isNamed(
              ctx.entryPoints().name(LibraryOp.ITERATOR_INDEX_TYPE_ZIP)))) {
        keep = true;
      } else {
        throw new FlcRuntimeError("unexpected use of iterable temporary " +
            origSym.getName() + " in " + parent);
      }
    }
    if (!keep) {
      if (defMove != null) {
        defMove.remove();
      }
      if (origSym.getDefPoint() != null) {
        origSym.getDefPoint().remove();
      }
    }
  }
}
