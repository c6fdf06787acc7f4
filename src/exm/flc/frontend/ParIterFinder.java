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

import exm.flc.ast.AstUtil;
import exm.flc.ast.CallExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.NamedExpr;
import exm.flc.ast.SymExpr;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.IterKind;
import exm.flc.common.lang.Types;
import exm.flc.frontend.IterCallRewriter.IterCall;
import exm.flc.frontend.LibraryEntryPoints.LibraryOp;
import exm.flc.frontend.typecheck.OverloadResolver;

/**
 * Picks the parallel flavor of a forall: standalone if the loop is not
 * zippered and a standalone overload applies, else leader, else serial
 * where the loop allows it.
 */
public class ParIterFinder {

  private final LoweringContext ctx;

  public ParIterFinder(LoweringContext ctx) {
    this.ctx = ctx;
  }

  /**
   * Resolve the iterable call with each tag in turn.  On success the
   * call carries the tag that resolved, or none for serial.
   */
  public ParIterFlavor findParIter(ForallStmt fs, IterCall ic)
                                   throws UserException {
    CallExpr iterCall = ic.call;
    checkForExplicitTagArgs(iterCall);

    NamedExpr tagArg = tagActual(IterKind.STANDALONE);
    iterCall.insertAtTail(tagArg);
    ParIterFlavor flavor = ParIterFlavor.NONE;

    if (!fs.zippered()) {
      if (ctx.resolver.tryResolveCall(iterCall).succeeded()) {
        flavor = ParIterFlavor.STANDALONE;
      }
    }

    if (flavor == ParIterFlavor.NONE) {
      NamedExpr leaderArg = tagActual(IterKind.LEADER);
      tagArg.replace(leaderArg);
      tagArg = leaderArg;
      if (ctx.resolver.tryResolveCall(iterCall).succeeded()) {
        flavor = ParIterFlavor.LEADER;
      }
    }

    if (flavor == ParIterFlavor.NONE && fs.allowSerialIterator()) {
      tagArg.remove();
      if (ic.origTarget != null) {
        iterCall.setBaseExpr(new SymExpr(ic.origTarget));
        flavor = ParIterFlavor.SERIAL;
      } else if (ctx.resolver.tryResolveCall(iterCall).succeeded()) {
        flavor = ParIterFlavor.SERIAL;
      }
    }

    if (flavor == ParIterFlavor.NONE) {
      reportNoParIter(fs, iterCall);
    }
    LogHelper.debug(fs, "forall over " + iterCall.getName() + ": " + flavor);
    return flavor;
  }

  private NamedExpr tagActual(IterKind kind) {
    return new NamedExpr(OverloadResolver.TAG_ACTUAL,
                         new SymExpr(ctx.globals.tagSymbol(kind)));
  }

  /**
   * Tags are for the compiler to add.
   */
  void checkForExplicitTagArgs(CallExpr iterCall) throws UserException {
    for (int i = 0; i < iterCall.numActuals(); i++) {
      Expr actual = iterCall.actual(i);
      boolean isTag = ctx.resolver.typeOf(actual) == Types.ITER_KIND;
      if (actual instanceof NamedExpr &&
          ((NamedExpr)actual).getName().equals(OverloadResolver.TAG_ACTUAL)) {
        isTag = true;
      }
      if (isTag) {
        ctx.diag.errorCont(iterCall, "user invocation of a parallel " +
            "iterator should not supply tag arguments -- they are added " +
            "implicitly by the compiler");
        ctx.diag.note(actual, "actual argument " + (i + 1) +
                      " of the iterator call");
        throw ctx.diag.stop();
      }
    }
  }

  private void reportNoParIter(ForallStmt fs, CallExpr iterCall)
                               throws UserException {
    if (iterCall.isNamed(ctx.entryPoints().name(LibraryOp.ELEMENTS_OF)) &&
        iterCall.numActuals() > 0 && AstUtil.isTypeExpr(iterCall.actual(0))) {
      throw ctx.diag.fatal(fs, "unable to iterate over type '" +
          ((SymExpr)iterCall.actual(0)).symbol().getType() + "'");
    }
    throw ctx.diag.fatal(fs, "A" + (fs.zippered() ? "" : " standalone or") +
        " leader iterator is not found for the iterable expression in " +
        "this forall loop");
  }
}
