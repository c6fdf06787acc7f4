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

import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.Expr;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.QualifiedType;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.IteratorRecordType;
import exm.flc.frontend.IterCallRewriter.IterCall;

/**
 * Resolves the header of one forall loop: picks the parallel iterator,
 * types the index variable, resolves the shadow variables and builds
 * the leader/follower or zippered-serial body.
 */
public class ForallResolver {

  private final LoweringContext ctx;
  private final IterCallRewriter rewriter;
  private final ParIterFinder finder;
  private final IndexVarRestructurer restructurer;
  private final LeaderFollowerBuilder leaderFollower;
  private final ZipperedSerial zipperedSerial;
  private final ShadowVars shadowVars;
  private final RecIterScaffold scaffold;

  public ForallResolver(LoweringContext ctx) {
    this.ctx = ctx;
    this.rewriter = new IterCallRewriter(ctx);
    this.finder = new ParIterFinder(ctx);
    this.restructurer = new IndexVarRestructurer();
    this.leaderFollower = new LeaderFollowerBuilder(ctx);
    this.zipperedSerial = new ZipperedSerial(ctx);
    this.shadowVars = new ShadowVars(ctx);
    this.scaffold = new RecIterScaffold(ctx);
  }

  /**
   * @param origSE the first iterable, already resolved
   * @return the call the loop now iterates: the parallel iterator call,
   *         or the trivial leader call for zippered serial iteration
   */
  public CallExpr resolveForallHeader(ForallStmt fs, SymExpr origSE)
                                      throws UserException {
    if (origSE != fs.firstIteratedExpr()) {
      throw new FlcRuntimeError("forall " + fs.id() +
                                ": header resolved from wrong iterable");
    }

    IterCall ic = rewriter.buildForallParIterCall(fs, origSE);
    CallExpr iterCall = ic.call;
    assert(iterCall == fs.firstIteratedExpr());
    assert(!origSE.inTree());

    boolean useOriginal = fs.createdFromForLoop() ||
                          fs.requireSerialIterator();
    ParIterFlavor flavor = useOriginal ? ParIterFlavor.SERIAL
                                       : finder.findParIter(fs, ic);
    ctx.resolver.resolveCall(iterCall);

    FnSymbol origIterFn = iterCall.resolvedFunction();
    boolean gotSA = flavor != ParIterFlavor.LEADER;

    if (ic.origTarget != null) {
      IteratorGroup igroup = ctx.globals.iteratorGroup(ic.origTarget);
      checkForNonIterator(igroup, flavor, iterCall);
      checkSlot(fs, igroup, flavor, origIterFn, ic);
    }

    CallExpr result;
    if (flavor == ParIterFlavor.SERIAL && fs.numIteratedExprs() > 1) {
      if (fs.numIteratedExprs() != fs.numInductionVars()) {
        throw new FlcRuntimeError("forall " + fs.id() + ": " +
            fs.numIteratedExprs() + " iterables but " +
            fs.numInductionVars() + " index variables");
      }
      zipperedSerial.handleZipperedSerial(fs, ic);
      shadowVars.setupAndResolve(fs);
      result = (CallExpr)fs.iteratedExpressions().tail();
    } else {
      restructurer.addParIdxVarsAndRestruct(fs, gotSA);
      resolveParallelIteratorAndIdxVar(fs, origIterFn);
      shadowVars.setupAndResolve(fs);

      if (gotSA) {
        if (Types.isIteratorRecord(origSE.symbol().getType())) {
          rewriter.removeOrigIterCall(origSE);
        }
      } else {
        leaderFollower.buildLeaderLoopBody(fs,
                           rebuildIterableCall(fs, iterCall, origSE));
      }

      if (iterCall != fs.firstIteratedExpr() ||
          fs.numIteratedExprs() != 1) {
        throw new FlcRuntimeError("forall " + fs.id() +
                    " does not iterate a single parallel iterator call");
      }
      result = iterCall;
    }

    scaffold.setupRecIterFields(fs, (CallExpr)fs.firstIteratedExpr());
    if (ctx.verify()) {
      verify(fs);
    }
    LogHelper.traceTree(fs, "resolved forall header:", fs);
    return result;
  }

  private void checkForNonIterator(IteratorGroup igroup,
        ParIterFlavor flavor, CallExpr parCall) throws UserException {
    if ((flavor == ParIterFlavor.STANDALONE && igroup.noniterSA()) ||
        (flavor == ParIterFlavor.LEADER && igroup.noniterL())) {
      FnSymbol dest = parCall.resolvedFunction();
      ctx.diag.errorCont(parCall, String.format("The iterable-expression " +
          "resolves to a non-iterator function '%s' when looking for a " +
          "parallel iterator", dest.getName()));
      ctx.diag.note(dest.getDeclPosition(), String.format(
          "The function '%s' is declared here", dest.getName()));
      throw ctx.diag.stop();
    }
  }

  private static void checkSlot(ForallStmt fs, IteratorGroup igroup,
      ParIterFlavor flavor, FnSymbol resolved, IterCall ic) {
    if (ic.useOriginal() || resolved == ic.origTarget) {
      if (flavor != ParIterFlavor.SERIAL || resolved != igroup.serial) {
        throw new FlcRuntimeError("forall " + fs.id() +
            ": serial iteration resolved to " + resolved.getName());
      }
      return;
    }
    FnSymbol expected = igroup.forFlavor(flavor);
    if (resolved != expected) {
      throw new FlcRuntimeError("forall " + fs.id() + ": " + flavor +
          " iterator resolved to " + resolved + ", expected " + expected);
    }
  }

  private void resolveParallelIteratorAndIdxVar(ForallStmt fs,
                             FnSymbol iterFn) throws UserException {
    QualifiedType iType = fsIterYieldType(fs, iterFn);
    VarSymbol idxVar = fs.parIdxVar();
    idxVar.setType(iType.type());
    idxVar.setQual(iType.getQual());
  }

  /**
   * What an iterator, or a function forwarding to one, yields.
   */
  QualifiedType fsIterYieldType(ForallStmt fs, FnSymbol iterFn)
                                throws UserException {
    if (iterFn.isIterator()) {
      QualifiedType yt = iterFn.getYieldType();
      if (yt == null || yt.type() == Types.UNKNOWN) {
        // Still resolving the iterator that contains this loop
        ctx.diag.errorCont(fs, "the recursion pattern seen in the first " +
            "iterable in this forall loop is not supported");
        ctx.diag.note(iterFn.getDeclPosition(),
                      "the corresponding iterator is here");
        ctx.diag.note(iterFn.getDeclPosition(),
                      "try declaring its return type");
        throw ctx.diag.stop();
      }
      return yt;
    }

    if (!(iterFn.getRetType() instanceof IteratorRecordType)) {
      throw new FlcRuntimeError(iterFn.getName() +
          " is neither an iterator nor forwards to one");
    }
    FnSymbol iterator =
        ((IteratorRecordType)iterFn.getRetType()).getIterator();
    return fsIterYieldType(fs, iterator);
  }

  /**
   * The iterable for the leader/follower body: the original iterable, or
   * the tuple of all zippered iterables, which are taken out of the loop.
   */
  private static Expr rebuildIterableCall(ForallStmt fs, CallExpr iterCall,
                                          Expr origExprFlw) {
    int origLength = fs.numIteratedExprs();
    if (origLength == 1) {
      return origExprFlw;
    }

    CallExpr result = new CallExpr(Prim.BUILD_TUPLE, origExprFlw);
    for (Expr curr = iterCall.next(); curr != null; curr = iterCall.next()) {
      result.insertAtTail(curr.remove());
    }
    if (result.numActuals() != origLength) {
      throw new FlcRuntimeError("zippered forall " + fs.id() + " has " +
          origLength + " iterables, tuple has " + result.numActuals());
    }
    return result;
  }

  /**
   * Checks the shape every resolved forall must have.
   */
  static void verify(ForallStmt fs) {
    boolean parallelShape = fs.numIteratedExprs() == 1 &&
        fs.firstIteratedExpr() instanceof CallExpr &&
        fs.numInductionVars() == 1;
    boolean zipSerialShape = fs.numIteratedExprs() == 1 &&
        fs.numInductionVars() == 1 &&
        fs.loopBody().getBody().size() >= 1;
    if (!parallelShape && !zipSerialShape) {
      throw new FlcRuntimeError("forall " + fs.id() +
                                " is malformed after header resolution");
    }
    if (!fs.hasRecIterScaffold()) {
      throw new FlcRuntimeError("forall " + fs.id() +
                                " has no recursive-iterator scaffold");
    }
    CallExpr call = (CallExpr)fs.firstIteratedExpr();
    if (call.resolvedFunction() == null) {
      throw new FlcRuntimeError("forall " + fs.id() +
                                " iterates an unresolved call");
    }
  }
}
