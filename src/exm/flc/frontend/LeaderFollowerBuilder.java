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
import exm.flc.ast.BlockStmt.BlockTag;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.CondStmt;
import exm.flc.ast.DefExpr;
import exm.flc.ast.DeferStmt;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.ForLoop;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.SymExpr;
import exm.flc.ast.SymbolMap;
import exm.flc.ast.VarSymbol;
import exm.flc.common.exceptions.UserException;
import exm.flc.frontend.LibraryEntryPoints.LibraryOp;

/**
 * Builds the body of a forall driven by a leader iterator: each leader
 * descriptor runs a serial loop over a follower of the iterable(s).
 *
 * Unless fast followers are disabled, the body first checks, statically
 * then at runtime, whether all iterables allow fast following, and
 * branches between a fast and a general follow loop over copies of the
 * user body.
 */
public class LeaderFollowerBuilder {

  public static final String ITER_LF = "chpl__iterLF";
  public static final String FOLLOW_ITER = "chpl__followIter";
  public static final String FAST_FOLLOW_ITER = "chpl__fastFollowIter";
  public static final String FAST_FOLLOW_IDX = "chpl__fastFollowIdx";
  public static final String STATIC_CHECK = "chpl__staticFFCheck";
  public static final String DYNAMIC_CHECK = "chpl__dynamicFFCheck";

  private final LoweringContext ctx;

  public LeaderFollowerBuilder(LoweringContext ctx) {
    this.ctx = ctx;
  }

  /**
   * Expects the loop body built by {@link IndexVarRestructurer}: the
   * follower index definition, then the user body.
   * @param iterExpr the iterable, or a tuple of the zippered iterables
   */
  public void buildLeaderLoopBody(ForallStmt fs, Expr iterExpr)
                                  throws UserException {
    boolean zippered = iterExpr instanceof CallExpr &&
        ((CallExpr)iterExpr).isPrimitive(Prim.BUILD_TUPLE) &&
        ((CallExpr)iterExpr).numActuals() > 1;

    BlockStmt loopBody = fs.loopBody();
    DefExpr followIdxDef = (DefExpr)loopBody.getBody().head().remove();
    BlockStmt userBody = (BlockStmt)loopBody.getBody().tail().remove();
    VarSymbol followIdx = (VarSymbol)followIdxDef.getSymbol();
    VarSymbol parIdx = fs.parIdxVar();

    BlockStmt preFS = new BlockStmt(BlockTag.SCOPELESS);
    VarSymbol iterRec = VarSymbol.newTemp(ITER_LF);
    iterRec.addFlag(Flag.NO_COPY);
    iterRec.addFlag(Flag.EXPR_TEMP);
    iterRec.addFlag(Flag.ITERABLE_TEMP);
    preFS.insertAtTail(new DefExpr(iterRec));
    preFS.insertAtTail(CallExpr.move(iterRec, iterExpr));

    VarSymbol followIter = VarSymbol.newTemp(FOLLOW_ITER);
    BlockStmt followBlock = buildFollowLoop(fs, iterRec, parIdx, followIter,
                              followIdx, userBody, false, zippered);

    if (ctx.noFastFollowers()) {
      loopBody.insertAtTail(followBlock);
    } else {
      VarSymbol staticCheck = VarSymbol.newTemp(STATIC_CHECK);
      staticCheck.addFlag(Flag.EXPR_TEMP);
      staticCheck.addFlag(Flag.MAYBE_PARAM);
      VarSymbol dynamicCheck = VarSymbol.newTemp(DYNAMIC_CHECK);
      dynamicCheck.addFlag(Flag.EXPR_TEMP);
      dynamicCheck.addFlag(Flag.MAYBE_PARAM);

      loopBody.insertAtTail(new DefExpr(staticCheck));
      loopBody.insertAtTail(new DefExpr(dynamicCheck));
      loopBody.insertAtTail(CallExpr.move(staticCheck, new CallExpr(
          ctx.entryPoints().name(LibraryOp.staticCheck(zippered)),
          new SymExpr(iterRec))));
      loopBody.insertAtTail(new CondStmt(new SymExpr(staticCheck),
          CallExpr.move(dynamicCheck, new CallExpr(
              ctx.entryPoints().name(LibraryOp.dynamicCheck(zippered)),
              new SymExpr(iterRec))),
          CallExpr.move(dynamicCheck, new SymExpr(Literals.FALSE))));

      VarSymbol fastFollowIdx = VarSymbol.newTemp(FAST_FOLLOW_IDX);
      fastFollowIdx.addFlag(Flag.INDEX_OF_INTEREST);
      fastFollowIdx.addFlag(Flag.INDEX_VAR);
      VarSymbol fastFollowIter = VarSymbol.newTemp(FAST_FOLLOW_ITER);
      SymbolMap map = new SymbolMap();
      map.put(followIdx, fastFollowIdx);
      BlockStmt fastBody = (BlockStmt)userBody.copy(map);

      BlockStmt fastFollowBlock = buildFollowLoop(fs, iterRec, parIdx,
          fastFollowIter, fastFollowIdx, fastBody, true, zippered);
      loopBody.insertAtTail(new CondStmt(new SymExpr(dynamicCheck),
                                         fastFollowBlock, followBlock));
    }

    fs.insertBefore(preFS);
    ctx.normalizer.normalize(preFS);
    ctx.resolver.resolveBlock(preFS);
    preFS.flattenAndRemove();
    LogHelper.traceTree(fs, "leader loop body:", loopBody);
  }

  /**
   * Block that acquires a follower for the leader index, releases it on
   * exit and runs a serial loop over it.
   */
  BlockStmt buildFollowLoop(ForallStmt ref, VarSymbol iterRec,
      VarSymbol leadIdx, VarSymbol followIter, VarSymbol followIdx,
      BlockStmt loopBody, boolean fast, boolean zippered) {
    BlockStmt followBlock = new BlockStmt();
    ForLoop followLoop = new ForLoop(followIdx, followIter, loopBody,
                                     zippered);

    followBlock.insertAtTail(new DefExpr(followIter));
    followIdx.addFlag(Flag.FOLLOWER_INDEX);

    CallExpr toFollower = new CallExpr(
        ctx.entryPoints().name(LibraryOp.toFollower(fast, zippered)),
        new SymExpr(iterRec), new SymExpr(leadIdx));
    followBlock.insertAtTail(CallExpr.move(followIter, new CallExpr(
        ctx.entryPoints().name(LibraryOp.getIterator(zippered)),
        toFollower)));
    followBlock.insertAtTail(new DeferStmt(new CallExpr(
        ctx.entryPoints().name(LibraryOp.FREE_ITERATOR),
        new SymExpr(followIter))));

    // statements are only inserted before nodes in a list
    ref.insertAfter(followBlock);
    ctx.normalizer.normalize(followBlock);
    followBlock.remove();

    DefExpr idxDef = followIdx.getDefPoint();
    if (idxDef == null) {
      idxDef = new DefExpr(followIdx);
    } else {
      idxDef.remove();
    }
    followBlock.insertAtTail(idxDef);

    BlockStmt typeBlock = new BlockStmt(BlockTag.TYPE);
    typeBlock.insertAtTail(CallExpr.move(followIdx, new CallExpr(
        ctx.entryPoints().name(LibraryOp.ITERATOR_INDEX),
        new SymExpr(followIter))));
    followBlock.insertAtTail(typeBlock);
    followBlock.insertAtTail(followLoop);
    return followBlock;
  }
}
