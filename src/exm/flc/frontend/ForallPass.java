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

import org.apache.log4j.Logger;

import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.CondStmt;
import exm.flc.ast.DefExpr;
import exm.flc.ast.DeferStmt;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForLoop;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.exceptions.UserException;

/**
 * Walks function bodies in program order, lowering reduce expressions
 * and resolving each forall header before the loop body.  Everything
 * else goes to the call resolver.
 */
public class ForallPass {

  public static final String ITERABLE_TMP = "chpl__iterable";

  private final Logger logger = Logging.getFlcLogger();

  private final LoweringContext ctx;
  private final ForallResolver forallResolver;
  private final ReduceLowering reduceLowering;
  private final ForallPostCheck postCheck;

  public ForallPass(LoweringContext ctx) {
    this.ctx = ctx;
    this.forallResolver = new ForallResolver(ctx);
    this.reduceLowering = new ReduceLowering(ctx);
    this.postCheck = new ForallPostCheck(ctx.diag);
  }

  /**
   * Resolve every function with a body that is not resolved yet.
   */
  public void resolveProgram() throws UserException {
    for (FnSymbol fn: ctx.globals.allFunctions()) {
      if (fn.getBody() != null && !fn.isResolved()) {
        resolveFunction(fn);
      }
    }
  }

  public void resolveFunction(FnSymbol fn) throws UserException {
    logger.debug("resolving function " + fn.getName());
    BlockStmt body = fn.getBody();
    ctx.normalizer.normalize(body);
    visitBlock(body);
    fn.setResolved(true);
    postCheck.check(fn);
  }

  private void visitBlock(BlockStmt block) throws UserException {
    if (block instanceof ForLoop) {
      ctx.resolver.resolveForLoopIndex((ForLoop)block);
    }
    Expr stmt = block.getBody().head();
    while (stmt != null) {
      CallExpr reduce = findReduce(stmt);
      if (reduce != null) {
        // Continue with what the lowering put before the statement
        Expr anchor = reduceLowering.lowerPrimReduce(reduce);
        stmt = anchor.next();
        anchor.remove();
        continue;
      }
      visitStmt(stmt);
      stmt = stmt.next();
    }
  }

  private void visitStmt(Expr stmt) throws UserException {
    if (stmt instanceof ForallStmt) {
      visitForall((ForallStmt)stmt);
    } else if (stmt instanceof BlockStmt) {
      BlockStmt block = (BlockStmt)stmt;
      if (block.isTypeBlock()) {
        ctx.resolver.resolveBlock(block);
      } else {
        visitBlock(block);
      }
    } else if (stmt instanceof CondStmt) {
      CondStmt cond = (CondStmt)stmt;
      ctx.resolver.resolveExpr(cond.condExpr());
      visitBlock(cond.thenStmt());
      if (cond.elseStmt() != null) {
        visitBlock(cond.elseStmt());
      }
    } else if (stmt instanceof DeferStmt) {
      visitBlock(((DeferStmt)stmt).body());
    } else {
      ctx.resolver.resolveExpr(stmt);
    }
  }

  private void visitForall(ForallStmt fs) throws UserException {
    if (!fs.hasRecIterScaffold()) {
      ctx.normalizer.normalize(fs.loopBody());
      normalizeIterables(fs);
      forallResolver.resolveForallHeader(fs,
                                  (SymExpr)fs.firstIteratedExpr());
    }
    visitBlock(fs.loopBody());
  }

  /**
   * Every iterable becomes a resolved reference to a temporary.
   */
  private void normalizeIterables(ForallStmt fs) throws UserException {
    for (Expr iterable: fs.iteratedExpressions()) {
      if (iterable instanceof SymExpr) {
        continue;
      }
      VarSymbol temp = VarSymbol.newTemp(ITERABLE_TMP);
      temp.addFlag(Flag.EXPR_TEMP);
      iterable.replace(new SymExpr(temp));
      DefExpr def = new DefExpr(temp);
      CallExpr move = CallExpr.move(temp, iterable);
      fs.insertBefore(def);
      fs.insertBefore(move);
      ctx.normalizer.normalize(move);
      ctx.resolver.resolveExpr(def);
      ctx.resolver.resolveExpr(move);
    }
  }

  /**
   * @return a reduce expression in stmt outside nested blocks, or null
   */
  private static CallExpr findReduce(Expr stmt) {
    if (stmt instanceof BlockStmt || stmt instanceof ForallStmt ||
        stmt instanceof CondStmt || stmt instanceof DeferStmt) {
      return null;
    }
    return findReduceIn(stmt);
  }

  private static CallExpr findReduceIn(Expr e) {
    for (Expr child: e.getChildren()) {
      CallExpr found = findReduceIn(child);
      if (found != null) {
        return found;
      }
    }
    if (e instanceof CallExpr && ((CallExpr)e).isPrimitive(Prim.REDUCE)) {
      return (CallExpr)e;
    }
    return null;
  }
}
