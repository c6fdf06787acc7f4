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
import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * A forall loop: iterables (several only when zippered), one induction
 * variable per iterable, shadow variables from the "with" clause and
 * the loop body.
 *
 * Once its header is resolved, the loop iterates exactly one parallel
 * iterator call with one induction variable.
 */
public class ForallStmt extends Expr {
  private final ExprList iterExprs = new ExprList(this);
  private final ExprList inductionVars = new ExprList(this);
  private final ExprList shadowVars = new ExprList(this);
  private BlockStmt loopBody;

  private boolean zippered;
  private boolean createdFromForLoop = false;
  private boolean allowSerialIterator = false;
  private boolean requireSerialIterator = false;
  private boolean fromReduce = false;

  /*
   * Detached pieces for lowering through an iterator record and a
   * stateful iterator, used if the parallel iterator is recursive.
   */
  private DefExpr recIterIRdef;
  private DefExpr recIterICdef;
  private CallExpr recIterGetIterator;
  private CallExpr recIterFreeIterator;

  public ForallStmt(BlockStmt loopBody, boolean zippered) {
    this.loopBody = adoptChild(loopBody);
    this.zippered = zippered;
  }

  /**
   * Convenience constructor matching the surface syntax
   */
  public static ForallStmt build(List<VarSymbol> indices,
      List<Expr> iterables, List<ShadowVarSymbol> intents,
      BlockStmt body, boolean zippered) {
    ForallStmt fs = new ForallStmt(body, zippered);
    for (VarSymbol index: indices) {
      index.addFlag(Flag.INDEX_VAR);
      fs.inductionVars.insertAtTail(new DefExpr(index));
    }
    for (Expr iterable: iterables) {
      fs.iterExprs.insertAtTail(iterable);
    }
    for (ShadowVarSymbol svar: intents) {
      fs.shadowVars.insertAtTail(svar.getDefPoint() != null ?
                                 svar.getDefPoint() : new DefExpr(svar));
    }
    return fs;
  }

  /**
   * Loop for a reduce expression: iterates the data, accumulating each
   * index (a tuple of indices when zippered) into the reduce shadow
   * variable.
   */
  public static ForallStmt fromReduceExpr(List<VarSymbol> indices,
      List<Expr> iterables, ShadowVarSymbol svar, boolean zippered,
      boolean requireSerial) {
    Expr accumulated;
    if (indices.size() == 1) {
      accumulated = new SymExpr(indices.get(0));
    } else {
      CallExpr tuple = new CallExpr(Prim.BUILD_TUPLE);
      for (VarSymbol index: indices) {
        tuple.insertAtTail(new SymExpr(index));
      }
      accumulated = tuple;
    }
    BlockStmt body = new BlockStmt(new CallExpr(Prim.REDUCE_ASSIGN,
                                          new SymExpr(svar), accumulated));
    List<ShadowVarSymbol> intents = new ArrayList<ShadowVarSymbol>();
    intents.add(svar);
    ForallStmt fs = build(indices, iterables, intents, body, zippered);
    fs.allowSerialIterator = true;
    fs.requireSerialIterator = requireSerial;
    fs.fromReduce = true;
    return fs;
  }

  public ExprList iteratedExpressions() {
    return iterExprs;
  }

  public ExprList inductionVariables() {
    return inductionVars;
  }

  public ExprList shadowVariables() {
    return shadowVars;
  }

  public BlockStmt loopBody() {
    return loopBody;
  }

  public Expr firstIteratedExpr() {
    return iterExprs.head();
  }

  public int numIteratedExprs() {
    return iterExprs.size();
  }

  public int numInductionVars() {
    return inductionVars.size();
  }

  /**
   * @return the index variable of the parallel loop, once the header has
   *        been resolved
   */
  public VarSymbol parIdxVar() {
    if (inductionVars.size() != 1) {
      throw new FlcRuntimeError("Expected one induction variable, have " +
                                inductionVars.size());
    }
    return (VarSymbol)((DefExpr)inductionVars.head()).getSymbol();
  }

  public List<ShadowVarSymbol> shadowVarSymbols() {
    List<ShadowVarSymbol> result = new ArrayList<ShadowVarSymbol>();
    for (Expr def: shadowVars) {
      result.add((ShadowVarSymbol)((DefExpr)def).getSymbol());
    }
    return result;
  }

  public boolean zippered() {
    return zippered;
  }

  public void setNotZippered() {
    zippered = false;
  }

  public boolean createdFromForLoop() {
    return createdFromForLoop;
  }

  public void setCreatedFromForLoop(boolean val) {
    createdFromForLoop = val;
  }

  public boolean allowSerialIterator() {
    return allowSerialIterator;
  }

  public void setAllowSerialIterator(boolean val) {
    allowSerialIterator = val;
  }

  public boolean requireSerialIterator() {
    return requireSerialIterator;
  }

  public void setRequireSerialIterator(boolean val) {
    requireSerialIterator = val;
  }

  public boolean fromReduce() {
    return fromReduce;
  }

  public void setRecIterScaffold(DefExpr irDef, DefExpr icDef,
                        CallExpr getIterator, CallExpr freeIterator) {
    this.recIterIRdef = irDef;
    this.recIterICdef = icDef;
    this.recIterGetIterator = getIterator;
    this.recIterFreeIterator = freeIterator;
  }

  public void clearRecIterScaffold() {
    setRecIterScaffold(null, null, null, null);
  }

  public boolean hasRecIterScaffold() {
    return recIterIRdef != null;
  }

  public DefExpr recIterIRdef() {
    return recIterIRdef;
  }

  public DefExpr recIterICdef() {
    return recIterICdef;
  }

  public CallExpr recIterGetIterator() {
    return recIterGetIterator;
  }

  public CallExpr recIterFreeIterator() {
    return recIterFreeIterator;
  }

  @Override
  public List<Expr> getChildren() {
    List<Expr> result = new ArrayList<Expr>();
    result.addAll(inductionVars.toList());
    result.addAll(iterExprs.toList());
    result.addAll(shadowVars.toList());
    result.add(loopBody);
    return result;
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    if (oldChild != loopBody || !(newChild instanceof BlockStmt)) {
      throw new FlcRuntimeError("Forall loop body must be a block");
    }
    orphan(loopBody);
    loopBody = adoptChild((BlockStmt)newChild);
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    ForallStmt result = new ForallStmt(
        (BlockStmt)loopBody.copyInner(map), zippered);
    for (Expr e: inductionVars) {
      result.inductionVars.insertAtTail(e.copyInner(map));
    }
    for (Expr e: iterExprs) {
      result.iterExprs.insertAtTail(e.copyInner(map));
    }
    for (Expr e: shadowVars) {
      result.shadowVars.insertAtTail(e.copyInner(map));
    }
    result.createdFromForLoop = createdFromForLoop;
    result.allowSerialIterator = allowSerialIterator;
    result.requireSerialIterator = requireSerialIterator;
    result.fromReduce = fromReduce;
    return samePos(result);
  }
}
