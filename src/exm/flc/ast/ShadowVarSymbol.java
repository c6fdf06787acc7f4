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

import exm.flc.common.lang.ForallIntentTag;

/**
 * Per-task view of a variable in a forall loop: a captured outer variable
 * or a task-private variable.
 *
 * The expressions describing it (the reference to the outer variable and,
 * for reductions, the reduce operator instance) are owned by an intent block
 * that hangs off the defining {@link DefExpr}.  A task-private variable's
 * type and initializer are the type and init of its DefExpr.
 */
public class ShadowVarSymbol extends VarSymbol {
  private ForallIntentTag intent;

  /** Resolved outer variable, null until resolved or if none */
  private Symbol outerVar;

  private final BlockStmt intentBlock;
  private Expr outerVarRef;
  private Expr reduceOpExpr;

  public ShadowVarSymbol(ForallIntentTag intent, String name,
                         Expr outerVarRef) {
    this(intent, name, outerVarRef, null);
  }

  public ShadowVarSymbol(ForallIntentTag intent, String name,
                         Expr outerVarRef, Expr reduceOpExpr) {
    super(name);
    this.intent = intent;
    this.intentBlock = new BlockStmt();
    setOuterVarRef(outerVarRef);
    setReduceOpExpr(reduceOpExpr);
  }

  public ForallIntentTag intent() {
    return intent;
  }

  public boolean isTaskPrivate() {
    return intent == ForallIntentTag.TASK_PRIVATE;
  }

  public boolean isReduce() {
    return intent == ForallIntentTag.REDUCE;
  }

  public Symbol getOuterVar() {
    return outerVar;
  }

  public void setOuterVar(Symbol outerVar) {
    this.outerVar = outerVar;
  }

  BlockStmt getIntentBlock() {
    return intentBlock;
  }

  /**
   * @return expression naming the outer variable, null if none
   */
  public Expr getOuterVarRef() {
    return outerVarRef;
  }

  public void setOuterVarRef(Expr ref) {
    if (outerVarRef != null) {
      outerVarRef.remove();
    }
    outerVarRef = ref;
    if (ref != null) {
      intentBlock.insertAtHead(ref);
    }
  }

  public Expr getReduceOpExpr() {
    return reduceOpExpr;
  }

  public void setReduceOpExpr(Expr opExpr) {
    if (reduceOpExpr != null) {
      reduceOpExpr.remove();
    }
    reduceOpExpr = opExpr;
    if (opExpr != null) {
      intentBlock.insertAtTail(opExpr);
    }
  }

  @Override
  public Symbol copySymbol() {
    ShadowVarSymbol result = new ShadowVarSymbol(intent, name,
        outerVarRef == null ? null : outerVarRef.copy(),
        reduceOpExpr == null ? null : reduceOpExpr.copy());
    result.outerVar = outerVar;
    copyAttrsTo(result);
    return result;
  }
}
