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

import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.lang.Types.Type;

/**
 * Call of a named function, of a resolved function, of a type
 * constructor, or of a primitive operation.
 */
public class CallExpr extends Expr {

  public static enum Prim {
    /** move(lhs, rhs): initialize or assign lhs */
    MOVE,
    /** zip(a, b, ...): iterables traversed in lockstep */
    ZIP,
    BUILD_TUPLE,
    /** tuple_get(t, k): component k, counting from 1 */
    TUPLE_GET,
    /** No effect, used as insertion anchor */
    NOOP,
    /** reduce(op, data, zippered) */
    REDUCE,
    /** Accumulate a value into a reduce shadow variable */
    REDUCE_ASSIGN,
    ADD_ASSIGN,
    /** Raise a program error with the given message */
    THROW,
  }

  private final Prim prim;
  private Expr baseExpr;
  private final ExprList args = new ExprList(this);

  private FnSymbol resolvedFn;
  private Type callType;

  public CallExpr(String name, Expr ...actuals) {
    this(null, new UnresolvedSymExpr(name), actuals);
  }

  /**
   * @param fn function or type to call
   */
  public CallExpr(Symbol fn, Expr ...actuals) {
    this(null, new SymExpr(fn), actuals);
  }

  public CallExpr(Prim prim, Expr ...actuals) {
    this(prim, null, actuals);
  }

  private CallExpr(Prim prim, Expr baseExpr, Expr[] actuals) {
    this.prim = prim;
    this.baseExpr = adoptChild(baseExpr);
    for (Expr actual: actuals) {
      args.insertAtTail(actual);
    }
  }

  public static CallExpr move(Symbol lhs, Expr rhs) {
    return new CallExpr(Prim.MOVE, new SymExpr(lhs), rhs);
  }

  public boolean isPrimitive() {
    return prim != null;
  }

  public boolean isPrimitive(Prim p) {
    return prim == p;
  }

  public Prim getPrim() {
    return prim;
  }

  public Expr getBaseExpr() {
    return baseExpr;
  }

  public void setBaseExpr(Expr newBase) {
    if (prim != null) {
      throw new FlcRuntimeError("Primitive " + prim + " has no base");
    }
    orphan(baseExpr);
    baseExpr = adoptChild(newBase);
  }

  /**
   * @return callee name, or null for primitives
   */
  public String getName() {
    if (baseExpr instanceof UnresolvedSymExpr) {
      return ((UnresolvedSymExpr)baseExpr).getName();
    } else if (baseExpr instanceof SymExpr) {
      return ((SymExpr)baseExpr).symbol().getName();
    }
    return null;
  }

  public boolean isNamed(String name) {
    return name.equals(getName());
  }

  /**
   * @return symbol the base expression refers to, null if unresolved
   */
  public Symbol getBaseSymbol() {
    if (baseExpr instanceof SymExpr) {
      return ((SymExpr)baseExpr).symbol();
    }
    return null;
  }

  public ExprList actuals() {
    return args;
  }

  public int numActuals() {
    return args.size();
  }

  /**
   * @param i 0-based position
   */
  public Expr actual(int i) {
    return args.get(i);
  }

  public void insertAtTail(Expr actual) {
    args.insertAtTail(actual);
  }

  public void insertAtHead(Expr actual) {
    args.insertAtHead(actual);
  }

  public FnSymbol resolvedFunction() {
    if (resolvedFn != null) {
      return resolvedFn;
    }
    Symbol base = getBaseSymbol();
    return base instanceof FnSymbol ? (FnSymbol)base : null;
  }

  public void setResolvedFunction(FnSymbol fn) {
    this.resolvedFn = fn;
  }

  /**
   * @return result type computed by the resolver, null if not resolved
   */
  public Type getCallType() {
    return callType;
  }

  public void setCallType(Type callType) {
    this.callType = callType;
  }

  @Override
  public List<Expr> getChildren() {
    List<Expr> result = new ArrayList<Expr>(args.size() + 1);
    if (baseExpr != null) {
      result.add(baseExpr);
    }
    result.addAll(args.toList());
    return result;
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    if (oldChild != baseExpr || baseExpr == null) {
      throw new FlcRuntimeError("Not a slot child of call " + id());
    }
    orphan(baseExpr);
    baseExpr = adoptChild(newChild);
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    CallExpr result = new CallExpr(prim,
        baseExpr == null ? null : baseExpr.copyInner(map), new Expr[0]);
    for (Expr actual: args) {
      result.insertAtTail(actual.copyInner(map));
    }
    result.resolvedFn = resolvedFn;
    result.callType = callType;
    return samePos(result);
  }
}
