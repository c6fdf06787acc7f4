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
 * Serial loop over a stateful iterator: each iteration stores the next
 * yielded value in the index variable, then runs the body.
 */
public class ForLoop extends BlockStmt {
  private SymExpr index;
  private SymExpr iterator;
  private final boolean zippered;

  public ForLoop(VarSymbol index, VarSymbol iterator, BlockStmt initBody,
                 boolean zippered) {
    this.index = adoptChild(new SymExpr(index));
    this.iterator = adoptChild(new SymExpr(iterator));
    this.zippered = zippered;
    if (initBody != null) {
      insertAtTail(initBody);
    }
  }

  public SymExpr indexGet() {
    return index;
  }

  public SymExpr iteratorGet() {
    return iterator;
  }

  public boolean zippered() {
    return zippered;
  }

  /**
   * Build a loop over iteratorExpr, with the iterator acquired before the
   * loop and released on leaving the enclosing block.
   *
   * @param indices a single index reference, or a tuple-building call of
   *                index references to be bound positionally
   * @return block holding the iterator setup and the loop
   */
  public static BlockStmt buildForLoop(Expr indices, Expr iteratorExpr,
                             BlockStmt body, boolean zippered) {
    BlockStmt result = new BlockStmt();
    VarSymbol iter = VarSymbol.newTemp("_iterator");
    iter.addFlag(Flag.EXPR_TEMP);
    VarSymbol index = VarSymbol.newTemp("_indexOfInterest");
    index.addFlag(Flag.INDEX_OF_INTEREST);
    index.addFlag(Flag.INDEX_VAR);

    result.insertAtTail(new DefExpr(iter));
    result.insertAtTail(CallExpr.move(iter, new CallExpr(
        zippered ? "_getIteratorZip" : "_getIterator", iteratorExpr)));
    result.insertAtTail(new DeferStmt(
        new CallExpr("_freeIterator", new SymExpr(iter))));
    result.insertAtTail(new DefExpr(index));

    ForLoop loop = new ForLoop(index, iter, body, zippered);
    destructureIndices(loop, indices, index);
    result.insertAtTail(loop);
    return result;
  }

  private static void destructureIndices(ForLoop loop, Expr indices,
                                         VarSymbol index) {
    if (indices instanceof SymExpr) {
      Symbol user = ((SymExpr)indices).symbol();
      loop.insertAtHead(CallExpr.move(user, new SymExpr(index)));
    } else if (indices instanceof CallExpr &&
               ((CallExpr)indices).isPrimitive(Prim.BUILD_TUPLE)) {
      CallExpr tuple = (CallExpr)indices;
      for (int k = tuple.numActuals(); k >= 1; k--) {
        Symbol user = ((SymExpr)tuple.actual(k - 1)).symbol();
        loop.insertAtHead(CallExpr.move(user,
            new CallExpr(Prim.TUPLE_GET, new SymExpr(index),
                         new SymExpr(Literals.intConst(k)))));
      }
    } else {
      throw new FlcRuntimeError("Unexpected loop indices: " + indices);
    }
  }

  @Override
  public List<Expr> getChildren() {
    List<Expr> result = new ArrayList<Expr>();
    result.add(index);
    result.add(iterator);
    result.addAll(getBody().toList());
    return result;
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    if (oldChild == index && newChild instanceof SymExpr) {
      orphan(index);
      index = adoptChild((SymExpr)newChild);
    } else if (oldChild == iterator && newChild instanceof SymExpr) {
      orphan(iterator);
      iterator = adoptChild((SymExpr)newChild);
    } else {
      throw new FlcRuntimeError("Cannot replace child of ForLoop " + id());
    }
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    ForLoop result = new ForLoop((VarSymbol)index.symbol(),
        (VarSymbol)iterator.symbol(), null, zippered);
    copyBodyInto(result, map);
    return samePos(result);
  }
}
