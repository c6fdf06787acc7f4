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

import java.util.List;

import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * Sequence of statements.
 */
public class BlockStmt extends Expr {

  public static enum BlockTag {
    NORMAL,
    /** Does not open a scope */
    SCOPELESS,
    /** Only resolved for the types it establishes, never executed */
    TYPE,
  }

  private BlockTag tag;
  private final ExprList body = new ExprList(this);

  /** Function owning this block, if it is a function body */
  private Symbol parentSymbol;

  public BlockStmt() {
    this(BlockTag.NORMAL);
  }

  public BlockStmt(BlockTag tag) {
    this.tag = tag;
  }

  public BlockStmt(Expr ...stmts) {
    this(BlockTag.NORMAL);
    for (Expr stmt: stmts) {
      body.insertAtTail(stmt);
    }
  }

  public BlockTag getTag() {
    return tag;
  }

  public void setTag(BlockTag tag) {
    this.tag = tag;
  }

  public boolean isTypeBlock() {
    return tag == BlockTag.TYPE;
  }

  public ExprList getBody() {
    return body;
  }

  public void insertAtTail(Expr stmt) {
    body.insertAtTail(stmt);
  }

  public void insertAtHead(Expr stmt) {
    body.insertAtHead(stmt);
  }

  public Symbol getParentSymbol() {
    return parentSymbol;
  }

  void setParentSymbol(Symbol parentSymbol) {
    if (parentSymbol != null && getParent() != null) {
      throw new FlcRuntimeError("Function body must be a root block");
    }
    this.parentSymbol = parentSymbol;
  }

  /**
   * Move the statements of this block to where the block is, then
   * remove the now empty block.
   */
  public void flattenAndRemove() {
    for (Expr stmt: body) {
      stmt.remove();
      insertBefore(stmt);
    }
    remove();
  }

  @Override
  public List<Expr> getChildren() {
    return body.toList();
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    throw new FlcRuntimeError("BlockStmt has no slot children");
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    BlockStmt result = new BlockStmt(tag);
    copyBodyInto(result, map);
    return samePos(result);
  }

  protected void copyBodyInto(BlockStmt result, SymbolMap map) {
    for (Expr stmt: body) {
      result.insertAtTail(stmt.copyInner(map));
    }
  }
}
