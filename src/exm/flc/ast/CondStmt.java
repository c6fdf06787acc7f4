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

public class CondStmt extends Expr {
  private Expr condExpr;
  private BlockStmt thenStmt;
  private BlockStmt elseStmt;

  /**
   * Branches that are not blocks are wrapped in one.
   */
  public CondStmt(Expr condExpr, Expr thenStmt, Expr elseStmt) {
    this.condExpr = adoptChild(condExpr);
    this.thenStmt = adoptChild(asBlock(thenStmt));
    this.elseStmt = adoptChild(asBlock(elseStmt));
  }

  private static BlockStmt asBlock(Expr stmt) {
    if (stmt == null || stmt instanceof BlockStmt &&
                        !(stmt instanceof ForLoop)) {
      return (BlockStmt)stmt;
    }
    return new BlockStmt(stmt);
  }

  public Expr condExpr() {
    return condExpr;
  }

  public BlockStmt thenStmt() {
    return thenStmt;
  }

  public BlockStmt elseStmt() {
    return elseStmt;
  }

  @Override
  public List<Expr> getChildren() {
    List<Expr> result = new ArrayList<Expr>(3);
    result.add(condExpr);
    result.add(thenStmt);
    if (elseStmt != null) {
      result.add(elseStmt);
    }
    return result;
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    if (oldChild == condExpr) {
      orphan(condExpr);
      condExpr = adoptChild(newChild);
    } else if (oldChild == thenStmt) {
      orphan(thenStmt);
      thenStmt = adoptChild(asBlock(newChild));
    } else if (oldChild == elseStmt && elseStmt != null) {
      orphan(elseStmt);
      elseStmt = adoptChild(asBlock(newChild));
    } else {
      throw new FlcRuntimeError("Not a child of CondStmt " + id());
    }
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    return samePos(new CondStmt(condExpr.copyInner(map),
        thenStmt.copyInner(map),
        elseStmt == null ? null : elseStmt.copyInner(map)));
  }
}
